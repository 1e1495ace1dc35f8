package dev.kaspa.gateway.rpc.relay;

import dev.kaspa.gateway.rpc.GatewayException;
import dev.kaspa.gateway.rpc.RpcStream;
import dev.kaspa.gateway.rpc.model.UtxoChangeNotification;
import dev.kaspa.gateway.rpc.protowire.KaspadRequest;
import dev.kaspa.gateway.rpc.protowire.KaspadResponse;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import reactor.core.publisher.Flux;

final class StreamNotificationSource implements NotificationSource {

    private final RpcStream stream;
    private final List<String> addresses;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicBoolean consumed = new AtomicBoolean();

    StreamNotificationSource(RpcStream stream, List<String> addresses) {
        this.stream = stream;
        this.addresses = List.copyOf(addresses);
    }

    void open(KaspadRequest subscribeCommand) {
        if (!state.compareAndSet(State.IDLE, State.OPENING)) {
            throw new IllegalStateException("Subscription already opened");
        }
        try {
            stream.send(subscribeCommand);
        } catch (GatewayException e) {
            close();
            throw e;
        }
        state.compareAndSet(State.OPENING, State.ACTIVE);
    }

    @Override
    public List<String> addresses() {
        return addresses;
    }

    @Override
    public Flux<UtxoChangeNotification> notifications() {
        return Flux.defer(() -> {
            if (!consumed.compareAndSet(false, true)) {
                return Flux.error(new IllegalStateException("Notification feed already has a subscriber"));
            }
            if (state.get() == State.CLOSED) {
                return Flux.empty();
            }
            return stream.receive()
                .filter(response -> response.getPayloadCase() == KaspadResponse.PayloadCase.UTXOS_CHANGED_NOTIFICATION)
                .map(response -> UtxoChangeNotification.fromProto(response.getUtxosChangedNotification()))
                .onErrorMap(error -> !(error instanceof GatewayException),
                    error -> GatewayException.connection("Subscription stream failed: " + error.getMessage(), error))
                .doOnTerminate(this::close)
                .doOnCancel(this::close);
        });
    }

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public void close() {
        if (state.getAndSet(State.CLOSED) != State.CLOSED) {
            stream.close();
        }
    }
}
