package dev.kaspa.gateway.rpc.grpc;

import dev.kaspa.gateway.rpc.GatewayException;
import dev.kaspa.gateway.rpc.RpcStream;
import dev.kaspa.gateway.rpc.protowire.KaspadRequest;
import dev.kaspa.gateway.rpc.protowire.KaspadResponse;
import io.grpc.ClientCall;
import io.grpc.Metadata;
import io.grpc.Status;
import java.util.concurrent.atomic.AtomicBoolean;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * {@link RpcStream} over one {@code MessageStream} client call. Inbound flow control is manual:
 * the call only reads as many envelopes as the subscriber has requested.
 */
final class GrpcRpcStream implements RpcStream {

    private final ClientCall<KaspadRequest, KaspadResponse> call;
    private final Sinks.Many<KaspadResponse> inbound = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicBoolean closed = new AtomicBoolean();

    GrpcRpcStream(ClientCall<KaspadRequest, KaspadResponse> call) {
        this.call = call;
    }

    void start() {
        call.start(new InboundListener(), new Metadata());
    }

    @Override
    public void send(KaspadRequest request) {
        if (closed.get()) {
            throw GatewayException.connection("Stream to node already closed", null);
        }
        try {
            call.sendMessage(request);
        } catch (IllegalStateException e) {
            throw GatewayException.connection("Unable to send envelope to node: " + e.getMessage(), e);
        }
    }

    @Override
    public void halfClose() {
        if (closed.get()) {
            return;
        }
        try {
            call.halfClose();
        } catch (IllegalStateException e) {
            throw GatewayException.connection("Unable to half-close stream to node: " + e.getMessage(), e);
        }
    }

    @Override
    public Flux<KaspadResponse> receive() {
        return inbound.asFlux()
            .doOnRequest(n -> call.request(n >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) n))
            .doOnCancel(this::close);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            call.cancel("Stream released by gateway", null);
        }
    }

    private final class InboundListener extends ClientCall.Listener<KaspadResponse> {

        @Override
        public void onMessage(KaspadResponse message) {
            inbound.tryEmitNext(message);
        }

        @Override
        public void onClose(Status status, Metadata trailers) {
            if (status.isOk()) {
                inbound.tryEmitComplete();
                return;
            }
            String description = status.getDescription() == null ? "" : " (" + status.getDescription() + ")";
            inbound.tryEmitError(GatewayException.connection(
                "Node stream closed with " + status.getCode() + description, status.asRuntimeException(trailers)));
        }
    }
}
