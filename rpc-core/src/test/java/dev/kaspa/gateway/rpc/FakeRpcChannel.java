package dev.kaspa.gateway.rpc;

import dev.kaspa.gateway.rpc.protowire.KaspadRequest;
import dev.kaspa.gateway.rpc.protowire.KaspadResponse;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import reactor.core.publisher.Flux;

/**
 * Test-only {@link RpcChannel}. Every opened stream answers independently: once an envelope has
 * been sent, {@code receive()} plays whatever the responder returns for that envelope.
 */
public final class FakeRpcChannel implements RpcChannel {

    private final Function<KaspadRequest, Flux<KaspadResponse>> responder;
    private final AtomicInteger opened = new AtomicInteger();
    private final List<FakeRpcStream> streams = new CopyOnWriteArrayList<>();
    private volatile GatewayException openFailure;
    private volatile boolean closed;

    public FakeRpcChannel(Function<KaspadRequest, Flux<KaspadResponse>> responder) {
        this.responder = responder;
    }

    public static FakeRpcChannel replying(KaspadResponse response) {
        return new FakeRpcChannel(request -> Flux.just(response));
    }

    public void failOpensWith(GatewayException failure) {
        this.openFailure = failure;
    }

    @Override
    public RpcStream openStream() {
        GatewayException failure = openFailure;
        if (failure != null) {
            throw failure;
        }
        opened.incrementAndGet();
        FakeRpcStream stream = new FakeRpcStream(responder);
        streams.add(stream);
        return stream;
    }

    public int openedStreams() {
        return opened.get();
    }

    public List<FakeRpcStream> streams() {
        return streams;
    }

    public FakeRpcStream onlyStream() {
        if (streams.size() != 1) {
            throw new IllegalStateException("expected exactly one stream but saw " + streams.size());
        }
        return streams.get(0);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
