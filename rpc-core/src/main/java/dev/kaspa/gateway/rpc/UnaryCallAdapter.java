package dev.kaspa.gateway.rpc;

import dev.kaspa.gateway.rpc.protowire.KaspadRequest;
import dev.kaspa.gateway.rpc.protowire.KaspadResponse;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import reactor.core.publisher.Mono;

/**
 * Drives one request/response round trip per call: a dedicated stream is opened, exactly one
 * envelope is sent, and the first reply is matched against the variant the request implies.
 * A single logical call is a single physical attempt; nothing is retried.
 */
public final class UnaryCallAdapter {

    private final RpcChannel channel;
    private final CorrelationIdGenerator correlationIds;
    private final LatencyRecorder latencyRecorder;

    public UnaryCallAdapter(RpcChannel channel, CorrelationIdGenerator correlationIds, LatencyRecorder latencyRecorder) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.correlationIds = Objects.requireNonNull(correlationIds, "correlationIds");
        this.latencyRecorder = Objects.requireNonNull(latencyRecorder, "latencyRecorder");
    }

    /**
     * Perform the round trip lazily, once per subscription.
     * @param request envelope carrying one unary payload; its {@code id} is overwritten
     * @return the matched response, or an error signal carrying a {@link GatewayException}
     */
    public Mono<KaspadResponse> call(KaspadRequest request) {
        Objects.requireNonNull(request, "request");
        return Mono.defer(() -> {
            RpcMethod method = RpcMethod.forRequest(request);
            KaspadRequest stamped = request.toBuilder().setId(correlationIds.next()).build();
            long started = System.nanoTime();
            return Mono.using(channel::openStream, stream -> exchange(stream, stamped, method), RpcStream::close)
                .doFinally(signal -> latencyRecorder.record(method.operationName(), elapsedMillis(started)));
        });
    }

    private Mono<KaspadResponse> exchange(RpcStream stream, KaspadRequest request, RpcMethod method) {
        stream.send(request);
        stream.halfClose();
        return stream.receive()
            .next()
            .switchIfEmpty(Mono.error(() -> new GatewayException(GatewayErrorKind.EMPTY_RESPONSE,
                "Node closed the stream without answering request " + Long.toUnsignedString(request.getId()))))
            .onErrorMap(error -> !(error instanceof GatewayException),
                error -> GatewayException.connection("Stream to node failed: " + error.getMessage(), error))
            .flatMap(response -> verify(method, response));
    }

    private static Mono<KaspadResponse> verify(RpcMethod method, KaspadResponse response) {
        if (!method.matches(response)) {
            return Mono.error(new GatewayException(GatewayErrorKind.PROTOCOL_MISMATCH,
                "Expected " + method.responseCase() + " but node replied with " + response.getPayloadCase()));
        }
        return method.remoteError(response)
            .<Mono<KaspadResponse>>map(error -> Mono.error(new GatewayException(GatewayErrorKind.REMOTE,
                error.getMessage().isEmpty() ? "Node reported an error without a message" : error.getMessage())))
            .orElseGet(() -> Mono.just(response));
    }

    private static double elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / (double) TimeUnit.MILLISECONDS.toNanos(1);
    }
}
