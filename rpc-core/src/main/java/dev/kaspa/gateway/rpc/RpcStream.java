package dev.kaspa.gateway.rpc;

import dev.kaspa.gateway.rpc.protowire.KaspadRequest;
import dev.kaspa.gateway.rpc.protowire.KaspadResponse;
import reactor.core.publisher.Flux;

/**
 * One bidirectional exchange of envelopes with the node, scoped to a single unary call or a single
 * subscription. Owned exclusively by whoever opened it.
 */
public interface RpcStream extends AutoCloseable {

    /**
     * Send one envelope to the node.
     * @throws GatewayException of kind {@link GatewayErrorKind#CONNECTION} when the stream is no
     * longer writable
     */
    void send(KaspadRequest request);

    /**
     * Tell the node no further envelopes follow on this stream. Receiving is unaffected.
     * @throws GatewayException of kind {@link GatewayErrorKind#CONNECTION} when the stream is no
     * longer writable
     */
    void halfClose();

    /**
     * Envelopes received from the node, in arrival order. Demand is forwarded to the transport so
     * nothing is read ahead of the subscriber; cancelling the subscription tears the stream down.
     * Transport failures are signalled as {@link GatewayException} of kind
     * {@link GatewayErrorKind#CONNECTION}. Only one subscriber is supported.
     */
    Flux<KaspadResponse> receive();

    /**
     * Release the stream. Idempotent; no further envelopes are delivered afterwards.
     */
    @Override
    void close();
}
