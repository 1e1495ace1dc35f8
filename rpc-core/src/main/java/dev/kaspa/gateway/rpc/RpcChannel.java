package dev.kaspa.gateway.rpc;

/**
 * Owning handle on the connection to the node. Shared read-only by every concurrent call and
 * subscription; each {@link #openStream()} yields an independent logical stream.
 */
public interface RpcChannel extends AutoCloseable {

    /**
     * Open a new bidirectional stream.
     * @return a fresh stream owned by the caller
     * @throws GatewayException of kind {@link GatewayErrorKind#CONNECTION} when the stream cannot
     * be opened
     */
    RpcStream openStream();

    @Override
    void close();
}
