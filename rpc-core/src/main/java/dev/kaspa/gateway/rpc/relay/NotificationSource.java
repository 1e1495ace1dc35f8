package dev.kaspa.gateway.rpc.relay;

import dev.kaspa.gateway.rpc.model.UtxoChangeNotification;
import java.util.List;
import reactor.core.publisher.Flux;

/**
 * Live UTXO change feed backed by one subscription stream to the node. The feed cannot be
 * restarted: once {@link State#CLOSED} the caller has to subscribe again.
 */
public interface NotificationSource extends AutoCloseable {

    enum State {
        IDLE, OPENING, ACTIVE, CLOSED
    }

    /**
     * Addresses the subscription watches, in the order they were sent to the node.
     */
    List<String> addresses();

    /**
     * Notifications in the order the node pushed them. Completes when the node ends the stream,
     * fails with a {@code GatewayException} on transport errors. Cancelling the subscription closes
     * the source. Only one subscriber is supported.
     */
    Flux<UtxoChangeNotification> notifications();

    State state();

    /**
     * Tear the underlying stream down. Idempotent.
     */
    @Override
    void close();
}
