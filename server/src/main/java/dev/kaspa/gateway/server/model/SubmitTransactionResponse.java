package dev.kaspa.gateway.server.model;

/**
 * Result of {@code POST /rpc/submitTransaction}.
 * @param transactionId id the node assigned to the accepted transaction
 */
public record SubmitTransactionResponse(String transactionId) {
}
