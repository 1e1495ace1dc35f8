package dev.kaspa.gateway.server.model;

/**
 * Body of {@code POST /rpc/submitTransaction}.
 * @param transaction transaction to broadcast
 * @param allowOrphan whether the node may accept the transaction while its inputs are unknown,
 * defaults to {@code false}
 */
public record SubmitTransactionRequest(TransactionInput transaction, Boolean allowOrphan) {

	public boolean allowOrphanOrDefault() {
		return allowOrphan != null && allowOrphan;
	}

}
