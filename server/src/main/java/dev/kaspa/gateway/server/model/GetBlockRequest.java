package dev.kaspa.gateway.server.model;

/**
 * Body of {@code POST /rpc/getBlock}.
 * @param hash block hash, 64 hexadecimal characters
 * @param includeTransactions whether the node should return the block's transactions, defaults to
 * {@code true}
 */
public record GetBlockRequest(String hash, Boolean includeTransactions) {

	/**
	 * Resolve the transaction flag, applying the default when the client left it out.
	 * @return {@code true} unless the client explicitly asked for the header only
	 */
	public boolean includeTransactionsOrDefault() {
		return includeTransactions == null || includeTransactions;
	}

}
