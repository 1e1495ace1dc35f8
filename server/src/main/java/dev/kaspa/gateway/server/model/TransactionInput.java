package dev.kaspa.gateway.server.model;

import java.util.List;

/**
 * Client supplied transaction. Optional scalar fields fall back to zero or empty values when the
 * transaction is converted for the node.
 * @param version transaction version
 * @param inputs inputs being spent
 * @param outputs outputs being created
 * @param lockTime lock time
 * @param subnetworkId hex subnetwork id
 * @param gas gas limit
 * @param payload hex payload
 */
public record TransactionInput(Integer version, List<TxInput> inputs, List<TxOutput> outputs, Long lockTime,
		String subnetworkId, Long gas, String payload) {

	/**
	 * One spent output.
	 * @param previousOutpoint output being spent
	 * @param signatureScript hex signature script
	 * @param sequence sequence number
	 * @param sigOpCount signature operation count, defaults to zero
	 */
	public record TxInput(OutpointInput previousOutpoint, String signatureScript, long sequence, Integer sigOpCount) {
	}

	/**
	 * Reference to the output being spent.
	 * @param transactionId hex id of the funding transaction
	 * @param index output index within that transaction
	 */
	public record OutpointInput(String transactionId, long index) {
	}

	/**
	 * One created output.
	 * @param amount value in sompi
	 * @param scriptPublicKey locking script
	 */
	public record TxOutput(long amount, ScriptPublicKeyInput scriptPublicKey) {
	}

	/**
	 * Locking script with its version.
	 * @param scriptPublicKey hex script
	 * @param version script version
	 */
	public record ScriptPublicKeyInput(String scriptPublicKey, int version) {
	}

}
