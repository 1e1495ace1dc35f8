package dev.kaspa.gateway.server.model;

import java.math.BigInteger;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import dev.kaspa.gateway.rpc.model.Outpoint;

/**
 * Block returned by {@code POST /rpc/getBlock}.
 * @param hash block hash
 * @param header block header
 * @param transactions transactions, empty when they were not requested
 * @param verboseData node computed data, {@code null} when the node sent none
 */
public record BlockResponse(String hash, BlockHeader header, List<TransactionView> transactions,
		BlockVerboseData verboseData) {

	/**
	 * Header fields copied verbatim from the node.
	 */
	public record BlockHeader(long version, String hashMerkleRoot, String acceptedIdMerkleRoot, String utxoCommitment,
			long timestamp, long bits, BigInteger nonce, long daaScore, String blueWork, long blueScore,
			String pruningPoint) {
	}

	/**
	 * Transaction inside a block. Id and hash come from the node's verbose data and are empty
	 * when the node did not send it.
	 */
	public record TransactionView(String transactionId, String hash, long mass, List<InputView> inputs,
			List<OutputView> outputs) {
	}

	public record InputView(Outpoint previousOutpoint, String signatureScript, long sequence) {
	}

	public record OutputView(long amount, String scriptPublicKey) {
	}

	public record BlockVerboseData(String hash, double difficulty, String selectedParentHash,
			List<String> transactionIds, @JsonProperty("isHeaderOnly") boolean isHeaderOnly, long blueScore,
			@JsonProperty("isChainBlock") boolean isChainBlock) {
	}

}
