package dev.kaspa.gateway.server.codec;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import dev.kaspa.gateway.rpc.GatewayErrorKind;
import dev.kaspa.gateway.rpc.GatewayException;
import dev.kaspa.gateway.rpc.model.Outpoint;
import dev.kaspa.gateway.rpc.model.UtxoChange;
import dev.kaspa.gateway.rpc.model.UtxoChangeNotification;
import dev.kaspa.gateway.rpc.model.UtxoEntry;
import dev.kaspa.gateway.rpc.protowire.GetBlockDagInfoResponseMessage;
import dev.kaspa.gateway.rpc.protowire.GetBlockResponseMessage;
import dev.kaspa.gateway.rpc.protowire.GetUtxosByAddressesResponseMessage;
import dev.kaspa.gateway.rpc.protowire.RpcBlock;
import dev.kaspa.gateway.rpc.protowire.RpcBlockHeader;
import dev.kaspa.gateway.rpc.protowire.RpcBlockVerboseData;
import dev.kaspa.gateway.rpc.protowire.RpcOutpoint;
import dev.kaspa.gateway.rpc.protowire.RpcScriptPublicKey;
import dev.kaspa.gateway.rpc.protowire.RpcTransaction;
import dev.kaspa.gateway.rpc.protowire.RpcTransactionInput;
import dev.kaspa.gateway.rpc.protowire.RpcTransactionOutput;
import dev.kaspa.gateway.server.model.BlockResponse;
import dev.kaspa.gateway.server.model.DagTipsResponse;
import dev.kaspa.gateway.server.model.TransactionInput;
import dev.kaspa.gateway.server.model.UtxosByAddressesResponse;

/**
 * Converts between the JSON models of the HTTP and WebSocket API and the node's protobuf messages.
 */
public final class KaspaMessageCodec {

	private static final long UINT32_MAX = 0xFFFFFFFFL;

	private KaspaMessageCodec() {
	}

	/**
	 * Build the node representation of a client supplied transaction. Optional scalars default to
	 * zero or empty; the mass is left for the node to compute.
	 * @param transaction client transaction
	 * @return protobuf transaction
	 * @throws GatewayException {@code INVALID_ARGUMENT} when required parts are missing or a number
	 * does not fit its unsigned wire field
	 */
	public static RpcTransaction toProto(TransactionInput transaction) {
		if (transaction == null) {
			throw GatewayException.invalidArgument("Transaction is required");
		}
		if (transaction.inputs() == null || transaction.outputs() == null) {
			throw GatewayException.invalidArgument("Transaction must list its inputs and outputs");
		}
		RpcTransaction.Builder builder = RpcTransaction.newBuilder()
			.setVersion(Objects.requireNonNullElse(transaction.version(), 0))
			.setLockTime(requireUnsigned(Objects.requireNonNullElse(transaction.lockTime(), 0L), "lockTime"))
			.setSubnetworkId(Objects.requireNonNullElse(transaction.subnetworkId(), ""))
			.setGas(requireUnsigned(Objects.requireNonNullElse(transaction.gas(), 0L), "gas"))
			.setPayload(Objects.requireNonNullElse(transaction.payload(), ""));
		for (TransactionInput.TxInput input : transaction.inputs()) {
			builder.addInputs(toProto(input));
		}
		for (TransactionInput.TxOutput output : transaction.outputs()) {
			builder.addOutputs(toProto(output));
		}
		return builder.build();
	}

	private static RpcTransactionInput toProto(TransactionInput.TxInput input) {
		if (input == null || input.previousOutpoint() == null) {
			throw GatewayException.invalidArgument("Every input needs a previousOutpoint");
		}
		return RpcTransactionInput.newBuilder()
			.setPreviousOutpoint(RpcOutpoint.newBuilder()
				.setTransactionId(Objects.requireNonNullElse(input.previousOutpoint().transactionId(), ""))
				.setIndex(requireUint32(input.previousOutpoint().index(), "previousOutpoint.index")))
			.setSignatureScript(Objects.requireNonNullElse(input.signatureScript(), ""))
			.setSequence(requireUnsigned(input.sequence(), "sequence"))
			.setSigOpCount(Objects.requireNonNullElse(input.sigOpCount(), 0))
			.build();
	}

	private static RpcTransactionOutput toProto(TransactionInput.TxOutput output) {
		if (output == null || output.scriptPublicKey() == null) {
			throw GatewayException.invalidArgument("Every output needs a scriptPublicKey");
		}
		return RpcTransactionOutput.newBuilder()
			.setAmount(requireUnsigned(output.amount(), "amount"))
			.setScriptPublicKey(RpcScriptPublicKey.newBuilder()
				.setScriptPublicKey(Objects.requireNonNullElse(output.scriptPublicKey().scriptPublicKey(), ""))
				.setVersion(output.scriptPublicKey().version()))
			.build();
	}

	private static long requireUnsigned(long value, String field) {
		if (value < 0) {
			throw GatewayException.invalidArgument(field + " must not be negative, got " + value);
		}
		return value;
	}

	private static int requireUint32(long value, String field) {
		if (value < 0 || value > UINT32_MAX) {
			throw GatewayException.invalidArgument(field + " must be between 0 and " + UINT32_MAX + ", got " + value);
		}
		return (int) value;
	}

	/**
	 * Convert a get-block reply. Header fields are copied verbatim.
	 * @param reply node reply
	 * @return JSON block
	 * @throws GatewayException {@code PROTOCOL_MISMATCH} when the reply carries no block or header
	 */
	public static BlockResponse toBlockResponse(GetBlockResponseMessage reply) {
		if (!reply.hasBlock()) {
			throw new GatewayException(GatewayErrorKind.PROTOCOL_MISMATCH, "Block data missing");
		}
		RpcBlock block = reply.getBlock();
		if (!block.hasHeader()) {
			throw new GatewayException(GatewayErrorKind.PROTOCOL_MISMATCH, "Block header missing");
		}
		RpcBlockHeader header = block.getHeader();
		BlockResponse.BlockHeader headerView = new BlockResponse.BlockHeader(
				Integer.toUnsignedLong(header.getVersion()), header.getHashMerkleRoot(), header.getAcceptedIdMerkleRoot(),
				header.getUtxoCommitment(), header.getTimestamp(), Integer.toUnsignedLong(header.getBits()),
				unsigned(header.getNonce()), header.getDaaScore(), header.getBlueWork(), header.getBlueScore(),
				header.getPruningPoint());
		List<BlockResponse.TransactionView> transactions = block.getTransactionsList()
			.stream()
			.map(KaspaMessageCodec::toTransactionView)
			.toList();
		BlockResponse.BlockVerboseData verboseData = block.hasVerboseData() ? toVerboseData(block.getVerboseData())
				: null;
		return new BlockResponse(header.getHash(), headerView, transactions, verboseData);
	}

	private static BlockResponse.TransactionView toTransactionView(RpcTransaction transaction) {
		String transactionId = transaction.hasVerboseData() ? transaction.getVerboseData().getTransactionId() : "";
		String hash = transaction.hasVerboseData() ? transaction.getVerboseData().getHash() : "";
		List<BlockResponse.InputView> inputs = transaction.getInputsList()
			.stream()
			.map(input -> new BlockResponse.InputView(
					input.hasPreviousOutpoint() ? Outpoint.fromProto(input.getPreviousOutpoint()) : new Outpoint("", 0),
					input.getSignatureScript(), input.getSequence()))
			.toList();
		List<BlockResponse.OutputView> outputs = transaction.getOutputsList()
			.stream()
			.map(output -> new BlockResponse.OutputView(output.getAmount(),
					output.hasScriptPublicKey() ? output.getScriptPublicKey().getScriptPublicKey() : ""))
			.toList();
		return new BlockResponse.TransactionView(transactionId, hash, transaction.getMass(), inputs, outputs);
	}

	private static BlockResponse.BlockVerboseData toVerboseData(RpcBlockVerboseData verbose) {
		return new BlockResponse.BlockVerboseData(verbose.getHash(), verbose.getDifficulty(),
				verbose.getSelectedParentHash(), List.copyOf(verbose.getTransactionIdsList()), verbose.getIsHeaderOnly(),
				verbose.getBlueScore(), verbose.getIsChainBlock());
	}

	public static DagTipsResponse toDagTips(GetBlockDagInfoResponseMessage reply) {
		return new DagTipsResponse(reply.getNetworkName(), List.copyOf(reply.getTipHashesList()),
				reply.getBlockCount(), reply.getHeaderCount(), reply.getDifficulty(), reply.getPastMedianTime(),
				List.copyOf(reply.getVirtualParentHashesList()), reply.getPruningPointHash(),
				reply.getVirtualDaaScore());
	}

	/**
	 * Convert a get-utxos-by-addresses reply. Entries share the shape of the {@code added} entries of
	 * a {@code utxo_changed} frame.
	 * @param reply node reply
	 * @return JSON entries
	 */
	public static UtxosByAddressesResponse toUtxos(GetUtxosByAddressesResponseMessage reply) {
		return new UtxosByAddressesResponse(reply.getEntriesList()
			.stream()
			.map(UtxoChange::fromProto)
			.map(KaspaMessageCodec::toUtxoChangeEntry)
			.toList());
	}

	/**
	 * Render a notification as the {@code utxo_changed} WebSocket frame. Values the node left out
	 * are written as {@code null}.
	 * @param notification notification relayed from the node
	 * @return frame ready for JSON serialisation
	 */
	public static Map<String, Object> toNotificationFrame(UtxoChangeNotification notification) {
		Map<String, Object> frame = new LinkedHashMap<>();
		frame.put("type", "utxo_changed");
		frame.put("added", notification.added().stream().map(KaspaMessageCodec::toUtxoChangeEntry).toList());
		frame.put("removed", notification.removed().stream().map(KaspaMessageCodec::removedEntry).toList());
		return frame;
	}

	public static Map<String, Object> toSubscribedFrame(List<String> addresses) {
		Map<String, Object> frame = new LinkedHashMap<>();
		frame.put("status", "subscribed");
		frame.put("addresses", addresses);
		return frame;
	}

	public static Map<String, Object> toErrorFrame(String message) {
		Map<String, Object> frame = new LinkedHashMap<>();
		frame.put("error", message);
		return frame;
	}

	/**
	 * Render one UTXO change with its outpoint and entry in snake_case.
	 * @param change change reported by the node
	 * @return entry ready for JSON serialisation
	 */
	public static Map<String, Object> toUtxoChangeEntry(UtxoChange change) {
		Map<String, Object> entry = removedEntry(change);
		entry.put("utxo_entry", change.utxoEntry() == null ? null : utxoEntry(change.utxoEntry()));
		return entry;
	}

	private static Map<String, Object> removedEntry(UtxoChange change) {
		Map<String, Object> entry = new LinkedHashMap<>();
		entry.put("address", change.address());
		entry.put("outpoint", change.outpoint() == null ? null : outpoint(change.outpoint()));
		return entry;
	}

	private static Map<String, Object> outpoint(Outpoint outpoint) {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("transaction_id", outpoint.transactionId());
		structured.put("index", outpoint.index());
		return structured;
	}

	private static Map<String, Object> utxoEntry(UtxoEntry utxoEntry) {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("amount", unsigned(utxoEntry.amount()));
		structured.put("script_public_key",
				utxoEntry.scriptPublicKey() == null ? null : utxoEntry.scriptPublicKey().script());
		structured.put("block_daa_score", unsigned(utxoEntry.blockDaaScore()));
		structured.put("is_coinbase", utxoEntry.coinbase());
		return structured;
	}

	private static BigInteger unsigned(long value) {
		return value >= 0 ? BigInteger.valueOf(value) : new BigInteger(Long.toUnsignedString(value));
	}

}
