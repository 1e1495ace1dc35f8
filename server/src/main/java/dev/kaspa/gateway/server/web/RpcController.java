package dev.kaspa.gateway.server.web;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dev.kaspa.gateway.rpc.GatewayException;
import dev.kaspa.gateway.rpc.KaspaNodeClient;
import dev.kaspa.gateway.rpc.protowire.RpcTransaction;
import dev.kaspa.gateway.server.codec.KaspaMessageCodec;
import dev.kaspa.gateway.server.model.BlockResponse;
import dev.kaspa.gateway.server.model.DagTipsResponse;
import dev.kaspa.gateway.server.model.GetBlockRequest;
import dev.kaspa.gateway.server.model.GetUtxosByAddressesRequest;
import dev.kaspa.gateway.server.model.RpcResponse;
import dev.kaspa.gateway.server.model.SubmitTransactionRequest;
import dev.kaspa.gateway.server.model.SubmitTransactionResponse;
import dev.kaspa.gateway.server.model.UtxosByAddressesResponse;
import reactor.core.publisher.Mono;

/**
 * Request/response endpoints. Each request becomes one unary call on its own node stream; failures
 * surface as {@link GatewayException} and are rendered by {@link GatewayExceptionHandler}.
 */
@RestController
@RequestMapping("/rpc")
public class RpcController {

	private static final Pattern BLOCK_HASH = Pattern.compile("[0-9a-fA-F]{64}");

	private final KaspaNodeClient nodeClient;

	public RpcController(KaspaNodeClient nodeClient) {
		this.nodeClient = Objects.requireNonNull(nodeClient, "nodeClient");
	}

	/**
	 * Fetch a block by hash. The hash is validated before the node is contacted.
	 * @param request block hash and transaction flag
	 * @return the block wrapped in an {@link RpcResponse}
	 */
	@PostMapping("/getBlock")
	public Mono<RpcResponse<BlockResponse>> getBlock(@RequestBody GetBlockRequest request) {
		if (request.hash() == null || !BLOCK_HASH.matcher(request.hash()).matches()) {
			throw GatewayException.invalidArgument("Invalid block hash format");
		}
		return timed(this.nodeClient.getBlock(request.hash(), request.includeTransactionsOrDefault()),
				KaspaMessageCodec::toBlockResponse);
	}

	/**
	 * Broadcast a transaction.
	 * @param request transaction and orphan policy
	 * @return id of the accepted transaction
	 */
	@PostMapping("/submitTransaction")
	public Mono<RpcResponse<SubmitTransactionResponse>> submitTransaction(
			@RequestBody SubmitTransactionRequest request) {
		RpcTransaction transaction = KaspaMessageCodec.toProto(request.transaction());
		return timed(this.nodeClient.submitTransaction(transaction, request.allowOrphanOrDefault()),
				reply -> new SubmitTransactionResponse(reply.getTransactionId()));
	}

	/**
	 * Report the current DAG tips. Any request body is ignored.
	 */
	@PostMapping("/getDAGTips")
	public Mono<RpcResponse<DagTipsResponse>> getDagTips() {
		return timed(this.nodeClient.getBlockDagInfo(), KaspaMessageCodec::toDagTips);
	}

	@PostMapping("/getUtxosByAddresses")
	public Mono<RpcResponse<UtxosByAddressesResponse>> getUtxosByAddresses(
			@RequestBody GetUtxosByAddressesRequest request) {
		List<String> addresses = request.addresses() == null ? List.of()
				: request.addresses()
					.stream()
					.filter(Objects::nonNull)
					.map(String::trim)
					.filter(address -> !address.isEmpty())
					.toList();
		if (addresses.isEmpty()) {
			throw GatewayException.invalidArgument("No addresses provided");
		}
		return timed(this.nodeClient.getUtxosByAddresses(addresses), KaspaMessageCodec::toUtxos);
	}

	private static <R, T> Mono<RpcResponse<T>> timed(Mono<R> call, Function<R, T> convert) {
		return Mono.defer(() -> {
			long started = System.nanoTime();
			return call.map(reply -> RpcResponse.success(convert.apply(reply),
					(System.nanoTime() - started) / 1_000_000.0));
		});
	}

}
