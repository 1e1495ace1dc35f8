package dev.kaspa.gateway.rpc;

import dev.kaspa.gateway.rpc.protowire.KaspadRequest;
import dev.kaspa.gateway.rpc.protowire.KaspadResponse;
import dev.kaspa.gateway.rpc.protowire.RPCError;
import java.util.Optional;

/**
 * Closed set of request/response round trips the gateway performs. Each constant ties a request
 * payload variant to the only response variant that may answer it.
 */
public enum RpcMethod {

    GET_BLOCK("get_block",
        KaspadRequest.PayloadCase.GET_BLOCK_REQUEST,
        KaspadResponse.PayloadCase.GET_BLOCK_RESPONSE),

    SUBMIT_TRANSACTION("submit_transaction",
        KaspadRequest.PayloadCase.SUBMIT_TRANSACTION_REQUEST,
        KaspadResponse.PayloadCase.SUBMIT_TRANSACTION_RESPONSE),

    GET_BLOCK_DAG_INFO("get_dag_tips",
        KaspadRequest.PayloadCase.GET_BLOCK_DAG_INFO_REQUEST,
        KaspadResponse.PayloadCase.GET_BLOCK_DAG_INFO_RESPONSE),

    GET_UTXOS_BY_ADDRESSES("get_utxos_by_addresses",
        KaspadRequest.PayloadCase.GET_UTXOS_BY_ADDRESSES_REQUEST,
        KaspadResponse.PayloadCase.GET_UTXOS_BY_ADDRESSES_RESPONSE);

    private final String operationName;
    private final KaspadRequest.PayloadCase requestCase;
    private final KaspadResponse.PayloadCase responseCase;

    RpcMethod(String operationName, KaspadRequest.PayloadCase requestCase, KaspadResponse.PayloadCase responseCase) {
        this.operationName = operationName;
        this.requestCase = requestCase;
        this.responseCase = responseCase;
    }

    /**
     * Name under which call latency is recorded.
     */
    public String operationName() {
        return operationName;
    }

    public KaspadRequest.PayloadCase requestCase() {
        return requestCase;
    }

    public KaspadResponse.PayloadCase responseCase() {
        return responseCase;
    }

    /**
     * Resolve the round trip a request envelope starts.
     * @throws GatewayException of kind {@link GatewayErrorKind#INVALID_ARGUMENT} when the envelope
     * carries no payload or a payload that cannot be answered by a single reply
     */
    public static RpcMethod forRequest(KaspadRequest request) {
        return switch (request.getPayloadCase()) {
            case GET_BLOCK_REQUEST -> GET_BLOCK;
            case SUBMIT_TRANSACTION_REQUEST -> SUBMIT_TRANSACTION;
            case GET_BLOCK_DAG_INFO_REQUEST -> GET_BLOCK_DAG_INFO;
            case GET_UTXOS_BY_ADDRESSES_REQUEST -> GET_UTXOS_BY_ADDRESSES;
            case NOTIFY_UTXOS_CHANGED_REQUEST ->
                throw GatewayException.invalidArgument("UTXO change subscriptions are not unary calls");
            case PAYLOAD_NOT_SET -> throw GatewayException.invalidArgument("Request envelope carries no payload");
        };
    }

    public boolean matches(KaspadResponse response) {
        return response.getPayloadCase() == responseCase;
    }

    /**
     * Error reported by the node inside a response already known to {@link #matches(KaspadResponse) match}.
     */
    public Optional<RPCError> remoteError(KaspadResponse response) {
        return switch (this) {
            case GET_BLOCK -> response.getGetBlockResponse().hasError()
                ? Optional.of(response.getGetBlockResponse().getError())
                : Optional.empty();
            case SUBMIT_TRANSACTION -> response.getSubmitTransactionResponse().hasError()
                ? Optional.of(response.getSubmitTransactionResponse().getError())
                : Optional.empty();
            case GET_BLOCK_DAG_INFO -> response.getGetBlockDagInfoResponse().hasError()
                ? Optional.of(response.getGetBlockDagInfoResponse().getError())
                : Optional.empty();
            case GET_UTXOS_BY_ADDRESSES -> response.getGetUtxosByAddressesResponse().hasError()
                ? Optional.of(response.getGetUtxosByAddressesResponse().getError())
                : Optional.empty();
        };
    }
}
