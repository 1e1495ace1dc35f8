package dev.kaspa.gateway.rpc;

import dev.kaspa.gateway.rpc.protowire.GetBlockDagInfoRequestMessage;
import dev.kaspa.gateway.rpc.protowire.GetBlockDagInfoResponseMessage;
import dev.kaspa.gateway.rpc.protowire.GetBlockRequestMessage;
import dev.kaspa.gateway.rpc.protowire.GetBlockResponseMessage;
import dev.kaspa.gateway.rpc.protowire.GetUtxosByAddressesRequestMessage;
import dev.kaspa.gateway.rpc.protowire.GetUtxosByAddressesResponseMessage;
import dev.kaspa.gateway.rpc.protowire.KaspadRequest;
import dev.kaspa.gateway.rpc.protowire.KaspadResponse;
import dev.kaspa.gateway.rpc.protowire.RpcTransaction;
import dev.kaspa.gateway.rpc.protowire.SubmitTransactionRequestMessage;
import dev.kaspa.gateway.rpc.protowire.SubmitTransactionResponseMessage;
import dev.kaspa.gateway.rpc.relay.NotificationSource;
import dev.kaspa.gateway.rpc.relay.SubscriptionRelay;
import java.util.List;
import java.util.Objects;
import reactor.core.publisher.Mono;

/**
 * Typed entry point to the node. Builds the request envelope for each operation and unwraps the
 * payload of the matched reply; all matching and error classification happens in
 * {@link UnaryCallAdapter} and {@link SubscriptionRelay}.
 */
public final class KaspaNodeClient {

    private final UnaryCallAdapter unaryCalls;
    private final SubscriptionRelay subscriptions;

    public KaspaNodeClient(UnaryCallAdapter unaryCalls, SubscriptionRelay subscriptions) {
        this.unaryCalls = Objects.requireNonNull(unaryCalls, "unaryCalls");
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
    }

    public Mono<GetBlockResponseMessage> getBlock(String hash, boolean includeTransactions) {
        KaspadRequest request = KaspadRequest.newBuilder()
            .setGetBlockRequest(GetBlockRequestMessage.newBuilder()
                .setHash(hash)
                .setIncludeTransactions(includeTransactions))
            .build();
        return unaryCalls.call(request).map(KaspadResponse::getGetBlockResponse);
    }

    public Mono<SubmitTransactionResponseMessage> submitTransaction(RpcTransaction transaction, boolean allowOrphan) {
        KaspadRequest request = KaspadRequest.newBuilder()
            .setSubmitTransactionRequest(SubmitTransactionRequestMessage.newBuilder()
                .setTransaction(transaction)
                .setAllowOrphan(allowOrphan))
            .build();
        return unaryCalls.call(request).map(KaspadResponse::getSubmitTransactionResponse);
    }

    public Mono<GetBlockDagInfoResponseMessage> getBlockDagInfo() {
        KaspadRequest request = KaspadRequest.newBuilder()
            .setGetBlockDagInfoRequest(GetBlockDagInfoRequestMessage.getDefaultInstance())
            .build();
        return unaryCalls.call(request).map(KaspadResponse::getGetBlockDagInfoResponse);
    }

    public Mono<GetUtxosByAddressesResponseMessage> getUtxosByAddresses(List<String> addresses) {
        KaspadRequest request = KaspadRequest.newBuilder()
            .setGetUtxosByAddressesRequest(GetUtxosByAddressesRequestMessage.newBuilder()
                .addAllAddresses(addresses))
            .build();
        return unaryCalls.call(request).map(KaspadResponse::getGetUtxosByAddressesResponse);
    }

    /**
     * Start a UTXO change subscription.
     * @throws GatewayException when the subscription cannot be established
     */
    public NotificationSource subscribeUtxosChanged(List<String> addresses) {
        return subscriptions.subscribe(addresses);
    }
}
