package dev.kaspa.gateway.rpc;

import dev.kaspa.gateway.rpc.protowire.GetBlockDagInfoRequestMessage;
import dev.kaspa.gateway.rpc.protowire.GetBlockDagInfoResponseMessage;
import dev.kaspa.gateway.rpc.protowire.GetBlockRequestMessage;
import dev.kaspa.gateway.rpc.protowire.GetBlockResponseMessage;
import dev.kaspa.gateway.rpc.protowire.GetUtxosByAddressesRequestMessage;
import dev.kaspa.gateway.rpc.protowire.GetUtxosByAddressesResponseMessage;
import dev.kaspa.gateway.rpc.protowire.KaspadRequest;
import dev.kaspa.gateway.rpc.protowire.KaspadResponse;
import dev.kaspa.gateway.rpc.protowire.NotifyUtxosChangedResponseMessage;
import dev.kaspa.gateway.rpc.protowire.RPCError;
import dev.kaspa.gateway.rpc.protowire.RpcBlock;
import dev.kaspa.gateway.rpc.protowire.RpcBlockHeader;
import dev.kaspa.gateway.rpc.protowire.RpcTransaction;
import dev.kaspa.gateway.rpc.protowire.SubmitTransactionRequestMessage;
import dev.kaspa.gateway.rpc.protowire.SubmitTransactionResponseMessage;
import dev.kaspa.gateway.rpc.protowire.UtxosChangedNotificationMessage;
import java.util.List;

/**
 * Envelope builders shared by the test suites.
 */
public final class Envelopes {

    private Envelopes() {
    }

    public static KaspadRequest getBlockRequest(String hash) {
        return KaspadRequest.newBuilder()
            .setGetBlockRequest(GetBlockRequestMessage.newBuilder().setHash(hash).setIncludeTransactions(true))
            .build();
    }

    public static KaspadRequest requestFor(RpcMethod method) {
        KaspadRequest.Builder builder = KaspadRequest.newBuilder();
        switch (method) {
            case GET_BLOCK -> builder.setGetBlockRequest(GetBlockRequestMessage.newBuilder().setHash("00".repeat(32)));
            case SUBMIT_TRANSACTION -> builder.setSubmitTransactionRequest(
                SubmitTransactionRequestMessage.newBuilder().setTransaction(RpcTransaction.getDefaultInstance()));
            case GET_BLOCK_DAG_INFO -> builder.setGetBlockDagInfoRequest(GetBlockDagInfoRequestMessage.getDefaultInstance());
            case GET_UTXOS_BY_ADDRESSES -> builder.setGetUtxosByAddressesRequest(
                GetUtxosByAddressesRequestMessage.newBuilder().addAddresses("kaspa:qptest"));
        }
        return builder.build();
    }

    public static RpcBlockHeader header(String hash) {
        return RpcBlockHeader.newBuilder()
            .setHash(hash)
            .setVersion(1)
            .setHashMerkleRoot("11".repeat(32))
            .setAcceptedIdMerkleRoot("22".repeat(32))
            .setUtxoCommitment("33".repeat(32))
            .setTimestamp(1_700_000_000_123L)
            .setBits(453_326_332)
            .setNonce(987_654_321L)
            .setDaaScore(81_234_567L)
            .setBlueWork("1f2e3d")
            .setBlueScore(80_000_000L)
            .setPruningPoint("44".repeat(32))
            .build();
    }

    public static KaspadResponse getBlockResponse(String hash) {
        return KaspadResponse.newBuilder()
            .setGetBlockResponse(GetBlockResponseMessage.newBuilder()
                .setBlock(RpcBlock.newBuilder().setHeader(header(hash))))
            .build();
    }

    public static KaspadResponse getBlockError(String message) {
        return KaspadResponse.newBuilder()
            .setGetBlockResponse(GetBlockResponseMessage.newBuilder()
                .setError(RPCError.newBuilder().setMessage(message)))
            .build();
    }

    public static KaspadResponse dagInfoResponse(long blockCount) {
        return KaspadResponse.newBuilder()
            .setGetBlockDagInfoResponse(GetBlockDagInfoResponseMessage.newBuilder()
                .setNetworkName("kaspa-mainnet")
                .setBlockCount(blockCount))
            .build();
    }

    /**
     * One response of every payload variant the node can send.
     */
    public static List<KaspadResponse> everyResponseVariant() {
        return List.of(
            getBlockResponse("55".repeat(32)),
            KaspadResponse.newBuilder()
                .setSubmitTransactionResponse(SubmitTransactionResponseMessage.newBuilder().setTransactionId("66".repeat(32)))
                .build(),
            dagInfoResponse(10),
            KaspadResponse.newBuilder()
                .setGetUtxosByAddressesResponse(GetUtxosByAddressesResponseMessage.getDefaultInstance())
                .build(),
            KaspadResponse.newBuilder()
                .setNotifyUtxosChangedResponse(NotifyUtxosChangedResponseMessage.getDefaultInstance())
                .build(),
            KaspadResponse.newBuilder()
                .setUtxosChangedNotification(UtxosChangedNotificationMessage.getDefaultInstance())
                .build(),
            KaspadResponse.getDefaultInstance());
    }
}
