package dev.kaspa.gateway.rpc.grpc;

import dev.kaspa.gateway.rpc.AtomicCorrelationIdGenerator;
import dev.kaspa.gateway.rpc.Envelopes;
import dev.kaspa.gateway.rpc.GatewayErrorKind;
import dev.kaspa.gateway.rpc.GatewayException;
import dev.kaspa.gateway.rpc.LatencyRecorder;
import dev.kaspa.gateway.rpc.UnaryCallAdapter;
import dev.kaspa.gateway.rpc.protowire.KaspadRequest;
import dev.kaspa.gateway.rpc.protowire.KaspadResponse;
import dev.kaspa.gateway.rpc.protowire.RPCGrpc;
import dev.kaspa.gateway.rpc.protowire.RpcOutpoint;
import dev.kaspa.gateway.rpc.protowire.RpcUtxosByAddressesEntry;
import dev.kaspa.gateway.rpc.protowire.UtxosChangedNotificationMessage;
import dev.kaspa.gateway.rpc.relay.NotificationSource;
import dev.kaspa.gateway.rpc.relay.SubscriptionRelay;
import io.grpc.ConnectivityState;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GrpcRpcChannelTest {

    private static final String HASH = "c0ffee".repeat(10) + "beef";

    private final FakeNode node = new FakeNode();
    private Server server;
    private GrpcRpcChannel channel;

    @BeforeEach
    void startNode() throws IOException {
        String name = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(name)
            .directExecutor()
            .addService(node)
            .build()
            .start();
        channel = GrpcRpcChannel.connect(InProcessChannelBuilder.forName(name).directExecutor(), Duration.ofSeconds(5));
    }

    @AfterEach
    void stopNode() throws InterruptedException {
        channel.close();
        server.shutdownNow();
        server.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void connectWaitsUntilReady() {
        assertEquals(ConnectivityState.READY, channel.state());
    }

    @Test
    void unaryCallRoundTripsOverOneStream() {
        UnaryCallAdapter adapter = new UnaryCallAdapter(channel, new AtomicCorrelationIdGenerator(), LatencyRecorder.NOOP);

        StepVerifier.create(adapter.call(Envelopes.getBlockRequest(HASH)))
            .assertNext(response -> {
                assertEquals(HASH, response.getGetBlockResponse().getBlock().getHeader().getHash());
                assertEquals(1L, response.getId());
            })
            .verifyComplete();
        assertEquals(1, node.requests.size());
        assertEquals(1L, node.requests.get(0).getId());
    }

    @Test
    void nodeClosingStreamWithErrorIsConnectionError() {
        node.failWith = Status.UNAVAILABLE.withDescription("node shutting down");
        UnaryCallAdapter adapter = new UnaryCallAdapter(channel, new AtomicCorrelationIdGenerator(), LatencyRecorder.NOOP);

        StepVerifier.create(adapter.call(Envelopes.getBlockRequest(HASH)))
            .expectErrorSatisfies(error -> {
                GatewayException gatewayError = assertInstanceOf(GatewayException.class, error);
                assertEquals(GatewayErrorKind.CONNECTION, gatewayError.kind());
                assertTrue(gatewayError.getMessage().contains("UNAVAILABLE"));
            })
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void subscriptionStreamsUntilCancelledAndNodeSeesCancellation() throws InterruptedException {
        SubscriptionRelay relay = new SubscriptionRelay(channel, new AtomicCorrelationIdGenerator());

        NotificationSource source = relay.subscribe(List.of("kaspa:qpwatched"));

        StepVerifier.create(source.notifications(), 2)
            .assertNext(n -> assertEquals(0L, n.added().get(0).outpoint().index()))
            .assertNext(n -> assertEquals(1L, n.added().get(0).outpoint().index()))
            .thenCancel()
            .verify(Duration.ofSeconds(5));
        assertTrue(node.cancelled.await(5, TimeUnit.SECONDS));
        assertEquals(NotificationSource.State.CLOSED, source.state());
    }

    @Test
    void unreachableNodeFailsToConnect() {
        GatewayException error = assertThrows(GatewayException.class,
            () -> GrpcRpcChannel.connect(new NodeTarget("127.0.0.1", 1, false), Duration.ofSeconds(5), List.of()));

        assertEquals(GatewayErrorKind.CONNECTION, error.kind());
    }

    private static final class FakeNode extends RPCGrpc.RPCImplBase {

        final List<KaspadRequest> requests = new CopyOnWriteArrayList<>();
        final CountDownLatch cancelled = new CountDownLatch(1);
        volatile Status failWith;

        @Override
        public StreamObserver<KaspadRequest> messageStream(StreamObserver<KaspadResponse> responseObserver) {
            ServerCallStreamObserver<KaspadResponse> responses = (ServerCallStreamObserver<KaspadResponse>) responseObserver;
            responses.setOnCancelHandler(cancelled::countDown);
            return new StreamObserver<>() {
                @Override
                public void onNext(KaspadRequest request) {
                    requests.add(request);
                    if (failWith != null) {
                        responses.onError(failWith.asRuntimeException());
                        return;
                    }
                    switch (request.getPayloadCase()) {
                        case GET_BLOCK_REQUEST -> responses.onNext(Envelopes.getBlockResponse(request.getGetBlockRequest().getHash())
                            .toBuilder().setId(request.getId()).build());
                        case NOTIFY_UTXOS_CHANGED_REQUEST -> {
                            for (int index = 0; index < 3; index++) {
                                responses.onNext(notification(request.getNotifyUtxosChangedRequest().getAddresses(0), index));
                            }
                        }
                        default -> responses.onError(Status.UNIMPLEMENTED.asRuntimeException());
                    }
                }

                @Override
                public void onError(Throwable t) {
                    // client cancellation, reported through the cancel handler
                }

                @Override
                public void onCompleted() {
                    if (failWith == null) {
                        responses.onCompleted();
                    }
                }
            };
        }

        private static KaspadResponse notification(String address, int index) {
            return KaspadResponse.newBuilder()
                .setUtxosChangedNotification(UtxosChangedNotificationMessage.newBuilder()
                    .addAdded(RpcUtxosByAddressesEntry.newBuilder()
                        .setAddress(address)
                        .setOutpoint(RpcOutpoint.newBuilder().setTransactionId("ab".repeat(32)).setIndex(index))))
                .build();
        }
    }
}
