package dev.kaspa.gateway.rpc.grpc;

import dev.kaspa.gateway.rpc.GatewayException;
import dev.kaspa.gateway.rpc.RpcChannel;
import dev.kaspa.gateway.rpc.RpcStream;
import dev.kaspa.gateway.rpc.protowire.KaspadRequest;
import dev.kaspa.gateway.rpc.protowire.KaspadResponse;
import dev.kaspa.gateway.rpc.protowire.RPCGrpc;
import io.grpc.CallOptions;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ConnectivityState;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link RpcChannel} backed by a single grpc-java {@link ManagedChannel}. Every stream is a separate
 * {@code protowire.RPC/MessageStream} call multiplexed over that channel. There is no reconnection
 * logic beyond what the channel itself does.
 */
public final class GrpcRpcChannel implements RpcChannel {

    static final int MAX_INBOUND_MESSAGE_BYTES = 64 * 1024 * 1024;

    private final ManagedChannel channel;

    GrpcRpcChannel(ManagedChannel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    /**
     * Connect to the node and wait until the connection is usable.
     * @throws GatewayException of kind {@code CONNECTION} when the node is unreachable within the
     * timeout
     */
    public static GrpcRpcChannel connect(NodeTarget target, Duration timeout, List<ClientInterceptor> interceptors) {
        ManagedChannelBuilder<?> builder = ManagedChannelBuilder.forAddress(target.host(), target.port())
            .maxInboundMessageSize(MAX_INBOUND_MESSAGE_BYTES)
            .intercept(interceptors);
        if (target.tls()) {
            builder.useTransportSecurity();
        } else {
            builder.usePlaintext();
        }
        return connect(builder, timeout);
    }

    static GrpcRpcChannel connect(ManagedChannelBuilder<?> builder, Duration timeout) {
        ManagedChannel channel = builder.build();
        try {
            awaitReady(channel, timeout);
        } catch (GatewayException e) {
            channel.shutdownNow();
            throw e;
        }
        return new GrpcRpcChannel(channel);
    }

    @Override
    public RpcStream openStream() {
        try {
            ClientCall<KaspadRequest, KaspadResponse> call =
                channel.newCall(RPCGrpc.getMessageStreamMethod(), CallOptions.DEFAULT);
            GrpcRpcStream stream = new GrpcRpcStream(call);
            stream.start();
            return stream;
        } catch (RuntimeException e) {
            throw GatewayException.connection("Unable to open stream to node: " + e.getMessage(), e);
        }
    }

    public ConnectivityState state() {
        return channel.getState(false);
    }

    @Override
    public void close() {
        channel.shutdown();
        try {
            if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitReady(ManagedChannel channel, Duration timeout) {
        CompletableFuture<ConnectivityState> settled = new CompletableFuture<>();
        watch(channel, channel.getState(true), settled);
        ConnectivityState state;
        try {
            state = settled.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw GatewayException.connection("Timed out after " + timeout + " connecting to node", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw GatewayException.connection("Interrupted while connecting to node", e);
        } catch (ExecutionException e) {
            throw GatewayException.connection("Failed connecting to node", e.getCause());
        }
        if (state != ConnectivityState.READY) {
            throw GatewayException.connection("Node connection failed, channel is " + state, null);
        }
    }

    private static void watch(ManagedChannel channel, ConnectivityState current,
                              CompletableFuture<ConnectivityState> settled) {
        if (current == ConnectivityState.READY
            || current == ConnectivityState.TRANSIENT_FAILURE
            || current == ConnectivityState.SHUTDOWN) {
            settled.complete(current);
            return;
        }
        channel.notifyWhenStateChanged(current, () -> watch(channel, channel.getState(false), settled));
    }
}
