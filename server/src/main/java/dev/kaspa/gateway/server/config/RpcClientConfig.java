package dev.kaspa.gateway.server.config;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.kaspa.gateway.rpc.AtomicCorrelationIdGenerator;
import dev.kaspa.gateway.rpc.CorrelationIdGenerator;
import dev.kaspa.gateway.rpc.KaspaNodeClient;
import dev.kaspa.gateway.rpc.LatencyRecorder;
import dev.kaspa.gateway.rpc.UnaryCallAdapter;
import dev.kaspa.gateway.rpc.grpc.GrpcRpcChannel;
import dev.kaspa.gateway.rpc.grpc.NodeTarget;
import dev.kaspa.gateway.rpc.relay.SubscriptionRelay;
import dev.kaspa.gateway.server.wire.WireLoggingInterceptor;
import io.grpc.ClientInterceptor;

/**
 * Wires the node channel and the call layers on top of it. The channel is connected eagerly so
 * the application refuses to start when the node is unreachable.
 */
@Configuration
public class RpcClientConfig {

	private static final Logger logger = LoggerFactory.getLogger(RpcClientConfig.class);

	@Bean(destroyMethod = "close")
	public GrpcRpcChannel rpcChannel(GatewayProperties properties) {
		NodeTarget target = NodeTarget.parse(properties.getNodeUrl());
		List<ClientInterceptor> interceptors = properties.isWireLogging() ? List.of(new WireLoggingInterceptor())
				: List.of();
		logger.info("Connecting to Kaspa node at {} (timeout {})", target, properties.getConnectTimeout());
		GrpcRpcChannel channel = GrpcRpcChannel.connect(target, properties.getConnectTimeout(), interceptors);
		logger.info("Connected to Kaspa node at {}", target);
		return channel;
	}

	@Bean
	public CorrelationIdGenerator correlationIdGenerator() {
		return new AtomicCorrelationIdGenerator();
	}

	@Bean
	public UnaryCallAdapter unaryCallAdapter(GrpcRpcChannel channel, CorrelationIdGenerator correlationIds,
			LatencyRecorder latencyRecorder) {
		return new UnaryCallAdapter(channel, correlationIds, latencyRecorder);
	}

	@Bean
	public SubscriptionRelay subscriptionRelay(GrpcRpcChannel channel, CorrelationIdGenerator correlationIds) {
		return new SubscriptionRelay(channel, correlationIds);
	}

	@Bean
	public KaspaNodeClient kaspaNodeClient(UnaryCallAdapter unaryCallAdapter, SubscriptionRelay subscriptionRelay) {
		return new KaspaNodeClient(unaryCallAdapter, subscriptionRelay);
	}

}
