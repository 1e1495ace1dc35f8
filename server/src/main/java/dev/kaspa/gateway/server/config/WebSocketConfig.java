package dev.kaspa.gateway.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.kaspa.gateway.rpc.KaspaNodeClient;
import dev.kaspa.gateway.server.transport.AddressQueryHandshakeInterceptor;
import dev.kaspa.gateway.server.transport.UtxoSubscriptionHandler;

/**
 * Registers the UTXO subscription handler on the configured endpoint.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

	private final GatewayProperties properties;

	private final KaspaNodeClient nodeClient;

	private final ObjectMapper objectMapper;

	public WebSocketConfig(GatewayProperties properties, KaspaNodeClient nodeClient, ObjectMapper objectMapper) {
		this.properties = properties;
		this.nodeClient = nodeClient;
		this.objectMapper = objectMapper;
	}

	@Bean
	public UtxoSubscriptionHandler utxoSubscriptionHandler() {
		return new UtxoSubscriptionHandler(this.nodeClient, this.objectMapper);
	}

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		GatewayProperties.WebSocket websocket = this.properties.getWebsocket();
		registry.addHandler(utxoSubscriptionHandler(), websocket.getEndpoint())
			.addInterceptors(new AddressQueryHandshakeInterceptor())
			.setAllowedOriginPatterns(websocket.getAllowedOrigins().toArray(String[]::new));
	}

}
