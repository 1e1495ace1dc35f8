package dev.kaspa.gateway.server.config;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the connection to the Kaspa node and for the client facing
 * endpoints the gateway exposes.
 */
@ConfigurationProperties(prefix = "kaspa.gateway")
public class GatewayProperties {

	/**
	 * gRPC endpoint of the Kaspa node, as {@code http://host:port}, {@code https://host:port} or
	 * {@code host:port}.
	 */
	private String nodeUrl = "http://localhost:16110";

	/**
	 * How long startup waits for the node connection to become ready.
	 */
	private Duration connectTimeout = Duration.ofSeconds(10);

	/**
	 * Node calls slower than this are logged as warnings.
	 */
	private Duration latencyTarget = Duration.ofMillis(50);

	/**
	 * Log every envelope exchanged with the node on the {@code WIRE} logger.
	 */
	private boolean wireLogging = false;

	private final WebSocket websocket = new WebSocket();

	/**
	 * Retrieve the node endpoint.
	 * @return node URL as configured
	 */
	public String getNodeUrl() {
		return nodeUrl;
	}

	/**
	 * Update the node endpoint.
	 * @param nodeUrl node URL
	 */
	public void setNodeUrl(String nodeUrl) {
		this.nodeUrl = nodeUrl;
	}

	/**
	 * Retrieve the connect timeout.
	 * @return maximum time to wait for the node channel at startup
	 */
	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	/**
	 * Update the connect timeout.
	 * @param connectTimeout maximum time to wait, {@code null} restores the default
	 */
	public void setConnectTimeout(Duration connectTimeout) {
		this.connectTimeout = Objects.requireNonNullElse(connectTimeout, Duration.ofSeconds(10));
	}

	/**
	 * Retrieve the latency target used for slow call warnings.
	 * @return latency target
	 */
	public Duration getLatencyTarget() {
		return latencyTarget;
	}

	/**
	 * Update the latency target.
	 * @param latencyTarget new target, {@code null} restores the default
	 */
	public void setLatencyTarget(Duration latencyTarget) {
		this.latencyTarget = Objects.requireNonNullElse(latencyTarget, Duration.ofMillis(50));
	}

	/**
	 * Determine whether node traffic is logged.
	 * @return {@code true} when every envelope is logged on {@code WIRE}
	 */
	public boolean isWireLogging() {
		return wireLogging;
	}

	/**
	 * Enable or disable node traffic logging.
	 * @param wireLogging {@code true} to log every envelope
	 */
	public void setWireLogging(boolean wireLogging) {
		this.wireLogging = wireLogging;
	}

	/**
	 * Settings of the UTXO subscription WebSocket.
	 * @return nested WebSocket settings
	 */
	public WebSocket getWebsocket() {
		return websocket;
	}

	/**
	 * WebSocket endpoint settings.
	 */
	public static class WebSocket {

		/**
		 * Path the UTXO subscription handler is mapped to.
		 */
		private String endpoint = "/ws/subscribeUTXO";

		/**
		 * Origins allowed to open the WebSocket.
		 */
		private List<String> allowedOrigins = List.of("*");

		public String getEndpoint() {
			return endpoint;
		}

		public void setEndpoint(String endpoint) {
			this.endpoint = endpoint;
		}

		public List<String> getAllowedOrigins() {
			return allowedOrigins;
		}

		public void setAllowedOrigins(List<String> allowedOrigins) {
			this.allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty() ? List.of("*") : allowedOrigins;
		}

	}

}
