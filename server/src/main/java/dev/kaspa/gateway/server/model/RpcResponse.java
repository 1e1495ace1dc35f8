package dev.kaspa.gateway.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope of every successful RPC endpoint reply.
 * @param success always {@code true} for replies produced by the controllers
 * @param data operation result
 * @param error failure description, {@code null} on success
 * @param latencyMs time spent serving the request, in milliseconds
 * @param <T> type of the operation result
 */
public record RpcResponse<T>(boolean success, T data, String error, @JsonProperty("latency_ms") double latencyMs) {

	public static <T> RpcResponse<T> success(T data, double latencyMs) {
		return new RpcResponse<>(true, data, null, latencyMs);
	}

}
