package dev.kaspa.gateway.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.kaspa.gateway.rpc.LatencyRecorder;
import dev.kaspa.gateway.server.metrics.MicrometerLatencyRecorder;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

/**
 * Prometheus registry backing {@code /metrics} and the latency recorder handed to the node client.
 */
@Configuration
public class MetricsConfig {

	@Bean(destroyMethod = "close")
	public PrometheusMeterRegistry prometheusMeterRegistry() {
		return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
	}

	@Bean
	public LatencyRecorder latencyRecorder(PrometheusMeterRegistry registry, GatewayProperties properties) {
		return new MicrometerLatencyRecorder(registry, properties.getLatencyTarget());
	}

}
