package dev.kaspa.gateway.server.web;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import dev.kaspa.gateway.server.metrics.MicrometerLatencyRecorder;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HealthControllerTest {

	private final PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

	@Test
	void healthIsOkWithEmptyBody() {
		ResponseEntity<Void> response = new HealthController(this.registry).health();

		assertEquals(200, response.getStatusCode().value());
		assertNull(response.getBody());
	}

	@Test
	void metricsExposeLatencyHistogram() {
		new MicrometerLatencyRecorder(this.registry, Duration.ofMillis(50)).record("get_block", 12.5);

		ResponseEntity<String> response = new HealthController(this.registry).metrics();

		assertEquals(HealthController.PROMETHEUS_TEXT, response.getHeaders().getContentType());
		assertTrue(response.getBody().contains("kaspa_rpc_latency_seconds_bucket"));
		assertTrue(response.getBody().contains("operation=\"get_block\""));
	}

}
