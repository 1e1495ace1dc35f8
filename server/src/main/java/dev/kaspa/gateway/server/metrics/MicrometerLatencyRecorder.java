package dev.kaspa.gateway.server.metrics;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.kaspa.gateway.rpc.LatencyRecorder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * {@link LatencyRecorder} publishing one histogram timer per node operation and warning about
 * calls slower than the configured target.
 */
public class MicrometerLatencyRecorder implements LatencyRecorder {

	private static final Logger logger = LoggerFactory.getLogger(MicrometerLatencyRecorder.class);

	/**
	 * Name of the timer; the operation is carried in the {@code operation} tag.
	 */
	public static final String METRIC_NAME = "kaspa.rpc.latency";

	private static final Duration[] BUCKETS = { Duration.ofMillis(1), Duration.ofMillis(5), Duration.ofMillis(10),
			Duration.ofMillis(25), Duration.ofMillis(50), Duration.ofMillis(100), Duration.ofMillis(250),
			Duration.ofMillis(500), Duration.ofMillis(1000) };

	private final MeterRegistry registry;

	private final double targetMillis;

	private final Map<String, Timer> timers = new ConcurrentHashMap<>();

	/**
	 * Create a recorder.
	 * @param registry registry the timers are registered with
	 * @param latencyTarget calls above this duration are logged at WARN
	 */
	public MicrometerLatencyRecorder(MeterRegistry registry, Duration latencyTarget) {
		this.registry = Objects.requireNonNull(registry, "registry");
		this.targetMillis = latencyTarget.toNanos() / 1_000_000.0;
	}

	@Override
	public void record(String operation, double millis) {
		Timer timer = this.timers.computeIfAbsent(operation, this::timer);
		timer.record((long) (millis * 1_000_000), TimeUnit.NANOSECONDS);
		if (millis > this.targetMillis) {
			logger.warn("Node call {} took {} ms, above the {} ms target", operation, String.format("%.3f", millis),
					this.targetMillis);
		}
	}

	private Timer timer(String operation) {
		return Timer.builder(METRIC_NAME)
			.description("Round trip time of calls to the Kaspa node")
			.tag("operation", operation)
			.serviceLevelObjectives(BUCKETS)
			.register(this.registry);
	}

}
