package dev.kaspa.gateway.rpc;

/**
 * Observability hook invoked once after every unary call, whether it succeeded or failed.
 * Implementations must not block and must not throw.
 */
@FunctionalInterface
public interface LatencyRecorder {

    LatencyRecorder NOOP = (operation, millis) -> {
    };

    void record(String operation, double millis);
}
