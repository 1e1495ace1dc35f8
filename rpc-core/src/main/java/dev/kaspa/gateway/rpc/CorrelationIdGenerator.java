package dev.kaspa.gateway.rpc;

/**
 * Source of correlation ids stamped on every outbound request envelope. Ids are unsigned 64-bit
 * values: strictly increasing within the process, never reused and never {@code 0}.
 */
@FunctionalInterface
public interface CorrelationIdGenerator {

    long next();
}
