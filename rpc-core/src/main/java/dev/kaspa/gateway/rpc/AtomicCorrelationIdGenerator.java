package dev.kaspa.gateway.rpc;

import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link CorrelationIdGenerator} backed by a single atomic counter. The counter is the only shared
 * mutable state of the correlation layer.
 */
public final class AtomicCorrelationIdGenerator implements CorrelationIdGenerator {

    private final AtomicLong counter;

    public AtomicCorrelationIdGenerator() {
        this(0L);
    }

    /**
     * @param lastIssued value treated as already issued; the next id is its unsigned successor
     */
    AtomicCorrelationIdGenerator(long lastIssued) {
        this.counter = new AtomicLong(lastIssued);
    }

    @Override
    public long next() {
        long id = counter.incrementAndGet();
        while (id == 0L) {
            // wrapped past 2^64 - 1
            id = counter.incrementAndGet();
        }
        return id;
    }
}
