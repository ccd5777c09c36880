package com.configline.backend.replication;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Stream lifecycle counters. Start and stop are each counted exactly once per stream, so
 * {@code started - stopped == active} holds whenever no update is in flight.
 */
@Component
public class StreamMetrics {

    public record Snapshot(long started, long stopped, long active) {}

    private final AtomicLong active = new AtomicLong();
    private final AtomicLong startedTotal = new AtomicLong();
    private final AtomicLong stoppedTotal = new AtomicLong();
    private final Counter started;
    private final Counter stopped;

    public StreamMetrics(MeterRegistry registry) {
        this.started = Counter.builder("replication.streams.started")
                .description("Total number of replication streams started")
                .register(registry);
        this.stopped = Counter.builder("replication.streams.stopped")
                .description("Total number of replication streams stopped")
                .register(registry);
        registry.gauge("replication.streams.active", active);
    }

    public synchronized void streamStarted() {
        startedTotal.incrementAndGet();
        active.incrementAndGet();
        started.increment();
    }

    public synchronized void streamStopped() {
        stoppedTotal.incrementAndGet();
        active.decrementAndGet();
        stopped.increment();
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(startedTotal.get(), stoppedTotal.get(), active.get());
    }
}
