package com.configline.backend.replication;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class StreamMetricsTest {

    @Test
    void counters_keepStartedMinusStoppedEqualToActive() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        StreamMetrics metrics = new StreamMetrics(registry);

        metrics.streamStarted();
        metrics.streamStarted();
        metrics.streamStopped();

        var s = metrics.snapshot();
        assertEquals(2, s.started());
        assertEquals(1, s.stopped());
        assertEquals(1, s.active());
        assertEquals(2.0, registry.get("replication.streams.started").counter().count());
        assertEquals(1.0, registry.get("replication.streams.stopped").counter().count());
        assertEquals(1.0, registry.get("replication.streams.active").gauge().value());
    }
}
