package com.configline.backend.replication;

import com.configline.backend.error.BadRequestException;
import com.configline.backend.project.SdkScope;
import com.configline.backend.replication.ReplicationStreamManager.StartRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ReplicationStreamManagerTest {

    private final ObjectMapper om = new ObjectMapper();
    private final UUID flagsId = UUID.randomUUID();
    private final FakeReplicas replicas = new FakeReplicas();
    private final StreamMetrics metrics = new StreamMetrics(new SimpleMeterRegistry());
    private final ReplicationStreamManager manager =
            new ReplicationStreamManager(replicas, metrics, new ReplicationProperties(), om, Clock.systemUTC());

    @AfterEach
    void tearDown() {
        manager.destroy();
    }

    @Test
    void open_sendsSnapshotFirst_thenCommittedChanges() throws Exception {
        replicas.entries.add(entry(1));
        FakeSink sink = new FakeSink();

        manager.open(new SdkScope("p1", "prod"), sink, null);
        replicas.entries.set(0, entry(2));
        manager.publishChange("p1", flagsId, "flags", false);
        manager.publishChange("other", flagsId, "flags", false);

        assertTrue(sink.awaitSent(2, 2000));
        assertEquals("init", om.readTree(sink.sent.get(0)).get("type").asText());
        assertEquals(2, om.readTree(sink.sent.get(1)).get("config").get("version").intValue());
        assertEquals(1, replicas.renderCalls);
    }

    @Test
    void open_serverSnapshotWinsOverClientState() {
        var client = new SdkConfig("flags", IntNode.valueOf(99), JsonNodeFactory.instance.arrayNode(), 99);
        var clientOnly = new SdkConfig("local", IntNode.valueOf(1), JsonNodeFactory.instance.arrayNode(), 1);

        var merged = ReplicationStreamManager.initialState(List.of(entry(3)),
                new StartRequest(List.of(client, clientOnly), List.of("flags", "local")));

        assertEquals(2, merged.size());
        assertEquals(3, merged.stream().filter(c -> c.name().equals("flags")).findFirst().orElseThrow().version());
    }

    @Test
    void open_missingRequiredConfig_failsAndReleasesStream() {
        FakeSink sink = new FakeSink();

        assertThrows(BadRequestException.class, () ->
                manager.open(new SdkScope("p1", "prod"), sink, new StartRequest(null, List.of("nope"))));

        var s = metrics.snapshot();
        assertEquals(1, s.started());
        assertEquals(1, s.stopped());
        assertEquals(0, manager.activeStreams());
    }

    @Test
    void streamClose_countsStopExactlyOnce() {
        FakeSink sink = new FakeSink();
        ReplicationStream stream = manager.open(new SdkScope("p1", "prod"), sink, null);

        stream.close(ReplicationStream.CloseReason.CLIENT_DISCONNECTED);
        stream.close(ReplicationStream.CloseReason.SHUTDOWN);

        var s = metrics.snapshot();
        assertEquals(1, s.started());
        assertEquals(1, s.stopped());
        assertEquals(0, s.active());
    }

    @Test
    void deletion_isBroadcastWithoutRendering() throws Exception {
        replicas.entries.add(entry(1));
        FakeSink sink = new FakeSink();
        manager.open(new SdkScope("p1", "prod"), sink, null);

        manager.publishChange("p1", flagsId, "flags", true);

        assertTrue(sink.awaitSent(2, 2000));
        var record = om.readTree(sink.sent.get(1));
        assertEquals("config_deleted", record.get("type").asText());
        assertEquals("flags", record.get("configName").asText());
        assertEquals(0, replicas.renderCalls);
    }

    @Test
    void changeRenderedAfterDeletion_isNotPublished() throws Exception {
        replicas.entries.add(entry(1));
        FakeSink sink = new FakeSink();
        manager.open(new SdkScope("p1", "prod"), sink, null);

        manager.publishChange("p1", flagsId, "flags", true);
        replicas.entries.clear();
        manager.publishChange("p1", flagsId, "flags", false);

        assertTrue(sink.awaitSent(2, 2000));
        Thread.sleep(50);
        assertEquals(2, sink.sent.size());
        assertEquals("config_deleted", om.readTree(sink.sent.get(1)).get("type").asText());
    }

    @Test
    void maxLifetimeClose_keepsCountersConsistent() throws Exception {
        ReplicationProperties props = new ReplicationProperties();
        props.setMaxLifetime(Duration.ofMillis(50));
        StreamMetrics local = new StreamMetrics(new SimpleMeterRegistry());
        ReplicationStreamManager shortLived = new ReplicationStreamManager(replicas, local, props, om, Clock.systemUTC());
        try {
            ReplicationStream stream = shortLived.open(new SdkScope("p1", "prod"), new FakeSink(), null);

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (local.snapshot().stopped() == 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }

            assertEquals(ReplicationStream.CloseReason.MAX_LIFETIME, stream.closeReason());
            var s = local.snapshot();
            assertEquals(1, s.started());
            assertEquals(1, s.stopped());
            assertEquals(s.started() - s.stopped(), s.active());
            assertEquals(0, shortLived.activeStreams());
        } finally {
            shortLived.destroy();
        }
    }

    private ReplicaEntry entry(int version) {
        return new ReplicaEntry(flagsId, ReplicaEntry.BASE,
                new SdkConfig("flags", IntNode.valueOf(version), JsonNodeFactory.instance.arrayNode(), version));
    }

    static class FakeReplicas extends ConfigReplicaService {
        final List<ReplicaEntry> entries = new ArrayList<>();
        int renderCalls;

        FakeReplicas() {
            super(null, null, null);
        }

        @Override
        public List<ReplicaEntry> snapshot(String projectId, String environmentId) {
            return List.copyOf(entries);
        }

        @Override
        public Optional<ReplicaEntry> render(String projectId, UUID configId, String environmentId) {
            renderCalls++;
            return entries.stream().filter(e -> e.configId().equals(configId)).findFirst();
        }
    }
}
