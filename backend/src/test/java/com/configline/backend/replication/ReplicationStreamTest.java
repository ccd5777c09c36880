package com.configline.backend.replication;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ReplicationStreamTest {

    private final ObjectMapper om = new ObjectMapper();
    private final UUID configId = UUID.randomUUID();

    @Test
    void recordsOfferedBeforeInit_areDeliveredAfterTheSnapshot() throws Exception {
        FakeSink sink = new FakeSink();
        ReplicationStream stream = stream(sink, 16, s -> {});

        stream.offer(change(2));
        stream.init(StreamRecord.init(List.of(sdk(1))), Map.of(configId + ":base", 1));

        Thread t = new Thread(stream);
        t.start();
        assertTrue(sink.awaitSent(2, 2000));
        stream.close(ReplicationStream.CloseReason.SHUTDOWN);
        t.join(2000);

        assertEquals("connected", sink.comments.get(0));
        assertEquals("init", type(sink.sent.get(0)));
        assertEquals("config_change", type(sink.sent.get(1)));
        assertEquals(2, om.readTree(sink.sent.get(1)).get("config").get("version").intValue());
        // internal ordering fields stay off the wire
        assertFalse(om.readTree(sink.sent.get(1)).has("entityKey"));
    }

    @Test
    void staleVersions_areDropped() {
        FakeSink sink = new FakeSink();
        ReplicationStream stream = stream(sink, 16, s -> {});
        stream.init(StreamRecord.init(List.of(sdk(3))), Map.of(configId + ":base", 3));

        assertTrue(stream.offer(change(2)));
        assertTrue(stream.offer(change(3)));
        assertEquals(1, stream.queued());

        stream.offer(change(4));
        stream.offer(change(4));
        assertEquals(2, stream.queued());
    }

    @Test
    void changeArrivingAfterDeletion_isDropped() throws Exception {
        FakeSink sink = new FakeSink();
        ReplicationStream stream = stream(sink, 16, s -> {});
        stream.init(StreamRecord.init(List.of(sdk(1))), Map.of(configId + ":base", 1));

        assertTrue(stream.offer(StreamRecord.deleted(configId, "flags")));
        // rendered before the delete committed, offered after it
        assertTrue(stream.offer(change(2)));
        assertTrue(stream.offer(StreamRecord.deleted(configId, "flags")));
        assertEquals(2, stream.queued());

        Thread t = new Thread(stream);
        t.start();
        assertTrue(sink.awaitSent(2, 2000));
        stream.close(ReplicationStream.CloseReason.SHUTDOWN);
        t.join(2000);

        assertEquals(List.of("init", "config_deleted"), sink.sent.stream().map(this::typeOf).toList());
    }

    @Test
    void deletionHeldBeforeInit_stillDropsLateChange() {
        FakeSink sink = new FakeSink();
        ReplicationStream stream = stream(sink, 16, s -> {});

        stream.offer(StreamRecord.deleted(configId, "flags"));
        stream.init(StreamRecord.init(List.of(sdk(1))), Map.of(configId + ":base", 1));
        stream.offer(change(2));

        assertEquals(2, stream.queued());
    }

    @Test
    void maxLifetime_closesStreamFromDeliveryLoop() throws Exception {
        FakeSink sink = new FakeSink();
        AtomicInteger closes = new AtomicInteger();
        ReplicationProperties props = new ReplicationProperties();
        props.setHeartbeatInterval(Duration.ofSeconds(30));
        props.setMaxLifetime(Duration.ofMillis(50));
        ReplicationStream stream = new ReplicationStream("p1", "prod", sink, om, Clock.systemUTC(), props,
                s -> closes.incrementAndGet());
        stream.init(StreamRecord.init(List.of()), Map.of());

        Thread t = new Thread(stream);
        t.start();
        t.join(2000);

        assertFalse(t.isAlive());
        assertEquals(ReplicationStream.CloseReason.MAX_LIFETIME, stream.closeReason());
        assertEquals(1, closes.get());
        assertEquals(1, sink.completeCalls);
        assertEquals(1, sink.sent.size());
    }

    @Test
    void overflow_closesStreamOnce() {
        FakeSink sink = new FakeSink();
        AtomicInteger closes = new AtomicInteger();
        ReplicationStream stream = stream(sink, 2, s -> closes.incrementAndGet());
        stream.init(StreamRecord.init(List.of()), Map.of());

        assertTrue(stream.offer(change(1)));
        assertFalse(stream.offer(change(2)));

        assertTrue(stream.isClosed());
        assertEquals(ReplicationStream.CloseReason.OVERFLOW, stream.closeReason());
        stream.close(ReplicationStream.CloseReason.SHUTDOWN);
        assertEquals(1, closes.get());
        assertEquals(1, sink.completeCalls);
        assertFalse(stream.offer(change(3)));
    }

    @Test
    void sendFailure_closesStream() throws Exception {
        FakeSink sink = new FakeSink();
        sink.failSends = true;
        ReplicationStream stream = stream(sink, 16, s -> {});
        stream.init(StreamRecord.init(List.of()), Map.of());

        Thread t = new Thread(stream);
        t.start();
        t.join(2000);

        assertEquals(ReplicationStream.CloseReason.SEND_FAILED, stream.closeReason());
    }

    @Test
    void clientDisconnect_closesStream() {
        FakeSink sink = new FakeSink();
        ReplicationStream stream = stream(sink, 16, s -> {});

        sink.disconnect.run();

        assertEquals(ReplicationStream.CloseReason.CLIENT_DISCONNECTED, stream.closeReason());
    }

    private ReplicationStream stream(FakeSink sink, int capacity, java.util.function.Consumer<ReplicationStream> onClose) {
        ReplicationProperties props = new ReplicationProperties();
        props.setQueueCapacity(capacity);
        props.setHeartbeatInterval(Duration.ofSeconds(30));
        return new ReplicationStream("p1", "prod", sink, om, Clock.systemUTC(), props, onClose);
    }

    private StreamRecord change(int version) {
        return StreamRecord.change(new ReplicaEntry(configId, ReplicaEntry.BASE, sdk(version)));
    }

    private static SdkConfig sdk(int version) {
        JsonNode overrides = JsonNodeFactory.instance.arrayNode();
        return new SdkConfig("flags", IntNode.valueOf(version), overrides, version);
    }

    private String type(String json) throws Exception {
        return om.readTree(json).get("type").asText();
    }

    private String typeOf(String json) {
        try {
            return type(json);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
