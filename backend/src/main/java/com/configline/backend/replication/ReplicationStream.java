package com.configline.backend.replication;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One subscriber. Writers enqueue through {@link #offer(StreamRecord)} and never block; a single
 * delivery loop ({@link #run()}) drains the queue into the sink.
 *
 * <p>Records offered before {@link #init(StreamRecord, Map)} are held back and replayed after the
 * snapshot, so the client always sees {@code init} first.
 *
 * <p>Config ids are never reused, so once a config's deletion has been delivered every later
 * record for that id is dropped. A change rendered before the delete committed can reach the
 * stream after the delete record.
 */
public class ReplicationStream implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ReplicationStream.class);

    public enum CloseReason { OVERFLOW, SEND_FAILED, CLIENT_DISCONNECTED, MAX_LIFETIME, SHUTDOWN, INIT_FAILED }

    private static final StreamRecord WAKE_UP = new StreamRecord("wake", null, null, null, null, null, 0);

    private final UUID id = UUID.randomUUID();
    private final String projectId;
    private final String environmentId;
    private final StreamSink sink;
    private final ObjectMapper om;
    private final Clock clock;
    private final Duration heartbeat;
    private final Instant deadline;
    private final int capacity;
    private final BlockingQueue<StreamRecord> queue;
    private final ArrayDeque<StreamRecord> held = new ArrayDeque<>();
    private final Map<String, Integer> lastVersions = new HashMap<>();
    private final Set<UUID> deletedConfigs = new HashSet<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Consumer<ReplicationStream> onClose;

    private boolean initialized;
    private volatile CloseReason closeReason;

    public ReplicationStream(
            String projectId,
            String environmentId,
            StreamSink sink,
            ObjectMapper om,
            Clock clock,
            ReplicationProperties props,
            Consumer<ReplicationStream> onClose
    ) {
        this.projectId = projectId;
        this.environmentId = environmentId;
        this.sink = sink;
        this.om = om;
        this.clock = clock;
        this.heartbeat = props.getHeartbeatInterval();
        this.deadline = clock.instant().plus(props.getMaxLifetime());
        this.capacity = props.getQueueCapacity();
        this.queue = new ArrayBlockingQueue<>(capacity + 1);
        this.onClose = onClose;
        sink.onDisconnect(() -> close(CloseReason.CLIENT_DISCONNECTED));
    }

    public UUID id() { return id; }
    public String projectId() { return projectId; }
    public String environmentId() { return environmentId; }
    public boolean isClosed() { return closed.get(); }
    public CloseReason closeReason() { return closeReason; }
    public int queued() { return queue.size(); }

    /** Enqueues the snapshot, then replays whatever arrived while it was being built. */
    public synchronized void init(StreamRecord initRecord, Map<String, Integer> versions) {
        if (closed.get()) return;
        lastVersions.putAll(versions);
        initialized = true;
        if (!enqueue(initRecord)) return;
        while (!held.isEmpty()) {
            if (!offer(held.poll())) return;
        }
    }

    /**
     * @return false when the record was not accepted because the stream is closed or just
     *         overflowed; stale records are dropped and count as accepted
     */
    public synchronized boolean offer(StreamRecord record) {
        if (closed.get()) return false;
        if (!initialized) {
            if (held.size() >= capacity) {
                close(CloseReason.OVERFLOW);
                return false;
            }
            held.add(record);
            return true;
        }
        if (record.configId() != null && deletedConfigs.contains(record.configId())) {
            return true;
        }
        if (StreamRecord.CONFIG_DELETED.equals(record.type())) {
            deletedConfigs.add(record.configId());
            String prefix = record.configId() + ":";
            lastVersions.keySet().removeIf(k -> k.startsWith(prefix));
            return enqueue(record);
        }
        if (record.entityKey() != null) {
            Integer last = lastVersions.get(record.entityKey());
            if (last != null && record.version() <= last) {
                return true;
            }
            lastVersions.put(record.entityKey(), record.version());
        }
        return enqueue(record);
    }

    private boolean enqueue(StreamRecord record) {
        // one slot is kept free for the wake-up marker
        if (queue.size() >= capacity || !queue.offer(record)) {
            close(CloseReason.OVERFLOW);
            return false;
        }
        return true;
    }

    @Override
    public void run() {
        try {
            sink.comment("connected");
            while (!closed.get()) {
                Duration untilDeadline = Duration.between(clock.instant(), deadline);
                if (untilDeadline.isNegative() || untilDeadline.isZero()) {
                    close(CloseReason.MAX_LIFETIME);
                    return;
                }
                long waitMs = Math.min(heartbeat.toMillis(), untilDeadline.toMillis());
                StreamRecord next = queue.poll(waitMs, TimeUnit.MILLISECONDS);
                if (closed.get()) return;
                if (next == null) {
                    if (!Duration.between(clock.instant(), deadline).isNegative()) {
                        sink.comment("ping");
                    }
                    continue;
                }
                if (next == WAKE_UP) continue;
                sink.send(serialize(next));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close(CloseReason.SHUTDOWN);
        } catch (IOException | RuntimeException e) {
            log.debug("replication stream {} send failed: {}", id, e.getMessage());
            close(CloseReason.SEND_FAILED);
        }
    }

    private String serialize(StreamRecord r) {
        try {
            return om.writeValueAsString(r);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize replication record", e);
        }
    }

    /** Closes once; later calls are no-ops. */
    public void close(CloseReason reason) {
        if (!closed.compareAndSet(false, true)) return;
        closeReason = reason;
        queue.offer(WAKE_UP);
        try {
            sink.complete();
        } catch (RuntimeException e) {
            log.debug("completing replication stream {} failed: {}", id, e.getMessage());
        }
        log.info("replication stream {} closed ({}) project={} env={}", id, reason, projectId, environmentId);
        onClose.accept(this);
    }
}
