package com.configline.backend.replication;

import com.configline.backend.error.BadRequestException;
import com.configline.backend.project.SdkScope;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry of live replication streams. Each stream gets its own delivery task; committed
 * changes are rendered once per environment and offered to every stream of that environment.
 */
@Component
public class ReplicationStreamManager implements DisposableBean {
    private static final Logger log = LoggerFactory.getLogger(ReplicationStreamManager.class);

    public record StartRequest(List<SdkConfig> currentConfigs, List<String> requiredConfigs) {}

    private final Map<UUID, ReplicationStream> streams = new ConcurrentHashMap<>();
    private final Map<String, Object> publishLocks = new ConcurrentHashMap<>();
    private final ConfigReplicaService replicas;
    private final StreamMetrics metrics;
    private final ReplicationProperties props;
    private final ObjectMapper om;
    private final Clock clock;
    private final ExecutorService delivery;

    public ReplicationStreamManager(
            ConfigReplicaService replicas,
            StreamMetrics metrics,
            ReplicationProperties props,
            ObjectMapper om,
            Clock clock
    ) {
        this.replicas = replicas;
        this.metrics = metrics;
        this.props = props;
        this.om = om;
        this.clock = clock;
        AtomicInteger n = new AtomicInteger();
        this.delivery = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "replication-stream-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Registers the subscriber first and only then builds its snapshot, so no change committed
     * in between can be missed.
     */
    public ReplicationStream open(SdkScope scope, StreamSink sink, StartRequest request) {
        ReplicationStream stream = new ReplicationStream(
                scope.projectId(), scope.environmentId(), sink, om, clock, props, this::unregister);
        streams.put(stream.id(), stream);
        metrics.streamStarted();

        try {
            List<ReplicaEntry> snapshot = replicas.snapshot(scope.projectId(), scope.environmentId());
            List<SdkConfig> configs = initialState(snapshot, request);
            Map<String, Integer> versions = new HashMap<>();
            snapshot.forEach(e -> versions.put(e.entityKey(), e.config().version()));
            stream.init(StreamRecord.init(configs), versions);
        } catch (RuntimeException e) {
            stream.close(ReplicationStream.CloseReason.INIT_FAILED);
            throw e;
        }
        delivery.execute(stream);
        log.info("replication stream {} opened project={} env={}", stream.id(), scope.projectId(), scope.environmentId());
        return stream;
    }

    /** Server state wins over what the client already has; required configs must exist somewhere. */
    static List<SdkConfig> initialState(List<ReplicaEntry> snapshot, StartRequest request) {
        Map<String, SdkConfig> merged = new LinkedHashMap<>();
        if (request != null && request.currentConfigs() != null) {
            request.currentConfigs().forEach(c -> merged.put(c.name(), c));
        }
        snapshot.forEach(e -> merged.put(e.config().name(), e.config()));

        if (request != null && request.requiredConfigs() != null) {
            List<String> missing = request.requiredConfigs().stream().filter(n -> !merged.containsKey(n)).toList();
            if (!missing.isEmpty()) {
                throw new BadRequestException("Required configs not found: " + String.join(", ", missing));
            }
        }
        return new ArrayList<>(merged.values());
    }

    /**
     * Renders and offers under a per-project lock. Each listener renders the committed state at
     * the time it holds the lock, so a change that lost the race to a later delete renders as
     * missing and is skipped instead of overtaking the delete record.
     */
    public void publishChange(String projectId, UUID configId, String configName, boolean deleted) {
        synchronized (publishLocks.computeIfAbsent(projectId, k -> new Object())) {
            Map<String, List<ReplicationStream>> byEnv = new HashMap<>();
            for (ReplicationStream s : streams.values()) {
                if (s.projectId().equals(projectId) && !s.isClosed()) {
                    byEnv.computeIfAbsent(s.environmentId(), k -> new ArrayList<>()).add(s);
                }
            }
            if (byEnv.isEmpty()) return;

            for (var entry : byEnv.entrySet()) {
                StreamRecord record;
                if (deleted) {
                    record = StreamRecord.deleted(configId, configName);
                } else {
                    Optional<ReplicaEntry> rendered = replicas.render(projectId, configId, entry.getKey());
                    // deleted since this change committed; the delete record covers it
                    if (rendered.isEmpty()) continue;
                    record = StreamRecord.change(rendered.get());
                }
                for (ReplicationStream s : entry.getValue()) {
                    s.offer(record);
                }
            }
        }
    }

    public int activeStreams() {
        return streams.size();
    }

    private void unregister(ReplicationStream stream) {
        if (streams.remove(stream.id()) != null) {
            metrics.streamStopped();
        }
    }

    @Override
    public void destroy() {
        for (ReplicationStream s : List.copyOf(streams.values())) {
            s.close(ReplicationStream.CloseReason.SHUTDOWN);
        }
        delivery.shutdownNow();
    }
}
