package com.configline.backend.replication;

import com.configline.backend.configs.ConfigEntity;
import com.configline.backend.configs.ConfigRepository;
import com.configline.backend.configs.ConfigVariantEntity;
import com.configline.backend.configs.ConfigVariantRepository;
import com.configline.backend.configs.RepositoryReferenceResolver;
import com.configline.backend.override.EvaluationResult;
import com.configline.backend.override.OverrideCodec;
import com.configline.backend.override.OverrideEvaluator;
import com.configline.backend.override.OverrideRenderer;
import com.configline.backend.override.ReferenceResolver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Renders what SDKs of one project/environment see, and caches whole snapshots per environment.
 * A cached snapshot is dropped whenever a config of its project commits.
 *
 * <p>Runs in its own read-only transaction because it is also called after the writer's
 * transaction has committed.
 */
@Service
@Transactional(readOnly = true, propagation = Propagation.REQUIRES_NEW)
public class ConfigReplicaService {

    private record Scope(String projectId, String environmentId) {}

    /** A snapshot is served only while its project's generation has not moved. */
    private record Cached(long generation, List<ReplicaEntry> entries) {}

    private final ConfigRepository configs;
    private final ConfigVariantRepository variants;
    private final RepositoryReferenceResolver resolver;

    private final Map<Scope, Cached> cache = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> generations = new ConcurrentHashMap<>();

    public ConfigReplicaService(
            ConfigRepository configs,
            ConfigVariantRepository variants,
            RepositoryReferenceResolver resolver
    ) {
        this.configs = configs;
        this.variants = variants;
        this.resolver = resolver;
    }

    public List<ReplicaEntry> snapshot(String projectId, String environmentId) {
        Scope scope = new Scope(projectId, environmentId);
        long generation = generation(projectId).get();
        Cached cached = cache.get(scope);
        if (cached != null && cached.generation() == generation) return cached.entries();

        List<ReplicaEntry> fresh = renderAll(projectId, environmentId);
        // tagged with the generation read before rendering; a commit during rendering outdates it
        cache.merge(scope, new Cached(generation, fresh),
                (old, neu) -> old.generation() > neu.generation() ? old : neu);
        return fresh;
    }

    public Optional<ReplicaEntry> render(String projectId, UUID configId, String environmentId) {
        return configs.findById(configId)
                .filter(c -> c.getProjectId().equals(projectId))
                .map(c -> entryFor(c, variants.findByConfig_IdAndEnvironmentId(c.getId(), environmentId).orElse(null),
                        memoized(resolver)));
    }

    public Optional<ReplicaEntry> find(String projectId, String environmentId, String configName) {
        return snapshot(projectId, environmentId).stream()
                .filter(e -> e.config().name().equals(configName))
                .findFirst();
    }

    /** Evaluates the rendered config the way an SDK would, against literals only. */
    public Optional<EvaluationResult> evaluate(
            String projectId, String environmentId, String configName, Map<String, JsonNode> context) {
        return find(projectId, environmentId, configName).map(e -> OverrideEvaluator.evaluateWithTrace(
                e.config().value(),
                OverrideCodec.decodeLenient(e.config().overrides()),
                context,
                ReferenceResolver.NONE));
    }

    public void invalidate(String projectId) {
        generation(projectId).incrementAndGet();
        cache.keySet().removeIf(s -> s.projectId().equals(projectId));
    }

    List<ReplicaEntry> renderAll(String projectId, String environmentId) {
        Map<UUID, ConfigVariantEntity> byConfig = new HashMap<>();
        for (ConfigVariantEntity v : variants.findByConfig_ProjectIdAndEnvironmentId(projectId, environmentId)) {
            byConfig.put(v.getConfig().getId(), v);
        }
        ReferenceResolver refs = memoized(resolver);
        List<ReplicaEntry> out = new ArrayList<>();
        for (ConfigEntity c : configs.findByProjectIdOrderByNameAsc(projectId)) {
            out.add(entryFor(c, byConfig.get(c.getId()), refs));
        }
        return List.copyOf(out);
    }

    private static ReplicaEntry entryFor(ConfigEntity c, ConfigVariantEntity variant, ReferenceResolver refs) {
        JsonNode value = variant != null ? variant.getValue() : c.getValue();
        JsonNode overrides = variant != null ? variant.getOverrides() : c.getOverrides();
        int version = variant != null ? variant.getVersion() : c.getVersion();
        String source = variant != null ? variant.getId().toString() : ReplicaEntry.BASE;

        JsonNode rendered = OverrideCodec.encode(OverrideRenderer.render(OverrideCodec.decodeLenient(overrides), refs));
        SdkConfig sdk = new SdkConfig(c.getName(), value == null ? NullNode.getInstance() : value, rendered, version);
        return new ReplicaEntry(c.getId(), source, sdk);
    }

    private static ReferenceResolver memoized(ReferenceResolver delegate) {
        Map<String, Optional<JsonNode>> memo = new HashMap<>();
        return (projectId, configName) ->
                memo.computeIfAbsent(projectId + '\u0000' + configName, k -> delegate.resolve(projectId, configName));
    }

    private AtomicLong generation(String projectId) {
        return generations.computeIfAbsent(projectId, k -> new AtomicLong());
    }
}
