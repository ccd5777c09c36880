package com.configline.backend.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** Writes a project's export to {@code <prefix><projectId>.json}. */
public class SnapshotPublishService {
    private static final Logger log = LoggerFactory.getLogger(SnapshotPublishService.class);

    private final SnapshotStore store;
    private final String bucket;
    private final String prefix;
    private final ObjectMapper om;

    public SnapshotPublishService(SnapshotStore store, String bucket, String prefix, ObjectMapper om) {
        this.store = Objects.requireNonNull(store, "store");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.prefix = prefix == null ? "" : prefix;
        this.om = Objects.requireNonNull(om, "om");
    }

    public SnapshotStore.StoredSnapshot publish(ProjectExport export) {
        if (export == null || export.projectId() == null || export.projectId().isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        byte[] json;
        try {
            json = om.writeValueAsBytes(export);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize export of " + export.projectId(), e);
        }
        var location = new SnapshotStore.SnapshotLocation(bucket, keyFor(export.projectId()), export.projectId());
        var res = store.put(location, json);
        log.info("published snapshot project={} key={} bytes={}", export.projectId(), location.key(), res.bytes());
        return res;
    }

    String keyFor(String projectId) {
        return prefix + projectId + ".json";
    }
}
