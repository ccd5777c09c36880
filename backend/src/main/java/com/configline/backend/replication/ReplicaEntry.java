package com.configline.backend.replication;

import java.util.UUID;

/**
 * Rendered config plus the identity of the row it came from, either the base config or one
 * variant. Versions are only comparable within the same {@link #entityKey()}.
 */
public record ReplicaEntry(UUID configId, String source, SdkConfig config) {

    public static final String BASE = "base";

    public String entityKey() {
        return configId + ":" + source;
    }
}
