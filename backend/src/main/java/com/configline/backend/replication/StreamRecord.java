package com.configline.backend.replication;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.UUID;

/**
 * One record on the replication stream. {@code type} is {@code init}, {@code config_change} or
 * {@code config_deleted}. The entity fields drive per-subscriber ordering and are not sent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamRecord(
        String type,
        List<SdkConfig> configs,
        SdkConfig config,
        String configName,
        @JsonIgnore UUID configId,
        @JsonIgnore String entityKey,
        @JsonIgnore int version
) {
    public static final String INIT = "init";
    public static final String CONFIG_CHANGE = "config_change";
    public static final String CONFIG_DELETED = "config_deleted";

    public static StreamRecord init(List<SdkConfig> configs) {
        return new StreamRecord(INIT, configs, null, null, null, null, 0);
    }

    public static StreamRecord change(ReplicaEntry entry) {
        return new StreamRecord(CONFIG_CHANGE, null, entry.config(), null, entry.configId(), entry.entityKey(),
                entry.config().version());
    }

    public static StreamRecord deleted(UUID configId, String configName) {
        return new StreamRecord(CONFIG_DELETED, null, null, configName, configId, null, 0);
    }
}
