package com.configline.backend.configs;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "config_variants",
        uniqueConstraints = @UniqueConstraint(name = "uk_config_variants_env", columnNames = {"config_id", "environment_id"}))
public class ConfigVariantEntity {

    @Id
    @Column(nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "config_id", nullable = false)
    private ConfigEntity config;

    @Column(name = "environment_id", nullable = false, length = 64)
    private String environmentId;

    @Column(nullable = false)
    private int version;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "value_json")
    private JsonNode value;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "schema_json")
    private JsonNode schema;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "overrides_json", nullable = false)
    private JsonNode overrides;

    @Column(name = "use_base_schema", nullable = false)
    private boolean useBaseSchema;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public ConfigEntity getConfig() { return config; }
    public void setConfig(ConfigEntity config) { this.config = config; }

    public String getEnvironmentId() { return environmentId; }
    public void setEnvironmentId(String environmentId) { this.environmentId = environmentId; }

    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }

    public JsonNode getValue() { return value; }
    public void setValue(JsonNode value) { this.value = value; }

    public JsonNode getSchema() { return schema; }
    public void setSchema(JsonNode schema) { this.schema = schema; }

    public JsonNode getOverrides() { return overrides; }
    public void setOverrides(JsonNode overrides) { this.overrides = overrides; }

    public boolean isUseBaseSchema() { return useBaseSchema; }
    public void setUseBaseSchema(boolean useBaseSchema) { this.useBaseSchema = useBaseSchema; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(OffsetDateTime updatedAt) { this.updatedAt = updatedAt; }
}
