package com.configline.backend.configs;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "config_variant_versions",
        uniqueConstraints = @UniqueConstraint(name = "uk_config_variant_versions", columnNames = {"variant_id", "version"}))
public class ConfigVariantVersionEntity {

    @Id
    @Column(nullable = false)
    private UUID id;

    @Column(name = "variant_id", nullable = false)
    private UUID variantId;

    @Column(name = "config_id", nullable = false)
    private UUID configId;

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

    @Column(name = "author_id", length = 320)
    private String authorId;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getVariantId() { return variantId; }
    public void setVariantId(UUID variantId) { this.variantId = variantId; }

    public UUID getConfigId() { return configId; }
    public void setConfigId(UUID configId) { this.configId = configId; }

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

    public String getAuthorId() { return authorId; }
    public void setAuthorId(String authorId) { this.authorId = authorId; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }
}
