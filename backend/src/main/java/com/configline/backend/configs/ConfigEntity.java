package com.configline.backend.configs;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "configs",
        uniqueConstraints = @UniqueConstraint(name = "uk_configs_project_name", columnNames = {"project_id", "name"}))
public class ConfigEntity {

    @Id
    @Column(nullable = false)
    private UUID id;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 2000)
    private String description;

    // Only ever advanced by the compare-and-swap update in ConfigRepository
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

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    // ---- getters/setters ----

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }

    public JsonNode getValue() { return value; }
    public void setValue(JsonNode value) { this.value = value; }

    public JsonNode getSchema() { return schema; }
    public void setSchema(JsonNode schema) { this.schema = schema; }

    public JsonNode getOverrides() { return overrides; }
    public void setOverrides(JsonNode overrides) { this.overrides = overrides; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(OffsetDateTime updatedAt) { this.updatedAt = updatedAt; }
}
