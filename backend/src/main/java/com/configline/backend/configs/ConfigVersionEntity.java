package com.configline.backend.configs;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

/** Immutable snapshot of a config as of one committed version. */
@Entity
@Table(name = "config_versions",
        uniqueConstraints = @UniqueConstraint(name = "uk_config_versions", columnNames = {"config_id", "version"}))
public class ConfigVersionEntity {

    @Id
    @Column(nullable = false)
    private UUID id;

    @Column(name = "config_id", nullable = false)
    private UUID configId;

    @Column(nullable = false)
    private int version;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 2000)
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "value_json")
    private JsonNode value;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "schema_json")
    private JsonNode schema;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "overrides_json", nullable = false)
    private JsonNode overrides;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "members_json", nullable = false)
    private JsonNode members;

    @Column(name = "author_id", length = 320)
    private String authorId;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getConfigId() { return configId; }
    public void setConfigId(UUID configId) { this.configId = configId; }

    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public JsonNode getValue() { return value; }
    public void setValue(JsonNode value) { this.value = value; }

    public JsonNode getSchema() { return schema; }
    public void setSchema(JsonNode schema) { this.schema = schema; }

    public JsonNode getOverrides() { return overrides; }
    public void setOverrides(JsonNode overrides) { this.overrides = overrides; }

    public JsonNode getMembers() { return members; }
    public void setMembers(JsonNode members) { this.members = members; }

    public String getAuthorId() { return authorId; }
    public void setAuthorId(String authorId) { this.authorId = authorId; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }
}
