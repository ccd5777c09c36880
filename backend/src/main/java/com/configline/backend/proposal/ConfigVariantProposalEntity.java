package com.configline.backend.proposal;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "config_variant_proposals", indexes = {
        @Index(name = "idx_variant_proposals_variant", columnList = "config_variant_id"),
        @Index(name = "idx_variant_proposals_config", columnList = "config_id")
})
public class ConfigVariantProposalEntity {

    @Id
    @Column(nullable = false)
    private UUID id;

    @Column(name = "config_variant_id", nullable = false)
    private UUID configVariantId;

    @Column(name = "config_id", nullable = false)
    private UUID configId;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(name = "environment_id", nullable = false, length = 64)
    private String environmentId;

    @Column(name = "proposer_id", nullable = false, length = 320)
    private String proposerId;

    @Column(name = "base_variant_version", nullable = false)
    private int baseVariantVersion;

    @Column(name = "value_proposed", nullable = false)
    private boolean valueProposed;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "proposed_value_json")
    private JsonNode proposedValue;

    @Column(name = "schema_proposed", nullable = false)
    private boolean schemaProposed;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "proposed_schema_json")
    private JsonNode proposedSchema;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "proposed_overrides_json")
    private JsonNode proposedOverrides;

    @Column(name = "proposed_use_base_schema")
    private Boolean proposedUseBaseSchema;

    @Column(length = 2000)
    private String message;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "approved_at")
    private OffsetDateTime approvedAt;

    @Column(name = "rejected_at")
    private OffsetDateTime rejectedAt;

    @Column(name = "reviewer_id", length = 320)
    private String reviewerId;

    @Column(name = "rejected_in_favor_of_proposal_id")
    private UUID rejectedInFavorOfProposalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "rejection_reason", length = 40)
    private RejectionReason rejectionReason;

    public ProposalStatus getStatus() {
        if (approvedAt != null) return ProposalStatus.APPROVED;
        if (rejectedAt != null) return ProposalStatus.REJECTED;
        return ProposalStatus.PENDING;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getConfigVariantId() { return configVariantId; }
    public void setConfigVariantId(UUID configVariantId) { this.configVariantId = configVariantId; }

    public UUID getConfigId() { return configId; }
    public void setConfigId(UUID configId) { this.configId = configId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getEnvironmentId() { return environmentId; }
    public void setEnvironmentId(String environmentId) { this.environmentId = environmentId; }

    public String getProposerId() { return proposerId; }
    public void setProposerId(String proposerId) { this.proposerId = proposerId; }

    public int getBaseVariantVersion() { return baseVariantVersion; }
    public void setBaseVariantVersion(int baseVariantVersion) { this.baseVariantVersion = baseVariantVersion; }

    public boolean isValueProposed() { return valueProposed; }
    public void setValueProposed(boolean valueProposed) { this.valueProposed = valueProposed; }

    public JsonNode getProposedValue() { return proposedValue; }
    public void setProposedValue(JsonNode proposedValue) { this.proposedValue = proposedValue; }

    public boolean isSchemaProposed() { return schemaProposed; }
    public void setSchemaProposed(boolean schemaProposed) { this.schemaProposed = schemaProposed; }

    public JsonNode getProposedSchema() { return proposedSchema; }
    public void setProposedSchema(JsonNode proposedSchema) { this.proposedSchema = proposedSchema; }

    public JsonNode getProposedOverrides() { return proposedOverrides; }
    public void setProposedOverrides(JsonNode proposedOverrides) { this.proposedOverrides = proposedOverrides; }

    public Boolean getProposedUseBaseSchema() { return proposedUseBaseSchema; }
    public void setProposedUseBaseSchema(Boolean proposedUseBaseSchema) { this.proposedUseBaseSchema = proposedUseBaseSchema; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

    public OffsetDateTime getApprovedAt() { return approvedAt; }
    public OffsetDateTime getRejectedAt() { return rejectedAt; }
    public String getReviewerId() { return reviewerId; }
    public UUID getRejectedInFavorOfProposalId() { return rejectedInFavorOfProposalId; }
    public RejectionReason getRejectionReason() { return rejectionReason; }
}
