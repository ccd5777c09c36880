package com.configline.backend.proposal;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Proposed change to a config. {@code configId} is a plain column so the proposal outlives the
 * config it targeted. A proposed field is present when its column is non-null, except value and
 * schema, which carry explicit flags because JSON null is a legal proposal for both.
 */
@Entity
@Table(name = "config_proposals", indexes = @Index(name = "idx_config_proposals_config", columnList = "config_id"))
public class ConfigProposalEntity {

    @Id
    @Column(nullable = false)
    private UUID id;

    @Column(name = "config_id", nullable = false)
    private UUID configId;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(name = "proposer_id", nullable = false, length = 320)
    private String proposerId;

    @Column(name = "base_config_version", nullable = false)
    private int baseConfigVersion;

    @Column(name = "proposed_delete", nullable = false)
    private boolean proposedDelete;

    @Column(name = "proposed_description", length = 2000)
    private String proposedDescription;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "proposed_members_json")
    private JsonNode proposedMembers;

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

    // ---- getters/setters ----

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getConfigId() { return configId; }
    public void setConfigId(UUID configId) { this.configId = configId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getProposerId() { return proposerId; }
    public void setProposerId(String proposerId) { this.proposerId = proposerId; }

    public int getBaseConfigVersion() { return baseConfigVersion; }
    public void setBaseConfigVersion(int baseConfigVersion) { this.baseConfigVersion = baseConfigVersion; }

    public boolean isProposedDelete() { return proposedDelete; }
    public void setProposedDelete(boolean proposedDelete) { this.proposedDelete = proposedDelete; }

    public String getProposedDescription() { return proposedDescription; }
    public void setProposedDescription(String proposedDescription) { this.proposedDescription = proposedDescription; }

    public JsonNode getProposedMembers() { return proposedMembers; }
    public void setProposedMembers(JsonNode proposedMembers) { this.proposedMembers = proposedMembers; }

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
