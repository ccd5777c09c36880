package com.configline.backend.proposal;

import com.configline.backend.configs.ConfigDtos.MembersBody;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.util.UUID;

/** Proposal bodies; field presence follows the config patch rules. */
public final class ProposalDtos {
    private ProposalDtos() {}

    public record CreateConfigProposalRequest(
            Integer baseVersion,
            Boolean proposedDelete,
            String description,
            JsonNode value,
            JsonNode schema,
            JsonNode overrides,
            MembersBody members,
            String message
    ) {}

    public record CreateVariantProposalRequest(
            Integer baseVersion,
            JsonNode value,
            JsonNode schema,
            JsonNode overrides,
            Boolean useBaseSchema,
            String message
    ) {}

    public record ConfigProposalView(
            UUID id,
            UUID configId,
            String projectId,
            String proposerId,
            int baseConfigVersion,
            ProposalStatus status,
            boolean proposedDelete,
            String proposedDescription,
            boolean valueProposed,
            JsonNode proposedValue,
            boolean schemaProposed,
            JsonNode proposedSchema,
            JsonNode proposedOverrides,
            MembersBody proposedMembers,
            String message,
            OffsetDateTime createdAt,
            OffsetDateTime approvedAt,
            OffsetDateTime rejectedAt,
            String reviewerId,
            UUID rejectedInFavorOfProposalId,
            String rejectionReason
    ) {}

    public record VariantProposalView(
            UUID id,
            UUID configVariantId,
            UUID configId,
            String environmentId,
            String proposerId,
            int baseVariantVersion,
            ProposalStatus status,
            boolean valueProposed,
            JsonNode proposedValue,
            boolean schemaProposed,
            JsonNode proposedSchema,
            JsonNode proposedOverrides,
            Boolean proposedUseBaseSchema,
            String message,
            OffsetDateTime createdAt,
            OffsetDateTime approvedAt,
            OffsetDateTime rejectedAt,
            String reviewerId,
            UUID rejectedInFavorOfProposalId,
            String rejectionReason
    ) {}
}
