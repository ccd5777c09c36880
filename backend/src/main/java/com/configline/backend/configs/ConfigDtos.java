package com.configline.backend.configs;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Request and response bodies of the config API. In patch bodies an absent JSON field leaves the
 * stored part unchanged, while an explicit {@code null} sets it (for {@code schema}: removes it).
 */
public final class ConfigDtos {
    private ConfigDtos() {}

    public record CreateConfigRequest(
            String name,
            String description,
            JsonNode value,
            JsonNode schema,
            JsonNode overrides,
            List<String> editorEmails,
            List<String> maintainerEmails,
            List<CreateVariantRequest> variants
    ) {}

    public record CreateVariantRequest(
            String environmentId,
            JsonNode value,
            JsonNode schema,
            JsonNode overrides,
            Boolean useBaseSchema
    ) {}

    public record MembersBody(List<String> editorEmails, List<String> maintainerEmails) {}

    public record PatchConfigRequest(
            Integer prevVersion,
            JsonNode value,
            JsonNode schema,
            JsonNode overrides,
            String description,
            MembersBody members
    ) {}

    public record PatchVariantRequest(
            Integer prevVersion,
            JsonNode value,
            JsonNode schema,
            JsonNode overrides,
            Boolean useBaseSchema
    ) {}

    public record RestoreRequest(Integer version, Integer prevVersion) {}

    public record EvaluateRequest(String environmentId, Map<String, JsonNode> context) {}

    public record ConfigSummary(UUID id, String name, String description, int version, OffsetDateTime updatedAt) {}

    public record VariantView(
            UUID id,
            String environmentId,
            int version,
            JsonNode value,
            JsonNode schema,
            JsonNode overrides,
            boolean useBaseSchema,
            OffsetDateTime updatedAt
    ) {}

    public record ConfigView(
            UUID id,
            String projectId,
            String name,
            String description,
            int version,
            JsonNode value,
            JsonNode schema,
            JsonNode overrides,
            List<String> editorEmails,
            List<String> maintainerEmails,
            List<VariantView> variants,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {}

    public record ConfigVersionView(
            int version,
            String name,
            String description,
            JsonNode value,
            JsonNode schema,
            JsonNode overrides,
            List<String> editorEmails,
            List<String> maintainerEmails,
            String authorId,
            OffsetDateTime createdAt
    ) {}

    public record VariantVersionView(
            int version,
            String environmentId,
            JsonNode value,
            JsonNode schema,
            JsonNode overrides,
            boolean useBaseSchema,
            String authorId,
            OffsetDateTime createdAt
    ) {}
}
