package com.configline.backend.publish;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/** Everything needed to recreate a project's configs elsewhere. Overrides are stored form, not rendered. */
public record ProjectExport(String projectId, List<ExportedConfig> configs) {

    public record ExportedConfig(
            String name,
            String description,
            JsonNode value,
            JsonNode schema,
            JsonNode overrides,
            Map<String, ExportedVariant> variants
    ) {}

    public record ExportedVariant(JsonNode value, JsonNode schema, JsonNode overrides, boolean useBaseSchema) {}
}
