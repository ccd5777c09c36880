package com.configline.backend.configs;

import com.configline.backend.permission.ChangeSet;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/** Content change of one variant; null fields are unchanged, as in {@link ConfigChange}. */
public record VariantChange(
        JsonNode value,
        boolean schemaChanged,
        JsonNode schema,
        JsonNode overrides,
        Boolean useBaseSchema
) {

    public ChangeSet diff(ConfigVariantEntity current) {
        boolean v = value != null && !value.equals(Json.orNull(current.getValue()));
        boolean s = schemaChanged && !Objects.equals(Json.schemaOrNull(schema), Json.schemaOrNull(current.getSchema()));
        boolean o = overrides != null && !overrides.equals(Json.orEmptyArray(current.getOverrides()));
        boolean u = useBaseSchema != null && useBaseSchema != current.isUseBaseSchema();
        return new ChangeSet(v, o, false, s, u, false, false);
    }
}
