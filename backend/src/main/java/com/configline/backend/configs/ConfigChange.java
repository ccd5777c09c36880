package com.configline.backend.configs;

import com.configline.backend.permission.ChangeSet;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Content change of a config. A null field leaves that part unchanged; the schema carries an
 * explicit flag so that removing it (null with {@code schemaChanged}) is expressible.
 */
public record ConfigChange(
        JsonNode value,
        boolean schemaChanged,
        JsonNode schema,
        JsonNode overrides,
        String description,
        ConfigMembers members
) {

    /** Fields that are present and differ from what is stored. */
    public ChangeSet diff(ConfigEntity current, ConfigMembers currentMembers) {
        boolean v = value != null && !value.equals(Json.orNull(current.getValue()));
        boolean s = schemaChanged && !Objects.equals(Json.schemaOrNull(schema), Json.schemaOrNull(current.getSchema()));
        boolean o = overrides != null && !overrides.equals(Json.orEmptyArray(current.getOverrides()));
        boolean d = description != null && !description.equals(current.getDescription());
        boolean m = members != null && !members.validated().equals(currentMembers);
        return new ChangeSet(v, o, d, s, false, m, false);
    }
}
