package com.configline.backend.override;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** Right-hand side of a comparison: an inline JSON value or a pointer into another config. */
public interface Operand {

    record Literal(JsonNode value) implements Operand {}

    /**
     * Points at the stored base value of {@code configName} in {@code projectId}, then walks
     * {@code path} (String keys, Integer indexes).
     */
    record Reference(String projectId, String configName, List<Object> path) implements Operand {
        public Reference {
            path = List.copyOf(path);
        }
    }
}
