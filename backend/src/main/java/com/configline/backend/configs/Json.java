package com.configline.backend.configs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;

final class Json {
    private Json() {}

    /** JSON null may come back from the database as SQL NULL. */
    static JsonNode orNull(JsonNode node) {
        return node == null ? NullNode.getInstance() : node;
    }

    static JsonNode orEmptyArray(JsonNode node) {
        return node == null || node.isNull() ? JsonNodeFactory.instance.arrayNode() : node;
    }

    /** Null and JSON null both mean "no schema". */
    static JsonNode schemaOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node;
    }
}
