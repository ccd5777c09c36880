package com.configline.backend.override;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** Named rule: when every condition matches, {@code value} replaces the base value. */
public record ConfigOverride(String name, List<Condition> conditions, JsonNode value) {
    public ConfigOverride {
        conditions = List.copyOf(conditions);
    }
}
