package com.configline.backend.override;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Comparator;
import java.util.Optional;

/** Comparison rules for condition operands. No coercion between JSON types. */
public final class JsonValues {
    private JsonValues() {}

    // 1 and 1.0 are the same number; everything else falls back to node equality
    private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return a.equals(b) ? 0 : 1;
    };

    public static boolean deepEquals(JsonNode a, JsonNode b) {
        if (a == null || b == null) return a == b;
        return a.equals(NUMERIC_AWARE, b);
    }

    public static boolean contains(JsonNode array, JsonNode candidate) {
        for (JsonNode item : array) {
            if (deepEquals(item, candidate)) return true;
        }
        return false;
    }

    /**
     * Orders two numbers numerically or two strings lexicographically.
     * Empty when the pair is not comparable.
     */
    public static Optional<Integer> compare(JsonNode a, JsonNode b) {
        if (a == null || b == null) return Optional.empty();
        if (a.isNumber() && b.isNumber()) {
            return Optional.of(a.decimalValue().compareTo(b.decimalValue()));
        }
        if (a.isTextual() && b.isTextual()) {
            return Optional.of(a.textValue().compareTo(b.textValue()));
        }
        return Optional.empty();
    }

    /** Text form used for segmentation hashing: raw string for text, JSON form otherwise. */
    public static String toHashInput(JsonNode node) {
        if (node.isTextual()) return node.textValue();
        if (node.isFloatingPointNumber() && node.decimalValue().stripTrailingZeros().scale() <= 0) {
            return node.decimalValue().toBigInteger().toString();
        }
        return node.toString();
    }

    public static String describe(JsonNode node) {
        return node == null || node.isMissingNode() ? "<missing>" : node.toString();
    }
}
