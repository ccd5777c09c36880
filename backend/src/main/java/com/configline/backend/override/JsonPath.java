package com.configline.backend.override;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Paths into a JSON document. A path is a list of segments: {@link String} object keys and
 * {@link Integer} array indexes.
 */
public final class JsonPath {
    private JsonPath() {}

    /**
     * Resolve a path against a JsonNode.
     * - String segments traverse objects, Integer segments traverse arrays.
     * - Returns Optional.empty() if any segment is missing or the node kind does not fit.
     * - An empty path resolves to the root itself.
     */
    public static Optional<JsonNode> get(JsonNode root, List<?> path) {
        if (root == null || root.isMissingNode()) return Optional.empty();
        if (path == null) return Optional.of(root);

        JsonNode cur = root;
        for (Object p : path) {
            if (p instanceof Integer idx) {
                if (!cur.isArray() || idx < 0 || idx >= cur.size()) return Optional.empty();
                cur = cur.get(idx);
            } else if (p instanceof String key) {
                if (!cur.isObject()) return Optional.empty();
                cur = cur.get(key);
                if (cur == null) return Optional.empty();
            } else {
                return Optional.empty();
            }
        }
        return Optional.of(cur);
    }

    /**
     * Parse "a.b[0].c" into ["a", "b", 0, "c"]. Bracketed non-numeric parts stay keys.
     */
    public static List<Object> parse(String pathString) {
        List<Object> parts = new ArrayList<>();
        if (pathString == null || pathString.isBlank()) return parts;

        StringBuilder cur = new StringBuilder();
        boolean inBracket = false;
        for (char c : pathString.toCharArray()) {
            if (c == '[') {
                flush(cur, parts, false);
                inBracket = true;
            } else if (c == ']') {
                if (inBracket) flush(cur, parts, true);
                inBracket = false;
            } else if (c == '.' && !inBracket) {
                flush(cur, parts, false);
            } else {
                cur.append(c);
            }
        }
        flush(cur, parts, false);
        return parts;
    }

    public static String format(List<?> path) {
        if (path == null || path.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < path.size(); i++) {
            Object p = path.get(i);
            if (p instanceof Integer) {
                sb.append('[').append(p).append(']');
            } else if (i == 0) {
                sb.append(p);
            } else if (p.toString().matches("[A-Za-z_$][A-Za-z0-9_$]*")) {
                sb.append('.').append(p);
            } else {
                sb.append("[\"").append(p).append("\"]");
            }
        }
        return sb.toString();
    }

    private static void flush(StringBuilder cur, List<Object> parts, boolean bracketed) {
        if (cur.length() == 0) return;
        String s = cur.toString();
        cur.setLength(0);
        if (bracketed && s.chars().allMatch(Character::isDigit)) {
            parts.add(Integer.parseInt(s));
        } else {
            parts.add(s.replace("\"", ""));
        }
    }
}
