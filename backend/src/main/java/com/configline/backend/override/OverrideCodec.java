package com.configline.backend.override;

import com.configline.backend.error.BadRequestException;
import com.configline.backend.error.ErrorCode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the override JSON format:
 * <pre>
 * [{"name": "...", "conditions": [{"operator": "equals", "property": "tier",
 *   "value": {"type": "literal", "value": "free"}}], "value": ...}]
 * </pre>
 * Decoding never throws; problems are collected and the offending nodes become
 * {@link Condition.Invalid}. Write paths call {@link #decodeStrict(JsonNode)}.
 */
public final class OverrideCodec {
    private OverrideCodec() {}

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public record Decoded(List<ConfigOverride> overrides, List<String> errors) {
        public boolean valid() {
            return errors.isEmpty();
        }
    }

    public static Decoded decode(JsonNode node) {
        List<String> errors = new ArrayList<>();
        List<ConfigOverride> out = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new Decoded(out, errors);
        }
        if (!node.isArray()) {
            errors.add("overrides: must be an array");
            return new Decoded(out, errors);
        }
        for (int i = 0; i < node.size(); i++) {
            out.add(decodeOverride(node.get(i), "overrides[" + i + "]", errors));
        }
        return new Decoded(out, errors);
    }

    /** Decode for read paths: malformed parts are kept as never-matching conditions. */
    public static List<ConfigOverride> decodeLenient(JsonNode node) {
        return decode(node).overrides();
    }

    public static List<ConfigOverride> decodeStrict(JsonNode node) {
        Decoded d = decode(node);
        if (!d.valid()) {
            throw new BadRequestException(ErrorCode.INVALID_OVERRIDES, "Invalid overrides", d.errors());
        }
        return d.overrides();
    }

    public static ArrayNode encode(List<ConfigOverride> overrides) {
        ArrayNode arr = NODES.arrayNode();
        for (ConfigOverride o : overrides) {
            ObjectNode n = arr.addObject();
            n.put("name", o.name());
            ArrayNode conds = n.putArray("conditions");
            o.conditions().forEach(c -> conds.add(encodeCondition(c)));
            n.set("value", o.value() == null ? NullNode.getInstance() : o.value());
        }
        return arr;
    }

    public static ObjectNode encodeCondition(Condition c) {
        ObjectNode n = NODES.objectNode();
        n.put("operator", c.operator());
        if (c instanceof Condition.Comparison cmp) {
            n.put("property", cmp.property());
            n.set("value", encodeOperand(cmp.operand()));
        } else if (c instanceof Condition.All all) {
            ArrayNode arr = n.putArray("conditions");
            all.conditions().forEach(x -> arr.add(encodeCondition(x)));
        } else if (c instanceof Condition.Any any) {
            ArrayNode arr = n.putArray("conditions");
            any.conditions().forEach(x -> arr.add(encodeCondition(x)));
        } else if (c instanceof Condition.Not not) {
            n.set("condition", encodeCondition(not.condition()));
        } else if (c instanceof Condition.Segmentation seg) {
            n.put("property", seg.property());
            n.put("fromPercentage", seg.fromPercentage());
            n.put("toPercentage", seg.toPercentage());
            n.put("seed", seg.seed());
        } else if (c instanceof Condition.Invalid inv) {
            n.put("reason", inv.reason());
        }
        return n;
    }

    private static ObjectNode encodeOperand(Operand operand) {
        ObjectNode n = NODES.objectNode();
        if (operand instanceof Operand.Literal lit) {
            n.put("type", "literal");
            n.set("value", lit.value() == null ? NullNode.getInstance() : lit.value());
        } else if (operand instanceof Operand.Reference ref) {
            n.put("type", "reference");
            n.put("projectId", ref.projectId());
            n.put("configName", ref.configName());
            ArrayNode path = n.putArray("path");
            for (Object p : ref.path()) {
                if (p instanceof Integer i) path.add(i);
                else path.add(p.toString());
            }
        }
        return n;
    }

    private static ConfigOverride decodeOverride(JsonNode n, String at, List<String> errors) {
        if (n == null || !n.isObject()) {
            errors.add(at + ": must be an object");
            return new ConfigOverride("", List.of(new Condition.Invalid(at + " is not an object")), NullNode.getInstance());
        }
        String name = "";
        JsonNode nameNode = n.get("name");
        if (nameNode == null || !nameNode.isTextual() || nameNode.textValue().isBlank()) {
            errors.add(at + ".name: must be a non-empty string");
        } else {
            name = nameNode.textValue();
        }

        JsonNode value = n.get("value");
        if (value == null) {
            errors.add(at + ".value: is required");
            value = NullNode.getInstance();
        }

        List<Condition> conditions = new ArrayList<>();
        JsonNode conds = n.get("conditions");
        if (conds == null || !conds.isArray()) {
            errors.add(at + ".conditions: must be an array");
            conditions.add(new Condition.Invalid(at + ".conditions is not an array"));
        } else {
            for (int i = 0; i < conds.size(); i++) {
                conditions.add(decodeCondition(conds.get(i), at + ".conditions[" + i + "]", errors));
            }
        }
        return new ConfigOverride(name, conditions, value);
    }

    static Condition decodeCondition(JsonNode n, String at, List<String> errors) {
        if (n == null || !n.isObject()) {
            return invalid(at, "must be an object", errors);
        }
        JsonNode opNode = n.get("operator");
        if (opNode == null || !opNode.isTextual()) {
            return invalid(at, "operator must be a string", errors);
        }
        String op = opNode.textValue();
        switch (op) {
            case "and", "or" -> {
                JsonNode children = n.get("conditions");
                if (children == null || !children.isArray()) {
                    return invalid(at, op + ".conditions must be an array", errors);
                }
                List<Condition> list = new ArrayList<>();
                for (int i = 0; i < children.size(); i++) {
                    list.add(decodeCondition(children.get(i), at + ".conditions[" + i + "]", errors));
                }
                return op.equals("and") ? new Condition.All(list) : new Condition.Any(list);
            }
            case "not" -> {
                JsonNode child = n.get("condition");
                if (child == null) {
                    return invalid(at, "not.condition is required", errors);
                }
                return new Condition.Not(decodeCondition(child, at + ".condition", errors));
            }
            case "segmentation" -> {
                return decodeSegmentation(n, at, errors);
            }
            default -> {
                var cmp = ComparisonOperator.fromWire(op);
                if (cmp.isEmpty()) {
                    return invalid(at, "unknown operator '" + op + "'", errors);
                }
                return decodeComparison(cmp.get(), n, at, errors);
            }
        }
    }

    private static Condition decodeComparison(ComparisonOperator op, JsonNode n, String at, List<String> errors) {
        String property = text(n, "property");
        if (property == null || property.isBlank()) {
            return invalid(at, "property must be a non-empty string", errors);
        }
        JsonNode v = n.get("value");
        if (v == null || !v.isObject()) {
            return invalid(at, "value must be an operand object", errors);
        }
        String type = text(v, "type");
        if ("literal".equals(type)) {
            JsonNode literal = v.has("value") ? v.get("value") : NullNode.getInstance();
            return new Condition.Comparison(op, property, new Operand.Literal(literal));
        }
        if ("reference".equals(type)) {
            String projectId = text(v, "projectId");
            String configName = text(v, "configName");
            if (projectId == null || projectId.isBlank()) {
                return invalid(at, "reference.projectId must be a non-empty string", errors);
            }
            if (configName == null || configName.isBlank()) {
                return invalid(at, "reference.configName must be a non-empty string", errors);
            }
            JsonNode pathNode = v.get("path");
            List<Object> path = new ArrayList<>();
            if (pathNode != null && !pathNode.isNull()) {
                if (!pathNode.isArray()) {
                    return invalid(at, "reference.path must be an array", errors);
                }
                for (JsonNode p : pathNode) {
                    if (p.isTextual()) {
                        path.add(p.textValue());
                    } else if (p.isIntegralNumber() && p.canConvertToInt() && p.intValue() >= 0) {
                        path.add(p.intValue());
                    } else {
                        return invalid(at, "reference.path segments must be strings or non-negative integers", errors);
                    }
                }
            }
            return new Condition.Comparison(op, property, new Operand.Reference(projectId, configName, path));
        }
        return invalid(at, "value.type must be 'literal' or 'reference'", errors);
    }

    private static Condition decodeSegmentation(JsonNode n, String at, List<String> errors) {
        String property = text(n, "property");
        if (property == null || property.isBlank()) {
            return invalid(at, "property must be a non-empty string", errors);
        }
        JsonNode from = n.get("fromPercentage");
        JsonNode to = n.get("toPercentage");
        if (from == null || !from.isNumber() || to == null || !to.isNumber()) {
            return invalid(at, "fromPercentage and toPercentage must be numbers", errors);
        }
        double f = from.doubleValue();
        double t = to.doubleValue();
        if (f < 0 || t > 100 || f > t) {
            return invalid(at, "percentages must satisfy 0 <= from <= to <= 100", errors);
        }
        String seed = text(n, "seed");
        if (seed == null) {
            return invalid(at, "seed must be a string", errors);
        }
        return new Condition.Segmentation(property, f, t, seed);
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return v != null && v.isTextual() ? v.textValue() : null;
    }

    private static Condition invalid(String at, String reason, List<String> errors) {
        String msg = at + ": " + reason;
        errors.add(msg);
        return new Condition.Invalid(msg);
    }
}
