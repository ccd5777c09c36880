package com.configline.backend.override;

import com.configline.backend.override.EvaluationResult.ConditionTrace;
import com.configline.backend.override.EvaluationResult.OverrideTrace;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the effective value of a config for a context. Overrides are tried in order and the
 * first one whose conditions all match wins; otherwise the base value applies.
 *
 * <p>Never throws. Missing context properties, unresolvable references, incomparable types and
 * malformed conditions evaluate to {@link ConditionResult#UNKNOWN}, which does not match.
 */
public final class OverrideEvaluator {
    private static final Logger log = LoggerFactory.getLogger(OverrideEvaluator.class);

    private OverrideEvaluator() {}

    public static JsonNode evaluate(
            JsonNode baseValue,
            List<ConfigOverride> overrides,
            Map<String, JsonNode> context,
            ReferenceResolver resolver
    ) {
        return evaluateWithTrace(baseValue, overrides, context, resolver).value();
    }

    public static EvaluationResult evaluateWithTrace(
            JsonNode baseValue,
            List<ConfigOverride> overrides,
            Map<String, JsonNode> context,
            ReferenceResolver resolver
    ) {
        Run run = new Run(context == null ? Map.of() : context, resolver == null ? ReferenceResolver.NONE : resolver);
        List<OverrideTrace> traces = new ArrayList<>();
        for (ConfigOverride o : overrides == null ? List.<ConfigOverride>of() : overrides) {
            List<ConditionTrace> condTraces = new ArrayList<>();
            ConditionResult result = run.allOf(o.conditions(), condTraces);
            traces.add(new OverrideTrace(o.name(), result, condTraces));
            if (result == ConditionResult.MATCHED) {
                return new EvaluationResult(o.value(), o.name(), traces);
            }
        }
        return new EvaluationResult(baseValue, null, traces);
    }

    /** State of one evaluation: the context and memoized reference lookups. */
    private static final class Run {
        private final Map<String, JsonNode> context;
        private final ReferenceResolver resolver;
        private final Map<String, Optional<JsonNode>> resolved = new HashMap<>();

        Run(Map<String, JsonNode> context, ReferenceResolver resolver) {
            this.context = context;
            this.resolver = resolver;
        }

        // Shared by override condition lists and "and": stop at the first NOT_MATCHED
        ConditionResult allOf(List<Condition> conditions, List<ConditionTrace> out) {
            boolean unknown = false;
            for (Condition c : conditions) {
                ConditionTrace t = eval(c);
                out.add(t);
                if (t.result() == ConditionResult.NOT_MATCHED) return ConditionResult.NOT_MATCHED;
                if (t.result() == ConditionResult.UNKNOWN) unknown = true;
            }
            return unknown ? ConditionResult.UNKNOWN : ConditionResult.MATCHED;
        }

        ConditionResult anyOf(List<Condition> conditions, List<ConditionTrace> out) {
            boolean unknown = false;
            for (Condition c : conditions) {
                ConditionTrace t = eval(c);
                out.add(t);
                if (t.result() == ConditionResult.MATCHED) return ConditionResult.MATCHED;
                if (t.result() == ConditionResult.UNKNOWN) unknown = true;
            }
            return unknown ? ConditionResult.UNKNOWN : ConditionResult.NOT_MATCHED;
        }

        ConditionTrace eval(Condition c) {
            if (c instanceof Condition.All all) {
                List<ConditionTrace> nested = new ArrayList<>();
                ConditionResult r = allOf(all.conditions(), nested);
                return new ConditionTrace("and", r, "AND: " + count(nested) + "/" + all.conditions().size() + " matched", nested);
            }
            if (c instanceof Condition.Any any) {
                List<ConditionTrace> nested = new ArrayList<>();
                ConditionResult r = anyOf(any.conditions(), nested);
                return new ConditionTrace("or", r, "OR: " + count(nested) + "/" + any.conditions().size() + " matched", nested);
            }
            if (c instanceof Condition.Not not) {
                ConditionTrace inner = eval(not.condition());
                return new ConditionTrace("not", inner.result().negate(), "NOT: inner " + inner.result(), List.of(inner));
            }
            if (c instanceof Condition.Segmentation seg) {
                return segmentation(seg);
            }
            if (c instanceof Condition.Comparison cmp) {
                return comparison(cmp);
            }
            if (c instanceof Condition.Invalid inv) {
                return ConditionTrace.leaf("invalid", ConditionResult.UNKNOWN, inv.reason());
            }
            return ConditionTrace.leaf(String.valueOf(c == null ? null : c.operator()), ConditionResult.UNKNOWN, "unsupported condition");
        }

        private ConditionTrace segmentation(Condition.Segmentation seg) {
            JsonNode ctx = context.get(seg.property());
            if (ctx == null || ctx.isNull() || ctx.isMissingNode()) {
                return ConditionTrace.leaf("segmentation", ConditionResult.UNKNOWN,
                        "Property \"" + seg.property() + "\" not found in context");
            }
            double unit = Segmentation.unit(JsonValues.toHashInput(ctx), seg.seed());
            boolean in = Segmentation.inRange(unit, seg.fromPercentage(), seg.toPercentage());
            return ConditionTrace.leaf("segmentation", ConditionResult.of(in),
                    seg.property() + " (" + JsonValues.toHashInput(ctx) + ") " + (in ? "in" : "not in")
                            + " [" + seg.fromPercentage() + ", " + seg.toPercentage() + ") unit=" + unit);
        }

        private ConditionTrace comparison(Condition.Comparison cmp) {
            String op = cmp.operator();
            JsonNode ctx = context.get(cmp.property());
            if (ctx == null || ctx.isMissingNode()) {
                return ConditionTrace.leaf(op, ConditionResult.UNKNOWN,
                        "Property \"" + cmp.property() + "\" not found in context");
            }
            Optional<JsonNode> expected = operand(cmp.operand());
            if (expected.isEmpty()) {
                return ConditionTrace.leaf(op, ConditionResult.UNKNOWN, "Reference could not be resolved");
            }
            JsonNode exp = expected.get();
            String shown = cmp.property() + " (" + JsonValues.describe(ctx) + ") " + op + " " + JsonValues.describe(exp);

            switch (cmp.op()) {
                case EQUALS:
                    return ConditionTrace.leaf(op, ConditionResult.of(JsonValues.deepEquals(ctx, exp)), shown);
                case IN:
                case NOT_IN:
                    if (!exp.isArray()) {
                        return ConditionTrace.leaf(op, ConditionResult.UNKNOWN, "Expected value must be an array");
                    }
                    boolean contained = JsonValues.contains(exp, ctx);
                    boolean matched = cmp.op() == ComparisonOperator.IN ? contained : !contained;
                    return ConditionTrace.leaf(op, ConditionResult.of(matched), shown);
                default:
                    Optional<Integer> order = JsonValues.compare(ctx, exp);
                    if (order.isEmpty()) {
                        return ConditionTrace.leaf(op, ConditionResult.UNKNOWN,
                                "Both values must be numbers or both strings: " + shown);
                    }
                    int o = order.get();
                    boolean ok = switch (cmp.op()) {
                        case LESS_THAN -> o < 0;
                        case LESS_THAN_OR_EQUAL -> o <= 0;
                        case GREATER_THAN -> o > 0;
                        case GREATER_THAN_OR_EQUAL -> o >= 0;
                        default -> false;
                    };
                    return ConditionTrace.leaf(op, ConditionResult.of(ok), shown);
            }
        }

        private Optional<JsonNode> operand(Operand operand) {
            if (operand instanceof Operand.Literal lit) {
                return Optional.ofNullable(lit.value());
            }
            if (operand instanceof Operand.Reference ref) {
                return lookup(ref.projectId(), ref.configName()).flatMap(v -> JsonPath.get(v, ref.path()));
            }
            return Optional.empty();
        }

        private Optional<JsonNode> lookup(String projectId, String configName) {
            String key = projectId + '\u0000' + configName;
            Optional<JsonNode> cached = resolved.get(key);
            if (cached != null) return cached;

            Optional<JsonNode> value;
            try {
                value = resolver.resolve(projectId, configName);
                if (value == null) value = Optional.empty();
            } catch (RuntimeException e) {
                log.warn("Reference lookup failed for {}/{}: {}", projectId, configName, e.getMessage());
                value = Optional.empty();
            }
            resolved.put(key, value);
            return value;
        }

        private static long count(List<ConditionTrace> traces) {
            return traces.stream().filter(t -> t.result() == ConditionResult.MATCHED).count();
        }
    }
}
