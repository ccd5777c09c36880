package com.configline.backend.override;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Outcome of an evaluation with the per-override breakdown. {@code matchedOverride} is null when
 * the base value applied.
 */
public record EvaluationResult(JsonNode value, String matchedOverride, List<OverrideTrace> overrides) {

    public record OverrideTrace(String name, ConditionResult result, List<ConditionTrace> conditions) {}

    public record ConditionTrace(
            String operator,
            ConditionResult result,
            String reason,
            List<ConditionTrace> nested
    ) {
        static ConditionTrace leaf(String operator, ConditionResult result, String reason) {
            return new ConditionTrace(operator, result, reason, List.of());
        }
    }
}
