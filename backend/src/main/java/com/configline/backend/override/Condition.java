package com.configline.backend.override;

import java.util.List;

/**
 * Node of an override's condition tree. Trees are decoded from JSON by {@link OverrideCodec};
 * anything the decoder cannot make sense of becomes {@link Invalid}, which never matches.
 */
public interface Condition {

    String operator();

    record Comparison(ComparisonOperator op, String property, Operand operand) implements Condition {
        @Override
        public String operator() {
            return op.wireName();
        }
    }

    record All(List<Condition> conditions) implements Condition {
        public All {
            conditions = List.copyOf(conditions);
        }

        @Override
        public String operator() {
            return "and";
        }
    }

    record Any(List<Condition> conditions) implements Condition {
        public Any {
            conditions = List.copyOf(conditions);
        }

        @Override
        public String operator() {
            return "or";
        }
    }

    record Not(Condition condition) implements Condition {
        @Override
        public String operator() {
            return "not";
        }
    }

    /** Deterministic percentage bucketing on a context property. */
    record Segmentation(String property, double fromPercentage, double toPercentage, String seed)
            implements Condition {
        @Override
        public String operator() {
            return "segmentation";
        }
    }

    record Invalid(String reason) implements Condition {
        @Override
        public String operator() {
            return "invalid";
        }
    }
}
