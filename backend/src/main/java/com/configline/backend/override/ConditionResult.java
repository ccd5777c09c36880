package com.configline.backend.override;

public enum ConditionResult {
    MATCHED,
    NOT_MATCHED,
    UNKNOWN;

    public ConditionResult negate() {
        return switch (this) {
            case MATCHED -> NOT_MATCHED;
            case NOT_MATCHED -> MATCHED;
            case UNKNOWN -> UNKNOWN;
        };
    }

    public static ConditionResult of(boolean matched) {
        return matched ? MATCHED : NOT_MATCHED;
    }
}
