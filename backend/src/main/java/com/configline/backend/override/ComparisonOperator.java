package com.configline.backend.override;

import java.util.Arrays;
import java.util.Optional;

public enum ComparisonOperator {
    EQUALS("equals"),
    IN("in"),
    NOT_IN("not_in"),
    LESS_THAN("less_than"),
    LESS_THAN_OR_EQUAL("less_than_or_equal"),
    GREATER_THAN("greater_than"),
    GREATER_THAN_OR_EQUAL("greater_than_or_equal");

    private final String wireName;

    ComparisonOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isOrdering() {
        return this == LESS_THAN || this == LESS_THAN_OR_EQUAL
                || this == GREATER_THAN || this == GREATER_THAN_OR_EQUAL;
    }

    public static Optional<ComparisonOperator> fromWire(String name) {
        return Arrays.stream(values()).filter(o -> o.wireName.equals(name)).findFirst();
    }
}
