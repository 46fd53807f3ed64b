package com.trialstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Logical operators for combining atomic criteria in an expression tree.
 */
public enum LogicalOperator {
    AND("AND"),
    OR("OR"),
    NOT("NOT");

    private final String value;

    LogicalOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * CIRCE criteria group type. NOT has no group form and is exported as occurrence suppression.
     */
    public String circeGroupType() {
        return this == OR ? "ANY" : "ALL";
    }

    public static LogicalOperator fromValue(String value) {
        for (LogicalOperator op : values()) {
            if (op.value.equalsIgnoreCase(value)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown LogicalOperator: " + value);
    }
}
