package com.trialstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Source of an expression tree's logical structure.
 */
public enum StructureConfidence {
    LLM("llm"),
    FALLBACK("fallback");

    private final String value;

    StructureConfidence(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static StructureConfidence fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (StructureConfidence confidence : values()) {
            if (confidence.value.equalsIgnoreCase(value)) {
                return confidence;
            }
        }
        throw new IllegalArgumentException("Unknown StructureConfidence: " + value);
    }
}
