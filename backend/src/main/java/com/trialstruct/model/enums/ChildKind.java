package com.trialstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminates the target table of a composite's child edge.
 */
public enum ChildKind {
    ATOMIC("atomic"),
    COMPOSITE("composite");

    private final String value;

    ChildKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ChildKind fromValue(String value) {
        for (ChildKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown ChildKind: " + value);
    }
}
