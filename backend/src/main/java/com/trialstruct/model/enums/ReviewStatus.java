package com.trialstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Human review state of an atomic criterion. Only reviewers move a record out of PENDING.
 */
public enum ReviewStatus {
    PENDING("pending"),
    APPROVED("approved"),
    MODIFIED("modified"),
    REJECTED("rejected");

    private final String value;

    ReviewStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ReviewStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ReviewStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown ReviewStatus: " + value);
    }
}
