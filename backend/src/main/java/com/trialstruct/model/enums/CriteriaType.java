package com.trialstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Polarity of an eligibility criterion.
 */
public enum CriteriaType {
    INCLUSION("inclusion"),
    EXCLUSION("exclusion");

    private final String value;

    CriteriaType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Anything that is not explicitly an exclusion is treated as an inclusion.
     */
    public static CriteriaType fromValue(String value) {
        if (value != null && EXCLUSION.value.equalsIgnoreCase(value.trim())) {
            return EXCLUSION;
        }
        return INCLUSION;
    }
}
