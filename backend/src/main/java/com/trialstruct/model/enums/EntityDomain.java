package com.trialstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;

/**
 * OMOP-style semantic domains for atomic criteria.
 */
public enum EntityDomain {
    CONDITION("condition"),
    MEASUREMENT("measurement"),
    DRUG("drug"),
    PROCEDURE("procedure"),
    OBSERVATION("observation"),
    DEVICE("device"),
    VISIT("visit"),
    DEMOGRAPHICS("demographics");

    // Pipeline entity types that arrive without an explicit domain.
    private static final Map<String, EntityDomain> ENTITY_TYPE_DOMAINS = Map.of(
        "Condition", CONDITION,
        "Medication", DRUG,
        "Lab_Value", MEASUREMENT,
        "Procedure", PROCEDURE,
        "Demographic", DEMOGRAPHICS,
        "Other", OBSERVATION
    );

    private final String value;

    EntityDomain(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup: unknown or blank domains resolve to null rather than failing.
     */
    public static EntityDomain fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (EntityDomain domain : values()) {
            if (domain.value.equalsIgnoreCase(value.trim())) {
                return domain;
            }
        }
        return null;
    }

    public static EntityDomain fromEntityType(String entityType) {
        if (entityType == null) {
            return null;
        }
        return ENTITY_TYPE_DOMAINS.get(entityType);
    }
}
