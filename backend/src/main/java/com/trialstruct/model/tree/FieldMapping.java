package com.trialstruct.model.tree;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Grounded field mapping produced by the terminology pipeline.
 * Codes are kept as strings; they are parsed to integers only on export.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldMapping(
    String entity,
    String relation,
    String value,
    String unit,
    String entityType,
    String entityDomain,
    String entityConceptId,
    String entityConceptSystem,
    String omopConceptId,
    Double confidenceScore
) {

    public static FieldMapping of(String entity, String relation, String value, String unit) {
        return new FieldMapping(entity, relation, value, unit, null, null, null, null, null, null);
    }

    public FieldMapping withDomain(String domain) {
        return new FieldMapping(entity, relation, value, unit, entityType, domain,
            entityConceptId, entityConceptSystem, omopConceptId, confidenceScore);
    }

    public FieldMapping withConcept(String system, String conceptId, String omopId) {
        return new FieldMapping(entity, relation, value, unit, entityType, entityDomain,
            conceptId, system, omopId, confidenceScore);
    }
}
