package com.trialstruct.model.tree;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.trialstruct.model.criteria.AtomicCriterion;

/**
 * Leaf of the expression tree, pointing at a persisted atomic criterion.
 * Entity, relation, value and unit echo the field mapping it was built from.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(value = "type", allowGetters = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AtomicNode(
    String atomicCriterionId,
    String entity,
    String relation,
    String value,
    String unit,
    String omopConceptId
) implements ExpressionNode {

    public static final String TYPE = "ATOMIC";

    public static AtomicNode of(AtomicCriterion atomic, FieldMapping mapping) {
        return new AtomicNode(
            atomic.getId(),
            mapping.entity(),
            mapping.relation(),
            mapping.value(),
            mapping.unit(),
            mapping.omopConceptId()
        );
    }

    @JsonProperty("type")
    public String type() {
        return TYPE;
    }

    @Override
    public int leafCount() {
        return 1;
    }
}
