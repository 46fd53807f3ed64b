package com.trialstruct.model.tree;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.trialstruct.model.enums.StructureConfidence;

/**
 * Structured form of a criterion, stored as JSON on the criterion record.
 *
 * @param root                root node of the expression tree
 * @param structureConfidence whether the structure came from the model or the flat-AND fallback
 * @param structureModel      model used for logic detection, null for fallback trees
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StructuredCriterionTree(
    ExpressionNode root,
    StructureConfidence structureConfidence,
    String structureModel
) {

    public static StructuredCriterionTree llm(ExpressionNode root, String model) {
        return new StructuredCriterionTree(root, StructureConfidence.LLM, model);
    }

    public static StructuredCriterionTree fallback(ExpressionNode root) {
        return new StructuredCriterionTree(root, StructureConfidence.FALLBACK, null);
    }
}
