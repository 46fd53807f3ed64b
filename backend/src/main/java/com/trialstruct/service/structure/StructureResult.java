package com.trialstruct.service.structure;

import com.trialstruct.model.criteria.AtomicCriterion;
import com.trialstruct.model.criteria.CompositeCriterion;
import com.trialstruct.model.criteria.CriterionRelationship;
import com.trialstruct.model.tree.StructuredCriterionTree;

import java.util.List;

/**
 * Output of structuring one criterion: the tree plus every row to persist.
 * Composites are listed parent-first.
 */
public record StructureResult(
    String criterionId,
    StructuredCriterionTree tree,
    List<AtomicCriterion> atomics,
    List<CompositeCriterion> composites,
    List<CriterionRelationship> relationships
) {}
