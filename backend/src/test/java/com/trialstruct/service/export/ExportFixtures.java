package com.trialstruct.service.export;

import com.trialstruct.model.criteria.AtomicCriterion;
import com.trialstruct.model.criteria.CompositeCriterion;
import com.trialstruct.model.criteria.Criterion;
import com.trialstruct.model.criteria.CriterionRelationship;
import com.trialstruct.model.criteria.Protocol;
import com.trialstruct.model.enums.CriteriaType;
import com.trialstruct.model.enums.EntityDomain;
import com.trialstruct.model.enums.LogicalOperator;
import com.trialstruct.model.tree.AtomicNode;
import com.trialstruct.model.tree.BranchNode;
import com.trialstruct.model.tree.ExpressionNode;
import com.trialstruct.model.tree.StructuredCriterionTree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory protocol export data for exporter tests.
 */
final class ExportFixtures {

    private final Protocol protocol = Protocol.builder().id("proto-1").title("Diabetes Study").build();
    private final List<Criterion> criteria = new ArrayList<>();
    private final List<AtomicCriterion> atomics = new ArrayList<>();
    private final Map<String, StructuredCriterionTree> trees = new LinkedHashMap<>();

    static ExportFixtures protocol() {
        return new ExportFixtures();
    }

    ExportFixtures titled(String title) {
        protocol.setTitle(title);
        return this;
    }

    ExportFixtures criterion(String id, CriteriaType type, ExpressionNode root, AtomicCriterion... leaves) {
        criteria.add(Criterion.builder()
            .id(id)
            .protocolId(protocol.getId())
            .criteriaType(type)
            .text("criterion " + id)
            .displayOrder(criteria.size())
            .build());
        for (int i = 0; i < leaves.length; i++) {
            leaves[i].setCriterionId(id);
            leaves[i].setInclusionExclusion(type);
            leaves[i].setMappingIndex(i);
            atomics.add(leaves[i]);
        }
        trees.put(id, StructuredCriterionTree.fallback(root));
        return this;
    }

    ExportFixtures unstructuredCriterion(String id) {
        criteria.add(Criterion.builder()
            .id(id)
            .protocolId(protocol.getId())
            .text("criterion " + id)
            .displayOrder(criteria.size())
            .build());
        return this;
    }

    ProtocolExportData build() {
        return ProtocolExportData.of(protocol, criteria, atomics, List.<CompositeCriterion>of(),
            List.<CriterionRelationship>of(), trees);
    }

    // ========================================================================
    // Atomics and nodes
    // ========================================================================

    static AtomicCriterion measurement(String id, String omopId, String op, double value, Integer unitConceptId) {
        return AtomicCriterion.builder()
            .id(id)
            .protocolId("proto-1")
            .inclusionExclusion(CriteriaType.INCLUSION)
            .entityText("HbA1c")
            .omopConceptId(omopId)
            .entityConceptId("4548-4")
            .entityConceptSystem("loinc")
            .entityDomain(EntityDomain.MEASUREMENT)
            .relationOperator(op)
            .valueNumeric(value)
            .unitText("%")
            .unitConceptId(unitConceptId)
            .originalText("HbA1c " + op + " " + value + "%")
            .build();
    }

    static AtomicCriterion condition(String id, String conceptId, String system, boolean negation) {
        return AtomicCriterion.builder()
            .id(id)
            .protocolId("proto-1")
            .inclusionExclusion(CriteriaType.INCLUSION)
            .entityText("Condition " + conceptId)
            .entityConceptId(conceptId)
            .entityConceptSystem(system)
            .entityDomain(EntityDomain.CONDITION)
            .relationOperator(negation ? "NOT" : "has")
            .negation(negation)
            .originalText("Condition " + conceptId)
            .build();
    }

    static AtomicCriterion age(String id, String op, Double years) {
        return AtomicCriterion.builder()
            .id(id)
            .protocolId("proto-1")
            .inclusionExclusion(CriteriaType.INCLUSION)
            .entityText("Age")
            .entityConceptId("424144002")
            .entityConceptSystem("snomed")
            .entityDomain(EntityDomain.DEMOGRAPHICS)
            .relationOperator(op)
            .valueNumeric(years)
            .unitText("years")
            .originalText("Age " + op + " " + years)
            .build();
    }

    static AtomicNode leaf(AtomicCriterion atomic) {
        return new AtomicNode(atomic.getId(), atomic.getEntityText(), atomic.getRelationOperator(), null, null, null);
    }

    static BranchNode and(ExpressionNode... children) {
        return new BranchNode(LogicalOperator.AND, List.of(children));
    }

    static BranchNode or(ExpressionNode... children) {
        return new BranchNode(LogicalOperator.OR, List.of(children));
    }

    static BranchNode not(ExpressionNode child) {
        return new BranchNode(LogicalOperator.NOT, List.of(child));
    }
}
