package com.trialstruct.service.structure;

import com.trialstruct.model.criteria.AtomicCriterion;
import com.trialstruct.model.criteria.CompositeCriterion;
import com.trialstruct.model.criteria.CriterionRelationship;
import com.trialstruct.model.enums.CriteriaType;
import com.trialstruct.model.enums.LogicalOperator;
import com.trialstruct.model.tree.AtomicNode;
import com.trialstruct.model.tree.BranchNode;
import com.trialstruct.model.tree.ExpressionNode;
import com.trialstruct.model.tree.FieldMapping;
import com.trialstruct.model.tree.StructuredCriterionTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Expression Tree Builder
 *
 * Builds the expression tree and its normalized rows for one criterion:
 * 1. one AtomicCriterion per field mapping, in mapping order
 * 2. logic detection over those mappings
 * 3. detected tree: one CompositeCriterion per branch plus ordered edges
 * 4. no detected tree: the single atomic as root, or a flat AND over all atomics
 *
 * Rows are returned, not persisted; the caller owns the transaction.
 */
@Slf4j
@Component
public class ExpressionTreeBuilder {

    private final AtomicCriterionFactory atomicFactory;
    private final LogicDetectionService logicDetectionService;

    public ExpressionTreeBuilder(AtomicCriterionFactory atomicFactory, LogicDetectionService logicDetectionService) {
        this.atomicFactory = atomicFactory;
        this.logicDetectionService = logicDetectionService;
    }

    public StructureResult build(
            String criterionId,
            String protocolId,
            CriteriaType polarity,
            List<FieldMapping> fieldMappings,
            String criterionText) {

        if (fieldMappings == null || fieldMappings.isEmpty()) {
            throw new IllegalArgumentException("At least one field mapping is required for criterion " + criterionId);
        }

        CriterionContext context = new CriterionContext(criterionId, protocolId, polarity, criterionText);
        BuildState state = new BuildState(context, fieldMappings);

        for (int i = 0; i < fieldMappings.size(); i++) {
            state.atomics.add(atomicFactory.build(fieldMappings.get(i), i, context));
        }

        Optional<LogicDetectionResponse> detected = logicDetectionService.detect(criterionText, fieldMappings);

        StructuredCriterionTree tree;
        if (detected.isPresent()) {
            BuiltNode root = buildFromLogic(detected.get().root(), null, state);
            tree = StructuredCriterionTree.llm(root.node(), logicDetectionService.getModelName());
        } else if (state.atomics.size() == 1) {
            tree = StructuredCriterionTree.fallback(atomicNode(0, state));
        } else {
            tree = StructuredCriterionTree.fallback(buildFlatAnd(state));
        }

        log.debug("Structured criterion {} ({}): {} atomics, {} composites, {} edges",
            criterionId, tree.structureConfidence().getValue(),
            state.atomics.size(), state.composites.size(), state.relationships.size());

        return new StructureResult(criterionId, tree,
            List.copyOf(state.atomics), List.copyOf(state.composites), List.copyOf(state.relationships));
    }

    private BuiltNode buildFromLogic(LogicNode node, CompositeCriterion parent, BuildState state) {
        if (node.isAtomic()) {
            int index = node.fieldMappingIndex();
            return new BuiltNode(atomicNode(index, state), ChildRef.atomic(state.atomics.get(index).getId()));
        }

        LogicalOperator operator = LogicalOperator.fromValue(node.nodeType());
        CompositeCriterion composite = newComposite(operator, parent, state);

        List<ExpressionNode> children = new ArrayList<>();
        List<LogicNode> logicChildren = node.children() != null ? node.children() : List.of();
        for (int seq = 0; seq < logicChildren.size(); seq++) {
            BuiltNode child = buildFromLogic(logicChildren.get(seq), composite, state);
            children.add(child.node());
            state.relationships.add(newRelationship(composite, child.ref(), seq));
        }

        return new BuiltNode(new BranchNode(operator, children), ChildRef.composite(composite.getId()));
    }

    private ExpressionNode buildFlatAnd(BuildState state) {
        CompositeCriterion root = newComposite(LogicalOperator.AND, null, state);

        List<ExpressionNode> children = new ArrayList<>();
        for (int seq = 0; seq < state.atomics.size(); seq++) {
            children.add(atomicNode(seq, state));
            state.relationships.add(newRelationship(root, ChildRef.atomic(state.atomics.get(seq).getId()), seq));
        }
        return new BranchNode(LogicalOperator.AND, children);
    }

    private AtomicNode atomicNode(int index, BuildState state) {
        return AtomicNode.of(state.atomics.get(index), state.fieldMappings.get(index));
    }

    private CompositeCriterion newComposite(LogicalOperator operator, CompositeCriterion parent, BuildState state) {
        CompositeCriterion composite = CompositeCriterion.builder()
            .id(generateId("comp"))
            .criterionId(state.context.criterionId())
            .protocolId(state.context.protocolId())
            .inclusionExclusion(state.context.polarity())
            .logicOperator(operator)
            .parentComposite(parent)
            .originalText(parent == null ? state.context.criterionText() : null)
            .build();
        state.composites.add(composite);
        return composite;
    }

    private CriterionRelationship newRelationship(CompositeCriterion parent, ChildRef child, int sequence) {
        return CriterionRelationship.builder()
            .id(generateId("rel"))
            .parentComposite(parent)
            .childKind(child.kind())
            .childId(child.id())
            .childSequence(sequence)
            .build();
    }

    private String generateId(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }

    private record BuiltNode(ExpressionNode node, ChildRef ref) {}

    private static final class BuildState {
        private final CriterionContext context;
        private final List<FieldMapping> fieldMappings;
        private final List<AtomicCriterion> atomics = new ArrayList<>();
        private final List<CompositeCriterion> composites = new ArrayList<>();
        private final List<CriterionRelationship> relationships = new ArrayList<>();

        private BuildState(CriterionContext context, List<FieldMapping> fieldMappings) {
            this.context = context;
            this.fieldMappings = fieldMappings;
        }
    }
}
