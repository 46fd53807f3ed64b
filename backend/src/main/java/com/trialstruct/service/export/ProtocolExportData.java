package com.trialstruct.service.export;

import com.trialstruct.model.criteria.AtomicCriterion;
import com.trialstruct.model.criteria.CompositeCriterion;
import com.trialstruct.model.criteria.Criterion;
import com.trialstruct.model.criteria.CriterionRelationship;
import com.trialstruct.model.criteria.Protocol;
import com.trialstruct.model.tree.StructuredCriterionTree;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Everything the exporters read for one protocol, loaded up front.
 * Exporters never touch the database.
 *
 * @param criteria         in display order
 * @param atomics          ordered by criterion display order, then mapping index
 * @param trees            parsed structured form per criterion id; unstructured criteria are absent
 */
public record ProtocolExportData(
    Protocol protocol,
    List<Criterion> criteria,
    List<AtomicCriterion> atomics,
    List<CompositeCriterion> composites,
    List<CriterionRelationship> relationships,
    Map<String, StructuredCriterionTree> trees,
    Map<String, AtomicCriterion> atomicsById,
    Map<String, List<CriterionRelationship>> childrenByParent
) {

    public static ProtocolExportData of(
            Protocol protocol,
            List<Criterion> criteria,
            List<AtomicCriterion> atomics,
            List<CompositeCriterion> composites,
            List<CriterionRelationship> relationships,
            Map<String, StructuredCriterionTree> trees) {

        Map<String, Integer> criterionOrder = new LinkedHashMap<>();
        for (int i = 0; i < criteria.size(); i++) {
            criterionOrder.put(criteria.get(i).getId(), i);
        }
        List<AtomicCriterion> orderedAtomics = atomics.stream()
            .sorted(Comparator
                .comparing((AtomicCriterion a) -> criterionOrder.getOrDefault(a.getCriterionId(), Integer.MAX_VALUE))
                .thenComparing(AtomicCriterion::getCriterionId)
                .thenComparing(a -> a.getMappingIndex() != null ? a.getMappingIndex() : 0))
            .toList();

        Map<String, List<CriterionRelationship>> children = relationships.stream()
            .sorted(Comparator.comparing(CriterionRelationship::getChildSequence))
            .collect(Collectors.groupingBy(r -> r.getParentComposite().getId(), LinkedHashMap::new, Collectors.toList()));

        return new ProtocolExportData(
            protocol,
            List.copyOf(criteria),
            orderedAtomics,
            List.copyOf(composites),
            List.copyOf(relationships),
            Map.copyOf(trees),
            orderedAtomics.stream().collect(Collectors.toMap(AtomicCriterion::getId, Function.identity(), (a, b) -> a)),
            children
        );
    }

    public Optional<StructuredCriterionTree> treeFor(Criterion criterion) {
        return Optional.ofNullable(trees.get(criterion.getId()));
    }

    public Optional<AtomicCriterion> atomic(String atomicId) {
        return atomicId == null ? Optional.empty() : Optional.ofNullable(atomicsById.get(atomicId));
    }
}
