package com.trialstruct.service.export;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trialstruct.model.criteria.AtomicCriterion;
import com.trialstruct.model.criteria.Criterion;
import com.trialstruct.model.enums.CriteriaType;
import com.trialstruct.model.enums.EntityDomain;
import com.trialstruct.model.enums.LogicalOperator;
import com.trialstruct.model.tree.AtomicNode;
import com.trialstruct.model.tree.BranchNode;
import com.trialstruct.model.tree.ExpressionNode;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CIRCE Cohort Exporter
 *
 * Builds an OHDSI CIRCE cohort expression from the structured criteria:
 * - inclusion trees become AdditionalCriteria entries, exclusion trees CensoringCriteria
 * - AND/OR map to ALL/ANY criteria groups
 * - NOT and negated atomics become a zero occurrence count on the inner criteria
 * - demographics (age) use DemographicCriteria and need no concept set
 */
@Component
public class CirceCohortExporter {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private static final String DEFAULT_DOMAIN_TABLE = "ConditionOccurrence";

    private static final Map<EntityDomain, String> DOMAIN_TABLES = Map.of(
        EntityDomain.CONDITION, "ConditionOccurrence",
        EntityDomain.MEASUREMENT, "Measurement",
        EntityDomain.DRUG, "DrugExposure",
        EntityDomain.PROCEDURE, "ProcedureOccurrence",
        EntityDomain.OBSERVATION, "Observation",
        EntityDomain.DEVICE, "DeviceExposure",
        EntityDomain.VISIT, "VisitOccurrence"
    );

    private static final Map<String, String> OPERATORS = Map.ofEntries(
        Map.entry(">", "gt"),
        Map.entry(">=", "gte"),
        Map.entry("<", "lt"),
        Map.entry("<=", "lte"),
        Map.entry("=", "eq"),
        Map.entry("==", "eq"),
        Map.entry("!=", "neq"),
        Map.entry("gt", "gt"),
        Map.entry("gte", "gte"),
        Map.entry("lt", "lt"),
        Map.entry("lte", "lte"),
        Map.entry("eq", "eq"),
        Map.entry("neq", "neq")
    );

    public ObjectNode export(ProtocolExportData data) {
        ConceptSetRegistry conceptSets = new ConceptSetRegistry();
        ArrayNode inclusion = JSON.arrayNode();
        ArrayNode censoring = JSON.arrayNode();

        for (Criterion criterion : data.criteria()) {
            data.treeFor(criterion).ifPresent(tree -> {
                ObjectNode group = buildNode(tree.root(), data, conceptSets);
                if (group == null) {
                    return;
                }
                if (criterion.getCriteriaType() == CriteriaType.EXCLUSION) {
                    censoring.add(group);
                } else {
                    inclusion.add(group);
                }
            });
        }

        ObjectNode expression = JSON.objectNode();
        expression.set("ConceptSets", conceptSets.items);

        ObjectNode primary = expression.putObject("PrimaryCriteria");
        primary.putArray("CriteriaList");
        ObjectNode window = primary.putObject("ObservationWindow");
        window.put("PriorDays", 0);
        window.put("PostDays", 0);
        primary.putObject("PrimaryCriteriaLimit").put("Type", "First");

        ObjectNode additional = expression.putObject("AdditionalCriteria");
        additional.put("Type", "ALL");
        additional.set("CriteriaList", inclusion);

        expression.set("CensoringCriteria", censoring);
        return expression;
    }

    // ========================================================================
    // Tree Walk
    // ========================================================================

    private ObjectNode buildNode(ExpressionNode node, ProtocolExportData data, ConceptSetRegistry conceptSets) {
        if (node instanceof AtomicNode leaf) {
            return data.atomic(leaf.atomicCriterionId())
                .map(atomic -> buildAtomic(atomic, conceptSets))
                .orElse(null);
        }
        if (node instanceof BranchNode branch) {
            return branch.operator() == LogicalOperator.NOT
                ? buildNot(branch, data, conceptSets)
                : buildGroup(branch, data, conceptSets);
        }
        return null;
    }

    private ObjectNode buildGroup(BranchNode branch, ProtocolExportData data, ConceptSetRegistry conceptSets) {
        ArrayNode children = JSON.arrayNode();
        for (ExpressionNode child : branch.children()) {
            ObjectNode built = buildNode(child, data, conceptSets);
            if (built != null) {
                children.add(built);
            }
        }
        if (children.isEmpty()) {
            return null;
        }

        ObjectNode group = JSON.objectNode();
        group.put("Type", branch.operator().circeGroupType());
        group.set("CriteriaList", children);
        return group;
    }

    private ObjectNode buildNot(BranchNode branch, ProtocolExportData data, ConceptSetRegistry conceptSets) {
        if (branch.children().isEmpty()) {
            return null;
        }
        ObjectNode inner = buildNode(branch.children().get(0), data, conceptSets);
        if (inner == null) {
            return null;
        }
        // Groups have no occurrence count and pass through unchanged
        if (inner.has("Criteria")) {
            putZeroOccurrence((ObjectNode) inner.get("Criteria"));
        }
        return inner;
    }

    // ========================================================================
    // Atomic Criteria
    // ========================================================================

    private ObjectNode buildAtomic(AtomicCriterion atomic, ConceptSetRegistry conceptSets) {
        if (ConceptIds.isDemographic(atomic)) {
            return buildDemographic(atomic);
        }

        Integer codesetId = conceptSets.ensure(atomic);
        if (codesetId == null) {
            return null;
        }

        ObjectNode entry = JSON.objectNode();
        ObjectNode criteria = entry.putObject("Criteria");
        String table = atomic.getEntityDomain() != null
            ? DOMAIN_TABLES.getOrDefault(atomic.getEntityDomain(), DEFAULT_DOMAIN_TABLE)
            : DEFAULT_DOMAIN_TABLE;
        criteria.putObject(table).put("CodesetId", codesetId);

        if (atomic.isNegation()) {
            putZeroOccurrence(criteria);
        }

        if (hasText(atomic.getRelationOperator()) && atomic.getValueNumeric() != null) {
            ObjectNode valueFilter = criteria.putObject("ValueAsNumber");
            valueFilter.put("Value", atomic.getValueNumeric());
            valueFilter.put("Op", operator(atomic.getRelationOperator(), "eq"));
            if (atomic.getUnitConceptId() != null) {
                valueFilter.put("UnitConceptId", atomic.getUnitConceptId());
            }
        }
        return entry;
    }

    private ObjectNode buildDemographic(AtomicCriterion atomic) {
        if (atomic.getValueNumeric() == null || !hasText(atomic.getRelationOperator())) {
            return null;
        }
        ObjectNode entry = JSON.objectNode();
        ObjectNode age = entry.putObject("Criteria").putObject("DemographicCriteria").putObject("Age");
        age.put("Value", atomic.getValueNumeric().intValue());
        age.put("Op", operator(atomic.getRelationOperator(), "gte"));
        return entry;
    }

    private static void putZeroOccurrence(ObjectNode criteria) {
        ObjectNode count = criteria.putObject("OccurrenceCount");
        count.put("Value", 0);
        count.put("Op", "eq");
    }

    private static String operator(String relation, String fallback) {
        return OPERATORS.getOrDefault(relation.trim().toLowerCase(Locale.ROOT), fallback);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Concept sets of one export, deduplicated by concept id.
     */
    private static final class ConceptSetRegistry {
        private final ArrayNode items = JSON.arrayNode();
        private final Map<Integer, Integer> indexByConcept = new HashMap<>();

        Integer ensure(AtomicCriterion atomic) {
            Integer conceptId = ConceptIds.conceptId(atomic);
            if (conceptId == null) {
                return null;
            }
            Integer existing = indexByConcept.get(conceptId);
            if (existing != null) {
                return existing;
            }

            int index = items.size();
            String text = atomic.getOriginalText();
            ObjectNode set = items.addObject();
            set.put("id", index);
            set.put("name", hasText(text) ? text : "Concept " + conceptId);
            ObjectNode item = set.putObject("expression").putArray("items").addObject();
            ObjectNode concept = item.putObject("concept");
            concept.put("CONCEPT_ID", conceptId);
            concept.put("CONCEPT_NAME", text != null ? text : "");
            item.put("isExcluded", false);
            item.put("includeDescendants", true);
            item.put("includeMapped", false);

            indexByConcept.put(conceptId, index);
            return index;
        }
    }
}
