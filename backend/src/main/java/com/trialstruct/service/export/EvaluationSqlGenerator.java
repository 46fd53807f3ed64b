package com.trialstruct.service.export;

import com.trialstruct.model.criteria.AtomicCriterion;
import com.trialstruct.model.enums.CriteriaType;
import com.trialstruct.model.enums.EntityDomain;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluation SQL Generator
 *
 * Generates OMOP CDM v5.4 SQL that evaluates a protocol's eligibility:
 * - one CTE per atomic criterion with a concept id, expanded through concept_ancestor
 * - measurement value/unit filters and year-of-birth age filters
 * - a final person query requiring every inclusion CTE and rejecting every exclusion CTE
 *
 * The final query is flat: inclusion atomics are all required and exclusion or
 * negated atomics all disqualify, whatever AND/OR/NOT nesting the trees carry.
 * An "A OR B" inclusion criterion is therefore evaluated as "A AND B".
 */
@Component
public class EvaluationSqlGenerator {

    static final String EMPTY_RESULT_SQL =
        "-- No structured criteria with valid concept IDs found.\n"
        + "SELECT NULL AS person_id WHERE 1=0;\n";

    private static final DomainTable DEFAULT_TABLE = new DomainTable("condition_occurrence", "condition_concept_id");

    private static final Map<EntityDomain, DomainTable> DOMAIN_TABLES = Map.of(
        EntityDomain.CONDITION, DEFAULT_TABLE,
        EntityDomain.MEASUREMENT, new DomainTable("measurement", "measurement_concept_id"),
        EntityDomain.DRUG, new DomainTable("drug_exposure", "drug_concept_id"),
        EntityDomain.PROCEDURE, new DomainTable("procedure_occurrence", "procedure_concept_id"),
        EntityDomain.OBSERVATION, new DomainTable("observation", "observation_concept_id"),
        EntityDomain.DEVICE, new DomainTable("device_exposure", "device_concept_id"),
        EntityDomain.VISIT, new DomainTable("visit_occurrence", "visit_concept_id")
    );

    private static final Map<String, String> SQL_OPERATORS = Map.ofEntries(
        Map.entry(">", ">"),
        Map.entry(">=", ">="),
        Map.entry("<", "<"),
        Map.entry("<=", "<="),
        Map.entry("=", "="),
        Map.entry("==", "="),
        Map.entry("!=", "!="),
        Map.entry("gt", ">"),
        Map.entry("gte", ">="),
        Map.entry("lt", "<"),
        Map.entry("lte", "<="),
        Map.entry("eq", "="),
        Map.entry("neq", "!=")
    );

    public String generate(ProtocolExportData data) {
        List<String> ctes = new ArrayList<>();
        List<String> inclusionNames = new ArrayList<>();
        List<String> exclusionNames = new ArrayList<>();

        List<AtomicCriterion> atomics = data.atomics();
        for (int i = 0; i < atomics.size(); i++) {
            AtomicCriterion atomic = atomics.get(i);
            Integer conceptId = ConceptIds.conceptId(atomic);
            if (conceptId == null) {
                continue;
            }

            String cteName = "cte_" + i;
            ctes.add(buildAtomicCte(atomic, conceptId, cteName));
            if (atomic.getInclusionExclusion() == CriteriaType.EXCLUSION || atomic.isNegation()) {
                exclusionNames.add(cteName);
            } else {
                inclusionNames.add(cteName);
            }
        }

        if (ctes.isEmpty()) {
            return EMPTY_RESULT_SQL;
        }

        List<String> parts = new ArrayList<>();
        parts.add("-- Auto-generated OMOP CDM v5.4 eligibility evaluation SQL");
        parts.add("-- Protocol: " + commentText(data.protocol().getTitle())
            + " (" + commentText(data.protocol().getId()) + ")");
        parts.add("-- Generated from " + ctes.size() + " atomic criteria\n");
        parts.add("WITH");
        parts.add(String.join(",\n\n", ctes));

        parts.add("\n\nSELECT p.person_id");
        parts.add("FROM person p");

        boolean first = true;
        for (String name : inclusionNames) {
            parts.add((first ? "WHERE" : "AND") + " EXISTS (\n" + personMatch(name) + ")");
            first = false;
        }
        for (String name : exclusionNames) {
            parts.add((first ? "WHERE" : "AND") + " NOT EXISTS (\n" + personMatch(name) + ")");
            first = false;
        }

        parts.add(";");
        return String.join("\n", parts);
    }

    // Free text stays on its single comment line
    private static String commentText(String text) {
        return text == null ? "" : text.replace('\r', ' ').replace('\n', ' ');
    }

    // ========================================================================
    // CTE Builders
    // ========================================================================

    private String buildAtomicCte(AtomicCriterion atomic, int conceptId, String cteName) {
        EntityDomain domain = atomic.getEntityDomain() != null ? atomic.getEntityDomain() : EntityDomain.CONDITION;
        if (domain == EntityDomain.DEMOGRAPHICS) {
            return buildDemographicsCte(atomic, cteName);
        }

        DomainTable table = DOMAIN_TABLES.getOrDefault(domain, DEFAULT_TABLE);
        List<String> lines = new ArrayList<>();
        lines.add(cteName + " AS (");
        lines.add("    SELECT DISTINCT t.person_id");
        lines.add("    FROM " + table.name() + " t");
        lines.add("    INNER JOIN concept_ancestor ca");
        lines.add("        ON ca.descendant_concept_id = t." + table.conceptColumn());
        lines.add("    WHERE ca.ancestor_concept_id = " + conceptId);

        if (domain == EntityDomain.MEASUREMENT && hasOperatorAndValue(atomic)) {
            lines.add("    AND t.value_as_number " + sqlOperator(atomic.getRelationOperator()) + " " + atomic.getValueNumeric());
            if (atomic.getUnitConceptId() != null) {
                lines.add("    AND t.unit_concept_id = " + atomic.getUnitConceptId());
            }
        }

        lines.add(")");
        return String.join("\n", lines);
    }

    private String buildDemographicsCte(AtomicCriterion atomic, String cteName) {
        List<String> lines = new ArrayList<>();
        lines.add(cteName + " AS (");
        lines.add("    SELECT p.person_id");
        lines.add("    FROM person p");
        if (hasOperatorAndValue(atomic)) {
            lines.add("    WHERE EXTRACT(YEAR FROM CURRENT_DATE) - p.year_of_birth "
                + sqlOperator(atomic.getRelationOperator()) + " " + atomic.getValueNumeric().intValue());
        } else {
            lines.add("    WHERE 1=1");
        }
        lines.add(")");
        return String.join("\n", lines);
    }

    private static String personMatch(String cteName) {
        return "    SELECT 1 FROM " + cteName + " c\n"
            + "    WHERE c.person_id = p.person_id\n";
    }

    private static boolean hasOperatorAndValue(AtomicCriterion atomic) {
        return atomic.getRelationOperator() != null && !atomic.getRelationOperator().isBlank()
            && atomic.getValueNumeric() != null;
    }

    private static String sqlOperator(String relation) {
        return SQL_OPERATORS.getOrDefault(relation.trim().toLowerCase(Locale.ROOT), "=");
    }

    private record DomainTable(String name, String conceptColumn) {}
}
