package com.trialstruct.service.export;

import com.trialstruct.model.criteria.AtomicCriterion;
import com.trialstruct.model.enums.CriteriaType;
import com.trialstruct.model.enums.EntityDomain;
import org.junit.jupiter.api.Test;

import static com.trialstruct.service.export.ExportFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class EvaluationSqlGeneratorTest {

    private final EvaluationSqlGenerator generator = new EvaluationSqlGenerator();

    @Test
    void shouldGenerateSingleConditionQuery() {
        AtomicCriterion diabetes = condition("a1", "201826", "snomed", false);
        ProtocolExportData data = protocol()
            .criterion("c1", CriteriaType.INCLUSION, leaf(diabetes), diabetes)
            .build();

        String sql = generator.generate(data);

        assertThat(sql).isEqualTo(
            "-- Auto-generated OMOP CDM v5.4 eligibility evaluation SQL\n"
            + "-- Protocol: Diabetes Study (proto-1)\n"
            + "-- Generated from 1 atomic criteria\n"
            + "\n"
            + "WITH\n"
            + "cte_0 AS (\n"
            + "    SELECT DISTINCT t.person_id\n"
            + "    FROM condition_occurrence t\n"
            + "    INNER JOIN concept_ancestor ca\n"
            + "        ON ca.descendant_concept_id = t.condition_concept_id\n"
            + "    WHERE ca.ancestor_concept_id = 201826\n"
            + ")\n"
            + "\n"
            + "\n"
            + "SELECT p.person_id\n"
            + "FROM person p\n"
            + "WHERE EXISTS (\n"
            + "    SELECT 1 FROM cte_0 c\n"
            + "    WHERE c.person_id = p.person_id\n"
            + ")\n"
            + ";");
    }

    @Test
    void shouldFilterMeasurementValueAndUnit() {
        AtomicCriterion lower = measurement("a1", "3004410", ">=", 7.0, 8554);
        AtomicCriterion upper = measurement("a2", "3004410", "lte", 10.0, null);
        ProtocolExportData data = protocol()
            .criterion("c1", CriteriaType.INCLUSION, and(leaf(lower), leaf(upper)), lower, upper)
            .build();

        String sql = generator.generate(data);

        assertThat(sql)
            .contains("-- Generated from 2 atomic criteria")
            .contains("FROM measurement t")
            .contains("ON ca.descendant_concept_id = t.measurement_concept_id")
            .contains("    AND t.value_as_number >= 7.0\n    AND t.unit_concept_id = 8554\n)")
            .contains("    AND t.value_as_number <= 10.0\n)")
            .contains("cte_0 AS (")
            .contains(")\n\ncte_1 AS (")
            .contains("WHERE EXISTS (\n    SELECT 1 FROM cte_0 c")
            .contains("AND EXISTS (\n    SELECT 1 FROM cte_1 c")
            .endsWith(")\n;");
    }

    @Test
    void shouldFlattenOrIntoRequiredExists() {
        // "HbA1c >= 7% OR fasting glucose >= 126" is evaluated as requiring both
        AtomicCriterion hba1c = measurement("a1", "3004410", ">=", 7.0, 8554);
        AtomicCriterion glucose = measurement("a2", "3004501", ">=", 126.0, 8840);
        ProtocolExportData data = protocol()
            .criterion("c1", CriteriaType.INCLUSION, or(leaf(hba1c), leaf(glucose)), hba1c, glucose)
            .build();

        String sql = generator.generate(data);

        assertThat(sql)
            .contains("WHERE EXISTS (\n    SELECT 1 FROM cte_0 c")
            .contains("AND EXISTS (\n    SELECT 1 FROM cte_1 c")
            .doesNotContain(" OR ");
    }

    @Test
    void shouldRejectExclusionAndNegatedAtomicsWithNotExists() {
        AtomicCriterion diabetes = condition("a1", "201826", "snomed", false);
        AtomicCriterion noInsulin = condition("a2", "21600713", "rxnorm", true);
        noInsulin.setEntityDomain(EntityDomain.DRUG);
        AtomicCriterion pregnancy = condition("a3", "4299535", "snomed", false);
        ProtocolExportData data = protocol()
            .criterion("c1", CriteriaType.INCLUSION, and(leaf(diabetes), leaf(noInsulin)), diabetes, noInsulin)
            .criterion("c2", CriteriaType.EXCLUSION, leaf(pregnancy), pregnancy)
            .build();

        String sql = generator.generate(data);

        assertThat(sql)
            .contains("FROM drug_exposure t")
            .contains("WHERE EXISTS (\n    SELECT 1 FROM cte_0 c")
            .contains("AND NOT EXISTS (\n    SELECT 1 FROM cte_1 c")
            .contains("AND NOT EXISTS (\n    SELECT 1 FROM cte_2 c");
    }

    @Test
    void shouldStartWithWhereWhenOnlyExclusionsExist() {
        AtomicCriterion pregnancy = condition("a1", "4299535", "snomed", false);
        AtomicCriterion dialysis = condition("a2", "4032243", "snomed", false);
        ProtocolExportData data = protocol()
            .criterion("c1", CriteriaType.EXCLUSION, or(leaf(pregnancy), leaf(dialysis)), pregnancy, dialysis)
            .build();

        String sql = generator.generate(data);

        assertThat(sql)
            .contains("FROM person p\nWHERE NOT EXISTS (\n    SELECT 1 FROM cte_0 c")
            .contains("AND NOT EXISTS (\n    SELECT 1 FROM cte_1 c");
    }

    @Test
    void shouldComputeAgeFromYearOfBirth() {
        AtomicCriterion adult = age("a1", ">=", 18.0);
        AtomicCriterion vague = age("a2", ">=", null);
        ProtocolExportData data = protocol()
            .criterion("c1", CriteriaType.INCLUSION, and(leaf(adult), leaf(vague)), adult, vague)
            .build();

        String sql = generator.generate(data);

        assertThat(sql)
            .contains("cte_0 AS (\n    SELECT p.person_id\n    FROM person p\n"
                + "    WHERE EXTRACT(YEAR FROM CURRENT_DATE) - p.year_of_birth >= 18\n)")
            .contains("cte_1 AS (\n    SELECT p.person_id\n    FROM person p\n    WHERE 1=1\n)");
    }

    @Test
    void shouldKeepAtomicIndexInCteNamesWhenSkippingUnmappedAtomics() {
        AtomicCriterion unmapped = condition("a1", "C0011849", "umls", false);
        AtomicCriterion diabetes = condition("a2", "201826", "snomed", false);
        ProtocolExportData data = protocol()
            .criterion("c1", CriteriaType.INCLUSION, and(leaf(unmapped), leaf(diabetes)), unmapped, diabetes)
            .build();

        String sql = generator.generate(data);

        assertThat(sql).contains("cte_1 AS (").doesNotContain("cte_0");
        assertThat(sql).contains("-- Generated from 1 atomic criteria");
    }

    @Test
    void shouldReturnStubWhenNothingResolves() {
        AtomicCriterion unmapped = condition("a1", "C0011849", "umls", false);
        ProtocolExportData data = protocol()
            .criterion("c1", CriteriaType.INCLUSION, leaf(unmapped), unmapped)
            .build();

        assertThat(generator.generate(data)).isEqualTo(
            "-- No structured criteria with valid concept IDs found.\n"
            + "SELECT NULL AS person_id WHERE 1=0;\n");
        assertThat(generator.generate(protocol().unstructuredCriterion("c1").build()))
            .isEqualTo(EvaluationSqlGenerator.EMPTY_RESULT_SQL);
    }

    @Test
    void shouldKeepMultiLineProtocolTitleInsideHeaderComment() {
        AtomicCriterion diabetes = condition("a1", "201826", "snomed", false);
        ProtocolExportData data = protocol()
            .titled("Study X\nDELETE FROM person;\r\n--")
            .criterion("c1", CriteriaType.INCLUSION, leaf(diabetes), diabetes)
            .build();

        String sql = generator.generate(data);

        assertThat(sql).contains("-- Protocol: Study X DELETE FROM person;  -- (proto-1)\n");
        assertThat(sql.lines().filter(line -> line.startsWith("DELETE"))).isEmpty();
    }
}
