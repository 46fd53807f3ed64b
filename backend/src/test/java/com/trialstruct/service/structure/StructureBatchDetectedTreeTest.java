package com.trialstruct.service.structure;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trialstruct.config.NormalizationConfig;
import com.trialstruct.model.audit.AuditLog;
import com.trialstruct.model.criteria.AtomicCriterion;
import com.trialstruct.model.criteria.CompositeCriterion;
import com.trialstruct.model.criteria.Criterion;
import com.trialstruct.model.criteria.CriterionRelationship;
import com.trialstruct.model.criteria.Protocol;
import com.trialstruct.model.enums.ChildKind;
import com.trialstruct.model.enums.CriteriaType;
import com.trialstruct.model.enums.LogicalOperator;
import com.trialstruct.model.enums.StructureConfidence;
import com.trialstruct.model.tree.StructuredCriterionTree;
import com.trialstruct.repository.AtomicCriterionRepository;
import com.trialstruct.repository.AuditLogRepository;
import com.trialstruct.repository.CompositeCriterionRepository;
import com.trialstruct.repository.CriterionRelationshipRepository;
import com.trialstruct.repository.CriterionRepository;
import com.trialstruct.repository.ProtocolRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.trialstruct.service.structure.LogicNode.atomic;
import static com.trialstruct.service.structure.LogicNode.branch;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Batch runs where the logic detector proposes nested trees or fails outright.
 */
@DataJpaTest
@Import({
    StructureBatchDetectedTreeTest.JacksonTestConfig.class,
    NormalizationConfig.class,
    AtomicCriterionFactory.class,
    ExpressionTreeBuilder.class,
    StructureBatchService.class
})
class StructureBatchDetectedTreeTest {

    private static final String NESTED_TEXT =
        "Type 2 diabetes or prediabetes, and no history of ketoacidosis";
    private static final String FAILING_TEXT = "Hypertension and hyperlipidemia";

    private static final String NESTED_MAPPINGS = """
        [{"entity": "Type 2 diabetes", "entity_domain": "condition", "omop_concept_id": "201826"},
         {"entity": "Prediabetes", "entity_domain": "condition", "omop_concept_id": "37018196"},
         {"entity": "Diabetic ketoacidosis", "entity_domain": "condition", "omop_concept_id": "443727"}]
        """;

    private static final String FAILING_MAPPINGS = """
        [{"entity": "Hypertension", "entity_domain": "condition", "omop_concept_id": "316866"},
         {"entity": "Hyperlipidemia", "entity_domain": "condition", "omop_concept_id": "432867"}]
        """;

    @TestConfiguration
    static class JacksonTestConfig {
        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }

    @MockBean
    private LogicDetectionService logicDetectionService;

    @Autowired
    private StructureBatchService structureBatchService;

    @Autowired
    private ProtocolRepository protocolRepository;

    @Autowired
    private CriterionRepository criterionRepository;

    @Autowired
    private AtomicCriterionRepository atomicRepository;

    @Autowired
    private CompositeCriterionRepository compositeRepository;

    @Autowired
    private CriterionRelationshipRepository relationshipRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Autowired
    private EntityManager entityManager;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        protocolRepository.save(Protocol.builder().id("proto-1").title("Diabetes Study").build());
        criterionRepository.save(criterion("crit-a", 0, NESTED_TEXT, NESTED_MAPPINGS));
        criterionRepository.save(criterion("crit-b", 1, FAILING_TEXT, FAILING_MAPPINGS));
        flushAndClear();

        LogicNode detected = branch("OR", branch("AND", atomic(0), atomic(1)), branch("NOT", atomic(2)));
        when(logicDetectionService.detect(eq(NESTED_TEXT), anyList()))
            .thenReturn(Optional.of(new LogicDetectionResponse(detected, "nested")));
        when(logicDetectionService.detect(eq(FAILING_TEXT), anyList()))
            .thenThrow(new IllegalStateException("kaboom"));
        when(logicDetectionService.getModelName()).thenReturn("test-model");
    }

    @Test
    void shouldPersistDetectedNestedTreeAndIsolateFailingCriterion() throws Exception {
        // WHEN
        StructureBatchResult result = structureBatchService.structureProtocol("proto-1");
        flushAndClear();

        // THEN
        assertThat(result.processed()).isEqualTo(1);
        assertThat(result.skipped()).isZero();
        assertThat(result.errors()).containsExactly("Structure build failed for criterion crit-b: kaboom");

        List<AtomicCriterion> atomics = atomicRepository.findByCriterionIdOrderByMappingIndexAsc("crit-a");
        assertThat(atomics).hasSize(3);

        Map<LogicalOperator, CompositeCriterion> composites = compositeRepository.findByCriterionId("crit-a").stream()
            .collect(Collectors.toMap(CompositeCriterion::getLogicOperator, Function.identity()));
        assertThat(composites).containsOnlyKeys(LogicalOperator.OR, LogicalOperator.AND, LogicalOperator.NOT);

        CompositeCriterion or = composites.get(LogicalOperator.OR);
        CompositeCriterion and = composites.get(LogicalOperator.AND);
        CompositeCriterion not = composites.get(LogicalOperator.NOT);
        assertThat(or.getParentComposite()).isNull();
        assertThat(or.getOriginalText()).isEqualTo(NESTED_TEXT);
        assertThat(and.getParentComposite().getId()).isEqualTo(or.getId());
        assertThat(not.getParentComposite().getId()).isEqualTo(or.getId());

        List<CriterionRelationship> rootEdges = relationshipRepository.findByParentCompositeIdOrderByChildSequenceAsc(or.getId());
        assertThat(rootEdges).extracting(CriterionRelationship::getChildKind)
            .containsExactly(ChildKind.COMPOSITE, ChildKind.COMPOSITE);
        assertThat(rootEdges).extracting(CriterionRelationship::getChildId)
            .containsExactly(and.getId(), not.getId());

        assertThat(relationshipRepository.findByParentCompositeIdOrderByChildSequenceAsc(and.getId()))
            .extracting(CriterionRelationship::getChildId)
            .containsExactly(atomics.get(0).getId(), atomics.get(1).getId());
        assertThat(relationshipRepository.findByParentCompositeIdOrderByChildSequenceAsc(not.getId()))
            .extracting(CriterionRelationship::getChildKind, CriterionRelationship::getChildId)
            .containsExactly(tuple(ChildKind.ATOMIC, atomics.get(2).getId()));

        StructuredCriterionTree tree = objectMapper.readValue(
            criterionRepository.findById("crit-a").orElseThrow().getStructuredCriterion(), StructuredCriterionTree.class);
        assertThat(tree.structureConfidence()).isEqualTo(StructureConfidence.LLM);
        assertThat(tree.root().leafCount()).isEqualTo(3);

        assertThat(atomicRepository.findByCriterionIdOrderByMappingIndexAsc("crit-b")).isEmpty();
        assertThat(compositeRepository.findByCriterionId("crit-b")).isEmpty();
        assertThat(criterionRepository.findById("crit-b").orElseThrow().getStructuredCriterion()).isNull();
    }

    @Test
    void shouldWriteOneAuditRecordPerBatch() throws Exception {
        // WHEN
        structureBatchService.structureProtocol("proto-1");
        flushAndClear();

        // THEN
        List<AuditLog> audits = auditLogRepository.findByTargetTypeAndTargetIdOrderByTimestampAsc("protocol", "proto-1");
        assertThat(audits).hasSize(1);
        AuditLog audit = audits.get(0);
        assertThat(audit.getEventType()).isEqualTo(AuditLog.STRUCTURE_TREES_BUILT);
        assertThat(audit.getActorId()).isEqualTo("system:structure");
        assertThat(audit.getTimestamp()).isNotNull();

        JsonNode details = objectMapper.readTree(audit.getDetails());
        assertThat(details.get("protocol_id").asText()).isEqualTo("proto-1");
        assertThat(details.get("criteria_processed").asInt()).isEqualTo(2);
        assertThat(details.get("criteria_structured").asInt()).isEqualTo(1);
        assertThat(details.get("errors").asInt()).isEqualTo(1);
    }

    @Test
    void shouldStructureOnlyRequestedCriteria() {
        // WHEN
        StructureBatchResult result = structureBatchService.structureCriteria("proto-1", List.of("crit-a"));
        flushAndClear();

        // THEN
        assertThat(result.processed()).isEqualTo(1);
        assertThat(result.errors()).isEmpty();
        assertThat(compositeRepository.findByCriterionId("crit-a")).hasSize(3);
        assertThat(criterionRepository.findById("crit-b").orElseThrow().getStructuredCriterion()).isNull();
    }

    @Test
    void shouldRejectCriterionIdsOutsideProtocol() {
        assertThatThrownBy(() -> structureBatchService.structureCriteria("proto-1", List.of("crit-a", "crit-z")))
            .isInstanceOf(EntityNotFoundException.class)
            .hasMessageContaining("crit-z");
        assertThat(auditLogRepository.findAll()).isEmpty();
    }

    private static Criterion criterion(String id, int order, String text, String mappings) {
        return Criterion.builder()
            .id(id)
            .protocolId("proto-1")
            .criteriaType(CriteriaType.INCLUSION)
            .text(text)
            .fieldMappings(mappings)
            .displayOrder(order)
            .build();
    }

    private void flushAndClear() {
        entityManager.flush();
        entityManager.clear();
    }
}
