package com.trialstruct.service.structure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trialstruct.model.audit.AuditLog;
import com.trialstruct.model.criteria.CompositeCriterion;
import com.trialstruct.model.criteria.Criterion;
import com.trialstruct.model.tree.FieldMapping;
import com.trialstruct.repository.AtomicCriterionRepository;
import com.trialstruct.repository.AuditLogRepository;
import com.trialstruct.repository.CompositeCriterionRepository;
import com.trialstruct.repository.CriterionRelationshipRepository;
import com.trialstruct.repository.CriterionRepository;
import com.trialstruct.repository.ProtocolRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;

/**
 * Structure Batch Service
 *
 * Structures every criterion of a protocol that carries field mappings:
 * - tree building (including the logic detection call) runs on a bounded pool
 * - rows and structured JSON are persisted on the calling thread, in one transaction
 * - a failing criterion is recorded and does not stop the batch
 * - every batch with qualifying criteria leaves one audit record
 * - storage failures propagate and roll the batch back
 */
@Slf4j
@Service
@Transactional
public class StructureBatchService {

    private static final String AUDIT_ACTOR = "system:structure";

    private static final TypeReference<List<FieldMapping>> FIELD_MAPPING_LIST = new TypeReference<>() {};

    private final ProtocolRepository protocolRepository;
    private final CriterionRepository criterionRepository;
    private final AtomicCriterionRepository atomicRepository;
    private final CompositeCriterionRepository compositeRepository;
    private final CriterionRelationshipRepository relationshipRepository;
    private final AuditLogRepository auditLogRepository;
    private final ExpressionTreeBuilder treeBuilder;
    private final ObjectMapper objectMapper;
    private final int maxConcurrency;

    public StructureBatchService(
            ProtocolRepository protocolRepository,
            CriterionRepository criterionRepository,
            AtomicCriterionRepository atomicRepository,
            CompositeCriterionRepository compositeRepository,
            CriterionRelationshipRepository relationshipRepository,
            AuditLogRepository auditLogRepository,
            ExpressionTreeBuilder treeBuilder,
            ObjectMapper objectMapper,
            @Value("${structure.max-concurrency:4}") int maxConcurrency) {
        this.protocolRepository = protocolRepository;
        this.criterionRepository = criterionRepository;
        this.atomicRepository = atomicRepository;
        this.compositeRepository = compositeRepository;
        this.relationshipRepository = relationshipRepository;
        this.auditLogRepository = auditLogRepository;
        this.treeBuilder = treeBuilder;
        this.objectMapper = objectMapper;
        this.maxConcurrency = Math.max(1, maxConcurrency);
    }

    // ========================================================================
    // Batch Entry Points
    // ========================================================================

    /**
     * Structure all criteria of a protocol.
     *
     * @throws EntityNotFoundException if the protocol does not exist
     */
    public StructureBatchResult structureProtocol(String protocolId) {
        if (!protocolRepository.existsById(protocolId)) {
            throw new EntityNotFoundException("Protocol not found: " + protocolId);
        }
        List<Criterion> criteria = criterionRepository.findByProtocolIdOrderByDisplayOrderAscIdAsc(protocolId);
        return structureBatch(protocolId, criteria);
    }

    /**
     * Structure selected criteria of a protocol, in display order.
     *
     * @throws EntityNotFoundException if the protocol does not exist or any id is not one of its criteria
     */
    public StructureBatchResult structureCriteria(String protocolId, Collection<String> criterionIds) {
        if (!protocolRepository.existsById(protocolId)) {
            throw new EntityNotFoundException("Protocol not found: " + protocolId);
        }
        Set<String> requested = new LinkedHashSet<>(criterionIds);
        List<Criterion> criteria = criterionRepository.findByProtocolIdAndIdInOrderByDisplayOrderAscIdAsc(protocolId, requested);
        if (criteria.size() != requested.size()) {
            criteria.forEach(criterion -> requested.remove(criterion.getId()));
            throw new EntityNotFoundException("Criteria not found in protocol " + protocolId + ": " + requested);
        }
        return structureBatch(protocolId, criteria);
    }

    /**
     * Structure the given criteria of a protocol.
     */
    public StructureBatchResult structureBatch(String protocolId, List<Criterion> criteria) {
        MDC.put("protocolId", protocolId);
        try {
            return runBatch(protocolId, criteria);
        } finally {
            MDC.remove("protocolId");
        }
    }

    private StructureBatchResult runBatch(String protocolId, List<Criterion> criteria) {
        List<String> errors = new ArrayList<>();
        List<PendingCriterion> pending = new ArrayList<>();
        int skipped = 0;

        for (Criterion criterion : criteria) {
            try {
                List<FieldMapping> mappings = parseFieldMappings(criterion);
                if (mappings.isEmpty()) {
                    skipped++;
                    continue;
                }
                pending.add(new PendingCriterion(criterion, mappings));
            } catch (JsonProcessingException e) {
                log.warn("Unreadable field mappings on criterion {}", criterion.getId(), e);
                errors.add(failureMessage(criterion, e));
            }
        }

        int qualifying = pending.size() + errors.size();
        List<BuiltCriterion> built = buildAll(protocolId, pending, errors);

        int processed = 0;
        for (BuiltCriterion item : built) {
            persist(item);
            processed++;
            log.info("Structured criterion {} ({}, {} atomics)", item.criterion().getId(),
                item.result().tree().structureConfidence().getValue(), item.result().atomics().size());
        }

        if (qualifying > 0) {
            writeAudit(protocolId, qualifying, processed, errors.size());
        }

        log.info("Structure batch for protocol {}: {} processed, {} skipped, {} failed",
            protocolId, processed, skipped, errors.size());
        return new StructureBatchResult(processed, skipped, errors);
    }

    // ========================================================================
    // Parallel Build
    // ========================================================================

    private List<BuiltCriterion> buildAll(String protocolId, List<PendingCriterion> pending, List<String> errors) {
        if (pending.isEmpty()) {
            return List.of();
        }

        MdcAwareExecutor executor = new MdcAwareExecutor(
            Executors.newFixedThreadPool(Math.min(maxConcurrency, pending.size())));
        try {
            List<CompletableFuture<BuiltCriterion>> futures = new ArrayList<>();
            for (PendingCriterion item : pending) {
                futures.add(CompletableFuture.supplyAsync(() -> build(protocolId, item), executor));
            }

            List<BuiltCriterion> built = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                Criterion criterion = pending.get(i).criterion();
                try {
                    built.add(futures.get(i).join());
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Structure build failed for criterion {}", criterion.getId(), cause);
                    errors.add(failureMessage(criterion, cause));
                }
            }
            return built;
        } finally {
            executor.shutdown();
        }
    }

    private BuiltCriterion build(String protocolId, PendingCriterion item) {
        Criterion criterion = item.criterion();
        StructureResult result = treeBuilder.build(
            criterion.getId(),
            protocolId,
            criterion.getCriteriaType(),
            item.mappings(),
            criterion.getText());
        try {
            return new BuiltCriterion(criterion, result, objectMapper.writeValueAsString(result.tree()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize structured criterion: " + e.getOriginalMessage(), e);
        }
    }

    // ========================================================================
    // Persistence
    // ========================================================================

    private void persist(BuiltCriterion item) {
        String criterionId = item.criterion().getId();

        relationshipRepository.deleteByCriterionId(criterionId);
        compositeRepository.clearParentsByCriterionId(criterionId);
        compositeRepository.deleteByCriterionId(criterionId);
        atomicRepository.deleteByCriterionId(criterionId);

        StructureResult result = item.result();
        atomicRepository.saveAll(result.atomics());
        // Parent-first order so each parent is managed before its children reference it
        for (CompositeCriterion composite : result.composites()) {
            compositeRepository.save(composite);
        }
        relationshipRepository.saveAll(result.relationships());

        Criterion criterion = item.criterion();
        criterion.setStructuredCriterion(item.treeJson());
        criterionRepository.save(criterion);
    }

    private void writeAudit(String protocolId, int qualifying, int processed, int failed) {
        ObjectNode details = objectMapper.createObjectNode();
        details.put("protocol_id", protocolId);
        details.put("criteria_processed", qualifying);
        details.put("criteria_structured", processed);
        details.put("errors", failed);

        auditLogRepository.save(AuditLog.builder()
            .id("audit-" + UUID.randomUUID())
            .eventType(AuditLog.STRUCTURE_TREES_BUILT)
            .actorId(AUDIT_ACTOR)
            .targetType("protocol")
            .targetId(protocolId)
            .details(details.toString())
            .timestamp(LocalDateTime.now())
            .build());
    }

    private List<FieldMapping> parseFieldMappings(Criterion criterion) throws JsonProcessingException {
        String json = criterion.getFieldMappings();
        if (json == null || json.isBlank()) {
            return List.of();
        }
        List<FieldMapping> mappings = objectMapper.readValue(json, FIELD_MAPPING_LIST);
        return mappings != null ? mappings : List.of();
    }

    private String failureMessage(Criterion criterion, Throwable cause) {
        return "Structure build failed for criterion " + criterion.getId() + ": " + cause.getMessage();
    }

    private record PendingCriterion(Criterion criterion, List<FieldMapping> mappings) {}

    private record BuiltCriterion(Criterion criterion, StructureResult result, String treeJson) {}
}
