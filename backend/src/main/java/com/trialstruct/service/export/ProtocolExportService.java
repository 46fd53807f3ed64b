package com.trialstruct.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trialstruct.model.criteria.Criterion;
import com.trialstruct.model.criteria.Protocol;
import com.trialstruct.model.tree.StructuredCriterionTree;
import com.trialstruct.repository.AtomicCriterionRepository;
import com.trialstruct.repository.CompositeCriterionRepository;
import com.trialstruct.repository.CriterionRelationshipRepository;
import com.trialstruct.repository.CriterionRepository;
import com.trialstruct.repository.ProtocolRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Protocol Export Service
 *
 * Loads a protocol's structured criteria once and hands them to the
 * CIRCE, FHIR Group and evaluation SQL exporters.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class ProtocolExportService {

    private final ProtocolRepository protocolRepository;
    private final CriterionRepository criterionRepository;
    private final AtomicCriterionRepository atomicRepository;
    private final CompositeCriterionRepository compositeRepository;
    private final CriterionRelationshipRepository relationshipRepository;
    private final CirceCohortExporter circeExporter;
    private final FhirGroupExporter fhirExporter;
    private final EvaluationSqlGenerator sqlGenerator;
    private final ObjectMapper objectMapper;

    public ProtocolExportService(
            ProtocolRepository protocolRepository,
            CriterionRepository criterionRepository,
            AtomicCriterionRepository atomicRepository,
            CompositeCriterionRepository compositeRepository,
            CriterionRelationshipRepository relationshipRepository,
            CirceCohortExporter circeExporter,
            FhirGroupExporter fhirExporter,
            EvaluationSqlGenerator sqlGenerator,
            ObjectMapper objectMapper) {
        this.protocolRepository = protocolRepository;
        this.criterionRepository = criterionRepository;
        this.atomicRepository = atomicRepository;
        this.compositeRepository = compositeRepository;
        this.relationshipRepository = relationshipRepository;
        this.circeExporter = circeExporter;
        this.fhirExporter = fhirExporter;
        this.sqlGenerator = sqlGenerator;
        this.objectMapper = objectMapper;
    }

    // ========================================================================
    // Loading
    // ========================================================================

    /**
     * Load export data for a protocol.
     * Empty when the protocol does not exist or has no criteria.
     */
    public Optional<ProtocolExportData> load(String protocolId) {
        Optional<Protocol> protocol = protocolRepository.findById(protocolId);
        if (protocol.isEmpty()) {
            return Optional.empty();
        }

        List<Criterion> criteria = criterionRepository.findByProtocolIdOrderByDisplayOrderAscIdAsc(protocolId);
        if (criteria.isEmpty()) {
            return Optional.empty();
        }

        Map<String, StructuredCriterionTree> trees = new HashMap<>();
        for (Criterion criterion : criteria) {
            parseTree(criterion).ifPresent(tree -> trees.put(criterion.getId(), tree));
        }

        return Optional.of(ProtocolExportData.of(
            protocol.get(),
            criteria,
            atomicRepository.findByProtocolId(protocolId),
            compositeRepository.findByProtocolId(protocolId),
            relationshipRepository.findByProtocolId(protocolId),
            trees
        ));
    }

    // ========================================================================
    // Exports
    // ========================================================================

    public ObjectNode exportCirce(String protocolId) {
        return circeExporter.export(require(protocolId));
    }

    public ObjectNode exportFhirGroup(String protocolId) {
        return fhirExporter.export(require(protocolId));
    }

    public String exportEvaluationSql(String protocolId) {
        return sqlGenerator.generate(require(protocolId));
    }

    private ProtocolExportData require(String protocolId) {
        return load(protocolId)
            .orElseThrow(() -> new EntityNotFoundException("No export data for protocol: " + protocolId));
    }

    private Optional<StructuredCriterionTree> parseTree(Criterion criterion) {
        String json = criterion.getStructuredCriterion();
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json, StructuredCriterionTree.class))
                .filter(tree -> tree.root() != null);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable structured criterion on {}: {}", criterion.getId(), e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
