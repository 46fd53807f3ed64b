package com.trialstruct.service.structure;

import com.trialstruct.model.criteria.AtomicCriterion;
import com.trialstruct.model.enums.EntityDomain;
import com.trialstruct.model.tree.FieldMapping;
import com.trialstruct.service.normalize.UnitNormalizer;
import com.trialstruct.service.normalize.UnitNormalizer.OrdinalMatch;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Atomic Criterion Factory
 *
 * Turns one grounded field mapping into an {@link AtomicCriterion}:
 * - value parsed as a number, otherwise kept as text
 * - negation read syntactically from the relation token
 * - unit, ordinal grade and categorical value resolved through the {@link UnitNormalizer}
 * - domain taken from the mapping, else derived from its entity type
 *
 * Unresolvable units and values are left null; nothing here throws for bad input.
 */
@Component
public class AtomicCriterionFactory {

    static final String DEFAULT_RELATION = "has";
    static final String NEGATION_TOKEN = "NOT";

    private final UnitNormalizer unitNormalizer;

    public AtomicCriterionFactory(UnitNormalizer unitNormalizer) {
        this.unitNormalizer = unitNormalizer;
    }

    public AtomicCriterion build(FieldMapping mapping, int mappingIndex, CriterionContext context) {
        ParsedValue parsed = parseValue(mapping.value());

        String relation = mapping.relation() != null ? mapping.relation() : DEFAULT_RELATION;
        // Only the literal token counts; phrasing like "absence of" is not inspected.
        boolean negation = NEGATION_TOKEN.equalsIgnoreCase(relation.trim());

        String rawUnit = mapping.unit();
        Integer unitConceptId = unitNormalizer.normalizeUnit(rawUnit).conceptId();
        Integer valueConceptId = null;

        // Ordinal scales win over plain unit resolution
        Optional<OrdinalMatch> ordinal = unitNormalizer.normalizeOrdinal(mapping.value(), mapping.entity());
        if (ordinal.isPresent()) {
            valueConceptId = ordinal.get().valueConceptId();
            if (ordinal.get().unitConceptId() != null) {
                unitConceptId = ordinal.get().unitConceptId();
            }
        } else if (parsed.text() != null && parsed.numeric() == null) {
            valueConceptId = unitNormalizer.normalizeValue(parsed.text()).conceptId();
        }

        return AtomicCriterion.builder()
            .id(generateId())
            .criterionId(context.criterionId())
            .protocolId(context.protocolId())
            .inclusionExclusion(context.polarity())
            .mappingIndex(mappingIndex)
            .entityText(mapping.entity())
            .entityConceptId(mapping.entityConceptId())
            .entityConceptSystem(mapping.entityConceptSystem())
            .omopConceptId(mapping.omopConceptId())
            .entityDomain(resolveDomain(mapping))
            .relationOperator(relation)
            .valueNumeric(parsed.numeric())
            .valueText(parsed.text())
            .unitText(rawUnit)
            .unitConceptId(unitConceptId)
            .valueConceptId(valueConceptId)
            .negation(negation)
            .originalText(context.criterionText())
            .confidenceScore(mapping.confidenceScore())
            .build();
    }

    static ParsedValue parseValue(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return new ParsedValue(null, null);
        }
        try {
            return new ParsedValue(new BigDecimal(rawValue.trim()).doubleValue(), null);
        } catch (NumberFormatException e) {
            return new ParsedValue(null, rawValue);
        }
    }

    static EntityDomain resolveDomain(FieldMapping mapping) {
        if (mapping.entityDomain() != null && !mapping.entityDomain().isBlank()) {
            return EntityDomain.fromValue(mapping.entityDomain());
        }
        return EntityDomain.fromEntityType(mapping.entityType());
    }

    private String generateId() {
        return "atom-" + UUID.randomUUID();
    }

    record ParsedValue(Double numeric, String text) {}
}
