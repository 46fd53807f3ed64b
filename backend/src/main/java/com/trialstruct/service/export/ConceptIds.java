package com.trialstruct.service.export;

import com.trialstruct.model.criteria.AtomicCriterion;
import com.trialstruct.model.enums.EntityDomain;

/**
 * Concept identifier resolution shared by the exporters.
 * The OMOP concept id wins over the entity concept id.
 */
final class ConceptIds {

    private ConceptIds() {
    }

    /**
     * First of (OMOP id, entity id) that parses as an integer, else null.
     */
    static Integer conceptId(AtomicCriterion atomic) {
        for (String candidate : new String[] {atomic.getOmopConceptId(), atomic.getEntityConceptId()}) {
            Integer parsed = parseInteger(candidate);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    /**
     * First non-null of (OMOP id, entity id), unparsed.
     */
    static String conceptCode(AtomicCriterion atomic) {
        if (atomic.getOmopConceptId() != null) {
            return atomic.getOmopConceptId();
        }
        return atomic.getEntityConceptId();
    }

    static boolean isDemographic(AtomicCriterion atomic) {
        return atomic.getEntityDomain() == EntityDomain.DEMOGRAPHICS;
    }

    private static Integer parseInteger(String value) {
        if (value == null || !value.trim().matches("[-+]?\\d{1,10}")) {
            return null;
        }
        long parsed = Long.parseLong(value.trim());
        if (parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE) {
            return null;
        }
        return (int) parsed;
    }
}
