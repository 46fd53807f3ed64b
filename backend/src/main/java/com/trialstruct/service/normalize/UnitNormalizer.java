package com.trialstruct.service.normalize;

import java.util.List;
import java.util.Optional;

/**
 * Deterministic unit, categorical value and ordinal scale lookup.
 * Never throws for unrecognized input; unknown text resolves to an empty result.
 */
public interface UnitNormalizer {

    /**
     * Resolve a unit string to its UCUM code and OMOP unit concept id.
     */
    NormalizedCode normalizeUnit(String unitText);

    /**
     * Resolve a categorical value (positive, negative, normal, ...) to its OMOP value concept id.
     */
    NormalizedCode normalizeValue(String valueText);

    /**
     * Resolve a value against an ordinal scale when the entity names one.
     * Empty when the entity is not a known ordinal scale. A present match may
     * still carry a null value concept id when the grade is not recognized.
     */
    Optional<OrdinalMatch> normalizeOrdinal(String rawValue, String entityText);

    /**
     * Configured ordinal grades still lacking a value concept id.
     */
    List<PendingOrdinalGrade> pendingOrdinalGrades();

    record NormalizedCode(String code, Integer conceptId) {

        public static final NormalizedCode EMPTY = new NormalizedCode(null, null);

        public boolean isResolved() {
            return conceptId != null;
        }
    }

    record OrdinalMatch(String scale, Integer valueConceptId, Integer unitConceptId) {}

    record PendingOrdinalGrade(String scale, String grade, String description) {}
}
