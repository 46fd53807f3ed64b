package com.trialstruct.service.structure;

import java.util.List;

/**
 * Outcome of structuring a batch of criteria.
 *
 * @param processed criteria whose tree was built and persisted
 * @param skipped   criteria without field mappings
 * @param errors    one message per criterion that failed
 */
public record StructureBatchResult(int processed, int skipped, List<String> errors) {

    public StructureBatchResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
