package com.trialstruct.dto.response;

import com.trialstruct.service.structure.StructureBatchResult;

import java.util.List;

/**
 * Response for a protocol structuring run.
 */
public record StructureBatchResponse(
    String protocolId,
    boolean success,
    int processed,
    int skipped,
    int failed,
    List<String> errors
) {

    public static StructureBatchResponse from(String protocolId, StructureBatchResult result) {
        return new StructureBatchResponse(
            protocolId,
            !result.hasErrors(),
            result.processed(),
            result.skipped(),
            result.errors().size(),
            result.errors()
        );
    }
}
