package com.trialstruct.controller;

import com.trialstruct.dto.request.StructureRequest;
import com.trialstruct.dto.response.StructureBatchResponse;
import com.trialstruct.service.structure.StructureBatchResult;
import com.trialstruct.service.structure.StructureBatchService;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller that turns a protocol's field-mapped criteria into expression trees.
 */
@RestController
@RequestMapping("/api/protocols")
public class StructureController {

    private final StructureBatchService structureBatchService;

    public StructureController(StructureBatchService structureBatchService) {
        this.structureBatchService = structureBatchService;
    }

    /**
     * Structure the criteria of a protocol that carry field mappings.
     * Without a body every criterion is structured; a body narrows the run to the listed ids.
     * Per-criterion failures are reported in the body, not as an error status.
     */
    @PostMapping("/{protocolId}/structure")
    public ResponseEntity<StructureBatchResponse> structure(
            @PathVariable String protocolId,
            @Valid @RequestBody(required = false) StructureRequest request) {
        StructureBatchResult result = request == null
            ? structureBatchService.structureProtocol(protocolId)
            : structureBatchService.structureCriteria(protocolId, request.criterionIds());
        return ResponseEntity.ok(StructureBatchResponse.from(protocolId, result));
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(EntityNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", ex.getMessage()));
    }
}
