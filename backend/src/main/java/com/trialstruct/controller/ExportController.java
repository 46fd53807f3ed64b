package com.trialstruct.controller;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trialstruct.service.export.ProtocolExportService;
import jakarta.persistence.EntityNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for protocol exports.
 * Produces a CIRCE cohort expression, a FHIR Group resource and OMOP evaluation SQL.
 */
@RestController
@RequestMapping("/api/protocols/{protocolId}/exports")
public class ExportController {

    private final ProtocolExportService exportService;

    public ExportController(ProtocolExportService exportService) {
        this.exportService = exportService;
    }

    // ========================================================================
    // Export Endpoints
    // ========================================================================

    /**
     * OHDSI CIRCE cohort expression, importable into Atlas.
     */
    @GetMapping(value = "/circe", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ObjectNode> circe(@PathVariable String protocolId) {
        return ResponseEntity.ok(exportService.exportCirce(protocolId));
    }

    /**
     * FHIR R4 Group resource.
     */
    @GetMapping(value = "/fhir", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ObjectNode> fhirGroup(@PathVariable String protocolId) {
        return ResponseEntity.ok(exportService.exportFhirGroup(protocolId));
    }

    /**
     * OMOP CDM v5.4 evaluation SQL as plain text.
     */
    @GetMapping(value = "/sql", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> evaluationSql(@PathVariable String protocolId) {
        return ResponseEntity.ok()
            .contentType(MediaType.TEXT_PLAIN)
            .body(exportService.exportEvaluationSql(protocolId));
    }

    // ========================================================================
    // Exception Handling
    // ========================================================================

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(EntityNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of("error", ex.getMessage()));
    }
}
