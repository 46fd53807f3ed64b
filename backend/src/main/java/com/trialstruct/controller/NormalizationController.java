package com.trialstruct.controller;

import com.trialstruct.service.normalize.UnitNormalizer;
import com.trialstruct.service.normalize.UnitNormalizer.PendingOrdinalGrade;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller exposing the normalization tables for curation.
 */
@RestController
@RequestMapping("/api/normalization")
public class NormalizationController {

    private final UnitNormalizer unitNormalizer;

    public NormalizationController(UnitNormalizer unitNormalizer) {
        this.unitNormalizer = unitNormalizer;
    }

    /**
     * Ordinal grades that still need an OMOP value concept before they can be exported.
     */
    @GetMapping("/ordinal-grades/pending")
    public ResponseEntity<List<PendingOrdinalGrade>> pendingOrdinalGrades() {
        return ResponseEntity.ok(unitNormalizer.pendingOrdinalGrades());
    }
}
