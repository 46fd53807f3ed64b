package com.trialstruct.service.structure;

import com.trialstruct.model.enums.CriteriaType;

/**
 * Ownership and text of the criterion whose field mappings are being structured.
 */
public record CriterionContext(
    String criterionId,
    String protocolId,
    CriteriaType polarity,
    String criterionText
) {}
