package com.trialstruct.service.structure;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Structured output of the logic detection call.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LogicDetectionResponse(
    LogicNode root,
    String reasoning
) {}
