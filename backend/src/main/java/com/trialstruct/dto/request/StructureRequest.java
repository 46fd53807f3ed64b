package com.trialstruct.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request DTO for structuring a subset of a protocol's criteria.
 */
public record StructureRequest(
    @NotEmpty(message = "At least one criterion ID is required")
    List<@NotBlank(message = "Criterion ID must not be blank") String> criterionIds
) {}
