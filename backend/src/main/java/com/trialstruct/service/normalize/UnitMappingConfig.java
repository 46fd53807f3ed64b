package com.trialstruct.service.normalize;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * Lookup tables backing {@link UcumUnitNormalizer}, bound from unit-mappings.json.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record UnitMappingConfig(
    List<UnitEntry> units,
    Map<String, Integer> valueMappings,
    Map<String, OrdinalScale> ordinalScales
) {

    public UnitMappingConfig {
        units = units == null ? List.of() : units;
        valueMappings = valueMappings == null ? Map.of() : valueMappings;
        ordinalScales = ordinalScales == null ? Map.of() : ordinalScales;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UnitEntry(
        String canonical,
        Integer omopUnitConceptId,
        List<String> aliases
    ) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OrdinalScale(
        List<String> entityAliases,
        String loincCode,
        Integer unitConceptId,
        Map<String, OrdinalGrade> values
    ) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OrdinalGrade(
        String description,
        Integer omopValueConceptId
    ) {}
}
