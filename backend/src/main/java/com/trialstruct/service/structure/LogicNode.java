package com.trialstruct.service.structure;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Logic tree proposed by the structured-reasoning model.
 * ATOMIC leaves point into the criterion's field mappings by index.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LogicNode(
    String nodeType,
    Integer fieldMappingIndex,
    List<LogicNode> children
) {

    public static final String ATOMIC = "ATOMIC";

    public static LogicNode atomic(int index) {
        return new LogicNode(ATOMIC, index, null);
    }

    public static LogicNode branch(String operator, LogicNode... children) {
        return new LogicNode(operator, null, List.of(children));
    }

    public boolean isAtomic() {
        return ATOMIC.equalsIgnoreCase(nodeType);
    }
}
