package com.trialstruct.model.tree;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trialstruct.model.enums.LogicalOperator;

import java.util.List;

/**
 * AND/OR/NOT node of the expression tree.
 */
public record BranchNode(
    @JsonProperty("type") LogicalOperator operator,
    List<ExpressionNode> children
) implements ExpressionNode {

    public BranchNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public int leafCount() {
        return children.stream().mapToInt(ExpressionNode::leafCount).sum();
    }
}
