package com.trialstruct.model.tree;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Node of the serialized expression tree stored on a criterion.
 * The {@code type} property is ATOMIC for leaves and the operator for branches.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.EXISTING_PROPERTY,
    property = "type",
    visible = true)
@JsonSubTypes({
    @JsonSubTypes.Type(value = AtomicNode.class, name = AtomicNode.TYPE),
    @JsonSubTypes.Type(value = BranchNode.class, names = {"AND", "OR", "NOT"})
})
public interface ExpressionNode {

    /**
     * Number of leaves below (and including) this node.
     */
    int leafCount();
}
