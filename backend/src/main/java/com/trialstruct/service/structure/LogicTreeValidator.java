package com.trialstruct.service.structure;

import com.trialstruct.model.enums.LogicalOperator;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates a model-proposed logic tree before any rows are built from it.
 *
 * A tree is accepted only when every leaf index is in [0, mappingCount),
 * every AND/OR/NOT node has at least one child, and the leaves cover each
 * index exactly once.
 */
public final class LogicTreeValidator {

    private LogicTreeValidator() {
    }

    public static boolean isValid(LogicNode root, int mappingCount) {
        if (root == null || mappingCount <= 0) {
            return false;
        }
        Set<Integer> seen = new HashSet<>();
        if (!collect(root, mappingCount, seen)) {
            return false;
        }
        return seen.size() == mappingCount;
    }

    private static boolean collect(LogicNode node, int mappingCount, Set<Integer> seen) {
        if (node == null || node.nodeType() == null) {
            return false;
        }
        if (node.isAtomic()) {
            Integer index = node.fieldMappingIndex();
            if (index == null || index < 0 || index >= mappingCount) {
                return false;
            }
            // a repeated index means some other mapping is missing or duplicated
            return seen.add(index);
        }
        if (!isOperator(node.nodeType())) {
            return false;
        }
        List<LogicNode> children = node.children();
        if (children == null || children.isEmpty()) {
            return false;
        }
        for (LogicNode child : children) {
            if (!collect(child, mappingCount, seen)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isOperator(String nodeType) {
        try {
            LogicalOperator.fromValue(nodeType);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
