package com.trialstruct.service.structure;

import com.trialstruct.model.enums.ChildKind;

/**
 * Reference to a freshly built tree row, returned up the recursion so the
 * parent can write its edge without looking the child up again.
 */
public record ChildRef(ChildKind kind, String id) {

    public static ChildRef atomic(String id) {
        return new ChildRef(ChildKind.ATOMIC, id);
    }

    public static ChildRef composite(String id) {
        return new ChildRef(ChildKind.COMPOSITE, id);
    }
}
