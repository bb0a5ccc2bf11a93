package com.planaccel.rules;

import com.planaccel.ir.PlanNode;

/**
 * Node-kind specific validation run after the generic type and child checks.
 * Checks report problems through {@link TagContext#reject(String)}; they never throw for
 * an unsupported node.
 */
@FunctionalInterface
public interface TagCheck {

    TagCheck NONE = (node, context) -> { };

    void check(PlanNode node, TagContext context);

    default TagCheck and(TagCheck next) {
        return (node, context) -> {
            check(node, context);
            next.check(node, context);
        };
    }
}
