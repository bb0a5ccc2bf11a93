package com.planaccel.rules;

import com.planaccel.ir.PlanNode;

import java.util.List;

/**
 * Builds the accelerated node for an accepted host node.
 */
@FunctionalInterface
public interface ReplacementFactory {

    /**
     * @param original the host node being replaced
     * @param children the already rewritten children, positionally matching the original's
     */
    PlanNode build(PlanNode original, List<PlanNode> children);
}
