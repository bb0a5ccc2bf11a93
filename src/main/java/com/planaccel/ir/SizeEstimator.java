package com.planaccel.ir;

import java.util.List;
import java.util.OptionalLong;

/**
 * Estimates the output size in bytes of a relational subtree from the sizes known at its scans.
 * Filters, projections, sorts and limits are assumed not to grow their input; the
 * estimate is empty when any contributing scan has no size.
 */
public class SizeEstimator implements PlanNodeVisitor<OptionalLong, Void> {

    private static final SizeEstimator INSTANCE = new SizeEstimator();

    public static OptionalLong estimate(PlanNode node) {
        return node.accept(INSTANCE, null);
    }

    @Override
    public OptionalLong visitScan(Scan node, Void context) {
        return node.getEstimatedSizeBytes();
    }

    @Override
    public OptionalLong visitJoin(Join node, Void context) {
        if (node.getJoinType() == Join.JoinType.CROSS) {
            return OptionalLong.empty();
        }
        OptionalLong left = node.getLeft().accept(this, context);
        OptionalLong right = node.getRight().accept(this, context);
        if (left.isEmpty() || right.isEmpty()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(saturatedAdd(left.getAsLong(), right.getAsLong()));
    }

    @Override
    public OptionalLong visitNode(PlanNode node, Void context) {
        if (node.getCategory() == NodeCategory.EXPRESSION) {
            return OptionalLong.empty();
        }
        // single-input steps pass their input size through
        List<PlanNode> children = node.getChildren();
        for (PlanNode child : children) {
            if (child != null && child.getCategory() == NodeCategory.RELATION) {
                return child.accept(this, context);
            }
        }
        return OptionalLong.empty();
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }
}
