package com.planaccel.rules;

import com.planaccel.ir.Aggregate;
import com.planaccel.ir.Join;
import com.planaccel.ir.PlanNode;
import com.planaccel.ir.SizeEstimator;
import com.planaccel.ir.Sort;
import com.planaccel.types.TypeSignature;
import com.planaccel.types.TypeSignatures;
import com.planaccel.types.TypeTag;

import java.util.List;
import java.util.OptionalLong;

/**
 * Built-in replacement rules for relational steps.
 */
public class RelationRules implements RuleProvider {

    /** Row types the columnar readers can decode: no maps. */
    static final TypeSignature SCAN_TYPES = TypeSignatures.COMMON
            .union(TypeSignature.of(TypeTag.BINARY))
            .nested(TypeTag.ARRAY, TypeTag.STRUCT);

    /** Types that can be hashed for grouping and join keys. */
    static final TypeSignature HASHABLE = TypeSignatures.ORDERABLE;

    @Override
    public List<ReplacementRule> getRules() {
        return List.of(
                ReplacementRule.builder("Scan")
                        .description("columnar table scan")
                        .acceleratedSignature(SCAN_TYPES)
                        .build(),
                ReplacementRule.builder("Filter")
                        .description("row filter")
                        .acceleratedSignature(TypeSignatures.ALL)
                        .build(),
                ReplacementRule.builder("Project")
                        .description("projection")
                        .acceleratedSignature(TypeSignatures.ALL)
                        .build(),
                ReplacementRule.builder("Join")
                        .description("hash join")
                        .acceleratedSignature(TypeSignatures.ALL)
                        .check(buildSideFitsInMemory())
                        .build(),
                ReplacementRule.builder("Aggregate")
                        .description("hash aggregation")
                        .acceleratedSignature(TypeSignatures.ALL)
                        .check(hashableGroupKeys())
                        .build(),
                ReplacementRule.builder("Sort")
                        .description("sort")
                        .acceleratedSignature(TypeSignatures.ALL)
                        .check(orderableSortKeys())
                        .build(),
                ReplacementRule.builder("Limit")
                        .description("limit")
                        .acceleratedSignature(TypeSignatures.ALL)
                        .build());
    }

    /**
     * The smaller join input is materialized on the device and must fit in the memory budget.
     * Joins with unknown input sizes are accepted, except cross joins, which always materialize
     * one side completely.
     */
    static TagCheck buildSideFitsInMemory() {
        return (node, context) -> {
            if (!(node instanceof Join)) {
                return;
            }
            Join join = (Join) node;
            OptionalLong left = SizeEstimator.estimate(join.getLeft());
            OptionalLong right = SizeEstimator.estimate(join.getRight());
            if (left.isEmpty() || right.isEmpty()) {
                if (join.getJoinType() == Join.JoinType.CROSS) {
                    context.reject("cross join needs size estimates for both inputs to plan the accelerated nested loop");
                }
                return;
            }
            long buildSide = Math.min(left.getAsLong(), right.getAsLong());
            long budget = context.getConfig().getMemoryBudgetBytes();
            if (buildSide > budget) {
                context.reject("smaller join input is estimated at " + buildSide
                        + " bytes, which exceeds the accelerator memory budget of " + budget + " bytes");
            }
        };
    }

    static TagCheck hashableGroupKeys() {
        return (node, context) -> {
            if (!(node instanceof Aggregate)) {
                return;
            }
            List<PlanNode> keys = ((Aggregate) node).getGroupKeys();
            for (int i = 0; i < keys.size(); i++) {
                if (!HASHABLE.contains(keys.get(i).getOutputType())) {
                    context.reject("grouping key " + i + " of type " + keys.get(i).getOutputType() + " cannot be hashed");
                }
            }
        };
    }

    static TagCheck orderableSortKeys() {
        return (node, context) -> {
            if (!(node instanceof Sort)) {
                return;
            }
            List<PlanNode> keys = ((Sort) node).getSortKeys();
            for (int i = 0; i < keys.size(); i++) {
                if (!TypeSignatures.ORDERABLE.contains(keys.get(i).getOutputType())) {
                    context.reject("sort key " + i + " of type " + keys.get(i).getOutputType() + " is not orderable");
                }
            }
        };
    }
}
