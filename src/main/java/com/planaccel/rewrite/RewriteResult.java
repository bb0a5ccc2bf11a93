package com.planaccel.rewrite;

import com.planaccel.ir.PlanNode;
import com.planaccel.tagging.TagDecision;
import com.planaccel.tagging.TaggedPlan;

import java.util.List;
import java.util.Objects;

/**
 * The output of a rewrite: the executable tree plus the decisions that shaped it.
 */
public final class RewriteResult {

    private final TaggedPlan tagged;
    private final PlanNode root;

    RewriteResult(TaggedPlan tagged, PlanNode root) {
        this.tagged = Objects.requireNonNull(tagged, "tagged is null");
        this.root = Objects.requireNonNull(root, "root is null");
    }

    public PlanNode getRoot() {
        return root;
    }

    /**
     * The tree that was submitted, left untouched.
     */
    public PlanNode getOriginal() {
        return tagged.getRoot();
    }

    public TaggedPlan getTaggedPlan() {
        return tagged;
    }

    /**
     * Tag decisions in post-order, one per node of the original tree.
     */
    public List<TagDecision> getDecisions() {
        return tagged.getDecisions();
    }

    public boolean wasRewritten() {
        return root != tagged.getRoot();
    }
}
