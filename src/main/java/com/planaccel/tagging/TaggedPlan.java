package com.planaccel.tagging;

import com.planaccel.ir.PlanNode;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A plan tree together with the decision taken for each of its nodes.
 * Decisions are keyed by node identity and listed in post-order.
 */
public final class TaggedPlan {

    private final PlanNode root;
    private final AccelerationConfig config;
    private final List<TagDecision> decisions;
    private final Map<PlanNode, TagDecision> byNode;

    TaggedPlan(PlanNode root, AccelerationConfig config, List<TagDecision> decisions) {
        this.root = Objects.requireNonNull(root, "root is null");
        this.config = Objects.requireNonNull(config, "config is null");
        this.decisions = Collections.unmodifiableList(decisions);
        this.byNode = new IdentityHashMap<>();
        for (TagDecision decision : decisions) {
            byNode.put(decision.getNode(), decision);
        }
    }

    public PlanNode getRoot() {
        return root;
    }

    public AccelerationConfig getConfig() {
        return config;
    }

    /**
     * Every decision, children before parents.
     */
    public List<TagDecision> getDecisions() {
        return decisions;
    }

    /**
     * @throws IllegalArgumentException if the node is not part of this tagged tree
     */
    public TagDecision decisionFor(PlanNode node) {
        TagDecision decision = byNode.get(node);
        if (decision == null) {
            throw new IllegalArgumentException("Node is not part of the tagged plan: " + (node == null ? null : node.describe()));
        }
        return decision;
    }

    public List<TagDecision> getRejected() {
        return decisions.stream().filter(d -> !d.isAccepted()).collect(Collectors.toList());
    }

    public boolean isFullyAccepted() {
        return decisions.stream().allMatch(TagDecision::isAccepted);
    }
}
