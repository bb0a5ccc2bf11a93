package com.planaccel.tagging;

import com.planaccel.ir.PlanNode;
import com.planaccel.rules.ReplacementRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The tagger's verdict for one plan node.
 */
public final class TagDecision {

    public enum Outcome {
        ACCEPTED,
        REJECTED
    }

    private final PlanNode node;
    private final Outcome outcome;
    private final List<String> reasons;
    private final ReplacementRule rule;

    private TagDecision(PlanNode node, Outcome outcome, List<String> reasons, ReplacementRule rule) {
        this.node = Objects.requireNonNull(node, "node is null");
        this.outcome = outcome;
        this.reasons = Collections.unmodifiableList(new ArrayList<>(reasons));
        this.rule = rule;
    }

    public static TagDecision accepted(PlanNode node, ReplacementRule rule) {
        return new TagDecision(node, Outcome.ACCEPTED, List.of(), Objects.requireNonNull(rule, "rule is null"));
    }

    /**
     * @param rule the rule that was consulted, or {@code null} if none exists for the node kind
     */
    public static TagDecision rejected(PlanNode node, List<String> reasons, ReplacementRule rule) {
        if (reasons.isEmpty()) {
            throw new IllegalArgumentException("A rejected decision needs at least one reason");
        }
        for (String reason : reasons) {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("Rejection reasons must not be blank");
            }
        }
        return new TagDecision(node, Outcome.REJECTED, reasons, rule);
    }

    public PlanNode getNode() {
        return node;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }

    public List<String> getReasons() {
        return reasons;
    }

    /**
     * All rejection reasons joined with "; ", or an empty string for accepted nodes.
     */
    public String getReason() {
        return String.join("; ", reasons);
    }

    public Optional<ReplacementRule> getRule() {
        return Optional.ofNullable(rule);
    }

    @Override
    public String toString() {
        return isAccepted()
                ? "Accepted(" + node.getNodeKind() + ")"
                : "Rejected(" + node.getNodeKind() + ": " + getReason() + ")";
    }
}
