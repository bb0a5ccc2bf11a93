package com.planaccel.rewrite;

import com.planaccel.ir.NodeCategory;
import com.planaccel.ir.PlanNode;
import com.planaccel.ir.Representation;
import com.planaccel.rules.ChildPolicy;
import com.planaccel.rules.ReplacementRule;
import com.planaccel.tagging.TagDecision;
import com.planaccel.tagging.TaggedPlan;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Turns a tagged plan into the tree that is executed.
 *
 * <p>General pattern, applied bottom-up:
 * <ol>
 *   <li>Rewrite the children.</li>
 *   <li>Accepted nodes are rebuilt by their rule's factory; relational children that stayed on
 *       the host are uploaded unless the rule consumes host rows at that position.</li>
 *   <li>Rejected nodes keep their host form; relational children that came back from the device
 *       are downloaded first. Expressions owned by a host node stay on the host.</li>
 * </ol>
 * The input tree is never modified; untouched subtrees are shared with the result.
 */
public class PlanRewriter {

    private static final Logger LOGGER = LogManager.getLogger(PlanRewriter.class);

    public RewriteResult rewrite(TaggedPlan tagged) {
        Objects.requireNonNull(tagged, "tagged is null");
        PlanNode original = tagged.getRoot();
        PlanNode rewritten = rewriteTree(original, tagged);
        // results are consumed on the host
        if (rewritten.getCategory() == NodeCategory.RELATION && rewritten.getRepresentation() == Representation.DEVICE) {
            rewritten = BoundaryAdapters.toHost(rewritten);
        }
        LOGGER.debug("Rewrote plan rooted at {} ({} of {} nodes accelerated)", original.getNodeKind(),
                tagged.getDecisions().stream().filter(TagDecision::isAccepted).count(), tagged.getDecisions().size());
        return new RewriteResult(tagged, rewritten);
    }

    /**
     * Bottom-up rebuild on an explicit stack. Each frame collects its rewritten children and is
     * replaced once the last one is in.
     */
    private PlanNode rewriteTree(PlanNode root, TaggedPlan tagged) {
        Deque<Frame> stack = new ArrayDeque<>();
        PlanNode result = enter(root, true, tagged, stack);
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            List<PlanNode> children = frame.node.getChildren();
            if (frame.newChildren.size() < children.size()) {
                PlanNode child = children.get(frame.newChildren.size());
                PlanNode done = enter(child, frame.decision.isAccepted(), tagged, stack);
                if (done != null) {
                    frame.newChildren.add(done);
                }
                continue;
            }
            stack.pop();
            PlanNode rebuilt = frame.decision.isAccepted() ? accelerate(frame) : keepOnHost(frame);
            if (stack.isEmpty()) {
                result = rebuilt;
            } else {
                stack.peek().newChildren.add(rebuilt);
            }
        }
        return result;
    }

    /**
     * @param ownerAccelerated whether the parent is being accelerated; decides the fate of expressions
     * @return the node itself when it needs no rewriting, otherwise {@code null} after pushing a frame
     */
    private PlanNode enter(PlanNode node, boolean ownerAccelerated, TaggedPlan tagged, Deque<Frame> stack) {
        if (node.getCategory() == NodeCategory.EXPRESSION && !ownerAccelerated) {
            return node;
        }
        stack.push(new Frame(node, tagged.decisionFor(node)));
        return null;
    }

    private PlanNode accelerate(Frame frame) {
        ReplacementRule rule = frame.decision.getRule().orElseThrow();
        List<PlanNode> newChildren = frame.newChildren;
        for (int i = 0; i < newChildren.size(); i++) {
            PlanNode newChild = newChildren.get(i);
            if (newChild.getCategory() == NodeCategory.RELATION
                    && newChild.getRepresentation() == Representation.HOST
                    && rule.getChildPolicy(i) != ChildPolicy.MIXED) {
                newChildren.set(i, BoundaryAdapters.toDevice(newChild));
            }
        }
        return rule.getFactory().build(frame.node, newChildren);
    }

    private PlanNode keepOnHost(Frame frame) {
        List<PlanNode> newChildren = frame.newChildren;
        for (int i = 0; i < newChildren.size(); i++) {
            PlanNode newChild = newChildren.get(i);
            if (newChild.getCategory() == NodeCategory.RELATION) {
                newChildren.set(i, BoundaryAdapters.toHost(newChild));
            }
        }
        // withChildren hands back the same instance when nothing below changed
        return frame.node.withChildren(newChildren);
    }

    private static final class Frame {
        private final PlanNode node;
        private final TagDecision decision;
        private final List<PlanNode> newChildren;

        Frame(PlanNode node, TagDecision decision) {
            this.node = node;
            this.decision = decision;
            this.newChildren = new ArrayList<>(node.getChildren().size());
        }
    }
}
