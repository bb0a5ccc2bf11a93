package com.planaccel.tagging;

import com.planaccel.ir.NodeCategory;
import com.planaccel.ir.PlanNode;
import com.planaccel.rewrite.BoundaryAdapters;
import com.planaccel.rules.CapabilityRegistry;
import com.planaccel.rules.ChildPolicy;
import com.planaccel.rules.ReplacementRule;
import com.planaccel.rules.TagContext;
import com.planaccel.types.DataType;
import com.planaccel.types.TypeSignature;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides, node by node, whether a host plan can be replaced by accelerated nodes.
 *
 * <p>The tree is walked once in post-order so that every child is decided before its parent.
 * A node is accepted when a rule exists for its kind, the rule is enabled, the declared output
 * type is in the rule's signature, every child is usable (accepted, or bridged by the rule's
 * child policy) and the rule's own check passes. A leaf expression whose kind has no rule, such
 * as a literal, is host-only; its parent can still take it as a value if the type transfers and
 * fits the parent's signature. Every failing condition is recorded as a reason. Rejection is
 * an ordinary outcome; only a malformed tree raises {@link StructuralTreeException}.
 *
 * <p>Instances hold no per-pass state and can be shared between threads once the registry is sealed.
 */
public class CompatibilityTagger {

    private static final Logger LOGGER = LogManager.getLogger(CompatibilityTagger.class);

    private final CapabilityRegistry registry;

    public CompatibilityTagger(CapabilityRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry is null");
    }

    public TaggedPlan tag(PlanNode root, AccelerationConfig config) {
        Objects.requireNonNull(root, "root is null");
        Objects.requireNonNull(config, "config is null");
        Pass pass = new Pass(config);
        pass.run(root);
        return new TaggedPlan(root, config, pass.ordered);
    }

    /**
     * State of one tagging pass.
     */
    private final class Pass {
        private final AccelerationConfig config;
        private final List<TagDecision> ordered = new ArrayList<>();
        private final Map<PlanNode, TagDecision> decided = new IdentityHashMap<>();
        private final Set<PlanNode> onPath = Collections.newSetFromMap(new IdentityHashMap<>());

        Pass(AccelerationConfig config) {
            this.config = config;
        }

        /**
         * Post-order walk on an explicit stack, so the depth of the tree is bounded by the heap only.
         */
        void run(PlanNode root) {
            Deque<Frame> stack = new ArrayDeque<>();
            enter(new Frame(root, null, -1), stack);
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                List<PlanNode> children = frame.node.getChildren();
                if (frame.next < children.size()) {
                    int i = frame.next++;
                    PlanNode child = children.get(i);
                    if (child == null) {
                        throw new StructuralTreeException("Dangling child reference at position " + i + " of "
                                + frame.node.getNodeKind() + " at " + frame.location());
                    }
                    enter(new Frame(child, frame, i), stack);
                    continue;
                }
                stack.pop();
                onPath.remove(frame.node);
                finish(frame);
            }
        }

        private void enter(Frame frame, Deque<Frame> stack) {
            PlanNode node = frame.node;
            if (onPath.contains(node)) {
                throw new StructuralTreeException("Cycle detected: " + node.getNodeKind() + " at " + frame.location() + " is its own ancestor");
            }
            if (decided.containsKey(node)) {
                throw new StructuralTreeException(node.getNodeKind() + " at " + frame.location() + " is referenced by more than one parent");
            }
            onPath.add(node);
            stack.push(frame);
        }

        private void finish(Frame frame) {
            PlanNode node = frame.node;
            if (node.getOutputType() == null) {
                throw new StructuralTreeException(node.getNodeKind() + " at " + frame.location() + " has no resolved output type");
            }
            TagDecision decision = decide(node);
            decided.put(node, decision);
            ordered.add(decision);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("{} at {}: {}", node.getNodeKind(), frame.location(), decision);
            }
        }

        private TagDecision decide(PlanNode node) {
            String kind = node.getNodeKind();
            List<String> reasons = new ArrayList<>();
            if (!config.isEnabled()) {
                reasons.add("acceleration is disabled by configuration");
            }
            Optional<ReplacementRule> maybeRule = registry.lookup(kind);
            if (maybeRule.isEmpty()) {
                reasons.add("no accelerated replacement registered for " + kind);
                return TagDecision.rejected(node, reasons, null);
            }
            ReplacementRule rule = maybeRule.get();

            if (config.isDisabled(kind)) {
                reasons.add(kind + " has been disabled by configuration");
            }
            rule.getDisabledByDefaultReason().ifPresent(why -> {
                if (!config.isExplicitlyEnabled(kind)) {
                    reasons.add(kind + " is disabled by default (" + why + "); list it in enabledKinds to use it");
                }
            });
            rule.getIncompatibleNote().ifPresent(note -> {
                if (!config.isIncompatibleOpsEnabled()) {
                    reasons.add(kind + " is not fully compatible with the host (" + note + "); enable incompatible ops to use it");
                }
            });

            DataType outputType = node.getOutputType();
            if (!rule.getAcceleratedSignature().contains(outputType)) {
                reasons.add("output type " + outputType + " not in signature");
            }
            checkChildren(node, rule, reasons);

            rule.getCheck().check(node, new NodeTagContext(config, reasons));

            return reasons.isEmpty()
                    ? TagDecision.accepted(node, rule)
                    : TagDecision.rejected(node, reasons, rule);
        }

        private void checkChildren(PlanNode node, ReplacementRule rule, List<String> reasons) {
            Optional<TypeSignature> inputSignature = rule.getInputSignature();
            List<PlanNode> children = node.getChildren();
            for (int i = 0; i < children.size(); i++) {
                PlanNode child = children.get(i);
                String label = "child " + i + " (" + child.getNodeKind() + ")";
                if (inputSignature.isPresent() && !inputSignature.get().contains(child.getOutputType())) {
                    reasons.add(label + " type " + child.getOutputType() + " not in input signature");
                }
                TagDecision childDecision = decided.get(child);
                if (childDecision.isAccepted()) {
                    continue;
                }
                if (child.getCategory() == NodeCategory.EXPRESSION) {
                    if (isHostOnlyLeaf(child, childDecision) && BoundaryAdapters.canTransfer(child.getOutputType())) {
                        // the value is handed to the device as an input of the parent
                        if (inputSignature.isEmpty() && !rule.getAcceleratedSignature().contains(child.getOutputType())) {
                            addOnce(reasons, "output type " + child.getOutputType() + " not in signature");
                        }
                        continue;
                    }
                    reasons.add(label + " was not accepted");
                    continue;
                }
                ChildPolicy policy = rule.getChildPolicy(i);
                switch (policy) {
                    case MIXED:
                        break;
                    case ADAPTABLE:
                        if (!BoundaryAdapters.canTransfer(child.getOutputType())) {
                            reasons.add(label + " was not accepted and no conversion adapter exists for type " + child.getOutputType());
                        }
                        break;
                    case ACCEPTED_ONLY:
                    default:
                        reasons.add(label + " was not accepted");
                        break;
                }
            }
        }

        /**
         * A leaf expression whose kind has no rule at all, as opposed to one its rule turned down.
         */
        private boolean isHostOnlyLeaf(PlanNode child, TagDecision childDecision) {
            return child.getChildren().isEmpty() && childDecision.getRule().isEmpty();
        }

        private void addOnce(List<String> reasons, String reason) {
            if (!reasons.contains(reason)) {
                reasons.add(reason);
            }
        }
    }

    /**
     * A node on the walk stack. The path from the root is rebuilt from the parent links only for messages.
     */
    private static final class Frame {
        private final PlanNode node;
        private final Frame parent;
        private final int position;
        private int next;

        Frame(PlanNode node, Frame parent, int position) {
            this.node = node;
            this.parent = parent;
            this.position = position;
        }

        String location() {
            Deque<Integer> positions = new ArrayDeque<>();
            for (Frame frame = this; frame.parent != null; frame = frame.parent) {
                positions.push(frame.position);
            }
            StringBuilder sb = new StringBuilder("root");
            for (int position : positions) {
                sb.append('/').append(position);
            }
            return sb.toString();
        }
    }

    private static final class NodeTagContext implements TagContext {
        private final AccelerationConfig config;
        private final List<String> reasons;

        NodeTagContext(AccelerationConfig config, List<String> reasons) {
            this.config = config;
            this.reasons = reasons;
        }

        @Override
        public AccelerationConfig getConfig() {
            return config;
        }

        @Override
        public void reject(String reason) {
            reasons.add(reason);
        }
    }
}
