package com.planaccel.rules;

import com.planaccel.ir.AcceleratedNode;
import com.planaccel.types.TypeSignature;
import com.planaccel.types.TypeSignatures;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes how nodes of one kind may be replaced by an accelerated equivalent.
 * Rules are immutable; create them with {@link #builder(String)}.
 */
public final class ReplacementRule {

    private final String nodeKind;
    private final List<String> aliases;
    private final String description;
    private final TypeSignature acceleratedSignature;
    private final TypeSignature hostSignature;
    private final TypeSignature inputSignature;
    private final ChildPolicy defaultChildPolicy;
    private final Map<Integer, ChildPolicy> childPolicies;
    private final TagCheck check;
    private final ReplacementFactory factory;
    private final String incompatibleNote;
    private final String disabledByDefaultReason;

    private ReplacementRule(Builder builder) {
        this.nodeKind = builder.nodeKind;
        this.aliases = Collections.unmodifiableList(new ArrayList<>(builder.aliases));
        this.description = builder.description != null ? builder.description : builder.nodeKind;
        this.acceleratedSignature = Objects.requireNonNull(builder.acceleratedSignature,
                "acceleratedSignature is null for " + builder.nodeKind);
        this.hostSignature = builder.hostSignature;
        this.inputSignature = builder.inputSignature;
        this.defaultChildPolicy = builder.defaultChildPolicy;
        this.childPolicies = Collections.unmodifiableMap(new HashMap<>(builder.childPolicies));
        this.check = builder.check;
        this.factory = builder.factory;
        this.incompatibleNote = builder.incompatibleNote;
        this.disabledByDefaultReason = builder.disabledByDefaultReason;
    }

    public static Builder builder(String nodeKind) {
        return new Builder(nodeKind);
    }

    public String getNodeKind() {
        return nodeKind;
    }

    /**
     * Additional node kinds this rule answers for, e.g. "Avg" for "Average".
     */
    public List<String> getAliases() {
        return aliases;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Output types the accelerated node supports.
     */
    public TypeSignature getAcceleratedSignature() {
        return acceleratedSignature;
    }

    /**
     * Output types the host implementation supports, used for reporting.
     */
    public TypeSignature getHostSignature() {
        return hostSignature;
    }

    /**
     * Types every child must produce, if the rule restricts them beyond the children's own rules.
     */
    public Optional<TypeSignature> getInputSignature() {
        return Optional.ofNullable(inputSignature);
    }

    public ChildPolicy getChildPolicy(int position) {
        return childPolicies.getOrDefault(position, defaultChildPolicy);
    }

    public TagCheck getCheck() {
        return check;
    }

    public ReplacementFactory getFactory() {
        return factory;
    }

    /**
     * Non-empty when the accelerated results can differ from the host's in documented cases.
     */
    public Optional<String> getIncompatibleNote() {
        return Optional.ofNullable(incompatibleNote);
    }

    /**
     * Non-empty when the rule must be switched on explicitly by listing its kind as enabled.
     */
    public Optional<String> getDisabledByDefaultReason() {
        return Optional.ofNullable(disabledByDefaultReason);
    }

    @Override
    public String toString() {
        return "ReplacementRule{" + nodeKind + ": " + description + ", accelerated=" + acceleratedSignature + "}";
    }

    public static final class Builder {
        private final String nodeKind;
        private final List<String> aliases = new ArrayList<>();
        private String description;
        private TypeSignature acceleratedSignature;
        private TypeSignature hostSignature = TypeSignatures.ALL;
        private TypeSignature inputSignature;
        private ChildPolicy defaultChildPolicy = ChildPolicy.ADAPTABLE;
        private final Map<Integer, ChildPolicy> childPolicies = new HashMap<>();
        private TagCheck check = TagCheck.NONE;
        private ReplacementFactory factory = AcceleratedNode::new;
        private String incompatibleNote;
        private String disabledByDefaultReason;

        private Builder(String nodeKind) {
            this.nodeKind = Objects.requireNonNull(nodeKind, "nodeKind is null");
        }

        public Builder alias(String alias) {
            aliases.add(Objects.requireNonNull(alias, "alias is null"));
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder acceleratedSignature(TypeSignature signature) {
            this.acceleratedSignature = Objects.requireNonNull(signature, "signature is null");
            return this;
        }

        public Builder hostSignature(TypeSignature signature) {
            this.hostSignature = Objects.requireNonNull(signature, "signature is null");
            return this;
        }

        public Builder inputSignature(TypeSignature signature) {
            this.inputSignature = Objects.requireNonNull(signature, "signature is null");
            return this;
        }

        /**
         * Policy for every relational child position without an explicit override.
         */
        public Builder childPolicy(ChildPolicy policy) {
            this.defaultChildPolicy = Objects.requireNonNull(policy, "policy is null");
            return this;
        }

        public Builder childPolicy(int position, ChildPolicy policy) {
            childPolicies.put(position, Objects.requireNonNull(policy, "policy is null"));
            return this;
        }

        public Builder check(TagCheck check) {
            this.check = this.check == TagCheck.NONE ? check : this.check.and(check);
            return this;
        }

        public Builder factory(ReplacementFactory factory) {
            this.factory = Objects.requireNonNull(factory, "factory is null");
            return this;
        }

        public Builder incompatible(String note) {
            this.incompatibleNote = Objects.requireNonNull(note, "note is null");
            return this;
        }

        public Builder disabledByDefault(String reason) {
            this.disabledByDefaultReason = Objects.requireNonNull(reason, "reason is null");
            return this;
        }

        public ReplacementRule build() {
            return new ReplacementRule(this);
        }
    }
}
