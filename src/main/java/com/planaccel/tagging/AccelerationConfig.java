package com.planaccel.tagging;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Runtime settings consulted while tagging a plan. Immutable; see {@link #builder()}.
 */
public final class AccelerationConfig {

    public static final long DEFAULT_MEMORY_BUDGET_BYTES = 1L << 30;

    private final boolean enabled;
    private final boolean strictArithmetic;
    private final long memoryBudgetBytes;
    private final boolean incompatibleOpsEnabled;
    private final Set<String> disabledKinds;
    private final Set<String> enabledKinds;
    private final ExplainMode explainMode;

    private AccelerationConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.strictArithmetic = builder.strictArithmetic;
        this.memoryBudgetBytes = builder.memoryBudgetBytes;
        this.incompatibleOpsEnabled = builder.incompatibleOpsEnabled;
        this.disabledKinds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.disabledKinds));
        this.enabledKinds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.enabledKinds));
        this.explainMode = builder.explainMode;
    }

    public static AccelerationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Master switch; when false every node stays on the host.
     */
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * ANSI-style arithmetic: overflow and invalid input raise errors instead of wrapping or producing null.
     */
    public boolean isStrictArithmetic() {
        return strictArithmetic;
    }

    public long getMemoryBudgetBytes() {
        return memoryBudgetBytes;
    }

    public boolean isIncompatibleOpsEnabled() {
        return incompatibleOpsEnabled;
    }

    public Set<String> getDisabledKinds() {
        return disabledKinds;
    }

    public Set<String> getEnabledKinds() {
        return enabledKinds;
    }

    public boolean isDisabled(String kind) {
        return disabledKinds.contains(kind);
    }

    public boolean isExplicitlyEnabled(String kind) {
        return enabledKinds.contains(kind);
    }

    public ExplainMode getExplainMode() {
        return explainMode;
    }

    @Override
    public String toString() {
        return "AccelerationConfig{enabled=" + enabled
                + ", strictArithmetic=" + strictArithmetic
                + ", memoryBudgetBytes=" + memoryBudgetBytes
                + ", incompatibleOpsEnabled=" + incompatibleOpsEnabled
                + ", disabledKinds=" + disabledKinds
                + ", enabledKinds=" + enabledKinds
                + ", explainMode=" + explainMode + "}";
    }

    public static final class Builder {
        private boolean enabled = true;
        private boolean strictArithmetic;
        private long memoryBudgetBytes = DEFAULT_MEMORY_BUDGET_BYTES;
        private boolean incompatibleOpsEnabled;
        private final Set<String> disabledKinds = new LinkedHashSet<>();
        private final Set<String> enabledKinds = new LinkedHashSet<>();
        private ExplainMode explainMode = ExplainMode.NONE;

        private Builder() {
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder strictArithmetic(boolean strictArithmetic) {
            this.strictArithmetic = strictArithmetic;
            return this;
        }

        public Builder memoryBudgetBytes(long memoryBudgetBytes) {
            if (memoryBudgetBytes < 0) {
                throw new IllegalArgumentException("memoryBudgetBytes must not be negative, got " + memoryBudgetBytes);
            }
            this.memoryBudgetBytes = memoryBudgetBytes;
            return this;
        }

        public Builder incompatibleOpsEnabled(boolean incompatibleOpsEnabled) {
            this.incompatibleOpsEnabled = incompatibleOpsEnabled;
            return this;
        }

        public Builder disableKind(String kind) {
            disabledKinds.add(Objects.requireNonNull(kind, "kind is null"));
            return this;
        }

        public Builder disabledKinds(Collection<String> kinds) {
            kinds.forEach(this::disableKind);
            return this;
        }

        public Builder enableKind(String kind) {
            enabledKinds.add(Objects.requireNonNull(kind, "kind is null"));
            return this;
        }

        public Builder enabledKinds(Collection<String> kinds) {
            kinds.forEach(this::enableKind);
            return this;
        }

        public Builder explainMode(ExplainMode explainMode) {
            this.explainMode = Objects.requireNonNull(explainMode, "explainMode is null");
            return this;
        }

        public AccelerationConfig build() {
            return new AccelerationConfig(this);
        }
    }
}
