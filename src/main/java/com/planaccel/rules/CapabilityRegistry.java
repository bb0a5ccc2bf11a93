package com.planaccel.rules;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps node kinds to their replacement rules.
 *
 * <p>A registry has two phases. While open, rules are added with {@link #register}; a kind can
 * be registered only once. {@link #seal()} ends the initialization phase: the rule table is
 * published through a volatile field and becomes read-only, so any number of tagging passes
 * can read it concurrently without locking. Lookups on an open registry fail.
 *
 * <p>A rule answers for its own kind and for its aliases. Every such name belongs to exactly one
 * rule: registering a rule whose kind or alias is already taken fails and leaves the registry
 * unchanged.
 */
public class CapabilityRegistry {

    private static final Logger LOGGER = LogManager.getLogger(CapabilityRegistry.class);

    private final Map<String, ReplacementRule> rulesByKind = new LinkedHashMap<>();
    private final Map<String, ReplacementRule> rulesByName = new LinkedHashMap<>();

    private volatile Snapshot snapshot;

    /**
     * The process-wide registry holding the built-in rules, built and sealed on first use.
     */
    public static CapabilityRegistry global() {
        return GlobalHolder.INSTANCE;
    }

    /**
     * Registers a rule for a node kind.
     * @throws DuplicateRuleException if the kind or one of the rule's aliases is already served by another rule
     * @throws IllegalArgumentException if the rule was built for another kind
     * @throws IllegalStateException if the registry is sealed
     */
    public synchronized CapabilityRegistry register(String kind, ReplacementRule rule) {
        Objects.requireNonNull(kind, "kind is null");
        Objects.requireNonNull(rule, "rule is null");
        if (snapshot != null) {
            throw new IllegalStateException("Registry is sealed, cannot register a rule for " + kind);
        }
        if (!kind.equals(rule.getNodeKind())) {
            throw new IllegalArgumentException("Rule for '" + rule.getNodeKind() + "' cannot be registered under '" + kind + "'");
        }
        List<String> names = new ArrayList<>();
        names.add(kind);
        for (String alias : rule.getAliases()) {
            if (!names.contains(alias)) {
                names.add(alias);
            }
        }
        // nothing is recorded until every name is known to be free
        for (String name : names) {
            ReplacementRule existing = rulesByName.get(name);
            if (existing != null) {
                throw new DuplicateRuleException(name, existing);
            }
        }
        rulesByKind.put(kind, rule);
        for (String name : names) {
            rulesByName.put(name, rule);
        }
        LOGGER.debug("Registered {} for {}", rule.getNodeKind(), names);
        return this;
    }

    public CapabilityRegistry register(ReplacementRule rule) {
        return register(rule.getNodeKind(), rule);
    }

    public CapabilityRegistry registerAll(RuleProvider provider) {
        for (ReplacementRule rule : provider.getRules()) {
            register(rule);
        }
        return this;
    }

    /**
     * Ends the initialization phase. Idempotent.
     */
    public synchronized CapabilityRegistry seal() {
        if (snapshot == null) {
            snapshot = new Snapshot(rulesByName, rulesByKind);
            LOGGER.info("Capability registry sealed with {} replacement rules", snapshot.ordered.size());
        }
        return this;
    }

    public boolean isSealed() {
        return snapshot != null;
    }

    /**
     * @return the rule serving the kind, or empty when no accelerated equivalent is known
     * @throws IllegalStateException if the registry has not been sealed yet
     */
    public Optional<ReplacementRule> lookup(String kind) {
        return Optional.ofNullable(sealedSnapshot().byName.get(kind));
    }

    /**
     * All rules in registration order.
     */
    public List<ReplacementRule> rules() {
        return sealedSnapshot().ordered;
    }

    private Snapshot sealedSnapshot() {
        Snapshot current = snapshot;
        if (current == null) {
            throw new IllegalStateException("Capability registry is still being initialized, call seal() first");
        }
        return current;
    }

    private static final class Snapshot {
        private final Map<String, ReplacementRule> byName;
        private final List<ReplacementRule> ordered;

        Snapshot(Map<String, ReplacementRule> byName, Map<String, ReplacementRule> byKind) {
            this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
            this.ordered = Collections.unmodifiableList(new ArrayList<>(byKind.values()));
        }
    }

    private static final class GlobalHolder {
        static final CapabilityRegistry INSTANCE = DefaultRules.newRegistry();
    }
}
