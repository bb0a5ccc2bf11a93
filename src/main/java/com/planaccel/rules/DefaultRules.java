package com.planaccel.rules;

import java.util.List;

/**
 * The built-in rule catalog.
 */
public final class DefaultRules {

    private DefaultRules() {}

    public static final List<RuleProvider> PROVIDERS = List.of(new ExpressionRules(), new RelationRules());

    /**
     * Creates a sealed registry with every built-in rule.
     */
    public static CapabilityRegistry newRegistry() {
        return populate(new CapabilityRegistry()).seal();
    }

    /**
     * Adds every built-in rule to an open registry, leaving it open for additional rules.
     */
    public static CapabilityRegistry populate(CapabilityRegistry registry) {
        for (RuleProvider provider : PROVIDERS) {
            registry.registerAll(provider);
        }
        return registry;
    }
}
