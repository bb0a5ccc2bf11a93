package com.planaccel.rules;

import com.planaccel.types.TypeSignatures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapabilityRegistryTest {

    private static ReplacementRule rule(String kind) {
        return ReplacementRule.builder(kind).acceleratedSignature(TypeSignatures.DOUBLE).build();
    }

    @Test
    @DisplayName("registering a kind twice fails and keeps the first rule")
    void duplicateKind() {
        ReplacementRule first = rule("Acos");
        CapabilityRegistry registry = new CapabilityRegistry().register(first);

        assertThatThrownBy(() -> registry.register(rule("Acos")))
                .isInstanceOf(DuplicateRuleException.class)
                .hasMessageContaining("Acos");

        registry.seal();
        assertThat(registry.lookup("Acos")).containsSame(first);
    }

    @Test
    void lookupAfterSealIsStable() {
        CapabilityRegistry registry = new CapabilityRegistry().register(rule("Acos")).register(rule("Asin")).seal();
        ReplacementRule acos = registry.lookup("Acos").orElseThrow();
        for (int i = 0; i < 10; i++) {
            assertThat(registry.lookup("Acos")).containsSame(acos);
        }
        assertThat(registry.lookup("Atan")).isEmpty();
        // sealing again changes nothing
        registry.seal();
        assertThat(registry.lookup("Acos")).containsSame(acos);
    }

    @Test
    void rulesKeepRegistrationOrder() {
        CapabilityRegistry registry = new CapabilityRegistry()
                .register(rule("Sin"))
                .register(rule("Acos"))
                .register(rule("Cos"))
                .seal();
        assertThat(registry.rules().stream().map(ReplacementRule::getNodeKind).collect(Collectors.toList()))
                .containsExactly("Sin", "Acos", "Cos");
    }

    @Test
    @DisplayName("an alias already served by another rule cannot be claimed again")
    void aliasCollisionIsRejected() {
        ReplacementRule average = ReplacementRule.builder("Average").alias("Avg")
                .acceleratedSignature(TypeSignatures.DOUBLE).build();
        ReplacementRule mean = ReplacementRule.builder("Mean").alias("Avg")
                .acceleratedSignature(TypeSignatures.DOUBLE).build();
        CapabilityRegistry registry = new CapabilityRegistry().register(average);

        assertThatThrownBy(() -> registry.register(mean))
                .isInstanceOf(DuplicateRuleException.class)
                .hasMessageContaining("'Avg'")
                .hasMessageContaining("Average");

        registry.seal();
        assertThat(registry.lookup("Avg")).containsSame(average);
        assertThat(registry.lookup("Average")).containsSame(average);
        // the failed registration left nothing behind
        assertThat(registry.lookup("Mean")).isEmpty();
        assertThat(registry.rules()).containsExactly(average);
    }

    @Test
    void kindAlreadyUsedAsAnAliasIsRejected() {
        CapabilityRegistry registry = DefaultRules.populate(new CapabilityRegistry());
        ReplacementRule avg = rule("Avg");

        assertThatThrownBy(() -> registry.register(avg))
                .isInstanceOfSatisfying(DuplicateRuleException.class,
                        e -> assertThat(e.getNodeKind()).isEqualTo("Avg"));

        registry.seal();
        assertThat(registry.lookup("Avg").orElseThrow().getNodeKind()).isEqualTo("Average");
        assertThat(registry.rules()).doesNotContain(avg);
    }

    @Test
    void aliasMatchingAnExistingKindIsRejected() {
        CapabilityRegistry registry = new CapabilityRegistry().register(rule("Acos"));
        ReplacementRule arccos = ReplacementRule.builder("ArcCos").alias("Acos")
                .acceleratedSignature(TypeSignatures.DOUBLE).build();

        assertThatThrownBy(() -> registry.register(arccos)).isInstanceOf(DuplicateRuleException.class);
        registry.seal();
        assertThat(registry.lookup("ArcCos")).isEmpty();
    }

    @Test
    void lifecycleIsEnforced() {
        CapabilityRegistry registry = new CapabilityRegistry().register(rule("Acos"));
        assertThat(registry.isSealed()).isFalse();
        assertThatThrownBy(() -> registry.lookup("Acos")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(registry::rules).isInstanceOf(IllegalStateException.class);

        registry.seal();
        assertThat(registry.isSealed()).isTrue();
        assertThatThrownBy(() -> registry.register(rule("Asin"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void ruleMustMatchKind() {
        CapabilityRegistry registry = new CapabilityRegistry();
        assertThatThrownBy(() -> registry.register("Asin", rule("Acos")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ruleRequiresAcceleratedSignature() {
        assertThatThrownBy(() -> ReplacementRule.builder("Acos").build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void globalRegistryHoldsTheDefaultCatalog() {
        CapabilityRegistry global = CapabilityRegistry.global();
        assertThat(global).isSameAs(CapabilityRegistry.global());
        assertThat(global.isSealed()).isTrue();
        for (String kind : List.of("Scan", "Filter", "Project", "Join", "Aggregate", "Sort", "Limit",
                "Literal", "ColumnRef", "Add", "Divide", "EqualTo", "And", "Acos", "Upper", "Sum", "Count")) {
            assertThat(global.lookup(kind)).as(kind).isPresent();
        }
        assertThat(global.lookup("Avg").orElseThrow().getNodeKind()).isEqualTo("Average");
        assertThat(global.lookup("Window")).isEmpty();
    }

    @Test
    void populateLeavesRegistryOpenForExtensions() {
        CapabilityRegistry registry = DefaultRules.populate(new CapabilityRegistry());
        registry.register(rule("Cbrt"));
        assertThatThrownBy(() -> registry.register(rule("Acos"))).isInstanceOf(DuplicateRuleException.class);
        registry.seal();
        assertThat(registry.lookup("Cbrt")).isPresent();
    }
}
