package com.planaccel.rules;

import java.util.List;

/**
 * A group of replacement rules contributed together, registered in list order.
 */
@FunctionalInterface
public interface RuleProvider {

    List<ReplacementRule> getRules();
}
