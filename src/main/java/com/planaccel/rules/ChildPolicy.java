package com.planaccel.rules;

/**
 * How an accelerated node treats a relational child that stays on the host.
 * Expression children are always required to be accepted.
 */
public enum ChildPolicy {
    /** The child must itself be accepted. */
    ACCEPTED_ONLY,
    /** A rejected child is accepted if a host-to-device adapter exists for its output type. */
    ADAPTABLE,
    /** The accelerated node consumes host rows directly at this position. */
    MIXED
}
