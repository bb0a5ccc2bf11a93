package com.planaccel.tagging;

/**
 * Which tagging decisions the planner logs after a pass.
 */
public enum ExplainMode {
    /** Log nothing. */
    NONE,
    /** Log only the parts of the plan that stay on the host, with reasons. */
    NOT_ON_ACCELERATOR,
    /** Log every decision. */
    ALL
}
