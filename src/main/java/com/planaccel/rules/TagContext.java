package com.planaccel.rules;

import com.planaccel.tagging.AccelerationConfig;

/**
 * What an extra validation check can see and do while a node is being tagged.
 */
public interface TagContext {

    AccelerationConfig getConfig();

    /**
     * Records why the node cannot be accelerated. Reasons are reported verbatim.
     */
    void reject(String reason);
}
