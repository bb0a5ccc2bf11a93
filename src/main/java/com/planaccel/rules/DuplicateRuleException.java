package com.planaccel.rules;

/**
 * Thrown when a replacement rule claims a node kind or alias that another rule already serves.
 */
public class DuplicateRuleException extends RuntimeException {

    private final String nodeKind;

    public DuplicateRuleException(String nodeKind, ReplacementRule existing) {
        super("A replacement rule for node kind '" + nodeKind + "' is already registered: " + existing.getNodeKind()
                + " (" + existing.getDescription() + ")");
        this.nodeKind = nodeKind;
    }

    public String getNodeKind() {
        return nodeKind;
    }
}
