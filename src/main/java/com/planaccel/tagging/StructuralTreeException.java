package com.planaccel.tagging;

/**
 * The submitted plan is not a finite tree of typed nodes: it has a cycle, a missing child,
 * a node shared between parents, or a node without a resolved output type.
 */
public class StructuralTreeException extends RuntimeException {

    public StructuralTreeException(String message) {
        super(message);
    }
}
