package com.planaccel.ir;

/**
 * Whether a plan node produces a value (an expression evaluated per row) or transforms
 * a stream of rows (a physical step).
 */
public enum NodeCategory {
    EXPRESSION,
    RELATION
}
