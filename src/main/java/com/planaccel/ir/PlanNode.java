package com.planaccel.ir;

import com.planaccel.types.DataType;

import java.util.List;
import java.util.Map;

/**
 * Base interface for nodes of a physical plan tree, both expressions and relational steps.
 * Nodes are immutable and own their children exclusively.
 */
public interface PlanNode {

    /**
     * Identifier of the node kind, used to look up replacement rules
     * (e.g. "Scan", "Join", "Acos", "Literal").
     */
    String getNodeKind();

    NodeCategory getCategory();

    /**
     * Get the child nodes of this node, in positional order.
     * Relational nodes list their inputs first, then the expressions they evaluate.
     * @return A list of child nodes (empty for leaves).
     */
    List<PlanNode> getChildren();

    /**
     * Creates a node of the same kind with replaced children.
     * Returns {@code this} if every child is the same instance as the current one.
     * @throws IllegalArgumentException if the number of children is wrong for the node kind.
     */
    PlanNode withChildren(List<PlanNode> children);

    /**
     * The declared output type. Relational nodes declare a STRUCT of their output columns.
     */
    DataType getOutputType();

    /**
     * Node-specific parameters (table name, join type, literal value, ...), in a stable order.
     */
    Map<String, Object> getParameters();

    default Representation getRepresentation() {
        return Representation.HOST;
    }

    /**
     * One-line description of this node without its children.
     */
    String describe();

    /**
     * Generates a string representation of the node and its subtree, with indentation.
     * @param indent Indentation string to apply for the current level.
     */
    String toString(String indent);

    <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context);
}
