package com.planaccel.ir;

import com.planaccel.types.DataType;

import java.util.List;
import java.util.Objects;

/**
 * A row-level function call. The function name is the node kind, so {@code Acos},
 * {@code Add} or {@code EqualTo} each resolve to their own replacement rule.
 */
public class ScalarFunction extends AbstractPlanNode {

    private final String name;
    private final DataType outputType;

    public ScalarFunction(String name, DataType outputType, List<PlanNode> arguments) {
        super(arguments);
        this.name = Objects.requireNonNull(name, "name is null");
        this.outputType = Objects.requireNonNull(outputType, "outputType is null");
    }

    public List<PlanNode> getArguments() {
        return getChildren();
    }

    @Override
    public String getNodeKind() {
        return name;
    }

    @Override
    public NodeCategory getCategory() {
        return NodeCategory.EXPRESSION;
    }

    @Override
    public DataType getOutputType() {
        return outputType;
    }

    @Override
    protected PlanNode replaceChildren(List<PlanNode> newChildren) {
        return new ScalarFunction(name, outputType, newChildren);
    }

    @Override
    public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
        return visitor.visitScalarFunction(this, context);
    }
}
