package com.planaccel.ir;

import com.planaccel.types.DataType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An aggregate call such as {@code Sum} or {@code Count}, evaluated by an {@link Aggregate} node.
 */
public class AggregateFunction extends AbstractPlanNode {

    private final String name;
    private final DataType outputType;
    private final boolean distinct;

    public AggregateFunction(String name, DataType outputType, List<PlanNode> arguments, boolean distinct) {
        super(arguments);
        this.name = Objects.requireNonNull(name, "name is null");
        this.outputType = Objects.requireNonNull(outputType, "outputType is null");
        this.distinct = distinct;
    }

    public AggregateFunction(String name, DataType outputType, List<PlanNode> arguments) {
        this(name, outputType, arguments, false);
    }

    public List<PlanNode> getArguments() {
        return getChildren();
    }

    public boolean isDistinct() {
        return distinct;
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
    public Map<String, Object> getParameters() {
        return distinct ? parameters("distinct", true) : Map.of();
    }

    @Override
    protected PlanNode replaceChildren(List<PlanNode> newChildren) {
        return new AggregateFunction(name, outputType, newChildren, distinct);
    }

    @Override
    public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
        return visitor.visitAggregateFunction(this, context);
    }
}
