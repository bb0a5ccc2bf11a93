package com.planaccel.ir;

import com.planaccel.types.DataType;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Keeps the input rows for which the condition is true.
 * Children: the input, then the condition.
 */
public class Filter extends AbstractPlanNode {

    private final DataType rowType;

    public Filter(PlanNode input, PlanNode condition) {
        super(Arrays.asList(Objects.requireNonNull(input, "input is null"), Objects.requireNonNull(condition, "condition is null")));
        this.rowType = input.getOutputType();
    }

    public PlanNode getInput() {
        return getChildren().get(0);
    }

    public PlanNode getCondition() {
        return getChildren().get(1);
    }

    @Override
    public String getNodeKind() {
        return "Filter";
    }

    @Override
    public NodeCategory getCategory() {
        return NodeCategory.RELATION;
    }

    @Override
    public DataType getOutputType() {
        return rowType;
    }

    @Override
    protected PlanNode replaceChildren(List<PlanNode> newChildren) {
        return new Filter(newChildren.get(0), newChildren.get(1));
    }

    @Override
    public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
        return visitor.visitFilter(this, context);
    }
}
