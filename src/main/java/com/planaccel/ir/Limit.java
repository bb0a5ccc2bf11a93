package com.planaccel.ir;

import com.planaccel.types.DataType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public class Limit extends AbstractPlanNode {

    private final long count;
    private final DataType rowType;

    public Limit(PlanNode input, long count) {
        super(List.of(Objects.requireNonNull(input, "input is null")));
        if (count < 0) {
            throw new IllegalArgumentException("Limit count must not be negative, got " + count);
        }
        this.count = count;
        this.rowType = input.getOutputType();
    }

    public PlanNode getInput() {
        return getChildren().get(0);
    }

    public long getCount() {
        return count;
    }

    @Override
    public String getNodeKind() {
        return "Limit";
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
    public Map<String, Object> getParameters() {
        return parameters("count", count);
    }

    @Override
    protected PlanNode replaceChildren(List<PlanNode> newChildren) {
        return new Limit(newChildren.get(0), count);
    }

    @Override
    public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
        return visitor.visitLimit(this, context);
    }
}
