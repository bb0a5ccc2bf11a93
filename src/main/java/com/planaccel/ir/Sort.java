package com.planaccel.ir;

import com.planaccel.types.DataType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orders the input rows. Children: the input, then the sort keys.
 */
public class Sort extends AbstractPlanNode {

    private final List<Boolean> ascending;
    private final DataType rowType;

    public Sort(PlanNode input, List<PlanNode> sortKeys, List<Boolean> ascending) {
        super(children(input, sortKeys));
        this.ascending = List.copyOf(Objects.requireNonNull(ascending, "ascending is null"));
        if (sortKeys.isEmpty()) {
            throw new IllegalArgumentException("Sort needs at least one sort key");
        }
        if (sortKeys.size() != ascending.size()) {
            throw new IllegalArgumentException("Sort has " + sortKeys.size() + " keys but " + ascending.size() + " directions");
        }
        this.rowType = input.getOutputType();
    }

    private static List<PlanNode> children(PlanNode input, List<PlanNode> sortKeys) {
        List<PlanNode> children = new ArrayList<>();
        children.add(Objects.requireNonNull(input, "input is null"));
        children.addAll(Objects.requireNonNull(sortKeys, "sortKeys is null"));
        return children;
    }

    public PlanNode getInput() {
        return getChildren().get(0);
    }

    public List<PlanNode> getSortKeys() {
        return getChildren().subList(1, getChildren().size());
    }

    public List<Boolean> getAscending() {
        return ascending;
    }

    @Override
    public String getNodeKind() {
        return "Sort";
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
        return parameters("ascending", ascending);
    }

    @Override
    protected PlanNode replaceChildren(List<PlanNode> newChildren) {
        return new Sort(newChildren.get(0), newChildren.subList(1, newChildren.size()), ascending);
    }

    @Override
    public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
        return visitor.visitSort(this, context);
    }
}
