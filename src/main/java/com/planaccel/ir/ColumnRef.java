package com.planaccel.ir;

import com.planaccel.types.DataType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reference to a column of the input rows of the owning relational node.
 */
public class ColumnRef extends AbstractPlanNode {

    private final String name;
    private final DataType type;

    public ColumnRef(String name, DataType type) {
        super(List.of());
        this.name = Objects.requireNonNull(name, "name is null");
        this.type = Objects.requireNonNull(type, "type is null");
    }

    public String getName() {
        return name;
    }

    @Override
    public String getNodeKind() {
        return "ColumnRef";
    }

    @Override
    public NodeCategory getCategory() {
        return NodeCategory.EXPRESSION;
    }

    @Override
    public DataType getOutputType() {
        return type;
    }

    @Override
    public Map<String, Object> getParameters() {
        return parameters("name", name);
    }

    @Override
    protected PlanNode replaceChildren(List<PlanNode> newChildren) {
        return this;
    }

    @Override
    public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
        return visitor.visitColumnRef(this, context);
    }
}
