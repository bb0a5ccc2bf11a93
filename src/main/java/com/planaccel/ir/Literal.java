package com.planaccel.ir;

import com.planaccel.types.DataType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A constant value. The value may be {@code null} for typed SQL NULLs.
 */
public class Literal extends AbstractPlanNode {

    private final DataType type;
    private final Object value;

    public Literal(DataType type, Object value) {
        super(List.of());
        this.type = Objects.requireNonNull(type, "type is null");
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public String getNodeKind() {
        return "Literal";
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
        return parameters("value", value);
    }

    @Override
    protected PlanNode replaceChildren(List<PlanNode> newChildren) {
        return this;
    }

    @Override
    public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }
}
