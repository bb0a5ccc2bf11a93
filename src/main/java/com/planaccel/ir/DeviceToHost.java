package com.planaccel.ir;

import com.planaccel.types.DataType;

import java.util.List;
import java.util.Objects;

/**
 * Boundary adapter. Copies columnar device batches back into host rows.
 * Created by the rewriter through {@code BoundaryAdapters}, never by plan producers.
 */
public class DeviceToHost extends AbstractPlanNode {

    public DeviceToHost(PlanNode child) {
        super(List.of(Objects.requireNonNull(child, "child is null")));
    }

    public PlanNode getChild() {
        return getChildren().get(0);
    }

    @Override
    public String getNodeKind() {
        return "DeviceToHost";
    }

    @Override
    public NodeCategory getCategory() {
        return NodeCategory.RELATION;
    }

    @Override
    public DataType getOutputType() {
        return getChild().getOutputType();
    }

    @Override
    public Representation getRepresentation() {
        return Representation.HOST;
    }

    @Override
    protected PlanNode replaceChildren(List<PlanNode> newChildren) {
        return new DeviceToHost(newChildren.get(0));
    }

    @Override
    public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
        return visitor.visitDeviceToHost(this, context);
    }
}
