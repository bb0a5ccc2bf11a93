package com.planaccel.ir;

import com.planaccel.types.DataType;

import java.util.List;
import java.util.Objects;

/**
 * Boundary adapter. Uploads host rows into columnar device batches.
 * Created by the rewriter through {@code BoundaryAdapters}, never by plan producers.
 */
public class HostToDevice extends AbstractPlanNode {

    public HostToDevice(PlanNode child) {
        super(List.of(Objects.requireNonNull(child, "child is null")));
    }

    public PlanNode getChild() {
        return getChildren().get(0);
    }

    @Override
    public String getNodeKind() {
        return "HostToDevice";
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
        return Representation.DEVICE;
    }

    @Override
    protected PlanNode replaceChildren(List<PlanNode> newChildren) {
        return new HostToDevice(newChildren.get(0));
    }

    @Override
    public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
        return visitor.visitHostToDevice(this, context);
    }
}
