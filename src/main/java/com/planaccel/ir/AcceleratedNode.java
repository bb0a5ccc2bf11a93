package com.planaccel.ir;

import com.planaccel.types.DataType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The accelerated counterpart of a host node. It keeps the kind, output type and parameters
 * of the node it replaced and produces its output on the device.
 */
public class AcceleratedNode extends AbstractPlanNode {

    private final PlanNode replaced;

    public AcceleratedNode(PlanNode replaced, List<PlanNode> children) {
        super(children);
        this.replaced = Objects.requireNonNull(replaced, "replaced is null");
        if (children.size() != replaced.getChildren().size()) {
            throw new IllegalArgumentException("Accelerated " + replaced.getNodeKind() + " expects "
                    + replaced.getChildren().size() + " children, got " + children.size());
        }
    }

    /**
     * The host node this node was built from.
     */
    public PlanNode getReplacedNode() {
        return replaced;
    }

    @Override
    public String getNodeKind() {
        return replaced.getNodeKind();
    }

    @Override
    public NodeCategory getCategory() {
        return replaced.getCategory();
    }

    @Override
    public DataType getOutputType() {
        return replaced.getOutputType();
    }

    @Override
    public Map<String, Object> getParameters() {
        return replaced.getParameters();
    }

    @Override
    public Representation getRepresentation() {
        return Representation.DEVICE;
    }

    @Override
    public String describe() {
        return "Accelerated" + super.describe();
    }

    @Override
    protected PlanNode replaceChildren(List<PlanNode> newChildren) {
        return new AcceleratedNode(replaced, newChildren);
    }

    @Override
    public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
        return visitor.visitAccelerated(this, context);
    }
}
