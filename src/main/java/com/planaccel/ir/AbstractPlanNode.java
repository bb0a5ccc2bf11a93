package com.planaccel.ir;

import com.planaccel.types.DataType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shared plumbing for plan nodes: child storage, identity-preserving {@link #withChildren},
 * printing and structural equality.
 */
public abstract class AbstractPlanNode implements PlanNode {

    private final List<PlanNode> children;

    protected AbstractPlanNode(List<PlanNode> children) {
        // copied element by element so that null children survive and are reported by the tagger
        this.children = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(children, "children is null")));
    }

    @Override
    public List<PlanNode> getChildren() {
        return children;
    }

    @Override
    public PlanNode withChildren(List<PlanNode> newChildren) {
        Objects.requireNonNull(newChildren, "newChildren is null");
        if (newChildren.size() != children.size()) {
            throw new IllegalArgumentException(getNodeKind() + " expects " + children.size()
                    + " children, got " + newChildren.size());
        }
        boolean changed = false;
        for (int i = 0; i < children.size(); i++) {
            if (newChildren.get(i) != children.get(i)) {
                changed = true;
                break;
            }
        }
        return changed ? replaceChildren(newChildren) : this;
    }

    /**
     * Builds a new instance with the given children; the size has already been checked.
     */
    protected abstract PlanNode replaceChildren(List<PlanNode> newChildren);

    @Override
    public Map<String, Object> getParameters() {
        return Map.of();
    }

    protected static Map<String, Object> parameters(Object... keyValues) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(params);
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder(getNodeKind());
        Map<String, Object> params = getParameters();
        if (!params.isEmpty()) {
            sb.append(' ').append(params);
        }
        DataType type = getOutputType();
        sb.append(" -> ").append(type);
        return sb.toString();
    }

    @Override
    public String toString(String indent) {
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append(describe());
        for (PlanNode child : children) {
            sb.append('\n');
            sb.append(child == null ? indent + "  <null>" : child.toString(indent + "  "));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toString("");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AbstractPlanNode that = (AbstractPlanNode) o;
        return getNodeKind().equals(that.getNodeKind())
                && Objects.equals(getOutputType(), that.getOutputType())
                && getParameters().equals(that.getParameters())
                && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), getNodeKind(), getOutputType(), getParameters(), children);
    }
}
