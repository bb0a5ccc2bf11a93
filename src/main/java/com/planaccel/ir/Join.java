package com.planaccel.ir;

import com.planaccel.types.DataType;
import com.planaccel.types.StructType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Represents a join of two inputs.
 * Children: the left input, the right input and, unless it is a cross join, the join condition.
 */
public class Join extends AbstractPlanNode {

    public enum JoinType {
        INNER,
        LEFT_OUTER,
        RIGHT_OUTER,
        FULL_OUTER,
        LEFT_SEMI,
        LEFT_ANTI,
        CROSS
    }

    private final JoinType joinType;
    private final DataType rowType;

    public Join(PlanNode left, PlanNode right, JoinType joinType, PlanNode condition) {
        super(children(left, right, joinType, condition));
        this.joinType = joinType;
        this.rowType = rowType(left.getOutputType(), right.getOutputType(), joinType);
    }

    public static Join cross(PlanNode left, PlanNode right) {
        return new Join(left, right, JoinType.CROSS, null);
    }

    private static List<PlanNode> children(PlanNode left, PlanNode right, JoinType joinType, PlanNode condition) {
        Objects.requireNonNull(joinType, "joinType is null");
        List<PlanNode> children = new ArrayList<>(3);
        children.add(Objects.requireNonNull(left, "left is null"));
        children.add(Objects.requireNonNull(right, "right is null"));
        if (joinType == JoinType.CROSS) {
            if (condition != null) {
                throw new IllegalArgumentException("A cross join has no condition");
            }
        } else {
            children.add(Objects.requireNonNull(condition, "condition is null"));
        }
        return children;
    }

    public PlanNode getLeft() {
        return getChildren().get(0);
    }

    public PlanNode getRight() {
        return getChildren().get(1);
    }

    public Optional<PlanNode> getCondition() {
        return getChildren().size() > 2 ? Optional.of(getChildren().get(2)) : Optional.empty();
    }

    public JoinType getJoinType() {
        return joinType;
    }

    @Override
    public String getNodeKind() {
        return "Join";
    }

    @Override
    public NodeCategory getCategory() {
        return NodeCategory.RELATION;
    }

    @Override
    public DataType getOutputType() {
        return rowType;
    }

    private static DataType rowType(DataType left, DataType right, JoinType joinType) {
        if (joinType == JoinType.LEFT_SEMI || joinType == JoinType.LEFT_ANTI) {
            return left;
        }
        if (!(left instanceof StructType) || !(right instanceof StructType)) {
            return null;
        }
        return ((StructType) left).concat((StructType) right);
    }

    @Override
    public Map<String, Object> getParameters() {
        return parameters("joinType", joinType);
    }

    @Override
    protected PlanNode replaceChildren(List<PlanNode> newChildren) {
        return new Join(newChildren.get(0), newChildren.get(1), joinType,
                newChildren.size() > 2 ? newChildren.get(2) : null);
    }

    @Override
    public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
        return visitor.visitJoin(this, context);
    }
}
