package com.planaccel.ir;

import com.planaccel.types.DataType;
import com.planaccel.types.DataTypes;
import com.planaccel.types.StructType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Represents a projection: one output column per expression.
 * Children: the input, then the projected expressions.
 */
public class Project extends AbstractPlanNode {

    private final List<String> names;
    private final DataType rowType;

    public Project(PlanNode input, List<PlanNode> projections, List<String> names) {
        super(concat(input, projections));
        this.names = List.copyOf(Objects.requireNonNull(names, "names is null"));
        if (projections.isEmpty()) {
            throw new IllegalArgumentException("Projections cannot be empty for Project");
        }
        if (projections.size() != names.size()) {
            throw new IllegalArgumentException("Project has " + projections.size() + " projections but " + names.size() + " names");
        }
        this.rowType = rowType();
    }

    static List<PlanNode> concat(PlanNode input, List<PlanNode> expressions) {
        List<PlanNode> children = new ArrayList<>();
        children.add(Objects.requireNonNull(input, "input is null"));
        children.addAll(Objects.requireNonNull(expressions, "expressions is null"));
        return children;
    }

    public PlanNode getInput() {
        return getChildren().get(0);
    }

    public List<PlanNode> getProjections() {
        return getChildren().subList(1, getChildren().size());
    }

    public List<String> getNames() {
        return names;
    }

    @Override
    public String getNodeKind() {
        return "Project";
    }

    @Override
    public NodeCategory getCategory() {
        return NodeCategory.RELATION;
    }

    @Override
    public DataType getOutputType() {
        return rowType;
    }

    private DataType rowType() {
        List<StructType.Field> fields = new ArrayList<>();
        List<PlanNode> projections = getProjections();
        for (int i = 0; i < projections.size(); i++) {
            PlanNode projection = projections.get(i);
            if (projection == null || projection.getOutputType() == null) {
                return null;
            }
            fields.add(DataTypes.field(names.get(i), projection.getOutputType()));
        }
        return DataTypes.structOf(fields);
    }

    @Override
    public Map<String, Object> getParameters() {
        return parameters("names", names);
    }

    @Override
    protected PlanNode replaceChildren(List<PlanNode> newChildren) {
        return new Project(newChildren.get(0), newChildren.subList(1, newChildren.size()), names);
    }

    @Override
    public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
        return visitor.visitProject(this, context);
    }
}
