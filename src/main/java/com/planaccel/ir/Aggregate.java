package com.planaccel.ir;

import com.planaccel.types.DataType;
import com.planaccel.types.DataTypes;
import com.planaccel.types.StructType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Hash aggregation. Children: the input, the grouping keys, then the aggregate calls.
 * The output row has one column per grouping key followed by one per aggregate call.
 */
public class Aggregate extends AbstractPlanNode {

    private final int groupKeyCount;
    private final List<String> names;
    private final DataType rowType;

    public Aggregate(PlanNode input, List<PlanNode> groupKeys, List<PlanNode> aggregates, List<String> names) {
        super(children(input, groupKeys, aggregates));
        this.groupKeyCount = groupKeys.size();
        this.names = List.copyOf(Objects.requireNonNull(names, "names is null"));
        if (names.size() != groupKeys.size() + aggregates.size()) {
            throw new IllegalArgumentException("Aggregate needs one name per grouping key and aggregate, got "
                    + names.size() + " names for " + (groupKeys.size() + aggregates.size()) + " columns");
        }
        this.rowType = rowType();
    }

    private static List<PlanNode> children(PlanNode input, List<PlanNode> groupKeys, List<PlanNode> aggregates) {
        List<PlanNode> children = new ArrayList<>();
        children.add(Objects.requireNonNull(input, "input is null"));
        children.addAll(Objects.requireNonNull(groupKeys, "groupKeys is null"));
        children.addAll(Objects.requireNonNull(aggregates, "aggregates is null"));
        return children;
    }

    public PlanNode getInput() {
        return getChildren().get(0);
    }

    public List<PlanNode> getGroupKeys() {
        return getChildren().subList(1, 1 + groupKeyCount);
    }

    public List<PlanNode> getAggregates() {
        return getChildren().subList(1 + groupKeyCount, getChildren().size());
    }

    public List<String> getNames() {
        return names;
    }

    @Override
    public String getNodeKind() {
        return "Aggregate";
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
        List<PlanNode> columns = getChildren().subList(1, getChildren().size());
        for (int i = 0; i < columns.size(); i++) {
            PlanNode column = columns.get(i);
            if (column == null || column.getOutputType() == null) {
                return null;
            }
            fields.add(DataTypes.field(names.get(i), column.getOutputType()));
        }
        return DataTypes.structOf(fields);
    }

    @Override
    public Map<String, Object> getParameters() {
        return parameters("groupKeys", groupKeyCount, "names", names);
    }

    @Override
    protected PlanNode replaceChildren(List<PlanNode> newChildren) {
        return new Aggregate(newChildren.get(0),
                newChildren.subList(1, 1 + groupKeyCount),
                newChildren.subList(1 + groupKeyCount, newChildren.size()),
                names);
    }

    @Override
    public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
        return visitor.visitAggregate(this, context);
    }
}
