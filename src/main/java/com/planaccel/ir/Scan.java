package com.planaccel.ir;

import com.planaccel.types.DataType;
import com.planaccel.types.StructType;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Represents a scan of a base table. Leaf node in the plan tree.
 */
public class Scan extends AbstractPlanNode {

    private final String tableName;
    private final StructType schema;
    private final Long estimatedSizeBytes;

    public Scan(String tableName, StructType schema, OptionalLong estimatedSizeBytes) {
        super(List.of());
        this.tableName = Objects.requireNonNull(tableName, "tableName is null");
        this.schema = Objects.requireNonNull(schema, "schema is null");
        this.estimatedSizeBytes = estimatedSizeBytes.isPresent() ? estimatedSizeBytes.getAsLong() : null;
    }

    public Scan(String tableName, StructType schema) {
        this(tableName, schema, OptionalLong.empty());
    }

    public String getTableName() {
        return tableName;
    }

    public OptionalLong getEstimatedSizeBytes() {
        return estimatedSizeBytes == null ? OptionalLong.empty() : OptionalLong.of(estimatedSizeBytes);
    }

    @Override
    public String getNodeKind() {
        return "Scan";
    }

    @Override
    public NodeCategory getCategory() {
        return NodeCategory.RELATION;
    }

    @Override
    public DataType getOutputType() {
        return schema;
    }

    @Override
    public Map<String, Object> getParameters() {
        return estimatedSizeBytes == null
                ? parameters("table", tableName)
                : parameters("table", tableName, "estimatedSizeBytes", estimatedSizeBytes);
    }

    @Override
    protected PlanNode replaceChildren(List<PlanNode> newChildren) {
        return this;
    }

    @Override
    public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
        return visitor.visitScan(this, context);
    }
}
