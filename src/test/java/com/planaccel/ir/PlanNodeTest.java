package com.planaccel.ir;

import com.planaccel.types.DataTypes;
import com.planaccel.types.StructType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanNodeTest {

    private static Scan scan(String name, long size) {
        return new Scan(name, StructType.fromColumns(Map.of(name + "_id", DataTypes.LONG)), OptionalLong.of(size));
    }

    @Test
    void withChildrenReturnsSameInstanceWhenNothingChanged() {
        Scan input = scan("t", 100);
        Filter filter = new Filter(input, new Literal(DataTypes.BOOLEAN, true));
        assertThat(filter.withChildren(filter.getChildren())).isSameAs(filter);

        PlanNode replaced = filter.withChildren(List.of(scan("u", 10), filter.getCondition()));
        assertThat(replaced).isNotSameAs(filter).isInstanceOf(Filter.class);
        assertThat(((Filter) replaced).getCondition()).isSameAs(filter.getCondition());
        assertThat(filter.getInput()).isSameAs(input);
    }

    @Test
    void withChildrenChecksArity() {
        Filter filter = new Filter(scan("t", 100), new Literal(DataTypes.BOOLEAN, true));
        assertThatThrownBy(() -> filter.withChildren(List.of(scan("u", 1))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Filter expects 2 children");
    }

    @Test
    void relationsDeclareStructOutputs() {
        Scan orders = new Scan("orders", StructType.fromColumns(Map.of("id", DataTypes.LONG)));
        Project project = new Project(orders,
                List.of(new ColumnRef("id", DataTypes.LONG), new Literal(DataTypes.STRING, "x")),
                List.of("id", "tag"));
        assertThat(project.getOutputType()).isEqualTo(DataTypes.structOf(List.of(
                DataTypes.field("id", DataTypes.LONG),
                DataTypes.field("tag", DataTypes.STRING))));

        Join join = Join.cross(new Scan("a", StructType.fromColumns(Map.of("x", DataTypes.INT))),
                new Scan("b", StructType.fromColumns(Map.of("y", DataTypes.DOUBLE))));
        assertThat(join.getChildren()).hasSize(2);
        assertThat(join.getCondition()).isEmpty();
        assertThat(join.getOutputType().toString()).isEqualTo("STRUCT<x:INT,y:DOUBLE>");
    }

    @Test
    void rowTypesAreComputedOnce() {
        Scan orders = new Scan("orders", StructType.fromColumns(Map.of("id", DataTypes.LONG)));
        ColumnRef id = new ColumnRef("id", DataTypes.LONG);
        Project project = new Project(new Limit(orders, 10), List.of(id), List.of("id"));
        Join join = Join.cross(project, new Scan("b", StructType.fromColumns(Map.of("y", DataTypes.DOUBLE))));

        assertThat(project.getOutputType()).isSameAs(project.getOutputType());
        assertThat(join.getOutputType()).isSameAs(join.getOutputType());
        assertThat(join.getOutputType().toString()).isEqualTo("STRUCT<id:LONG,y:DOUBLE>");
    }

    @Test
    void aggregateSplitsKeysAndCalls() {
        Scan input = new Scan("t", StructType.fromColumns(Map.of("k", DataTypes.STRING)));
        ColumnRef key = new ColumnRef("k", DataTypes.STRING);
        AggregateFunction count = new AggregateFunction("Count", DataTypes.LONG, List.of());
        Aggregate aggregate = new Aggregate(input, List.of(key), List.of(count), List.of("k", "cnt"));
        assertThat(aggregate.getGroupKeys()).containsExactly(key);
        assertThat(aggregate.getAggregates()).containsExactly(count);
        assertThatThrownBy(() -> new Aggregate(new Scan("t", StructType.fromColumns(Map.of("k", DataTypes.STRING))),
                List.of(new ColumnRef("k", DataTypes.STRING)), List.of(), List.of("k", "extra")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sizeEstimates() {
        assertThat(SizeEstimator.estimate(scan("t", 100))).hasValue(100);
        assertThat(SizeEstimator.estimate(new Limit(new Filter(scan("t", 100), new Literal(DataTypes.BOOLEAN, true)), 5)))
                .hasValue(100);
        Join join = new Join(scan("a", 100), scan("b", 250), Join.JoinType.INNER, new Literal(DataTypes.BOOLEAN, true));
        assertThat(SizeEstimator.estimate(join)).hasValue(350);
        assertThat(SizeEstimator.estimate(new Scan("u", StructType.fromColumns(Map.of("x", DataTypes.INT))))).isEmpty();
        assertThat(SizeEstimator.estimate(new Literal(DataTypes.INT, 1))).isEmpty();
    }

    @Test
    void treeIsPrintedWithIndentation() {
        Filter filter = new Filter(scan("t", 100), new Literal(DataTypes.BOOLEAN, true));
        String[] lines = filter.toString().split("\n");
        assertThat(lines).hasSize(3);
        assertThat(lines[0]).startsWith("Filter");
        assertThat(lines[1]).startsWith("  Scan");
        assertThat(lines[2]).startsWith("  Literal");
    }
}
