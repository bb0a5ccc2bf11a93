package com.planaccel.ir;

/**
 * Visitor pattern interface for traversing plan trees.
 * Every method falls back to {@link #visitNode} unless overridden.
 *
 * @param <R> Return type of the visit methods.
 * @param <C> Type of the context object passed during traversal.
 */
public interface PlanNodeVisitor<R, C> {

    default R visitLiteral(Literal node, C context) {
        return visitNode(node, context);
    }

    default R visitColumnRef(ColumnRef node, C context) {
        return visitNode(node, context);
    }

    default R visitScalarFunction(ScalarFunction node, C context) {
        return visitNode(node, context);
    }

    default R visitAggregateFunction(AggregateFunction node, C context) {
        return visitNode(node, context);
    }

    default R visitScan(Scan node, C context) {
        return visitNode(node, context);
    }

    default R visitFilter(Filter node, C context) {
        return visitNode(node, context);
    }

    default R visitProject(Project node, C context) {
        return visitNode(node, context);
    }

    default R visitJoin(Join node, C context) {
        return visitNode(node, context);
    }

    default R visitAggregate(Aggregate node, C context) {
        return visitNode(node, context);
    }

    default R visitSort(Sort node, C context) {
        return visitNode(node, context);
    }

    default R visitLimit(Limit node, C context) {
        return visitNode(node, context);
    }

    default R visitAccelerated(AcceleratedNode node, C context) {
        return visitNode(node, context);
    }

    default R visitDeviceToHost(DeviceToHost node, C context) {
        return visitNode(node, context);
    }

    default R visitHostToDevice(HostToDevice node, C context) {
        return visitNode(node, context);
    }

    /**
     * Handler for nodes without a more specific override, including plan node types
     * defined outside this package.
     */
    R visitNode(PlanNode node, C context);
}
