package com.planaccel.rewrite;

import com.planaccel.ir.AcceleratedNode;
import com.planaccel.ir.ColumnRef;
import com.planaccel.ir.DeviceToHost;
import com.planaccel.ir.Filter;
import com.planaccel.ir.HostToDevice;
import com.planaccel.ir.Limit;
import com.planaccel.ir.Literal;
import com.planaccel.ir.PlanNode;
import com.planaccel.ir.Representation;
import com.planaccel.ir.ScalarFunction;
import com.planaccel.ir.Scan;
import com.planaccel.rules.CapabilityRegistry;
import com.planaccel.rules.ChildPolicy;
import com.planaccel.rules.ExpressionRules;
import com.planaccel.rules.ReplacementRule;
import com.planaccel.tagging.AccelerationConfig;
import com.planaccel.tagging.CompatibilityTagger;
import com.planaccel.types.DataType;
import com.planaccel.types.DataTypes;
import com.planaccel.types.StructType;
import com.planaccel.types.TypeSignatures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanRewriterTest {

    private final PlanRewriter rewriter = new PlanRewriter();

    private static RewriteResult rewrite(PlanNode root, AccelerationConfig config) {
        return rewrite(CapabilityRegistry.global(), root, config);
    }

    private static RewriteResult rewrite(CapabilityRegistry registry, PlanNode root, AccelerationConfig config) {
        return new PlanRewriter().rewrite(new CompatibilityTagger(registry).tag(root, config));
    }

    private static Scan ordersScan() {
        Map<String, DataType> columns = new LinkedHashMap<>();
        columns.put("order_id", DataTypes.LONG);
        columns.put("amount", DataTypes.DOUBLE);
        return new Scan("orders", StructType.fromColumns(columns), OptionalLong.of(1_000));
    }

    private static Filter filterOrders() {
        return new Filter(ordersScan(), new ScalarFunction("GreaterThan", DataTypes.BOOLEAN, List.of(
                new ColumnRef("amount", DataTypes.DOUBLE),
                new Literal(DataTypes.DOUBLE, 10.0))));
    }

    @Test
    @DisplayName("a fully accepted plan is replaced and downloaded once at the root")
    void fullyAccepted() {
        Filter filter = filterOrders();
        RewriteResult result = rewrite(filter, AccelerationConfig.defaults());

        assertThat(result.wasRewritten()).isTrue();
        PlanNode root = result.getRoot();
        assertThat(root).isInstanceOf(DeviceToHost.class);
        PlanNode accelerated = ((DeviceToHost) root).getChild();
        assertThat(accelerated).isInstanceOf(AcceleratedNode.class);
        assertThat(accelerated.getNodeKind()).isEqualTo("Filter");
        assertThat(((AcceleratedNode) accelerated).getReplacedNode()).isSameAs(filter);
        assertThat(accelerated.getOutputType()).isEqualTo(filter.getOutputType());
        assertThat(accelerated.getChildren()).allSatisfy(child -> {
            assertThat(child).isInstanceOf(AcceleratedNode.class);
            assertThat(child.getRepresentation()).isEqualTo(Representation.DEVICE);
        });
        assertThat(accelerated.getChildren().get(1).getChildren()).allSatisfy(child ->
                assertThat(child).isInstanceOf(AcceleratedNode.class));
    }

    @Test
    @DisplayName("when every node is rejected the same tree comes back")
    void allRejectedKeepsShape() {
        Filter filter = filterOrders();
        String before = filter.toString();

        RewriteResult result = rewrite(filter, AccelerationConfig.builder().enabled(false).build());

        assertThat(result.getRoot()).isSameAs(filter);
        assertThat(result.wasRewritten()).isFalse();
        assertThat(result.getDecisions()).noneMatch(decision -> decision.isAccepted());
        assertThat(filter.toString()).isEqualTo(before);
    }

    @Test
    void hostInputUnderAcceleratedParentIsUploaded() {
        Filter filter = filterOrders();
        RewriteResult result = rewrite(filter, AccelerationConfig.builder().disableKind("Scan").build());

        PlanNode accelerated = ((DeviceToHost) result.getRoot()).getChild();
        assertThat(accelerated.getNodeKind()).isEqualTo("Filter");
        PlanNode input = accelerated.getChildren().get(0);
        assertThat(input).isInstanceOf(HostToDevice.class);
        assertThat(((HostToDevice) input).getChild()).isSameAs(filter.getInput());
    }

    @Test
    void acceleratedInputUnderHostParentIsDownloaded() {
        Filter filter = filterOrders();
        RewriteResult result = rewrite(filter, AccelerationConfig.builder().disableKind("Filter").build());

        PlanNode root = result.getRoot();
        assertThat(root).isInstanceOf(Filter.class);
        assertThat(root.getRepresentation()).isEqualTo(Representation.HOST);
        PlanNode input = ((Filter) root).getInput();
        assertThat(input).isInstanceOf(DeviceToHost.class);
        assertThat(((DeviceToHost) input).getChild().getNodeKind()).isEqualTo("Scan");
        // expressions of a host node stay in host form even though they were accepted
        assertThat(((Filter) root).getCondition()).isSameAs(filter.getCondition());
    }

    @Test
    void mixedPolicyConsumesHostRowsDirectly() {
        CapabilityRegistry registry = new CapabilityRegistry()
                .registerAll(new ExpressionRules())
                .register(ReplacementRule.builder("Scan").acceleratedSignature(TypeSignatures.ALL).build())
                .register(ReplacementRule.builder("Filter")
                        .acceleratedSignature(TypeSignatures.ALL)
                        .childPolicy(0, ChildPolicy.MIXED)
                        .build())
                .seal();
        Filter filter = filterOrders();

        RewriteResult result = rewrite(registry, filter, AccelerationConfig.builder().disableKind("Scan").build());

        PlanNode accelerated = ((DeviceToHost) result.getRoot()).getChild();
        assertThat(accelerated.getChildren().get(0)).isSameAs(filter.getInput());
    }

    @Test
    void expressionRootIsRewrittenWithoutAdapters() {
        PlanNode acos = new ScalarFunction("Acos", DataTypes.DOUBLE, List.of(new Literal(DataTypes.DOUBLE, 0.5)));
        RewriteResult result = rewrite(acos, AccelerationConfig.defaults());

        assertThat(result.getRoot()).isInstanceOf(AcceleratedNode.class);
        assertThat(result.getRoot().getNodeKind()).isEqualTo("Acos");
    }

    @Test
    void rewriterReadsOnlyTheDecisions() {
        Filter filter = filterOrders();
        RewriteResult first = rewriter.rewrite(new CompatibilityTagger(CapabilityRegistry.global())
                .tag(filter, AccelerationConfig.defaults()));
        RewriteResult second = rewriter.rewrite(first.getTaggedPlan());

        assertThat(second.getRoot()).isEqualTo(first.getRoot());
        assertThat(second.getOriginal()).isSameAs(filter);
    }

    @Test
    @DisplayName("Acos over a literal without a rule keeps the literal as its host-side input")
    void hostValueUnderAcceleratedExpression() {
        CapabilityRegistry registry = new CapabilityRegistry()
                .register(ReplacementRule.builder("Acos").acceleratedSignature(TypeSignatures.DOUBLE).build())
                .seal();
        Literal half = new Literal(DataTypes.DOUBLE, 0.5);
        PlanNode acos = new ScalarFunction("Acos", DataTypes.DOUBLE, List.of(half));

        RewriteResult result = rewrite(registry, acos, AccelerationConfig.defaults());

        assertThat(result.getRoot()).isInstanceOf(AcceleratedNode.class);
        assertThat(result.getRoot().getChildren()).containsExactly(half);
        assertThat(result.getRoot().getChildren().get(0)).isSameAs(half);
    }

    @Test
    @DisplayName("a chain of 100k limits is rewritten without exhausting the call stack")
    void deepTreesAreRewritten() {
        int depth = 100_000;
        Scan scan = ordersScan();
        PlanNode plan = scan;
        for (int i = 0; i < depth; i++) {
            plan = new Limit(plan, i);
        }

        RewriteResult result = rewrite(plan, AccelerationConfig.builder().disableKind("Scan").build());

        PlanNode node = ((DeviceToHost) result.getRoot()).getChild();
        for (int i = 0; i < depth; i++) {
            assertThat(node).isInstanceOf(AcceleratedNode.class);
            node = node.getChildren().get(0);
        }
        assertThat(node).isInstanceOf(HostToDevice.class);
        assertThat(((HostToDevice) node).getChild()).isSameAs(scan);
    }

    @Test
    @DisplayName("adapters are idempotent and undo each other")
    void adapterIdempotence() {
        Scan host = ordersScan();
        PlanNode device = new AcceleratedNode(host, List.of());

        assertThat(BoundaryAdapters.toHost(host)).isSameAs(host);
        assertThat(BoundaryAdapters.toDevice(device)).isSameAs(device);

        PlanNode uploaded = BoundaryAdapters.toDevice(host);
        assertThat(uploaded).isInstanceOf(HostToDevice.class);
        assertThat(BoundaryAdapters.toDevice(uploaded)).isSameAs(uploaded);
        assertThat(BoundaryAdapters.toHost(uploaded)).isSameAs(host);

        PlanNode downloaded = BoundaryAdapters.toHost(device);
        assertThat(downloaded).isInstanceOf(DeviceToHost.class);
        assertThat(BoundaryAdapters.toHost(downloaded)).isSameAs(downloaded);
        assertThat(BoundaryAdapters.toDevice(downloaded)).isSameAs(device);
    }

    @Test
    void expressionsNeverCrossTheBoundary() {
        assertThatThrownBy(() -> BoundaryAdapters.toDevice(new Literal(DataTypes.INT, 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mapsCannotBeTransferred() {
        assertThat(BoundaryAdapters.canTransfer(ordersScan().getOutputType())).isTrue();
        assertThat(BoundaryAdapters.canTransfer(DataTypes.structOf(List.of(
                DataTypes.field("m", DataTypes.mapOf(DataTypes.STRING, DataTypes.INT)))))).isFalse();
    }
}
