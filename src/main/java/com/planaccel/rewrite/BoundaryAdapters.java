package com.planaccel.rewrite;

import com.planaccel.ir.DeviceToHost;
import com.planaccel.ir.HostToDevice;
import com.planaccel.ir.NodeCategory;
import com.planaccel.ir.PlanNode;
import com.planaccel.ir.Representation;
import com.planaccel.types.DataType;
import com.planaccel.types.TypeSignature;
import com.planaccel.types.TypeSignatures;
import com.planaccel.types.TypeTag;

/**
 * Inserts the adapters that move rows between the host and the device.
 *
 * <p>Both directions are idempotent: a node already in the requested representation is returned
 * as is, and adapting back across an adapter removes that adapter instead of stacking a second one.
 */
public final class BoundaryAdapters {

    private BoundaryAdapters() {}

    /**
     * Row types the host-to-device upload can convert. Maps have no columnar upload path.
     */
    public static final TypeSignature TRANSFERABLE = TypeSignatures.COMMON
            .union(TypeSignature.of(TypeTag.BINARY))
            .nested(TypeTag.ARRAY, TypeTag.STRUCT);

    public static boolean canTransfer(DataType rowType) {
        return TRANSFERABLE.contains(rowType);
    }

    public static PlanNode toHost(PlanNode node) {
        requireRelation(node);
        if (node instanceof HostToDevice) {
            return ((HostToDevice) node).getChild();
        }
        if (node.getRepresentation() == Representation.HOST) {
            return node;
        }
        return new DeviceToHost(node);
    }

    public static PlanNode toDevice(PlanNode node) {
        requireRelation(node);
        if (node instanceof DeviceToHost) {
            return ((DeviceToHost) node).getChild();
        }
        if (node.getRepresentation() == Representation.DEVICE) {
            return node;
        }
        return new HostToDevice(node);
    }

    private static void requireRelation(PlanNode node) {
        if (node.getCategory() != NodeCategory.RELATION) {
            throw new IllegalArgumentException("Only relational nodes cross the host/device boundary, got " + node.getNodeKind());
        }
    }
}
