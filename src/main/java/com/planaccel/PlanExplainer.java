package com.planaccel;

import com.planaccel.ir.NodeCategory;
import com.planaccel.ir.PlanNode;
import com.planaccel.tagging.ExplainMode;
import com.planaccel.tagging.TagDecision;
import com.planaccel.tagging.TaggedPlan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders tagging decisions as indented explain text, one line per node:
 * <pre>
 * *Exec &lt;Filter&gt; will run on the accelerator
 *   !Exec &lt;Scan&gt; cannot run on the accelerator because output type ... not in signature
 *   @Expression &lt;ColumnRef&gt; could run on the accelerator but its owning node stays on the host
 * </pre>
 * In {@link ExplainMode#NOT_ON_ACCELERATOR} mode only the {@code !} and {@code @} lines are kept.
 */
public final class PlanExplainer {

    private static final String INDENT = "  ";

    private PlanExplainer() {}

    public static String explain(TaggedPlan tagged, ExplainMode mode) {
        Objects.requireNonNull(tagged, "tagged is null");
        Objects.requireNonNull(mode, "mode is null");
        if (mode == ExplainMode.NONE) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        explain(tagged.getRoot(), "", true, tagged, mode, lines);
        return String.join("\n", lines);
    }

    /**
     * Renders a plan tree, one node per line, children indented below their parent.
     */
    public static String tree(PlanNode root) {
        return root.toString("");
    }

    private static void explain(PlanNode node, String indent, boolean ownerAccepted, TaggedPlan tagged,
                                ExplainMode mode, List<String> lines) {
        TagDecision decision = tagged.decisionFor(node);
        boolean expression = node.getCategory() == NodeCategory.EXPRESSION;
        String label = (expression ? "Expression" : "Exec") + " <" + node.getNodeKind() + ">";
        String line;
        if (!decision.isAccepted()) {
            line = "!" + label + " cannot run on the accelerator because " + decision.getReason();
        } else if (expression && !ownerAccepted) {
            line = "@" + label + " could run on the accelerator but its owning node stays on the host";
        } else {
            line = mode == ExplainMode.ALL ? "*" + label + " will run on the accelerator" : null;
        }
        if (line != null) {
            lines.add(indent + line);
        }
        // expressions inherit their owner; relations start fresh
        for (PlanNode child : node.getChildren()) {
            boolean childOwnerAccepted = child.getCategory() == NodeCategory.EXPRESSION
                    ? decision.isAccepted() && (!expression || ownerAccepted)
                    : true;
            explain(child, indent + INDENT, childOwnerAccepted, tagged, mode, lines);
        }
    }
}
