package com.planaccel;

import com.planaccel.ir.PlanNode;
import com.planaccel.rewrite.PlanRewriter;
import com.planaccel.rewrite.RewriteResult;
import com.planaccel.rules.CapabilityRegistry;
import com.planaccel.tagging.AccelerationConfig;
import com.planaccel.tagging.CompatibilityTagger;
import com.planaccel.tagging.ExplainMode;
import com.planaccel.tagging.TagDecision;
import com.planaccel.tagging.TaggedPlan;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Runs tagging and rewriting for a host plan and logs the explain output the
 * configuration asks for. Stateless apart from the sealed registry, so one planner
 * can serve concurrent callers.
 */
public class AcceleratedPlanner {

    private static final Logger LOGGER = LogManager.getLogger(AcceleratedPlanner.class);

    private final CompatibilityTagger tagger;
    private final PlanRewriter rewriter = new PlanRewriter();
    private final AccelerationConfig config;

    /**
     * Constructor.
     * @param registry A sealed registry.
     * @param config Runtime settings applied to every plan.
     */
    public AcceleratedPlanner(CapabilityRegistry registry, AccelerationConfig config) {
        this.tagger = new CompatibilityTagger(Objects.requireNonNull(registry, "registry is null"));
        this.config = Objects.requireNonNull(config, "config is null");
    }

    public AcceleratedPlanner(AccelerationConfig config) {
        this(CapabilityRegistry.global(), config);
    }

    public AccelerationConfig getConfig() {
        return config;
    }

    /**
     * Tags and rewrites a plan.
     * @param plan The root of a typed host plan; it is not modified.
     * @return The rewritten plan together with the decisions.
     * @throws com.planaccel.tagging.StructuralTreeException if the tree is malformed
     */
    public RewriteResult plan(PlanNode plan) {
        TaggedPlan tagged = tagger.tag(plan, config);
        RewriteResult result = rewriter.rewrite(tagged);

        ExplainMode mode = config.getExplainMode();
        if (mode != ExplainMode.NONE) {
            String explain = PlanExplainer.explain(tagged, mode);
            if (!explain.isEmpty()) {
                if (tagged.isFullyAccepted()) {
                    LOGGER.info("Plan explain:\n{}", explain);
                } else {
                    LOGGER.warn("Parts of the plan will not run on the accelerator:\n{}", explain);
                }
            }
        }
        long accepted = tagged.getDecisions().stream().filter(TagDecision::isAccepted).count();
        LOGGER.info("Planned {}: {} of {} nodes accelerated", plan.getNodeKind(), accepted, tagged.getDecisions().size());
        return result;
    }
}
