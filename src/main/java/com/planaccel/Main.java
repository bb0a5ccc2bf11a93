package com.planaccel;

import com.planaccel.ir.PlanNode;
import com.planaccel.rewrite.RewriteResult;
import com.planaccel.rules.CapabilityRegistry;
import com.planaccel.rules.SupportedOpsReport;
import com.planaccel.tagging.AccelerationConfig;
import com.planaccel.tagging.ExplainMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point.
 * <pre>
 * Main [--config file.yaml] "SELECT ..." ["SELECT ..." ...]
 * Main --supported-ops
 * </pre>
 * Without {@code --config} the {@code accelerator.yaml} classpath resource is used.
 */
public class Main {

    private static final Logger LOGGER = LogManager.getLogger(Main.class);

    public static void main(String[] args) {
        List<String> queries = new ArrayList<>();
        Path configFile = null;
        boolean supportedOps = false;
        for (int i = 0; i < args.length; i++) {
            if ("--supported-ops".equals(args[i])) {
                supportedOps = true;
            } else if ("--config".equals(args[i]) && i + 1 < args.length) {
                configFile = Path.of(args[++i]);
            } else {
                queries.add(args[i]);
            }
        }

        if (supportedOps) {
            System.out.print(new SupportedOpsReport(CapabilityRegistry.global()).render());
            return;
        }

        // --- Load Config ---
        Config config;
        try {
            config = configFile != null ? Config.loadFromFile(configFile) : Config.loadFromResources("accelerator.yaml");
            LOGGER.info("Configuration loaded, tables: {}", config.getTables().keySet());
        } catch (RuntimeException e) {
            LOGGER.fatal("Configuration loading failed: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        if (queries.isEmpty()) {
            System.err.println("Usage: Main [--config file.yaml] <sql>... | --supported-ops");
            System.exit(2);
            return;
        }

        AccelerationConfig accelerationConfig = config.toAccelerationConfig();
        SqlPlanBuilder builder = new SqlPlanBuilder(config);
        AcceleratedPlanner planner = new AcceleratedPlanner(accelerationConfig);
        // always print the explain, even when logging it is switched off
        ExplainMode printMode = accelerationConfig.getExplainMode() == ExplainMode.NONE
                ? ExplainMode.ALL : accelerationConfig.getExplainMode();

        int failures = 0;
        for (String sql : queries) {
            System.out.println("--- " + sql);
            try {
                PlanNode plan = builder.build(sql);
                RewriteResult result = planner.plan(plan);
                System.out.println(PlanExplainer.explain(result.getTaggedPlan(), printMode));
                System.out.println();
                System.out.println(PlanExplainer.tree(result.getRoot()));
            } catch (RuntimeException e) {
                failures++;
                LOGGER.error("Planning failed for query: {}", sql, e);
            }
        }
        if (failures > 0) {
            System.exit(1);
        }
    }
}
