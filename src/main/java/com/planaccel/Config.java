package com.planaccel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.planaccel.tagging.AccelerationConfig;
import com.planaccel.tagging.ExplainMode;
import com.planaccel.types.DataType;
import com.planaccel.types.DataTypeParser;
import com.planaccel.types.StructType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap; // Preserve definition order
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Loads and holds the acceleration settings and the table catalog from a YAML file
 * (see {@code accelerator.yaml}).
 */
public class Config {

    // These field names must match the top-level keys in the YAML file
    private AccelerationSettings acceleration = new AccelerationSettings();
    private Map<String, TableDefinition> tables = new LinkedHashMap<>();

    public AccelerationSettings getAcceleration() {
        return acceleration;
    }

    public void setAcceleration(AccelerationSettings acceleration) {
        this.acceleration = acceleration != null ? acceleration : new AccelerationSettings();
    }

    public Map<String, TableDefinition> getTables() {
        return tables;
    }

    public void setTables(Map<String, TableDefinition> tables) {
        this.tables = tables != null ? tables : new LinkedHashMap<>();
    }

    // --- Inner classes representing the structure in YAML ---

    public static class AccelerationSettings {
        private boolean enabled = true;
        private boolean strictArithmetic;
        private long memoryBudgetBytes = AccelerationConfig.DEFAULT_MEMORY_BUDGET_BYTES;
        private boolean incompatibleOpsEnabled;
        private List<String> disabledKinds = new ArrayList<>();
        private List<String> enabledKinds = new ArrayList<>();
        private ExplainMode explain = ExplainMode.NONE;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isStrictArithmetic() {
            return strictArithmetic;
        }

        public void setStrictArithmetic(boolean strictArithmetic) {
            this.strictArithmetic = strictArithmetic;
        }

        public long getMemoryBudgetBytes() {
            return memoryBudgetBytes;
        }

        public void setMemoryBudgetBytes(long memoryBudgetBytes) {
            this.memoryBudgetBytes = memoryBudgetBytes;
        }

        public boolean isIncompatibleOpsEnabled() {
            return incompatibleOpsEnabled;
        }

        public void setIncompatibleOpsEnabled(boolean incompatibleOpsEnabled) {
            this.incompatibleOpsEnabled = incompatibleOpsEnabled;
        }

        public List<String> getDisabledKinds() {
            return disabledKinds;
        }

        public void setDisabledKinds(List<String> disabledKinds) {
            this.disabledKinds = disabledKinds != null ? disabledKinds : new ArrayList<>();
        }

        public List<String> getEnabledKinds() {
            return enabledKinds;
        }

        public void setEnabledKinds(List<String> enabledKinds) {
            this.enabledKinds = enabledKinds != null ? enabledKinds : new ArrayList<>();
        }

        public ExplainMode getExplain() {
            return explain;
        }

        public void setExplain(ExplainMode explain) {
            this.explain = explain != null ? explain : ExplainMode.NONE;
        }
    }

    public static class TableDefinition {
        // list of single-entry maps so the YAML keeps column order: - name: TYPE
        private List<Map<String, String>> schema;
        private Long estimatedSizeBytes;

        public List<Map<String, String>> getSchema() {
            return schema;
        }

        public void setSchema(List<Map<String, String>> schema) {
            this.schema = schema;
        }

        public Long getEstimatedSizeBytes() {
            return estimatedSizeBytes;
        }

        public void setEstimatedSizeBytes(Long estimatedSizeBytes) {
            this.estimatedSizeBytes = estimatedSizeBytes;
        }

        /**
         * Parses the column types into a row type, preserving column order.
         * @throws IllegalArgumentException if a type string is invalid
         */
        public StructType toRowType() {
            Map<String, DataType> columns = new LinkedHashMap<>();
            if (schema != null) {
                for (Map<String, String> column : schema) {
                    // duplicates keep the first definition
                    column.forEach((name, type) -> columns.putIfAbsent(name, DataTypeParser.parse(type)));
                }
            }
            return StructType.fromColumns(columns);
        }

        public OptionalLong estimatedSize() {
            return estimatedSizeBytes == null ? OptionalLong.empty() : OptionalLong.of(estimatedSizeBytes);
        }
    }

    // --- Loading Logic ---

    /**
     * Loads configuration from the specified classpath resource path.
     * @param resourcePath Path relative to the classpath root (e.g., "accelerator.yaml")
     * @throws RuntimeException if loading fails.
     */
    public static Config loadFromResources(String resourcePath) {
        try (InputStream is = Config.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new RuntimeException("Cannot find configuration file in classpath: " + resourcePath);
            }
            return read(is, resourcePath);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load configuration from " + resourcePath, e);
        }
    }

    public static Config loadFromFile(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return read(is, path.toString());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load configuration from " + path, e);
        }
    }

    private static Config read(InputStream is, String source) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try {
            Config config = mapper.readValue(is, Config.class);
            if (config == null) {
                return new Config(); // empty document
            }
            // fail on bad type strings at load time rather than at first query
            config.getTables().forEach((name, table) -> {
                try {
                    table.toRowType();
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid schema for table '" + name + "': " + e.getMessage(), e);
                }
            });
            return config;
        } catch (IOException | IllegalArgumentException e) {
            throw new RuntimeException("Failed to load configuration from " + source, e);
        }
    }

    // --- Convenience Accessors ---

    /**
     * Gets the definition of a table.
     * @throws IllegalArgumentException if the table is not found.
     */
    public TableDefinition getTable(String tableName) {
        Objects.requireNonNull(tableName, "tableName cannot be null");
        TableDefinition tableDef = tables.get(tableName);
        if (tableDef == null) {
            throw new IllegalArgumentException("Table definition not found in config: " + tableName);
        }
        return tableDef;
    }

    public StructType getTableSchema(String tableName) {
        return getTable(tableName).toRowType();
    }

    public AccelerationConfig toAccelerationConfig() {
        return AccelerationConfig.builder()
                .enabled(acceleration.isEnabled())
                .strictArithmetic(acceleration.isStrictArithmetic())
                .memoryBudgetBytes(acceleration.getMemoryBudgetBytes())
                .incompatibleOpsEnabled(acceleration.isIncompatibleOpsEnabled())
                .disabledKinds(acceleration.getDisabledKinds())
                .enabledKinds(acceleration.getEnabledKinds())
                .explainMode(acceleration.getExplain())
                .build();
    }
}
