package com.planaccel;

import com.planaccel.tagging.AccelerationConfig;
import com.planaccel.tagging.ExplainMode;
import com.planaccel.types.DataTypes;
import com.planaccel.types.StructType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class ConfigTest {

    @Test
    void loadsTablesInDeclarationOrder() {
        Config config = Config.loadFromResources("accelerator.yaml");

        assertThat(config.getTables()).containsOnlyKeys("orders", "customers", "events");
        StructType orders = config.getTableSchema("orders");
        assertThat(orders.toString())
                .isEqualTo("STRUCT<order_id:LONG,customer_id:LONG,amount:DECIMAL(10,2),ratio:DOUBLE,status:STRING>");
        assertThat(config.getTable("orders").estimatedSize()).hasValue(50_000_000L);
        assertThat(config.getTable("events").estimatedSize()).isEmpty();
        assertThat(config.getTableSchema("customers").getFields().get(2).getType())
                .isEqualTo(DataTypes.arrayOf(DataTypes.STRING));
    }

    @Test
    void convertsToRuntimeSettings() {
        AccelerationConfig runtime = Config.loadFromResources("accelerator.yaml").toAccelerationConfig();

        assertThat(runtime.isEnabled()).isTrue();
        assertThat(runtime.isStrictArithmetic()).isFalse();
        assertThat(runtime.getMemoryBudgetBytes()).isEqualTo(1_000_000L);
        assertThat(runtime.isDisabled("Sort")).isTrue();
        assertThat(runtime.isDisabled("Filter")).isFalse();
        assertThat(runtime.getExplainMode()).isEqualTo(ExplainMode.ALL);
    }

    @Test
    void missingSectionsFallBackToDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("minimal.yaml");
        Files.write(file, "tables:\n  t:\n    schema:\n      - x: INT\n".getBytes(StandardCharsets.UTF_8));

        Config config = Config.loadFromFile(file);

        assertThat(config.toAccelerationConfig().getMemoryBudgetBytes())
                .isEqualTo(AccelerationConfig.DEFAULT_MEMORY_BUDGET_BYTES);
        assertThat(config.toAccelerationConfig().getExplainMode()).isEqualTo(ExplainMode.NONE);
        assertThat(config.getTableSchema("t").getFields()).hasSize(1);
    }

    @Test
    void unknownTableIsRejected() {
        Config config = Config.loadFromResources("accelerator.yaml");
        assertThatThrownBy(() -> config.getTable("lineitem"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Table definition not found in config: lineitem");
    }

    @Test
    void invalidTypeFailsAtLoadTime(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("bad.yaml");
        Files.write(file, "tables:\n  bad:\n    schema:\n      - x: WIDGET\n".getBytes(StandardCharsets.UTF_8));

        Throwable thrown = catchThrowable(() -> Config.loadFromFile(file));

        assertThat(thrown).isInstanceOf(RuntimeException.class).hasMessageContaining("Failed to load configuration");
        assertThat(thrown.getCause()).hasMessageContaining("Invalid schema for table 'bad'");
    }

    @Test
    void missingResourceFails() {
        assertThatThrownBy(() -> Config.loadFromResources("no-such-file.yaml"))
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining("Cannot find configuration file in classpath");
    }
}
