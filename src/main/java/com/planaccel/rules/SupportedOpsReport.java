package com.planaccel.rules;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.planaccel.types.DataType;
import com.planaccel.types.DataTypes;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tabulates which data types every registered kind supports, as CSV:
 * one row per rule, one column per representative type.
 */
public class SupportedOpsReport {

    public enum SupportLevel {
        /** Supported on the accelerator. */
        S,
        /** Supported on the host only. */
        H,
        /** Not supported. */
        NS
    }

    /** Column label to the representative type checked for that column. */
    static final Map<String, DataType> REPRESENTATIVE_TYPES = representativeTypes();

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    private final CapabilityRegistry registry;

    public SupportedOpsReport(CapabilityRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry is null");
    }

    public static SupportLevel supportLevel(ReplacementRule rule, DataType type) {
        if (rule.getAcceleratedSignature().contains(type)) {
            return SupportLevel.S;
        }
        if (rule.getHostSignature().contains(type)) {
            return SupportLevel.H;
        }
        return SupportLevel.NS;
    }

    public String render() {
        StringWriter out = new StringWriter();
        try (SequenceWriter rows = CSV_MAPPER.writer(schema()).writeValues(out)) {
            for (ReplacementRule rule : registry.rules()) {
                rows.write(row(rule));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render the supported operations report", e);
        }
        return out.toString();
    }

    static CsvSchema schema() {
        CsvSchema.Builder builder = CsvSchema.builder()
                .addColumn("Kind")
                .addColumn("Description");
        REPRESENTATIVE_TYPES.keySet().forEach(builder::addColumn);
        return builder.addColumn("Notes").setUseHeader(true).build();
    }

    private static Map<String, String> row(ReplacementRule rule) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("Kind", rule.getNodeKind());
        row.put("Description", rule.getDescription());
        REPRESENTATIVE_TYPES.forEach((label, type) -> row.put(label, supportLevel(rule, type).name()));
        row.put("Notes", notes(rule));
        return row;
    }

    private static String notes(ReplacementRule rule) {
        List<String> notes = new ArrayList<>();
        if (!rule.getAliases().isEmpty()) {
            notes.add("aliases " + String.join(" ", rule.getAliases()));
        }
        rule.getIncompatibleNote().ifPresent(note -> notes.add("incompatible: " + note));
        rule.getDisabledByDefaultReason().ifPresent(reason -> notes.add("disabled by default: " + reason));
        return String.join("; ", notes);
    }

    private static Map<String, DataType> representativeTypes() {
        Map<String, DataType> types = new LinkedHashMap<>();
        types.put("BOOLEAN", DataTypes.BOOLEAN);
        types.put("BYTE", DataTypes.BYTE);
        types.put("SHORT", DataTypes.SHORT);
        types.put("INT", DataTypes.INT);
        types.put("LONG", DataTypes.LONG);
        types.put("FLOAT", DataTypes.FLOAT);
        types.put("DOUBLE", DataTypes.DOUBLE);
        types.put("DATE", DataTypes.DATE);
        types.put("TIMESTAMP", DataTypes.TIMESTAMP);
        types.put("STRING", DataTypes.STRING);
        types.put("DECIMAL_64", DataTypes.decimal(18, 2));
        types.put("DECIMAL_128", DataTypes.decimal(38, 10));
        types.put("NULL", DataTypes.NULL);
        types.put("BINARY", DataTypes.BINARY);
        types.put("ARRAY", DataTypes.arrayOf(DataTypes.INT));
        types.put("MAP", DataTypes.mapOf(DataTypes.STRING, DataTypes.STRING));
        types.put("STRUCT", DataTypes.structOf(List.of(DataTypes.field("a", DataTypes.INT))));
        return types;
    }
}
