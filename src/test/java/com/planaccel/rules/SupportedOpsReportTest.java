package com.planaccel.rules;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.planaccel.types.DataTypes;
import com.planaccel.types.TypeSignatures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SupportedOpsReportTest {

    private static List<Map<String, String>> parse(String csv) throws Exception {
        try (MappingIterator<Map<String, String>> rows = new CsvMapper()
                .readerFor(Map.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(csv)) {
            return rows.readAll();
        }
    }

    private static Map<String, String> rowFor(List<Map<String, String>> rows, String kind) {
        return rows.stream().filter(row -> kind.equals(row.get("Kind"))).findFirst().orElseThrow();
    }

    @Test
    void supportLevelsFollowTheSignaturePair() {
        ReplacementRule acos = ReplacementRule.builder("Acos")
                .acceleratedSignature(TypeSignatures.DOUBLE)
                .hostSignature(TypeSignatures.NUMERIC)
                .build();
        assertThat(SupportedOpsReport.supportLevel(acos, DataTypes.DOUBLE)).isEqualTo(SupportedOpsReport.SupportLevel.S);
        assertThat(SupportedOpsReport.supportLevel(acos, DataTypes.decimal(10, 2))).isEqualTo(SupportedOpsReport.SupportLevel.H);
        assertThat(SupportedOpsReport.supportLevel(acos, DataTypes.STRING)).isEqualTo(SupportedOpsReport.SupportLevel.NS);
    }

    @Test
    void reportHasOneRowPerRule() throws Exception {
        CapabilityRegistry registry = new CapabilityRegistry()
                .registerAll(new RelationRules())
                .seal();
        String csv = new SupportedOpsReport(registry).render();

        assertThat(csv).startsWith("Kind,Description,BOOLEAN,BYTE");
        List<Map<String, String>> rows = parse(csv);
        assertThat(rows).hasSize(registry.rules().size());
        Map<String, String> scan = rowFor(rows, "Scan");
        assertThat(scan.get("MAP")).isEqualTo("H");
        assertThat(scan.get("ARRAY")).isEqualTo("S");
    }

    @Test
    void notesMentionIncompatibilities() throws Exception {
        List<Map<String, String>> rows = parse(new SupportedOpsReport(CapabilityRegistry.global()).render());

        assertThat(rowFor(rows, "Upper").get("Notes")).startsWith("incompatible:");
        assertThat(rowFor(rows, "Average").get("Notes")).isEqualTo("aliases Avg");
    }

    @Test
    void descriptionsAndNotesWithCommasKeepTheirColumns() throws Exception {
        CapabilityRegistry registry = new CapabilityRegistry()
                .register(ReplacementRule.builder("Round")
                        .description("round, half up")
                        .acceleratedSignature(TypeSignatures.DOUBLE)
                        .incompatible("ties differ for -0.5, 0.5")
                        .build())
                .seal();
        String csv = new SupportedOpsReport(registry).render();

        List<Map<String, String>> rows = parse(csv);
        assertThat(rows).hasSize(1);
        Map<String, String> round = rows.get(0);
        assertThat(round).hasSize(SupportedOpsReport.schema().size());
        assertThat(round.get("Description")).isEqualTo("round, half up");
        assertThat(round.get("DOUBLE")).isEqualTo("S");
        assertThat(round.get("Notes")).isEqualTo("incompatible: ties differ for -0.5, 0.5");
    }
}
