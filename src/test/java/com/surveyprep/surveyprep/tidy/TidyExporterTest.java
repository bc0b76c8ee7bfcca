package com.surveyprep.surveyprep.tidy;

import com.surveyprep.surveyprep.pipeline.PipelineOptions;
import com.surveyprep.surveyprep.pipeline.RunIssues;
import com.surveyprep.surveyprep.schema.MrSet;
import com.surveyprep.surveyprep.schema.SchemaResolver;
import com.surveyprep.surveyprep.schema.SurveySchema;
import com.surveyprep.surveyprep.table.Table;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TidyExporterTest {

    private final TidyExporter exporter = new TidyExporter();

    @Test
    void shouldEmitOneRowPerRespondentAndOption() {
        Table wide = table(List.of("회원ID", "weight", "Q1_1", "Q1_2", "gender"),
                new Object[]{"A", 1.5d, 1, 0, "M"},
                new Object[]{"B", 0.5d, 0, 1, "F"},
                new Object[]{"C", 1.0d, 1, 1, "F"},
                new Object[]{"D", 1.0d, 0, 0, "M"});
        PipelineOptions options = PipelineOptions.defaults();

        TidyExport tidy = exporter.export(wide, schema(wide, options), options);

        Table q1 = tidy.setTables().get("Q1");
        assertEquals(List.of("회원ID", "weight", "question", "option", "value", "label"), q1.columns());
        assertEquals(8, q1.rowCount());
        for (int r = 0; r < q1.rowCount(); r++) {
            String id = (String) q1.get(r, "회원ID");
            int source = List.of("A", "B", "C", "D").indexOf(id);
            String option = (String) q1.get(r, "option");
            assertEquals(wide.get(source, option), q1.get(r, "value"));
            assertEquals(wide.get(source, "weight"), q1.get(r, "weight"));
            assertEquals("Q1", q1.get(r, "question"));
        }
    }

    @Test
    void shouldOrderRowsRespondentMajor() {
        Table wide = table(List.of("회원ID", "Q1_1", "Q1_2"),
                new Object[]{"A", 1, 0},
                new Object[]{"B", 0, 1});
        PipelineOptions options = PipelineOptions.defaults();

        Table q1 = exporter.export(wide, schema(wide, options), options).setTables().get("Q1");

        assertEquals(List.of("A", "A", "B", "B"), q1.column("회원ID"));
        assertEquals(List.of("Q1_1", "Q1_2", "Q1_1", "Q1_2"), q1.column("option"));
    }

    @Test
    void shouldCombineSetsAndSingleResponsesInMasterTable() {
        Table wide = table(List.of("회원ID", "Q1_1", "Q1_2", "Q2", "Q3_1", "Q3_2", "Q3_3"),
                new Object[]{"A", 1, 0, "Male", 0, 0, 1},
                new Object[]{"B", 0, 1, "Female", 1, 1, 0});
        PipelineOptions options = PipelineOptions.defaults();

        TidyExport tidy = exporter.export(wide, schema(wide, options), options);

        assertEquals(List.of("Q1", "Q3"), new ArrayList<>(tidy.setTables().keySet()));
        assertEquals(4 + 6 + 2, tidy.master().rowCount());
        assertEquals("Q2", tidy.master().get(10, "question"));
        assertEquals("Male", tidy.master().get(10, "value"));
    }

    @Test
    void shouldUseRowPositionWhenIdColumnIsAbsent() {
        Table wide = table(List.of("Q1_1", "Q1_2"),
                new Object[]{1, 0},
                new Object[]{0, 1});
        PipelineOptions options = PipelineOptions.defaults();

        Table q1 = exporter.export(wide, schema(wide, options), options).setTables().get("Q1");

        assertEquals(List.of(1, 1, 2, 2), q1.column(PipelineOptions.DEFAULT_ID_COLUMN));
    }

    @Test
    void shouldCarryConfiguredColumnsAndIgnoreUnknownOnes() {
        Table wide = table(List.of("회원ID", "Q1_1", "Q1_2", "gender", "age"),
                new Object[]{"A", 1, 0, "M", 30});
        PipelineOptions options = PipelineOptions.builder()
                .carryColumns(List.of("gender", "region"))
                .build();

        TidyExport tidy = exporter.export(wide, schema(wide, options), options);

        assertEquals(List.of("회원ID", "gender", "question", "option", "value", "label"),
                tidy.setTables().get("Q1").columns());
        assertEquals(List.of("M", "M"), tidy.setTables().get("Q1").column("gender"));
        assertEquals(2 + 1, tidy.master().rowCount());
        assertEquals("age", tidy.master().get(2, "question"));
    }

    @Test
    void shouldLabelOptionsFromSchemaAndPairedTextColumns() {
        Table wide = table(List.of("회원ID", "Brand A", "Brand B", "Q2", "Q2(TEXT)"),
                new Object[]{"A", 1, 0, 1, "Male"},
                new Object[]{"B", 0, 1, 2, null});
        SurveySchema schema = new SurveySchema(
                List.of(new MrSet("Q1", List.of("Brand A", "Brand B"))),
                List.of(),
                Map.of("Q2", "Q2(TEXT)"),
                Map.of("Brand A", "Brand A", "Brand B", "Brand B"));

        TidyExport tidy = exporter.export(wide, schema, PipelineOptions.defaults());

        assertEquals(List.of("Brand A", "Brand B", "Brand A", "Brand B"), tidy.setTables().get("Q1").column("label"));
        Table master = tidy.master();
        assertEquals(6, master.rowCount());
        assertEquals("Male", master.get(4, "label"));
        assertNull(master.get(5, "label"));
    }

    private SurveySchema schema(Table table, PipelineOptions options) {
        return new SchemaResolver().resolve(table.columns(), options, new RunIssues());
    }

    private Table table(List<String> columns, Object[]... rows) {
        List<List<Object>> data = new ArrayList<>();
        for (Object[] row : rows) {
            data.add(Arrays.asList(row));
        }
        return Table.of(columns, data);
    }
}
