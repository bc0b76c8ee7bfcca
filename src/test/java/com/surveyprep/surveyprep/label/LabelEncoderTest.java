package com.surveyprep.surveyprep.label;

import com.surveyprep.surveyprep.pipeline.IssueKind;
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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LabelEncoderTest {

    private static final String SKIP = PipelineOptions.DEFAULT_SKIP_SENTINEL;

    private final LabelEncoder encoder = new LabelEncoder();

    @Test
    void shouldReplaceCodesWithSameRowLabelsAndDropTextColumn() {
        Table raw = table(List.of("회원ID", "Q2", "Q2(TEXT)"),
                new Object[]{"A", 1, "Male"},
                new Object[]{"B", 2, "Female"},
                new Object[]{"C", 1, "Man"});
        RunIssues issues = new RunIssues();

        LabelEncoding encoding = encode(raw, PipelineOptions.defaults(), issues);

        assertEquals(List.of("회원ID", "Q2"), encoding.table().columns());
        assertEquals(List.of("Male", "Female", "Man"), encoding.table().column("Q2"));
        assertTrue(issues.toReport().isClean());
    }

    @Test
    void shouldKeepCodeWhenLabelIsBlankAndReportIt() {
        Table raw = table(List.of("회원ID", "Q2", "Q2(TEXT)"),
                new Object[]{"A", 1, "Male"},
                new Object[]{"B", 3, null},
                new Object[]{"C", 2, " "},
                new Object[]{"D", SKIP, null});
        RunIssues issues = new RunIssues();

        LabelEncoding encoding = encode(raw, PipelineOptions.defaults(), issues);

        assertEquals(Arrays.asList("Male", 3, 2, SKIP), encoding.table().column("Q2"));
        assertEquals(2, issues.count(IssueKind.MISSING_LABEL_PAIR));
    }

    @Test
    void shouldKeepSkipSentinelInsteadOfPairedLabel() {
        Table filled = table(List.of("회원ID", "Q2", "Q2(TEXT)"),
                new Object[]{"A", 1, "Yes"},
                new Object[]{"B", SKIP, "No"});
        RunIssues issues = new RunIssues();

        LabelEncoding encoding = encode(filled, PipelineOptions.defaults(), issues);

        assertEquals(List.of("Yes", SKIP), encoding.table().column("Q2"));
        assertTrue(issues.toReport().isClean());
    }

    @Test
    void shouldNotRenameOptionsOntoReservedColumnNames() {
        Table raw = table(List.of("회원ID", "Q1_1", "Q1_1(TEXT)", "Q1_2", "Q1_2(TEXT)", "Q1_3", "Q1_3(TEXT)"),
                new Object[]{"A", 1, "weight", 0, "value", 1, "Brand C"});

        LabelEncoding encoding = encode(raw, PipelineOptions.defaults(), new RunIssues());

        assertEquals(List.of("회원ID", "weight_1", "value_1", "Brand C"), encoding.table().columns());
        assertEquals(Map.of("weight_1", "weight", "value_1", "value", "Brand C", "Brand C"),
                encoding.schema().optionLabels());
    }

    @Test
    void shouldKeepLabelColumnsWhenConfigured() {
        Table raw = table(List.of("회원ID", "Q2", "Q2(TEXT)"),
                new Object[]{"A", 1, "Male"});
        PipelineOptions options = PipelineOptions.builder().dropLabelColumns(false).build();

        LabelEncoding encoding = encode(raw, options, new RunIssues());

        assertEquals(List.of("회원ID", "Q2", "Q2(TEXT)"), encoding.table().columns());
        assertEquals("Male", encoding.table().get(0, "Q2"));
    }

    @Test
    void shouldRenameOptionColumnsAndUpdateSchema() {
        Table raw = table(List.of("회원ID", "Q1_1", "Q1_1(TEXT)", "Q1_2", "Q1_2(TEXT)"),
                new Object[]{"A", 0, null, 1, "Brand B"},
                new Object[]{"B", 1, "Brand A", 0, null});

        LabelEncoding encoding = encode(raw, PipelineOptions.defaults(), new RunIssues());

        assertEquals(List.of("회원ID", "Brand A", "Brand B"), encoding.table().columns());
        assertEquals(Arrays.asList(0, 1), encoding.table().column("Brand A"));
        assertEquals(new MrSet("Q1", List.of("Brand A", "Brand B")), encoding.schema().mrSet("Q1").orElseThrow());
        assertEquals(Map.of("Brand A", "Brand A", "Brand B", "Brand B"), encoding.schema().optionLabels());
    }

    @Test
    void shouldDisambiguateDuplicateOptionLabels() {
        Table raw = table(List.of("회원ID", "Q1_1", "Q1_1(TEXT)", "Q1_2", "Q1_2(TEXT)"),
                new Object[]{"A", 1, "Other", 1, "Other"});

        LabelEncoding encoding = encode(raw, PipelineOptions.defaults(), new RunIssues());

        assertEquals(List.of("회원ID", "Other", "Other_1"), encoding.table().columns());
        assertEquals(List.of("Other", "Other_1"), encoding.schema().mrSet("Q1").orElseThrow().members());
    }

    @Test
    void shouldRecordOptionLabelsWithoutRenamingWhenDisabled() {
        Table raw = table(List.of("회원ID", "Q1_1", "Q1_1(TEXT)", "Q1_2", "Q1_2(TEXT)"),
                new Object[]{"A", 1, "Brand A", 0, null});
        PipelineOptions options = PipelineOptions.builder().renameMrColumns(false).build();
        RunIssues issues = new RunIssues();

        LabelEncoding encoding = encode(raw, options, issues);

        assertEquals(List.of("회원ID", "Q1_1", "Q1_2"), encoding.table().columns());
        assertEquals(Map.of("Q1_1", "Brand A"), encoding.schema().optionLabels());
        assertEquals(1, issues.count(IssueKind.MISSING_LABEL_PAIR));
    }

    @Test
    void shouldReportNumericColumnsWithoutLabelPair() {
        Table raw = table(List.of("회원ID", "age", "comment", "Q2", "Q2(TEXT)"),
                new Object[]{"A", 21, "good", 1, "Male"},
                new Object[]{"B", "35", "bad", 2, "Female"});
        RunIssues issues = new RunIssues();

        LabelEncoding encoding = encode(raw, PipelineOptions.defaults(), issues);

        assertEquals(1, issues.count(IssueKind.MISSING_LABEL_PAIR));
        assertEquals(List.of(21, "35"), encoding.table().column("age"));
    }

    @Test
    void shouldLeaveInputTableUntouched() {
        Table raw = table(List.of("회원ID", "Q2", "Q2(TEXT)"),
                new Object[]{"A", 1, "Male"});

        encode(raw, PipelineOptions.defaults(), new RunIssues());

        assertEquals(Arrays.asList("A", 1, "Male"), raw.row(0));
        assertFalse(raw.columns().isEmpty());
    }

    private LabelEncoding encode(Table table, PipelineOptions options, RunIssues issues) {
        SurveySchema schema = new SchemaResolver().resolve(table.columns(), options, new RunIssues());
        return encoder.encode(table, schema, options, issues);
    }

    private Table table(List<String> columns, Object[]... rows) {
        List<List<Object>> data = new ArrayList<>();
        for (Object[] row : rows) {
            data.add(Arrays.asList(row));
        }
        return Table.of(columns, data);
    }
}
