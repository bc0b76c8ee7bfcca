package com.surveyprep.surveyprep.missing;

import com.surveyprep.surveyprep.pipeline.PipelineOptions;
import com.surveyprep.surveyprep.pipeline.RunIssues;
import com.surveyprep.surveyprep.schema.SchemaResolver;
import com.surveyprep.surveyprep.schema.SkipRule;
import com.surveyprep.surveyprep.schema.SurveySchema;
import com.surveyprep.surveyprep.table.Table;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class MissingValueHandlerTest {

    private static final String SKIP = PipelineOptions.DEFAULT_SKIP_SENTINEL;

    private final MissingValueHandler handler = new MissingValueHandler();

    @Test
    void shouldBinarizeOptionsAndFillSkippedDependents() {
        PipelineOptions options = PipelineOptions.builder()
                .skipRule(SkipRule.of("Q2", "Q1_1", List.of("1")))
                .build();
        Table raw = table(List.of("회원ID", "Q1_1", "Q1_2", "Q1_3", "Q2"),
                new Object[]{"A", "1", "", "3", "5"},
                new Object[]{"B", 0, null, 1, "4"});

        Table result = handler.handle(raw, schema(raw, options), options);

        assertEquals(Arrays.asList("A", 1, 0, 1, "5"), result.row(0));
        assertEquals(Arrays.asList("B", 0, 0, 1, SKIP), result.row(1));
    }

    @Test
    void shouldNotChangeTableOnSecondApplication() {
        PipelineOptions options = PipelineOptions.builder()
                .skipRule(SkipRule.of("Q3", "Q2", List.of("1")))
                .skipRule(SkipRule.of("Q2", "Q1", List.of("1", "2")))
                .build();
        Table raw = table(List.of("회원ID", "Q1", "Q2", "Q3_1", "Q3_2"),
                new Object[]{"A", 1, 1, "x", null},
                new Object[]{"B", 1, 2, 1, 1},
                new Object[]{"C", 3, 1, 1, 0});
        SurveySchema schema = schema(raw, options);

        Table once = handler.handle(raw, schema, options);
        Table twice = handler.handle(once, schema, options);

        assertEquals(once.columns(), twice.columns());
        assertEquals(once.rows(), twice.rows());
    }

    @Test
    void shouldLetSkipSentinelOverrideComputedIndicators() {
        PipelineOptions options = PipelineOptions.builder()
                .skipRule(SkipRule.of("Q3", "Q2", List.of("1")))
                .build();
        Table raw = table(List.of("회원ID", "Q2", "Q3_1", "Q3_2"),
                new Object[]{"A", 1, 1, null},
                new Object[]{"B", 2, 1, null});

        Table result = handler.handle(raw, schema(raw, options), options);

        assertEquals(Arrays.asList("A", 1, 1, 0), result.row(0));
        assertEquals(Arrays.asList("B", 2, SKIP, SKIP), result.row(1));
    }

    @Test
    void shouldPropagateSkipThroughChainedGatesRegardlessOfDeclarationOrder() {
        PipelineOptions options = PipelineOptions.builder()
                .skipRule(SkipRule.of("Q3", "Q2", List.of("1")))
                .skipRule(SkipRule.of("Q2", "Q1", List.of("1")))
                .build();
        Table raw = table(List.of("회원ID", "Q1", "Q2", "Q3"),
                new Object[]{"A", 2, 1, 5});

        Table result = handler.handle(raw, schema(raw, options), options);

        assertEquals(Arrays.asList("A", 2, SKIP, SKIP), result.row(0));
    }

    @Test
    void shouldMatchGateValuesAcrossNumericRepresentations() {
        PipelineOptions options = PipelineOptions.builder()
                .skipRule(SkipRule.of("Q2", "Q1", List.of("1")))
                .build();
        Table raw = table(List.of("회원ID", "Q1", "Q2"),
                new Object[]{"A", 1.0d, "yes"},
                new Object[]{"B", "1", "yes"},
                new Object[]{"C", 1L, "yes"});

        Table result = handler.handle(raw, schema(raw, options), options);

        assertEquals(List.of("yes", "yes", "yes"), result.column("Q2"));
    }

    @Test
    void shouldProduceSameOutputForSameInput() {
        PipelineOptions options = PipelineOptions.builder()
                .skipRule(SkipRule.of("Q2", "Q1_1", List.of("1")))
                .build();
        Table raw = table(List.of("회원ID", "Q1_1", "Q1_2", "Q2"),
                new Object[]{"A", 1, null, 3},
                new Object[]{"B", null, 1, 4});
        SurveySchema schema = schema(raw, options);

        assertEquals(handler.handle(raw, schema, options).rows(), handler.handle(raw, schema, options).rows());
    }

    @Test
    void shouldLeaveInputTableUntouched() {
        PipelineOptions options = PipelineOptions.defaults();
        Table raw = table(List.of("회원ID", "Q1_1", "Q1_2"),
                new Object[]{"A", "x", null});

        handler.handle(raw, schema(raw, options), options);

        assertEquals(Arrays.asList("A", "x", null), raw.row(0));
    }

    @Test
    void shouldFillCategoricalBlanksOnlyWhenEnabled() {
        Table raw = table(List.of("회원ID", "region", "age"),
                new Object[]{"A", "서울", 21},
                new Object[]{"B", null, null},
                new Object[]{"C", "부산", 35},
                new Object[]{"D", "서울", 44});

        PipelineOptions defaults = PipelineOptions.defaults();
        Table untouched = handler.handle(raw, schema(raw, defaults), defaults);
        assertNull(untouched.get(1, "region"));

        PipelineOptions enabled = PipelineOptions.builder()
                .fillCategoricalBlanks(true)
                .categoricalDistinctLimit(2)
                .build();
        Table filled = handler.handle(raw, schema(raw, enabled), enabled);
        assertEquals(SKIP, filled.get(1, "region"));
        assertNull(filled.get(1, "age"));
    }

    @Test
    void shouldKeepSentinelWhenBinarizing() {
        assertEquals(SKIP, MissingValueHandler.binarize(SKIP, SKIP));
        assertEquals(MissingValueHandler.SELECTED, MissingValueHandler.binarize("Brand A", SKIP));
        assertEquals(MissingValueHandler.NOT_SELECTED, MissingValueHandler.binarize("0", SKIP));
        assertEquals(MissingValueHandler.NOT_SELECTED, MissingValueHandler.binarize(" ", SKIP));
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
