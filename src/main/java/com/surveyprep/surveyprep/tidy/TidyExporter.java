package com.surveyprep.surveyprep.tidy;

import com.surveyprep.surveyprep.pipeline.PipelineOptions;
import com.surveyprep.surveyprep.schema.MrSet;
import com.surveyprep.surveyprep.schema.SurveySchema;
import com.surveyprep.surveyprep.table.Cells;
import com.surveyprep.surveyprep.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reshapes the processed wide table into long tables. Rows are emitted respondent-major, options in schema
 * order, so a set with k members over n respondents always yields exactly n*k rows.
 */
@Component
public class TidyExporter {

    private static final Logger log = LoggerFactory.getLogger(TidyExporter.class);

    public static final String COLUMN_QUESTION = "question";
    public static final String COLUMN_OPTION = "option";
    public static final String COLUMN_VALUE = "value";
    public static final String COLUMN_LABEL = "label";

    public static final Set<String> FIXED_COLUMNS = Set.of(COLUMN_QUESTION, COLUMN_OPTION, COLUMN_VALUE, COLUMN_LABEL);

    public TidyExport export(Table wide, SurveySchema schema, PipelineOptions options) {
        List<String> carried = carriedColumns(wide, schema, options);
        List<String> columns = new ArrayList<>(carried);
        columns.add(0, options.idColumn());
        columns.addAll(List.of(COLUMN_QUESTION, COLUMN_OPTION, COLUMN_VALUE, COLUMN_LABEL));

        Map<String, Table> setTables = new LinkedHashMap<>();
        Table.Builder master = Table.builder(columns);
        for (MrSet set : schema.mrSets()) {
            List<String> members = new ArrayList<>();
            for (String member : set.members()) {
                if (wide.hasColumn(member)) {
                    members.add(member);
                }
            }
            Table.Builder setTable = Table.builder(columns);
            for (int r = 0; r < wide.rowCount(); r++) {
                for (String member : members) {
                    List<Object> row = longRow(wide, r, carried, options, set.name(), member,
                            optionLabel(wide, r, member, schema, options));
                    setTable.addRow(row);
                    master.addRow(row);
                }
            }
            setTables.put(set.name(), setTable.build());
        }

        List<String> singles = singleResponseColumns(wide, schema, carried, options);
        for (int r = 0; r < wide.rowCount(); r++) {
            for (String column : singles) {
                master.addRow(longRow(wide, r, carried, options, column, column, pairedLabel(wide, r, column, schema, options)));
            }
        }

        Table masterTable = master.build();
        log.info("Tidy export complete. respondents={}, setTables={}, masterRows={}",
                wide.rowCount(), setTables.size(), masterTable.rowCount());
        return new TidyExport(setTables, masterTable);
    }

    private List<Object> longRow(Table wide, int r, List<String> carried, PipelineOptions options,
                                 String question, String option, Object label) {
        List<Object> row = new ArrayList<>(carried.size() + 5);
        row.add(respondentId(wide, r, options));
        for (String column : carried) {
            row.add(wide.get(r, column));
        }
        row.add(question);
        row.add(option);
        row.add(wide.get(r, option));
        row.add(label);
        return row;
    }

    /**
     * The configured ID column when present, otherwise the 1-based row position.
     */
    private Object respondentId(Table wide, int r, PipelineOptions options) {
        if (wide.hasColumn(options.idColumn())) {
            return wide.get(r, options.idColumn());
        }
        return r + 1;
    }

    /**
     * Weight first (when present), then the configured carry-over columns that exist in the wide table.
     */
    private List<String> carriedColumns(Table wide, SurveySchema schema, PipelineOptions options) {
        List<String> carried = new ArrayList<>();
        if (wide.hasColumn(options.weightColumn())) {
            carried.add(options.weightColumn());
        }
        for (String column : options.carryColumns()) {
            if (carried.contains(column) || column.equals(options.idColumn())) {
                continue;
            }
            if (!wide.hasColumn(column) || schema.isMrMember(column) || FIXED_COLUMNS.contains(column)) {
                log.warn("Carry-over column {} is unavailable for tidy export; ignored", column);
                continue;
            }
            carried.add(column);
        }
        return carried;
    }

    private List<String> singleResponseColumns(Table wide, SurveySchema schema, List<String> carried,
                                               PipelineOptions options) {
        List<String> singles = new ArrayList<>();
        for (String column : wide.columns()) {
            if (column.equals(options.idColumn()) || carried.contains(column) || schema.isMrMember(column)
                    || schema.isLabelColumn(column) || column.endsWith(options.labelSuffix())) {
                continue;
            }
            singles.add(column);
        }
        return singles;
    }

    private Object optionLabel(Table wide, int r, String member, SurveySchema schema, PipelineOptions options) {
        Object paired = pairedLabel(wide, r, member, schema, options);
        return paired != null ? paired : schema.optionLabels().get(member);
    }

    /**
     * Label text from the same row's paired column; none for a skipped cell.
     */
    private Object pairedLabel(Table wide, int r, String column, SurveySchema schema, PipelineOptions options) {
        String textColumn = schema.labelPairs().get(column);
        if (textColumn == null || !wide.hasColumn(textColumn)
                || options.skipSentinel().equals(wide.get(r, column))) {
            return null;
        }
        Object label = wide.get(r, textColumn);
        return Cells.isBlank(label) ? null : label;
    }
}
