package com.surveyprep.surveyprep.label;

import com.surveyprep.surveyprep.pipeline.IssueKind;
import com.surveyprep.surveyprep.pipeline.PipelineOptions;
import com.surveyprep.surveyprep.pipeline.RunIssues;
import com.surveyprep.surveyprep.schema.SurveySchema;
import com.surveyprep.surveyprep.table.Cells;
import com.surveyprep.surveyprep.table.Table;
import com.surveyprep.surveyprep.tidy.TidyExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Replaces response codes with the text of their paired label column, row by row. No code-to-label dictionary
 * is consulted: every substituted value is copied from the same row's label cell.
 *
 * <p>Multi-response members keep their 0/1 indicators; their option label (first non-blank label cell) is
 * recorded in the schema and, optionally, becomes the column name.</p>
 */
@Component
public class LabelEncoder {

    private static final Logger log = LoggerFactory.getLogger(LabelEncoder.class);

    public LabelEncoding encode(Table table, SurveySchema schema, PipelineOptions options, RunIssues issues) {
        Table.Builder builder = table.toBuilder();
        Set<String> used = new HashSet<>(table.columns());
        used.add(options.idColumn());
        used.add(options.weightColumn());
        used.addAll(TidyExporter.FIXED_COLUMNS);
        Map<String, String> renames = new LinkedHashMap<>();
        Map<String, String> optionLabels = new LinkedHashMap<>();
        int substituted = 0;

        for (Map.Entry<String, String> pair : schema.labelPairs().entrySet()) {
            String codeColumn = pair.getKey();
            String textColumn = pair.getValue();
            if (!table.hasColumn(codeColumn) || !table.hasColumn(textColumn)) {
                continue;
            }

            if (schema.isMrMember(codeColumn)) {
                String label = firstLabel(table, textColumn);
                if (label == null) {
                    issues.report(IssueKind.MISSING_LABEL_PAIR, "Option column " + codeColumn
                            + " has no label text in " + textColumn + "; name kept");
                } else {
                    optionLabels.put(codeColumn, label);
                    if (options.renameMrColumns() && !label.equals(codeColumn)) {
                        String newName = uniqueName(label, used);
                        builder.renameColumn(codeColumn, newName);
                        used.add(newName);
                        renames.put(codeColumn, newName);
                    }
                }
            } else {
                int blankLabels = 0;
                for (int r = 0; r < table.rowCount(); r++) {
                    Object code = table.get(r, codeColumn);
                    Object text = table.get(r, textColumn);
                    if (options.skipSentinel().equals(code)) {
                        continue;
                    }
                    if (!Cells.isBlank(text)) {
                        builder.set(r, codeColumn, text);
                        substituted++;
                    } else if (!Cells.isBlank(code)) {
                        blankLabels++;
                    }
                }
                issues.report(IssueKind.MISSING_LABEL_PAIR, blankLabels + " row(s) of " + codeColumn
                        + " have a blank label in " + textColumn + "; code kept", blankLabels);
            }

            if (options.dropLabelColumns()) {
                builder.removeColumn(textColumn);
            }
        }

        reportUnpairedCodeColumns(table, schema, options, issues);

        SurveySchema encoded = schema.withOptionLabels(optionLabels).withRenamedColumns(renames);
        log.info("Label encoding complete. pairs={}, substitutedCells={}, renamedOptions={}",
                schema.labelPairs().size(), substituted, renames.size());
        return new LabelEncoding(builder.build(), encoded);
    }

    private String firstLabel(Table table, String textColumn) {
        for (int r = 0; r < table.rowCount(); r++) {
            Object text = table.get(r, textColumn);
            if (!Cells.isBlank(text)) {
                return Cells.text(text);
            }
        }
        return null;
    }

    /**
     * Appends {@code _1}, {@code _2}, ... until the name is free.
     */
    private String uniqueName(String base, Set<String> used) {
        String candidate = base;
        int i = 1;
        while (used.contains(candidate)) {
            candidate = base + "_" + i;
            i++;
        }
        return candidate;
    }

    private void reportUnpairedCodeColumns(Table table, SurveySchema schema, PipelineOptions options, RunIssues issues) {
        for (String column : table.columns()) {
            if (column.equals(options.idColumn()) || column.equals(options.weightColumn())
                    || column.endsWith(options.labelSuffix()) || schema.labelPairs().containsKey(column)
                    || schema.isMrMember(column)) {
                continue;
            }
            if (isNumericColumn(table, column, options.skipSentinel())) {
                issues.report(IssueKind.MISSING_LABEL_PAIR, "Column " + column
                        + " has no paired label column; values left as codes");
            }
        }
    }

    private boolean isNumericColumn(Table table, String column, String sentinel) {
        boolean anyValue = false;
        for (int r = 0; r < table.rowCount(); r++) {
            Object value = table.get(r, column);
            if (Cells.isBlank(value) || sentinel.equals(value)) {
                continue;
            }
            if (!Cells.isNumeric(value)) {
                return false;
            }
            anyValue = true;
        }
        return anyValue;
    }
}
