package com.surveyprep.surveyprep.missing;

import com.surveyprep.surveyprep.pipeline.PipelineOptions;
import com.surveyprep.surveyprep.schema.MrSet;
import com.surveyprep.surveyprep.schema.SkipRule;
import com.surveyprep.surveyprep.schema.SurveySchema;
import com.surveyprep.surveyprep.table.Cells;
import com.surveyprep.surveyprep.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Binary-encodes multi-response members and fills structurally skipped cells with the skip sentinel.
 *
 * <p>Binarization runs over the whole table before any skip rule, so a sentinel can override a computed 0/1
 * and gates on member columns see 0/1 values. The stage is idempotent: 0/1 stay 0/1, the sentinel is never
 * binarized, and gates are evaluated in dependency order.</p>
 */
@Component
public class MissingValueHandler {

    private static final Logger log = LoggerFactory.getLogger(MissingValueHandler.class);

    public static final Integer SELECTED = 1;
    public static final Integer NOT_SELECTED = 0;

    public Table handle(Table table, SurveySchema schema, PipelineOptions options) {
        String sentinel = options.skipSentinel();
        Table.Builder builder = table.toBuilder();

        int binarized = 0;
        for (MrSet set : schema.mrSets()) {
            for (String member : set.members()) {
                if (!builder.hasColumn(member)) {
                    continue;
                }
                for (int r = 0; r < builder.rowCount(); r++) {
                    builder.set(r, member, binarize(builder.get(r, member), sentinel));
                }
                binarized++;
            }
        }

        int skipped = 0;
        for (SkipRule rule : schema.skipRules()) {
            if (!builder.hasColumn(rule.gate()) || !builder.hasColumn(rule.dependent())) {
                continue;
            }
            for (int r = 0; r < builder.rowCount(); r++) {
                if (!rule.isSatisfiedBy(builder.get(r, rule.gate()))) {
                    if (!sentinel.equals(builder.get(r, rule.dependent()))) {
                        skipped++;
                    }
                    builder.set(r, rule.dependent(), sentinel);
                }
            }
        }

        int filled = options.fillCategoricalBlanks() ? fillCategoricalBlanks(builder, schema, options) : 0;

        log.info("Missing-value handling complete. binarizedColumns={}, skippedCells={}, filledBlankCells={}",
                binarized, skipped, filled);
        return builder.build();
    }

    /**
     * Non-empty, non-zero becomes 1; empty or zero becomes 0; the sentinel is kept.
     */
    static Object binarize(Object value, String sentinel) {
        if (value instanceof String text && sentinel.equals(text.trim())) {
            return sentinel;
        }
        return Cells.isEmptyOrZero(value) ? NOT_SELECTED : SELECTED;
    }

    /**
     * Fills blanks of low-cardinality single-response columns with the sentinel, as an opt-in for sources whose
     * skip logic is not declared.
     */
    private int fillCategoricalBlanks(Table.Builder builder, SurveySchema schema, PipelineOptions options) {
        int filled = 0;
        for (String column : builder.columns()) {
            if (column.equals(options.idColumn()) || column.equals(options.weightColumn())
                    || schema.isMrMember(column) || column.endsWith(options.labelSuffix())) {
                continue;
            }
            Set<String> distinct = new HashSet<>();
            for (int r = 0; r < builder.rowCount(); r++) {
                Object value = builder.get(r, column);
                if (!Cells.isBlank(value) && !options.skipSentinel().equals(value)) {
                    distinct.add(Cells.key(value));
                }
            }
            if (distinct.isEmpty() || distinct.size() > options.categoricalDistinctLimit()) {
                continue;
            }
            for (int r = 0; r < builder.rowCount(); r++) {
                if (Cells.isBlank(builder.get(r, column))) {
                    builder.set(r, column, options.skipSentinel());
                    filled++;
                }
            }
        }
        return filled;
    }
}
