package com.surveyprep.surveyprep.pipeline;

import com.surveyprep.surveyprep.schema.SurveySchema;
import com.surveyprep.surveyprep.table.Table;
import com.surveyprep.surveyprep.tidy.TidyExport;

/**
 * Output of one pipeline run.
 *
 * @param wide   processed wide table
 * @param schema schema as seen by the last stage (option columns may have been renamed by label encoding)
 * @param tidy   long tables, or {@code null} when tidy export was not enabled
 * @param report data-quality report for the run
 */
public record PipelineResult(Table wide, SurveySchema schema, TidyExport tidy, RunReport report) {

    public boolean hasTidyExport() {
        return tidy != null;
    }
}
