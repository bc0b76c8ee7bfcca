package com.surveyprep.surveyprep.pipeline;

import com.surveyprep.surveyprep.schema.SurveySchema;

/**
 * Resolved schema for an uploaded table, returned before any processing step runs.
 */
public record SchemaPreview(SurveySchema schema, RunReport report) {
}
