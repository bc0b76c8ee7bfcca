package com.surveyprep.surveyprep.label;

import com.surveyprep.surveyprep.schema.SurveySchema;
import com.surveyprep.surveyprep.table.Table;

/**
 * Label encoder output: the relabelled table plus the schema updated for any renamed option columns.
 */
public record LabelEncoding(Table table, SurveySchema schema) {
}
