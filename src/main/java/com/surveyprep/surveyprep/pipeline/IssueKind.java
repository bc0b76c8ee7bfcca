package com.surveyprep.surveyprep.pipeline;

/**
 * Data-quality conditions a run can report. Only {@link #STRUCTURAL_INPUT_ERROR} stops anything, and only the
 * step that raised it.
 */
public enum IssueKind {

    /** A column partially matches a multi-response naming pattern and was left ungrouped. */
    SCHEMA_AMBIGUITY,

    /** A skip rule names a gating (or dependent) column absent from the table, or takes part in a cycle. */
    UNRESOLVED_SKIP_GATE,

    /** A respondent's strata combination has no usable population reference row. */
    UNMATCHED_STRATUM,

    /** A response column has no paired label column, or the paired cell is blank. */
    MISSING_LABEL_PAIR,

    /** An enabled step lacks required input; the step is skipped for the whole run. */
    STRUCTURAL_INPUT_ERROR
}
