package com.surveyprep.surveyprep.pipeline;

public enum PipelineStep {
    SCHEMA_RESOLUTION,
    MISSING_VALUE_HANDLING,
    WEIGHT_CALCULATION,
    LABEL_ENCODING,
    TIDY_EXPORT
}
