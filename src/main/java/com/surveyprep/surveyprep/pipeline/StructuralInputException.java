package com.surveyprep.surveyprep.pipeline;

/**
 * Raised by a stage when its required input is absent. The pipeline skips that step and records the
 * condition instead of failing the run.
 */
public class StructuralInputException extends IllegalStateException {

    public StructuralInputException(String message) {
        super(message);
    }
}
