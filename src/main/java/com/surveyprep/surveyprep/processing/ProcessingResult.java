package com.surveyprep.surveyprep.processing;

import com.surveyprep.surveyprep.pipeline.RunReport;

/**
 * Packaged outputs of one processing request.
 */
public record ProcessingResult(String archiveFileName, byte[] archive, RunReport report) {
}
