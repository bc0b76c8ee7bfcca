package com.surveyprep.surveyprep.processing;

import java.util.List;

/**
 * Per-request overrides of the configured defaults; {@code null} keeps the configured value.
 */
public record ProcessingOverrides(
        Boolean missing,
        Boolean weight,
        Boolean label,
        Boolean tidy,
        Boolean rescale,
        String idColumn,
        List<String> strata,
        String populationColumn,
        String format
) {

    public static ProcessingOverrides none() {
        return new ProcessingOverrides(null, null, null, null, null, null, null, null, null);
    }
}
