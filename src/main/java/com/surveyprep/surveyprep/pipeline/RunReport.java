package com.surveyprep.surveyprep.pipeline;

import java.util.List;
import java.util.Map;

/**
 * Immutable per-run data-quality report returned alongside the output tables.
 *
 * @param counts       number of occurrences per issue kind (kinds that never occurred are absent)
 * @param examples     first few messages per issue kind
 * @param skippedSteps enabled steps that could not run, with the reason
 */
public record RunReport(Map<IssueKind, Integer> counts, Map<IssueKind, List<String>> examples, List<SkippedStep> skippedSteps) {

    public RunReport {
        counts = counts == null ? Map.of() : Map.copyOf(counts);
        examples = examples == null ? Map.of() : Map.copyOf(examples);
        skippedSteps = skippedSteps == null ? List.of() : List.copyOf(skippedSteps);
    }

    public int count(IssueKind kind) {
        return counts.getOrDefault(kind, 0);
    }

    public boolean isClean() {
        return counts.isEmpty() && skippedSteps.isEmpty();
    }

    public record SkippedStep(PipelineStep step, String reason) {
    }
}
