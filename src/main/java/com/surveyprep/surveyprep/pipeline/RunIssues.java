package com.surveyprep.surveyprep.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates non-fatal conditions for one pipeline run. Not shared between runs.
 */
public class RunIssues {

    private static final Logger log = LoggerFactory.getLogger(RunIssues.class);

    static final int MAX_EXAMPLES_PER_KIND = 5;

    private final Map<IssueKind, Integer> counts = new EnumMap<>(IssueKind.class);
    private final Map<IssueKind, List<String>> examples = new EnumMap<>(IssueKind.class);
    private final List<RunReport.SkippedStep> skippedSteps = new ArrayList<>();

    public void report(IssueKind kind, String message) {
        report(kind, message, 1);
    }

    /**
     * Records {@code occurrences} instances of one condition under a single example message.
     */
    public void report(IssueKind kind, String message, int occurrences) {
        if (occurrences <= 0) {
            return;
        }
        counts.merge(kind, occurrences, Integer::sum);
        List<String> kindExamples = examples.computeIfAbsent(kind, k -> new ArrayList<>());
        if (kindExamples.size() < MAX_EXAMPLES_PER_KIND) {
            kindExamples.add(message);
            log.warn("{}: {}", kind, message);
        }
    }

    public void skipStep(PipelineStep step, String reason) {
        skippedSteps.add(new RunReport.SkippedStep(step, reason));
        report(IssueKind.STRUCTURAL_INPUT_ERROR, step + ": " + reason);
    }

    public int count(IssueKind kind) {
        return counts.getOrDefault(kind, 0);
    }

    public RunReport toReport() {
        Map<IssueKind, List<String>> examplesCopy = new EnumMap<>(IssueKind.class);
        examples.forEach((kind, messages) -> examplesCopy.put(kind, List.copyOf(messages)));
        return new RunReport(counts, examplesCopy, skippedSteps);
    }
}
