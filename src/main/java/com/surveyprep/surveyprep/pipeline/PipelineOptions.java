package com.surveyprep.surveyprep.pipeline;

import com.surveyprep.surveyprep.schema.SkipRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable configuration for one pipeline run: step toggles plus the naming conventions every stage reads.
 */
public record PipelineOptions(
        boolean runMissingValueHandling,
        boolean runWeightCalculation,
        boolean runLabelEncoding,
        boolean runTidyExport,
        String idColumn,
        String skipSentinel,
        String mrSeparator,
        String mrSuffixPattern,
        boolean mrRequiresLabelPair,
        Map<String, List<String>> declaredMrSets,
        List<SkipRule> skipRules,
        String labelSuffix,
        boolean dropLabelColumns,
        boolean renameMrColumns,
        boolean fillCategoricalBlanks,
        int categoricalDistinctLimit,
        List<String> strataColumns,
        String populationColumn,
        String weightColumn,
        boolean rescaleWeights,
        List<String> carryColumns
) {

    public static final String DEFAULT_ID_COLUMN = "회원ID";
    public static final String DEFAULT_SKIP_SENTINEL = "스킵(해당 없음)";
    public static final String DEFAULT_MR_SEPARATOR = "_";
    public static final String DEFAULT_MR_SUFFIX_PATTERN = "\\d+";
    public static final String DEFAULT_LABEL_SUFFIX = "(TEXT)";
    public static final int DEFAULT_CATEGORICAL_DISTINCT_LIMIT = 20;
    public static final String DEFAULT_POPULATION_COLUMN = "pop_share";
    public static final String DEFAULT_WEIGHT_COLUMN = "weight";

    public PipelineOptions {
        requireText(idColumn, "idColumn");
        requireText(skipSentinel, "skipSentinel");
        requireText(mrSeparator, "mrSeparator");
        requireText(mrSuffixPattern, "mrSuffixPattern");
        requireText(labelSuffix, "labelSuffix");
        requireText(populationColumn, "populationColumn");
        requireText(weightColumn, "weightColumn");
        if (categoricalDistinctLimit < 1) {
            throw new IllegalArgumentException("categoricalDistinctLimit must be positive");
        }

        Map<String, List<String>> sets = new LinkedHashMap<>();
        if (declaredMrSets != null) {
            declaredMrSets.forEach((name, members) -> sets.put(name, List.copyOf(members)));
        }
        declaredMrSets = Collections.unmodifiableMap(sets);
        skipRules = skipRules == null ? List.of() : List.copyOf(skipRules);
        strataColumns = strataColumns == null ? List.of() : List.copyOf(strataColumns);
        carryColumns = carryColumns == null ? List.of() : List.copyOf(carryColumns);
    }

    public static PipelineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.runMissingValueHandling = runMissingValueHandling;
        builder.runWeightCalculation = runWeightCalculation;
        builder.runLabelEncoding = runLabelEncoding;
        builder.runTidyExport = runTidyExport;
        builder.idColumn = idColumn;
        builder.skipSentinel = skipSentinel;
        builder.mrSeparator = mrSeparator;
        builder.mrSuffixPattern = mrSuffixPattern;
        builder.mrRequiresLabelPair = mrRequiresLabelPair;
        builder.declaredMrSets = new LinkedHashMap<>(declaredMrSets);
        builder.skipRules = new ArrayList<>(skipRules);
        builder.labelSuffix = labelSuffix;
        builder.dropLabelColumns = dropLabelColumns;
        builder.renameMrColumns = renameMrColumns;
        builder.fillCategoricalBlanks = fillCategoricalBlanks;
        builder.categoricalDistinctLimit = categoricalDistinctLimit;
        builder.strataColumns = new ArrayList<>(strataColumns);
        builder.populationColumn = populationColumn;
        builder.weightColumn = weightColumn;
        builder.rescaleWeights = rescaleWeights;
        builder.carryColumns = new ArrayList<>(carryColumns);
        return builder;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    public static final class Builder {

        private boolean runMissingValueHandling = true;
        private boolean runWeightCalculation;
        private boolean runLabelEncoding;
        private boolean runTidyExport;
        private String idColumn = DEFAULT_ID_COLUMN;
        private String skipSentinel = DEFAULT_SKIP_SENTINEL;
        private String mrSeparator = DEFAULT_MR_SEPARATOR;
        private String mrSuffixPattern = DEFAULT_MR_SUFFIX_PATTERN;
        private boolean mrRequiresLabelPair;
        private Map<String, List<String>> declaredMrSets = new LinkedHashMap<>();
        private List<SkipRule> skipRules = new ArrayList<>();
        private String labelSuffix = DEFAULT_LABEL_SUFFIX;
        private boolean dropLabelColumns = true;
        private boolean renameMrColumns = true;
        private boolean fillCategoricalBlanks;
        private int categoricalDistinctLimit = DEFAULT_CATEGORICAL_DISTINCT_LIMIT;
        private List<String> strataColumns = new ArrayList<>();
        private String populationColumn = DEFAULT_POPULATION_COLUMN;
        private String weightColumn = DEFAULT_WEIGHT_COLUMN;
        private boolean rescaleWeights;
        private List<String> carryColumns = new ArrayList<>();

        private Builder() {
        }

        public Builder runMissingValueHandling(boolean value) {
            this.runMissingValueHandling = value;
            return this;
        }

        public Builder runWeightCalculation(boolean value) {
            this.runWeightCalculation = value;
            return this;
        }

        public Builder runLabelEncoding(boolean value) {
            this.runLabelEncoding = value;
            return this;
        }

        public Builder runTidyExport(boolean value) {
            this.runTidyExport = value;
            return this;
        }

        public Builder idColumn(String value) {
            this.idColumn = value;
            return this;
        }

        public Builder skipSentinel(String value) {
            this.skipSentinel = value;
            return this;
        }

        public Builder mrSeparator(String value) {
            this.mrSeparator = value;
            return this;
        }

        public Builder mrSuffixPattern(String value) {
            this.mrSuffixPattern = value;
            return this;
        }

        public Builder mrRequiresLabelPair(boolean value) {
            this.mrRequiresLabelPair = value;
            return this;
        }

        public Builder declareMrSet(String name, List<String> members) {
            this.declaredMrSets.put(name, List.copyOf(members));
            return this;
        }

        public Builder skipRule(SkipRule rule) {
            this.skipRules.add(rule);
            return this;
        }

        public Builder labelSuffix(String value) {
            this.labelSuffix = value;
            return this;
        }

        public Builder dropLabelColumns(boolean value) {
            this.dropLabelColumns = value;
            return this;
        }

        public Builder renameMrColumns(boolean value) {
            this.renameMrColumns = value;
            return this;
        }

        public Builder fillCategoricalBlanks(boolean value) {
            this.fillCategoricalBlanks = value;
            return this;
        }

        public Builder categoricalDistinctLimit(int value) {
            this.categoricalDistinctLimit = value;
            return this;
        }

        public Builder strataColumns(List<String> value) {
            this.strataColumns = new ArrayList<>(value);
            return this;
        }

        public Builder populationColumn(String value) {
            this.populationColumn = value;
            return this;
        }

        public Builder weightColumn(String value) {
            this.weightColumn = value;
            return this;
        }

        public Builder rescaleWeights(boolean value) {
            this.rescaleWeights = value;
            return this;
        }

        public Builder carryColumns(List<String> value) {
            this.carryColumns = new ArrayList<>(value);
            return this;
        }

        public PipelineOptions build() {
            return new PipelineOptions(
                    runMissingValueHandling,
                    runWeightCalculation,
                    runLabelEncoding,
                    runTidyExport,
                    idColumn,
                    skipSentinel,
                    mrSeparator,
                    mrSuffixPattern,
                    mrRequiresLabelPair,
                    declaredMrSets,
                    skipRules,
                    labelSuffix,
                    dropLabelColumns,
                    renameMrColumns,
                    fillCategoricalBlanks,
                    categoricalDistinctLimit,
                    strataColumns,
                    populationColumn,
                    weightColumn,
                    rescaleWeights,
                    carryColumns
            );
        }
    }
}
