package com.surveyprep.surveyprep.processing;

import com.surveyprep.surveyprep.pipeline.PipelineOptions;
import com.surveyprep.surveyprep.schema.SkipRule;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized survey processing defaults bound from {@code application.properties}. Requests may override
 * the step toggles and weighting inputs per run.
 */
@ConfigurationProperties(prefix = "survey")
public class SurveyPrepProperties {

    private boolean runMissingValueHandling = true;
    private boolean runWeightCalculation;
    private boolean runLabelEncoding;
    private boolean runTidyExport;

    private String idColumn = PipelineOptions.DEFAULT_ID_COLUMN;
    private String skipSentinel = PipelineOptions.DEFAULT_SKIP_SENTINEL;

    private String mrSeparator = PipelineOptions.DEFAULT_MR_SEPARATOR;
    private String mrSuffixPattern = PipelineOptions.DEFAULT_MR_SUFFIX_PATTERN;
    private boolean mrRequiresLabelPair;
    private Map<String, List<String>> mrSets = new LinkedHashMap<>();
    private List<SkipRuleProperties> skipRules = new ArrayList<>();

    private String labelSuffix = PipelineOptions.DEFAULT_LABEL_SUFFIX;
    private boolean dropLabelColumns = true;
    private boolean renameMrColumns = true;

    private boolean fillCategoricalBlanks;
    private int categoricalDistinctLimit = PipelineOptions.DEFAULT_CATEGORICAL_DISTINCT_LIMIT;

    private List<String> strataColumns = new ArrayList<>();
    private String populationColumn = PipelineOptions.DEFAULT_POPULATION_COLUMN;
    private String weightColumn = PipelineOptions.DEFAULT_WEIGHT_COLUMN;
    private boolean rescaleWeights;

    private List<String> carryColumns = new ArrayList<>();

    private int excelHeaderRow = SurveyPrepConstants.DEFAULT_EXCEL_HEADER_ROW;
    private String outputFormat = SurveyPrepConstants.FORMAT_XLSX;

    /**
     * Builds the immutable run configuration from the bound defaults.
     */
    public PipelineOptions toOptions() {
        PipelineOptions.Builder builder = PipelineOptions.builder()
                .runMissingValueHandling(runMissingValueHandling)
                .runWeightCalculation(runWeightCalculation)
                .runLabelEncoding(runLabelEncoding)
                .runTidyExport(runTidyExport)
                .idColumn(idColumn)
                .skipSentinel(skipSentinel)
                .mrSeparator(mrSeparator)
                .mrSuffixPattern(mrSuffixPattern)
                .mrRequiresLabelPair(mrRequiresLabelPair)
                .labelSuffix(labelSuffix)
                .dropLabelColumns(dropLabelColumns)
                .renameMrColumns(renameMrColumns)
                .fillCategoricalBlanks(fillCategoricalBlanks)
                .categoricalDistinctLimit(categoricalDistinctLimit)
                .strataColumns(strataColumns)
                .populationColumn(populationColumn)
                .weightColumn(weightColumn)
                .rescaleWeights(rescaleWeights)
                .carryColumns(carryColumns);
        mrSets.forEach(builder::declareMrSet);
        for (SkipRuleProperties rule : skipRules) {
            builder.skipRule(SkipRule.of(rule.getDependent(), rule.getGate(), rule.getValues()));
        }
        return builder.build();
    }

    public boolean isRunMissingValueHandling() {
        return runMissingValueHandling;
    }

    public void setRunMissingValueHandling(boolean runMissingValueHandling) {
        this.runMissingValueHandling = runMissingValueHandling;
    }

    public boolean isRunWeightCalculation() {
        return runWeightCalculation;
    }

    public void setRunWeightCalculation(boolean runWeightCalculation) {
        this.runWeightCalculation = runWeightCalculation;
    }

    public boolean isRunLabelEncoding() {
        return runLabelEncoding;
    }

    public void setRunLabelEncoding(boolean runLabelEncoding) {
        this.runLabelEncoding = runLabelEncoding;
    }

    public boolean isRunTidyExport() {
        return runTidyExport;
    }

    public void setRunTidyExport(boolean runTidyExport) {
        this.runTidyExport = runTidyExport;
    }

    public String getIdColumn() {
        return idColumn;
    }

    public void setIdColumn(String idColumn) {
        this.idColumn = idColumn;
    }

    public String getSkipSentinel() {
        return skipSentinel;
    }

    public void setSkipSentinel(String skipSentinel) {
        this.skipSentinel = skipSentinel;
    }

    public String getMrSeparator() {
        return mrSeparator;
    }

    public void setMrSeparator(String mrSeparator) {
        this.mrSeparator = mrSeparator;
    }

    public String getMrSuffixPattern() {
        return mrSuffixPattern;
    }

    public void setMrSuffixPattern(String mrSuffixPattern) {
        this.mrSuffixPattern = mrSuffixPattern;
    }

    public boolean isMrRequiresLabelPair() {
        return mrRequiresLabelPair;
    }

    public void setMrRequiresLabelPair(boolean mrRequiresLabelPair) {
        this.mrRequiresLabelPair = mrRequiresLabelPair;
    }

    public Map<String, List<String>> getMrSets() {
        return mrSets;
    }

    public void setMrSets(Map<String, List<String>> mrSets) {
        this.mrSets = mrSets;
    }

    public List<SkipRuleProperties> getSkipRules() {
        return skipRules;
    }

    public void setSkipRules(List<SkipRuleProperties> skipRules) {
        this.skipRules = skipRules;
    }

    public String getLabelSuffix() {
        return labelSuffix;
    }

    public void setLabelSuffix(String labelSuffix) {
        this.labelSuffix = labelSuffix;
    }

    public boolean isDropLabelColumns() {
        return dropLabelColumns;
    }

    public void setDropLabelColumns(boolean dropLabelColumns) {
        this.dropLabelColumns = dropLabelColumns;
    }

    public boolean isRenameMrColumns() {
        return renameMrColumns;
    }

    public void setRenameMrColumns(boolean renameMrColumns) {
        this.renameMrColumns = renameMrColumns;
    }

    public boolean isFillCategoricalBlanks() {
        return fillCategoricalBlanks;
    }

    public void setFillCategoricalBlanks(boolean fillCategoricalBlanks) {
        this.fillCategoricalBlanks = fillCategoricalBlanks;
    }

    public int getCategoricalDistinctLimit() {
        return categoricalDistinctLimit;
    }

    public void setCategoricalDistinctLimit(int categoricalDistinctLimit) {
        this.categoricalDistinctLimit = categoricalDistinctLimit;
    }

    public List<String> getStrataColumns() {
        return strataColumns;
    }

    public void setStrataColumns(List<String> strataColumns) {
        this.strataColumns = strataColumns;
    }

    public String getPopulationColumn() {
        return populationColumn;
    }

    public void setPopulationColumn(String populationColumn) {
        this.populationColumn = populationColumn;
    }

    public String getWeightColumn() {
        return weightColumn;
    }

    public void setWeightColumn(String weightColumn) {
        this.weightColumn = weightColumn;
    }

    public boolean isRescaleWeights() {
        return rescaleWeights;
    }

    public void setRescaleWeights(boolean rescaleWeights) {
        this.rescaleWeights = rescaleWeights;
    }

    public List<String> getCarryColumns() {
        return carryColumns;
    }

    public void setCarryColumns(List<String> carryColumns) {
        this.carryColumns = carryColumns;
    }

    public int getExcelHeaderRow() {
        return excelHeaderRow;
    }

    public void setExcelHeaderRow(int excelHeaderRow) {
        this.excelHeaderRow = excelHeaderRow;
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(String outputFormat) {
        this.outputFormat = outputFormat;
    }

    /**
     * One declared skip rule: {@code dependent} (column or multi-response set) applies only when
     * {@code gate} holds one of {@code values}.
     */
    public static class SkipRuleProperties {

        private String dependent;
        private String gate;
        private List<String> values = new ArrayList<>();

        public String getDependent() {
            return dependent;
        }

        public void setDependent(String dependent) {
            this.dependent = dependent;
        }

        public String getGate() {
            return gate;
        }

        public void setGate(String gate) {
            this.gate = gate;
        }

        public List<String> getValues() {
            return values;
        }

        public void setValues(List<String> values) {
            this.values = values;
        }
    }
}
