package com.surveyprep.surveyprep.pipeline;

import com.surveyprep.surveyprep.label.LabelEncoder;
import com.surveyprep.surveyprep.label.LabelEncoding;
import com.surveyprep.surveyprep.missing.MissingValueHandler;
import com.surveyprep.surveyprep.schema.SchemaResolver;
import com.surveyprep.surveyprep.schema.SurveySchema;
import com.surveyprep.surveyprep.table.Table;
import com.surveyprep.surveyprep.tidy.TidyExport;
import com.surveyprep.surveyprep.tidy.TidyExporter;
import com.surveyprep.surveyprep.weight.WeightCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the stages in order: schema resolution, missing-value handling, weight calculation, label encoding,
 * tidy export. Each stage takes the previous stage's table and returns a new one; a disabled step passes the
 * table through, and a step that lacks required input is skipped while later steps still run.
 *
 * <p>Holds no per-run state, so independent runs may execute concurrently.</p>
 */
@Service
public class SurveyPipeline {

    private static final Logger log = LoggerFactory.getLogger(SurveyPipeline.class);

    private final SchemaResolver schemaResolver;
    private final MissingValueHandler missingValueHandler;
    private final WeightCalculator weightCalculator;
    private final LabelEncoder labelEncoder;
    private final TidyExporter tidyExporter;

    public SurveyPipeline(SchemaResolver schemaResolver,
                          MissingValueHandler missingValueHandler,
                          WeightCalculator weightCalculator,
                          LabelEncoder labelEncoder,
                          TidyExporter tidyExporter) {
        this.schemaResolver = schemaResolver;
        this.missingValueHandler = missingValueHandler;
        this.weightCalculator = weightCalculator;
        this.labelEncoder = labelEncoder;
        this.tidyExporter = tidyExporter;
    }

    /**
     * Convenience for callers outside a Spring context.
     */
    public static SurveyPipeline standalone() {
        return new SurveyPipeline(new SchemaResolver(), new MissingValueHandler(), new WeightCalculator(),
                new LabelEncoder(), new TidyExporter());
    }

    public SchemaPreview preview(Table raw, PipelineOptions options) {
        RunIssues issues = new RunIssues();
        SurveySchema schema = schemaResolver.resolve(raw.columns(), options, issues);
        return new SchemaPreview(schema, issues.toReport());
    }

    /**
     * @param population population reference table, may be {@code null} when weighting is disabled
     */
    public PipelineResult run(Table raw, Table population, PipelineOptions options) {
        RunIssues issues = new RunIssues();
        SurveySchema schema = schemaResolver.resolve(raw.columns(), options, issues);
        Table table = raw;

        if (options.runMissingValueHandling()) {
            table = missingValueHandler.handle(table, schema, options);
        }

        if (options.runWeightCalculation()) {
            try {
                table = weightCalculator.calculate(table, population, options, issues);
            } catch (StructuralInputException ex) {
                issues.skipStep(PipelineStep.WEIGHT_CALCULATION, ex.getMessage());
            }
        }

        if (options.runLabelEncoding()) {
            LabelEncoding encoding = labelEncoder.encode(table, schema, options, issues);
            table = encoding.table();
            schema = encoding.schema();
        }

        TidyExport tidy = null;
        if (options.runTidyExport()) {
            tidy = tidyExporter.export(table, schema, options);
        }

        RunReport report = issues.toReport();
        log.info("Survey pipeline complete. respondents={}, columns={}, mrSets={}, issues={}, skippedSteps={}",
                table.rowCount(), table.columnCount(), schema.mrSets().size(), report.counts(), report.skippedSteps().size());
        return new PipelineResult(table, schema, tidy, report);
    }
}
