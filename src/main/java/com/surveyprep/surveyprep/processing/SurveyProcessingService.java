package com.surveyprep.surveyprep.processing;

import com.surveyprep.surveyprep.pipeline.PipelineOptions;
import com.surveyprep.surveyprep.pipeline.PipelineResult;
import com.surveyprep.surveyprep.pipeline.SchemaPreview;
import com.surveyprep.surveyprep.pipeline.SurveyPipeline;
import com.surveyprep.surveyprep.table.Table;
import com.surveyprep.surveyprep.table.TableReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Orchestrates one upload: parses the raw survey file (and optional population reference), applies request
 * overrides to the configured defaults, runs the pipeline and packages the outputs.
 */
@Service
public class SurveyProcessingService {

    private static final Logger log = LoggerFactory.getLogger(SurveyProcessingService.class);

    private final SurveyPipeline surveyPipeline;
    private final TableReader tableReader;
    private final OutputArchiveWriter outputArchiveWriter;
    private final SurveyPrepProperties surveyPrepProperties;

    public SurveyProcessingService(SurveyPipeline surveyPipeline,
                                   TableReader tableReader,
                                   OutputArchiveWriter outputArchiveWriter,
                                   SurveyPrepProperties surveyPrepProperties) {
        this.surveyPipeline = surveyPipeline;
        this.tableReader = tableReader;
        this.outputArchiveWriter = outputArchiveWriter;
        this.surveyPrepProperties = surveyPrepProperties;
    }

    /**
     * Runs the enabled steps over an uploaded survey file and returns the packaged archive.
     *
     * @throws IllegalArgumentException when the raw file is missing, unreadable or a parameter is invalid
     */
    public ProcessingResult process(UploadedTable raw, UploadedTable population, ProcessingOverrides overrides) {
        if (raw == null || !raw.isPresent()) {
            throw new IllegalArgumentException(SurveyPrepConstants.MSG_RAW_FILE_REQUIRED);
        }
        ProcessingOverrides effective = overrides == null ? ProcessingOverrides.none() : overrides;
        PipelineOptions options = resolveOptions(effective);
        String format = resolveFormat(effective.format());

        Table rawTable = tableReader.read(raw.fileName(), raw.content());
        Table populationTable = population != null && population.isPresent()
                ? tableReader.read(population.fileName(), population.content())
                : null;

        PipelineResult result = surveyPipeline.run(rawTable, populationTable, options);
        byte[] archive = outputArchiveWriter.write(result, format);

        log.info("Processed survey upload. file={}, respondents={}, archiveBytes={}",
                raw.fileName(), rawTable.rowCount(), archive.length);
        return new ProcessingResult(SurveyPrepConstants.ARCHIVE_FILE_NAME, archive, result.report());
    }

    /**
     * Resolves the schema of an uploaded file without running any processing step.
     */
    public SchemaPreview previewSchema(UploadedTable raw, String idColumn) {
        if (raw == null || !raw.isPresent()) {
            throw new IllegalArgumentException(SurveyPrepConstants.MSG_RAW_FILE_REQUIRED);
        }
        PipelineOptions options = resolveOptions(new ProcessingOverrides(
                null, null, null, null, null, idColumn, null, null, null));
        return surveyPipeline.preview(tableReader.read(raw.fileName(), raw.content()), options);
    }

    PipelineOptions resolveOptions(ProcessingOverrides overrides) {
        PipelineOptions defaults = surveyPrepProperties.toOptions();
        PipelineOptions.Builder builder = defaults.toBuilder();
        if (overrides.missing() != null) {
            builder.runMissingValueHandling(overrides.missing());
        }
        if (overrides.weight() != null) {
            builder.runWeightCalculation(overrides.weight());
        }
        if (overrides.label() != null) {
            builder.runLabelEncoding(overrides.label());
        }
        if (overrides.tidy() != null) {
            builder.runTidyExport(overrides.tidy());
        }
        if (overrides.rescale() != null) {
            builder.rescaleWeights(overrides.rescale());
        }
        if (hasText(overrides.idColumn())) {
            builder.idColumn(overrides.idColumn().trim());
        }
        if (overrides.strata() != null && !overrides.strata().isEmpty()) {
            builder.strataColumns(overrides.strata());
        }
        if (hasText(overrides.populationColumn())) {
            builder.populationColumn(overrides.populationColumn().trim());
        }
        return builder.build();
    }

    private String resolveFormat(String requested) {
        String format = hasText(requested) ? requested.trim().toLowerCase(Locale.ROOT)
                : surveyPrepProperties.getOutputFormat().toLowerCase(Locale.ROOT);
        if (!SurveyPrepConstants.FORMAT_XLSX.equals(format) && !SurveyPrepConstants.FORMAT_CSV.equals(format)) {
            throw new IllegalArgumentException(SurveyPrepConstants.MSG_UNSUPPORTED_FORMAT.formatted(format));
        }
        return format;
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
