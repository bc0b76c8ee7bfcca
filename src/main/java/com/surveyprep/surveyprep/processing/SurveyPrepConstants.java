package com.surveyprep.surveyprep.processing;

/**
 * Shared constants for the upload, processing and download flow.
 */
public final class SurveyPrepConstants {

    private SurveyPrepConstants() {
    }

    public static final int DEFAULT_EXCEL_HEADER_ROW = 1;

    public static final String FORMAT_XLSX = "xlsx";
    public static final String FORMAT_CSV = "csv";

    public static final String ARCHIVE_FILE_NAME = "survey_outputs.zip";
    public static final String PROCESSED_FILE_BASE_NAME = "processed";
    public static final String TIDY_DIRECTORY = "tidy/";
    public static final String REPORT_FILE_NAME = "report.json";
    public static final String FILE_EXT_CSV = ".csv";

    public static final String MEDIA_TYPE_ZIP = "application/zip";

    public static final String MSG_RAW_FILE_REQUIRED = "Raw survey file is required";
    public static final String MSG_UNSUPPORTED_FORMAT = "Unsupported output format: %s (expected xlsx or csv)";
    public static final String MSG_ARCHIVE_WRITE_FAILED = "Unable to package survey outputs";
    public static final String MSG_PROCESSING_FAILED = "Failed to process survey file";
}
