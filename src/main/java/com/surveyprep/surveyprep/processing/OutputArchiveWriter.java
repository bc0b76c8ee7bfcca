package com.surveyprep.surveyprep.processing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.surveyprep.surveyprep.pipeline.PipelineResult;
import com.surveyprep.surveyprep.table.Table;
import com.surveyprep.surveyprep.table.TableWriter;
import com.surveyprep.surveyprep.tidy.TidyExport;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Output sink: packages the processed wide table, the tidy tables and the run report into one ZIP archive.
 */
@Component
public class OutputArchiveWriter {

    private final TableWriter tableWriter;
    private final ObjectMapper objectMapper;

    public OutputArchiveWriter(TableWriter tableWriter, ObjectMapper objectMapper) {
        this.tableWriter = tableWriter;
        this.objectMapper = objectMapper;
    }

    public byte[] write(PipelineResult result, String format) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(out)) {
            if (SurveyPrepConstants.FORMAT_CSV.equals(format)) {
                putEntry(zos, SurveyPrepConstants.PROCESSED_FILE_BASE_NAME + SurveyPrepConstants.FILE_EXT_CSV,
                        tableWriter.toCsv(result.wide()));
            } else {
                putEntry(zos, SurveyPrepConstants.PROCESSED_FILE_BASE_NAME + "." + SurveyPrepConstants.FORMAT_XLSX,
                        tableWriter.toXlsx(result.wide()));
            }

            if (result.hasTidyExport()) {
                TidyExport tidy = result.tidy();
                String masterEntry = tidyEntryName(TidyExport.MASTER_TABLE_NAME);
                Set<String> usedEntries = new HashSet<>();
                usedEntries.add(masterEntry);
                for (Map.Entry<String, Table> entry : tidy.setTables().entrySet()) {
                    String entryName = uniqueEntryName(TidyExport.setTableName(entry.getKey()), usedEntries);
                    putEntry(zos, entryName, tableWriter.toCsv(entry.getValue()));
                }
                putEntry(zos, masterEntry, tableWriter.toCsv(tidy.master()));
            }

            putEntry(zos, SurveyPrepConstants.REPORT_FILE_NAME,
                    objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(result.report()));
        } catch (IOException ex) {
            throw new IllegalStateException(SurveyPrepConstants.MSG_ARCHIVE_WRITE_FAILED, ex);
        }
        return out.toByteArray();
    }

    /**
     * Set table names are free-form, so a sanitized name may collide with the master table or another set.
     * Collisions get {@code _1}, {@code _2}, ... appended.
     */
    private String uniqueEntryName(String tableName, Set<String> usedEntries) {
        String candidate = tidyEntryName(tableName);
        int i = 1;
        while (usedEntries.contains(candidate)) {
            candidate = tidyEntryName(tableName + "_" + i);
            i++;
        }
        usedEntries.add(candidate);
        return candidate;
    }

    private String tidyEntryName(String tableName) {
        return SurveyPrepConstants.TIDY_DIRECTORY + tableName.replaceAll("[\\\\/:*?\"<>|]", "_")
                + SurveyPrepConstants.FILE_EXT_CSV;
    }

    private void putEntry(ZipOutputStream zos, String name, byte[] content) throws IOException {
        zos.putNextEntry(new ZipEntry(name));
        zos.write(content);
        zos.closeEntry();
    }
}
