package com.surveyprep.surveyprep.processing;

/**
 * Uploaded source payload with original filename and byte content.
 */
public record UploadedTable(String fileName, byte[] content) {

    public boolean isPresent() {
        return fileName != null && content != null && content.length > 0;
    }
}
