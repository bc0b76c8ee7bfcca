package com.surveyprep.surveyprep.processing;

import com.surveyprep.surveyprep.pipeline.SchemaPreview;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Upload/download endpoints wrapping the survey processing pipeline.
 */
@RestController
@RequestMapping("/api/survey")
public class SurveyPrepController {

    private final SurveyProcessingService surveyProcessingService;

    public SurveyPrepController(SurveyProcessingService surveyProcessingService) {
        this.surveyProcessingService = surveyProcessingService;
    }

    /**
     * Runs the selected steps over an uploaded survey file and returns the outputs as a ZIP archive.
     */
    @PostMapping(value = "/process", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> process(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "population", required = false) MultipartFile population,
            @RequestParam(required = false) Boolean missing,
            @RequestParam(required = false) Boolean weight,
            @RequestParam(required = false) Boolean label,
            @RequestParam(required = false) Boolean tidy,
            @RequestParam(required = false) Boolean rescale,
            @RequestParam(required = false) String idColumn,
            @RequestParam(required = false) String strata,
            @RequestParam(required = false) String populationColumn,
            @RequestParam(required = false) String format) {
        try {
            ProcessingOverrides overrides = new ProcessingOverrides(
                    missing, weight, label, tidy, rescale, idColumn, splitColumns(strata), populationColumn, format);
            ProcessingResult result = surveyProcessingService.process(toUpload(file), toUpload(population), overrides);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType(SurveyPrepConstants.MEDIA_TYPE_ZIP));
            headers.setContentDisposition(ContentDisposition.attachment().filename(result.archiveFileName()).build());
            return ResponseEntity.ok().headers(headers).body(result.archive());
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (Exception ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, SurveyPrepConstants.MSG_PROCESSING_FAILED, ex);
        }
    }

    /**
     * Returns the multi-response sets, skip rules and label pairs resolved for an uploaded file.
     */
    @PostMapping(value = "/schema", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SchemaPreview> previewSchema(
            @RequestParam("file") MultipartFile file,
            @RequestParam(required = false) String idColumn) {
        try {
            return ResponseEntity.ok(surveyProcessingService.previewSchema(toUpload(file), idColumn));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (Exception ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, SurveyPrepConstants.MSG_PROCESSING_FAILED, ex);
        }
    }

    private UploadedTable toUpload(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            return null;
        }
        return new UploadedTable(file.getOriginalFilename(), file.getBytes());
    }

    private List<String> splitColumns(String value) {
        List<String> columns = new ArrayList<>();
        if (value == null) {
            return columns;
        }
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                columns.add(part.trim());
            }
        }
        return columns;
    }
}
