package net.kyver.relink.controller;

import net.kyver.relink.core.ReplaceException;
import net.kyver.relink.core.ValidationResult;
import net.kyver.relink.processor.BatchReport;
import net.kyver.relink.service.RelinkService;
import net.kyver.relink.service.TransformService;
import net.kyver.relink.util.TransformationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

@RestController
@RequestMapping("/api/v1")
public class TransformController {
    private static final Logger logger = LoggerFactory.getLogger(TransformController.class);

    private final TransformService transformService;
    private final RelinkService relinkService;

    @Autowired
    public TransformController(TransformService transformService, RelinkService relinkService) {
        this.transformService = transformService;
        this.relinkService = relinkService;
    }

    @PostMapping(value = "/transform", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> transformFile(
            @RequestParam("file") MultipartFile file,
            @RequestParam("rules") String rulesJson) {

        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";
        logger.info("Transform request: {} ({} bytes)", filename, file.getSize());

        if (file.isEmpty()) {
            logger.warn("Empty file received: {}", filename);
            return ResponseEntity.badRequest()
                .body(Map.of("error", "File is empty", "filename", filename));
        }

        TransformationResult result;
        try {
            result = transformService.transformFile(file, rulesJson);
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected rules for {}: {}", filename, e.getMessage());
            return ResponseEntity.badRequest()
                .body(Map.of("error", e.getMessage(), "filename", filename));
        }

        if (!result.isSuccess()) {
            HttpStatus status = result.isValidationError() ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR;
            logger.warn("Transform failed for {}: {}", filename, result.getErrorMessage());
            return ResponseEntity.status(status)
                .body(Map.of("error", result.getErrorMessage(),
                           "code", result.getErrorCode(),
                           "filename", filename));
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentDispositionFormData("attachment", filename);
        headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        headers.setContentLength(result.getContentLength());
        headers.add("X-Processing-Time-Ms",
            String.valueOf(result.getProcessingResult().getProcessingTimeMillis()));
        headers.add("X-Replacements-Made",
            String.valueOf(result.getProcessingResult().getReplacementCount()));
        if (!result.getWarnings().isEmpty()) {
            headers.add("X-Rule-Warnings", String.valueOf(result.getWarnings().size()));
        }

        logger.info("Transform completed: {} ({} replacements)",
                   filename, result.getProcessingResult().getReplacementCount());

        return new ResponseEntity<>(result.getContent(), headers, HttpStatus.OK);
    }

    @PostMapping("/validate")
    public ResponseEntity<?> validateRules(@RequestParam("rules") String rulesJson) {
        try {
            ValidationResult result = transformService.validateRules(rulesJson);

            return ResponseEntity.ok(Map.of(
                "valid", result.isValid(),
                "errors", result.getErrors(),
                "warnings", result.getWarnings()
            ));

        } catch (IllegalArgumentException e) {
            logger.warn("Validation error: {}", e.getMessage());
            return ResponseEntity.badRequest()
                .body(Map.of("error", "Validation failed", "message", e.getMessage()));
        }
    }

    @PostMapping("/relink")
    public ResponseEntity<?> relink(
            @RequestParam("directory") String directory,
            @RequestParam("domain") String domain,
            @RequestParam("newDomain") String newDomain) {

        logger.info("Relink request: {} ({} -> {})", directory, domain, newDomain);

        try {
            BatchReport report = relinkService.relinkAsync(directory, domain, newDomain).join();
            return ResponseEntity.ok(toJson(report));

        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest()
                .body(Map.of("error", e.getMessage(), "directory", directory));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", e.getMessage(), "directory", directory));
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Relink of {} failed: {}", directory, cause.getMessage(), cause);

            String code = cause instanceof ReplaceException replaceException
                    ? replaceException.getErrorCode()
                    : "INTERNAL";
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Relink failed",
                           "code", code,
                           "message", String.valueOf(cause.getMessage()),
                           "directory", directory));
        }
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> getMetrics() {
        return ResponseEntity.ok(transformService.getPerformanceMetrics());
    }

    private Map<String, Object> toJson(BatchReport report) {
        List<Map<String, Object>> files = report.getFileReports().stream()
            .map(fileReport -> Map.<String, Object>of(
                "file", relinkService.getWorkRoot().relativize(fileReport.getFile()).toString(),
                "rule", fileReport.getRuleName(),
                "replacements", fileReport.getResult().getReplacementCount()))
            .toList();

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("directory", relinkService.getWorkRoot().relativize(report.getRoot()).toString());
        json.put("filesVisited", report.getFilesVisited());
        json.put("entriesSkipped", report.getEntriesSkipped());
        json.put("filesTransformed", report.getFilesTransformed());
        json.put("totalReplacements", report.getTotalReplacements());
        json.put("processingTimeMs", report.getProcessingTimeMillis());
        json.put("files", files);
        return json;
    }
}
