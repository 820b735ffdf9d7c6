package net.kyver.relink.util;

import net.kyver.relink.core.ProcessingResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of transforming one uploaded file: either the rewritten bytes with their
 * {@link ProcessingResult}, or an error code and message.
 */
public class TransformationResult {

    public static final String VALIDATION_ERROR = "VALIDATION";

    private final String filename;
    private final byte[] content;
    private final String errorCode;
    private final String errorMessage;
    private final ProcessingResult processingResult;
    private final List<String> warnings;

    private TransformationResult(String filename, byte[] content, String errorCode,
                                 String errorMessage, ProcessingResult processingResult,
                                 List<String> warnings) {
        this.filename = filename;
        this.content = content;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
        this.processingResult = processingResult;
        this.warnings = new ArrayList<>(warnings);
    }

    public static TransformationResult success(String filename, byte[] content,
                                               ProcessingResult processingResult, List<String> warnings) {
        return new TransformationResult(filename, content, null, null, processingResult, warnings);
    }

    public static TransformationResult error(String filename, String errorCode, String errorMessage) {
        return new TransformationResult(filename, null, errorCode, errorMessage, null, List.of());
    }

    public String getFilename() {
        return filename;
    }

    public boolean isSuccess() {
        return errorCode == null;
    }

    public boolean isValidationError() {
        return VALIDATION_ERROR.equals(errorCode);
    }

    public byte[] getContent() {
        return content != null ? content.clone() : null;
    }

    public int getContentLength() {
        return content != null ? content.length : 0;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public ProcessingResult getProcessingResult() {
        return processingResult;
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return String.format("TransformationResult{filename='%s', size=%d bytes, %s}",
                    filename, getContentLength(), processingResult);
        }
        return String.format("TransformationResult{filename='%s', error=%s, message='%s'}",
                filename, errorCode, errorMessage);
    }
}
