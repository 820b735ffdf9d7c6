package net.kyver.relink.service;

import net.kyver.relink.core.CancellationSignal;
import net.kyver.relink.core.ProcessingResult;
import net.kyver.relink.core.ReplaceEngine;
import net.kyver.relink.core.ReplaceException;
import net.kyver.relink.core.ValidationResult;
import net.kyver.relink.core.replacement.ReplacementRules;
import net.kyver.relink.util.PerformanceProfiler;
import net.kyver.relink.util.TransformationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Applies posted rule sets to uploaded files. Callbacks receive the uploaded file name as
 * their context.
 */
@Service
public class TransformService {
    private static final Logger logger = LoggerFactory.getLogger(TransformService.class);

    private final ReplaceEngine engine;
    private final RuleCompiler ruleCompiler;
    private final CancellationSignal shutdownSignal;

    @Autowired
    public TransformService(ReplaceEngine engine, RuleCompiler ruleCompiler, CancellationSignal shutdownSignal) {
        this.engine = engine;
        this.ruleCompiler = ruleCompiler;
        this.shutdownSignal = shutdownSignal;
    }

    public TransformationResult transformFile(MultipartFile file, List<RuleDefinition> definitions) {
        String filename = file.getOriginalFilename();
        logger.info("Transforming file: {} (size: {} bytes, rules: {})", filename, file.getSize(), definitions.size());

        ValidationResult validation = ruleCompiler.validate(definitions);
        if (!validation.isValid()) {
            return TransformationResult.error(filename, TransformationResult.VALIDATION_ERROR,
                    "Validation failed: " + validation.getErrors());
        }
        ReplacementRules<String> rules = ruleCompiler.compile(definitions);

        long startTime = System.nanoTime();
        try (InputStream input = file.getInputStream();
             ByteArrayOutputStream output = new ByteArrayOutputStream()) {

            ProcessingResult result = engine.processStream(input, output, rules, filename,
                    StandardCharsets.UTF_8, shutdownSignal);
            engine.getProfiler().recordOperation("transform");

            return TransformationResult.success(filename, output.toByteArray(), result, validation.getWarnings());

        } catch (IOException | ReplaceException e) {
            double duration = (System.nanoTime() - startTime) / 1_000_000.0;
            logger.error("File transformation failed: {} after {}ms: {}",
                    filename, String.format("%.2f", duration), e.getMessage(), e);

            String code = e instanceof ReplaceException replaceException
                    ? replaceException.getErrorCode()
                    : ReplaceException.ErrorKind.SOURCE_READ.name();
            return TransformationResult.error(filename, code, "Processing failed: " + e.getMessage());
        }
    }

    public TransformationResult transformFile(MultipartFile file, String rulesJson) {
        return transformFile(file, ruleCompiler.parse(rulesJson));
    }

    public ValidationResult validateRules(String rulesJson) {
        return ruleCompiler.validate(ruleCompiler.parse(rulesJson));
    }

    public Map<String, Object> getPerformanceMetrics() {
        PerformanceProfiler profiler = engine.getProfiler();
        return Map.of(
            "totalOperations", profiler.getTotalOperations(),
            "totalCharsProcessed", profiler.getTotalCharsProcessed(),
            "totalReplacements", profiler.getTotalReplacements(),
            "averageProcessingTimeMs", profiler.getAverageProcessingTimeNanos() / 1_000_000.0,
            "averageThroughputCharsPerSecond", profiler.getAverageThroughputCharsPerSecond(),
            "maxThroughputCharsPerSecond", profiler.getMaxThroughputCharsPerSecond(),
            "transformRequests", profiler.getOperationCount("transform"),
            "relinkJobs", profiler.getOperationCount("relink"),
            "chunkSize", engine.getChunkSize()
        );
    }

    public String generatePerformanceReport() {
        return engine.getProfiler().generateReport();
    }

    public void resetPerformanceMetrics() {
        engine.getProfiler().reset();
        logger.info("Performance metrics reset");
    }
}
