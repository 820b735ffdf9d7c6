package net.kyver.relink.config;

import net.kyver.relink.core.CancellationSignal;
import net.kyver.relink.core.ReplaceEngine;
import net.kyver.relink.processor.DirectoryReplacer;
import net.kyver.relink.service.file.AtomicFileReplacer;
import net.kyver.relink.util.PerformanceProfiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.nio.file.Paths;

@Configuration
public class RelinkConfig {
    private static final Logger logger = LoggerFactory.getLogger(RelinkConfig.class);

    private final CancellationSignal shutdownSignal = new CancellationSignal();

    @Bean
    public PerformanceProfiler performanceProfiler() {
        return new PerformanceProfiler();
    }

    @Bean
    public ReplaceEngine replaceEngine(@Value("${relink.chunk-size:65536}") int chunkSize,
                                       PerformanceProfiler profiler) {
        return new ReplaceEngine(chunkSize, profiler);
    }

    @Bean
    public AtomicFileReplacer atomicFileReplacer(ReplaceEngine engine,
                                                 @Value("${relink.charset:UTF-8}") String charset,
                                                 @Value("${relink.temp-dir:}") String tempDir) {
        Path tempRoot = tempDir.isBlank() ? null : Paths.get(tempDir);
        return new AtomicFileReplacer(engine, Charset.forName(charset), tempRoot);
    }

    @Bean
    public DirectoryReplacer directoryReplacer(AtomicFileReplacer atomicFileReplacer) {
        return new DirectoryReplacer(atomicFileReplacer);
    }

    /**
     * Shared signal cancelled when the context shuts down, so running jobs stop at the next
     * chunk instead of holding up the executor.
     */
    @Bean
    public CancellationSignal shutdownSignal() {
        return shutdownSignal;
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        logger.info("Cancelling running replacement jobs");
        shutdownSignal.cancel();
    }
}
