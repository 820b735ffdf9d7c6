package net.kyver.relink.processor;

import net.kyver.relink.core.CancellationSignal;
import net.kyver.relink.core.ReplaceCancelledException;
import net.kyver.relink.core.ReplaceEngine;
import net.kyver.relink.core.ReplaceException;
import net.kyver.relink.core.replacement.ReplacementRules;
import net.kyver.relink.service.file.AtomicFileReplacer;
import net.kyver.relink.util.PerformanceProfiler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryReplacerTest {

    @TempDir
    Path root;

    @TempDir
    Path tempRoot;

    @TempDir
    Path elsewhere;

    private DirectoryReplacer replacer;

    @BeforeEach
    void setUp() throws IOException {
        AtomicFileReplacer fileReplacer = new AtomicFileReplacer(
                new ReplaceEngine(8, new PerformanceProfiler()), StandardCharsets.UTF_8, tempRoot);
        replacer = new DirectoryReplacer(fileReplacer);

        Files.createDirectories(root.resolve("a"));
        Files.writeString(root.resolve("a").resolve("c.txt"), "x in a/c");
        Files.writeString(root.resolve("a.txt"), "x in a");
        Files.writeString(root.resolve("b.txt"), "x in b");
        Files.writeString(root.resolve("image.png"), "x but binary");
    }

    @Test
    void testVisitsFilesDepthFirstInNameOrder() {
        List<Path> seen = new ArrayList<>();
        ReplacementRules<FileContext> rules = ReplacementRules.<FileContext>builder()
                .add("x", (match, context, count) -> {
                    seen.add(context.getRelativePath());
                    return "y";
                })
                .build();
        FileRuleRegistry registry = new FileRuleRegistry()
                .register(FileRule.forExtensions("txt", rules, "txt"));

        BatchReport report = replacer.replaceInDirectory(root, registry, CancellationSignal.none());

        assertEquals(List.of(Path.of("a", "c.txt"), Path.of("a.txt"), Path.of("b.txt")), seen);
        assertEquals(4, report.getFilesVisited());
        assertEquals(3, report.getFilesTransformed());
        assertEquals(3, report.getTotalReplacements());
    }

    @Test
    void testOnlyAcceptedFilesChange() throws IOException {
        FileRuleRegistry registry = new FileRuleRegistry()
                .register(FileRule.forExtensions("txt", ReplacementRules.<FileContext>builder().add("x", "y").build(), ".txt"));

        replacer.replaceInDirectory(root, registry, CancellationSignal.none());

        assertEquals("y in a/c", Files.readString(root.resolve("a").resolve("c.txt")));
        assertEquals("y in a", Files.readString(root.resolve("a.txt")));
        assertEquals("x but binary", Files.readString(root.resolve("image.png")));
    }

    @Test
    void testRulesApplyInRegistrationOrder() throws IOException {
        FileRuleRegistry registry = new FileRuleRegistry()
                .register(new FileRule("x-to-y", file -> file.endsWith("b.txt"),
                        ReplacementRules.<FileContext>builder().add("x", "y").build()))
                .register(new FileRule("y-to-z", file -> file.endsWith("b.txt"),
                        ReplacementRules.<FileContext>builder().add("y", "z").build()));

        BatchReport report = replacer.replaceInDirectory(root, registry, CancellationSignal.none());

        assertEquals("z in b", Files.readString(root.resolve("b.txt")));
        assertEquals(2, report.getFileReports().size());
        assertEquals("x-to-y", report.getFileReports().get(0).getRuleName());
        assertEquals("y-to-z", report.getFileReports().get(1).getRuleName());
        assertEquals(1, report.getFilesTransformed());
    }

    @Test
    void testPredicateSeesEarlierRewrite() throws IOException {
        FileRuleRegistry registry = new FileRuleRegistry()
                .register(new FileRule("first", file -> file.endsWith("a.txt"),
                        ReplacementRules.<FileContext>builder().add("x", "marker").build()))
                .register(new FileRule("second", file -> Files.readString(file).contains("marker"),
                        ReplacementRules.<FileContext>builder().add("marker", "done").build()));

        replacer.replaceInDirectory(root, registry, CancellationSignal.none());

        assertEquals("done in a", Files.readString(root.resolve("a.txt")));
        assertEquals("x in b", Files.readString(root.resolve("b.txt")));
    }

    @Test
    void testPredicateFailureAborts() {
        FileRuleRegistry registry = new FileRuleRegistry()
                .register(new FileRule("broken", file -> {
                    throw new IOException("cannot sniff " + file.getFileName());
                }, ReplacementRules.<FileContext>builder().add("x", "y").build()));

        ReplaceException e = assertThrows(ReplaceException.class,
                () -> replacer.replaceInDirectory(root, registry, CancellationSignal.none()));

        assertEquals(ReplaceException.ErrorKind.SOURCE_READ, e.getKind());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void testCancelledBeforeFirstFile() throws IOException {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        FileRuleRegistry registry = new FileRuleRegistry()
                .register(FileRule.forExtensions("txt", ReplacementRules.<FileContext>builder().add("x", "y").build(), "txt"));

        assertThrows(ReplaceCancelledException.class, () -> replacer.replaceInDirectory(root, registry, signal));

        assertEquals("x in a", Files.readString(root.resolve("a.txt")));
    }

    @Test
    void testFailureKeepsEarlierFilesAndLeavesFailedFileUntouched() throws IOException {
        FileRuleRegistry registry = new FileRuleRegistry()
                .register(FileRule.forExtensions("txt", ReplacementRules.<FileContext>builder()
                        .add("x", (match, context, count) -> {
                            if (context.getFile().endsWith("b.txt")) {
                                throw new IllegalStateException("refusing " + context.getFile());
                            }
                            return "y";
                        })
                        .build(), "txt"));

        assertThrows(IllegalStateException.class,
                () -> replacer.replaceInDirectory(root, registry, CancellationSignal.none()));

        assertEquals("y in a", Files.readString(root.resolve("a.txt")));
        assertEquals("x in b", Files.readString(root.resolve("b.txt")));
    }

    @Test
    void testRootMustBeDirectory() {
        FileRuleRegistry registry = new FileRuleRegistry();

        ReplaceException e = assertThrows(ReplaceException.class, () -> replacer.replaceInDirectory(
                root.resolve("a.txt"), registry, CancellationSignal.none()));
        assertEquals(ReplaceException.ErrorKind.SOURCE_READ, e.getKind());
    }

    private static FileRuleRegistry txtRules() {
        return new FileRuleRegistry()
                .register(FileRule.forExtensions("txt", ReplacementRules.<FileContext>builder().add("x", "y").build(), "txt"));
    }

    @Test
    void testSymbolicLinks() throws IOException {
        Path target = Files.writeString(elsewhere.resolve("target.txt"), "x outside");
        Path linkedDir = Files.createDirectory(elsewhere.resolve("dir"));
        Files.writeString(linkedDir.resolve("inner.txt"), "x inner");
        Files.createSymbolicLink(root.resolve("dir-link"), linkedDir);
        Files.createSymbolicLink(root.resolve("file-link.txt"), target);
        Files.createSymbolicLink(root.resolve("dangling.txt"), elsewhere.resolve("gone.txt"));

        BatchReport report = replacer.replaceInDirectory(root, txtRules(), CancellationSignal.none());

        assertEquals("x inner", Files.readString(linkedDir.resolve("inner.txt")));
        assertFalse(Files.isSymbolicLink(root.resolve("file-link.txt")));
        assertEquals("y outside", Files.readString(root.resolve("file-link.txt")));
        assertEquals("x outside", Files.readString(target));
        assertTrue(Files.isSymbolicLink(root.resolve("dangling.txt")));

        assertEquals(5, report.getFilesVisited());
        assertEquals(2, report.getEntriesSkipped());
        assertEquals(4, report.getFilesTransformed());
    }

    @Test
    void testUndecodableFileDoesNotAbortRun() throws IOException {
        Files.write(root.resolve("bad.txt"), new byte[]{'x', ' ', (byte) 0xFF});

        BatchReport report = replacer.replaceInDirectory(root, txtRules(), CancellationSignal.none());

        assertEquals("y \uFFFD", Files.readString(root.resolve("bad.txt")));
        assertEquals("y in b", Files.readString(root.resolve("b.txt")));
        assertEquals(4, report.getFilesTransformed());
    }
}
