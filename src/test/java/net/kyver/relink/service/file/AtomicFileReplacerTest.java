package net.kyver.relink.service.file;

import net.kyver.relink.core.CancellationSignal;
import net.kyver.relink.core.ProcessingResult;
import net.kyver.relink.core.ReplaceCancelledException;
import net.kyver.relink.core.ReplaceEngine;
import net.kyver.relink.core.ReplaceException;
import net.kyver.relink.core.replacement.ReplacementRules;
import net.kyver.relink.util.PerformanceProfiler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class AtomicFileReplacerTest {

    @TempDir
    Path workDir;

    @TempDir
    Path tempRoot;

    private AtomicFileReplacer replacer;

    @BeforeEach
    void setUp() {
        ReplaceEngine engine = new ReplaceEngine(4, new PerformanceProfiler());
        replacer = new AtomicFileReplacer(engine, StandardCharsets.UTF_8, tempRoot);
    }

    private long tempEntries() throws IOException {
        try (Stream<Path> entries = Files.list(tempRoot)) {
            return entries.count();
        }
    }

    @Test
    void testReplaceInFile() throws IOException {
        Path file = workDir.resolve("page.html");
        Files.writeString(file, "<a href=\"http://old.org/x\">old.org</a>");
        ReplacementRules<Path> rules = ReplacementRules.<Path>builder()
                .literal("old.org", "new.net")
                .build();

        ProcessingResult result = replacer.replaceInFile(file, rules, file, CancellationSignal.none());

        assertEquals("<a href=\"http://new.net/x\">new.net</a>", Files.readString(file));
        assertEquals(2, result.getReplacementCount());
        assertEquals(0, tempEntries());
    }

    @Test
    void testCallbackFailureLeavesFileUntouched() throws IOException {
        Path file = workDir.resolve("data.txt");
        byte[] original = "one two three two one".getBytes(StandardCharsets.UTF_8);
        Files.write(file, original);
        ReplacementRules<Void> rules = ReplacementRules.<Void>builder()
                .add("one", "1")
                .add("three", (match, context, count) -> {
                    throw new IllegalStateException("callback failed");
                })
                .build();

        assertThrows(IllegalStateException.class,
                () -> replacer.replaceInFile(file, rules, null, CancellationSignal.none()));

        assertArrayEquals(original, Files.readAllBytes(file));
        assertEquals(0, tempEntries());
    }

    @Test
    void testErrorInCallbackRemovesTemporaryDirectory() throws IOException {
        Path file = workDir.resolve("data.txt");
        Files.writeString(file, "a b c d");
        ReplacementRules<Void> rules = ReplacementRules.<Void>builder()
                .add("c", (match, context, count) -> {
                    throw new StackOverflowError();
                })
                .build();

        assertThrows(StackOverflowError.class,
                () -> replacer.replaceInFile(file, rules, null, CancellationSignal.none()));

        assertEquals("a b c d", Files.readString(file));
        try (Stream<Path> entries = Files.walk(tempRoot)) {
            assertEquals(List.of(tempRoot), entries.collect(Collectors.toList()));
        }
    }

    @Test
    void testCancelledRunLeavesFileUntouched() throws IOException {
        Path file = workDir.resolve("data.txt");
        Files.writeString(file, "aaaaaaaaaaaa");
        CancellationSignal signal = new CancellationSignal();
        ReplacementRules<Void> rules = ReplacementRules.<Void>builder()
                .add("a", (match, context, count) -> {
                    if (count == 5) {
                        signal.cancel();
                    }
                    return "b";
                })
                .build();

        assertThrows(ReplaceCancelledException.class,
                () -> replacer.replaceInFile(file, rules, null, signal));

        assertEquals("aaaaaaaaaaaa", Files.readString(file));
        assertEquals(0, tempEntries());
    }

    @Test
    void testMissingFile() throws IOException {
        Path missing = workDir.resolve("missing.txt");
        ReplacementRules<Void> rules = ReplacementRules.<Void>builder().add("a", "b").build();

        ReplaceException e = assertThrows(ReplaceException.class,
                () -> replacer.replaceInFile(missing, rules, null, CancellationSignal.none()));

        assertEquals(ReplaceException.ErrorKind.SOURCE_READ, e.getKind());
        assertEquals(missing, e.getPath());
        assertFalse(Files.exists(missing));
        assertEquals(0, tempEntries());
    }

    @Test
    void testTransformTo() throws IOException {
        Path source = workDir.resolve("source.txt");
        Path target = workDir.resolve("target.txt");
        Files.writeString(source, "hello world");
        Files.writeString(target, "stale");
        ReplacementRules<Void> rules = ReplacementRules.<Void>builder().add("world", "there").build();

        replacer.transformTo(source, target, rules, null, CancellationSignal.none());

        assertEquals("hello world", Files.readString(source));
        assertEquals("hello there", Files.readString(target));
    }

    @Test
    void testTransformToRejectsSameFile() throws IOException {
        Path source = workDir.resolve("source.txt");
        Files.writeString(source, "hello");
        ReplacementRules<Void> rules = ReplacementRules.<Void>builder().add("h", "j").build();

        assertThrows(IllegalArgumentException.class, () -> replacer.transformTo(
                source, workDir.resolve("./source.txt"), rules, null, CancellationSignal.none()));
        assertEquals("hello", Files.readString(source));
    }

    @Test
    void testEmptyFile() throws IOException {
        Path file = workDir.resolve("empty.txt");
        Files.createFile(file);
        ReplacementRules<Void> rules = ReplacementRules.<Void>builder().add("a", "b").build();

        ProcessingResult result = replacer.replaceInFile(file, rules, null, CancellationSignal.none());

        assertEquals(0, Files.size(file));
        assertEquals(0, result.getCharsRead());
    }
}
