package com.calcbridge.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class FunctionTableTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaultTableLookup() {
        FunctionTable table = FunctionTable.loadDefault();

        FunctionMapping len = table.lookup("len").orElseThrow();
        assertEquals(FunctionMapping.Kind.DIRECT, len.kind());
        assertEquals("LENGTH", len.target());
        assertTrue(table.lookup("SUM").orElseThrow().aggregate());
        assertEquals(FunctionMapping.Kind.UNSUPPORTED, table.lookup("DateDiff").orElseThrow().kind());
    }

    @Test
    void testRegistryView() {
        FunctionTable table = FunctionTable.loadDefault();

        assertTrue(table.isKnown("sum"));
        assertTrue(table.isKnown("DATEDIFF"));
        assertFalse(table.isKnown("FOO"));
        assertTrue(table.returnsString("upper"));
        assertFalse(table.returnsString("LEN"));
        assertFalse(table.returnsString("FOO"));
    }

    @Test
    void testLoadFileOverridesDefaults() throws IOException {
        Path file = tempDir.resolve("functions.json");
        Files.writeString(file, "[\n"
            + "  {\"name\": \"len\", \"kind\": \"TEMPLATE\", \"target\": \"CHAR_LENGTH({0})\"},\n"
            + "  {\"name\": \"MY_FN\", \"kind\": \"DIRECT\", \"target\": \"MY_UDF\", \"comment\": \"ignored\"}\n"
            + "]");

        FunctionTable table = FunctionTable.load(file);

        assertEquals(FunctionMapping.Kind.TEMPLATE, table.lookup("LEN").orElseThrow().kind());
        assertEquals("MY_UDF", table.lookup("my_fn").orElseThrow().target());
        assertEquals(FunctionTable.loadDefault().size() + 1, table.size());
    }

    @Test
    void testLoadMissingFileThrows() {
        assertThrows(IOException.class, () -> FunctionTable.load(tempDir.resolve("missing.json")));
    }

    @Test
    void testLaterEntryWins() {
        FunctionTable table = FunctionTable.of(
            new FunctionMapping("ABS", FunctionMapping.Kind.DIRECT, "ABS", false, false),
            new FunctionMapping("abs", FunctionMapping.Kind.TEMPLATE, "ABS({0})", false, false));

        assertEquals(1, table.size());
        assertEquals(FunctionMapping.Kind.TEMPLATE, table.lookup("Abs").orElseThrow().kind());
    }

    @Test
    void testTemplateArity() {
        assertEquals(3, new FunctionMapping("IIF", FunctionMapping.Kind.TEMPLATE,
            "CASE WHEN {0} THEN {1} ELSE {2} END", false, false).templateArity());
        assertEquals(0, new FunctionMapping("NOW", FunctionMapping.Kind.TEMPLATE,
            "CURRENT_TIMESTAMP()", false, false).templateArity());
        assertEquals(-1, new FunctionMapping("ABS", FunctionMapping.Kind.DIRECT, "ABS", false, false).templateArity());
    }

    @Test
    void testMappingValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> new FunctionMapping("ABS", FunctionMapping.Kind.DIRECT, null, false, false));
        assertThrows(IllegalArgumentException.class,
            () -> new FunctionMapping(" ", FunctionMapping.Kind.DIRECT, "ABS", false, false));
    }

    @Test
    void testOverridesDoNotWarn() throws IOException {
        Path file = tempDir.resolve("functions.json");
        Files.writeString(file, "[{\"name\": \"LEN\", \"kind\": \"DIRECT\", \"target\": \"CHAR_LENGTH\"}]");

        List<ILoggingEvent> events = captureLogs(() -> FunctionTable.load(file));

        assertTrue(events.stream().noneMatch(event -> event.getLevel() == Level.WARN),
            () -> "unexpected warnings: " + events);
    }

    @Test
    void testDuplicateWithinOneSourceWarns() {
        List<ILoggingEvent> events = captureLogs(() -> FunctionTable.loadDefault().withOverrides(List.of(
            new FunctionMapping("MY_FN", FunctionMapping.Kind.DIRECT, "A", false, false),
            new FunctionMapping("my_fn", FunctionMapping.Kind.DIRECT, "B", false, false))));

        assertEquals(1, events.stream().filter(event -> event.getLevel() == Level.WARN).count());
    }

    @Test
    void testWithOverridesLeavesOriginalUnchanged() {
        FunctionTable defaults = FunctionTable.loadDefault();

        FunctionTable overridden = defaults.withOverrides(List.of(
            new FunctionMapping("LEN", FunctionMapping.Kind.DIRECT, "CHAR_LENGTH", false, false)));

        assertEquals("CHAR_LENGTH", overridden.lookup("len").orElseThrow().target());
        assertEquals("LENGTH", defaults.lookup("len").orElseThrow().target());
        assertEquals(defaults.size(), overridden.size());
    }

    private static List<ILoggingEvent> captureLogs(ThrowingRunnable action) {
        Logger logger = (Logger) LoggerFactory.getLogger(FunctionTable.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            action.run();
        } catch (IOException exception) {
            throw new IllegalStateException(exception);
        } finally {
            logger.detachAppender(appender);
        }
        return appender.list;
    }

    @FunctionalInterface
    private interface ThrowingRunnable {
        void run() throws IOException;
    }
}
