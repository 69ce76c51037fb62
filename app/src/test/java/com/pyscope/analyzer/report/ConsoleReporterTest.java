package com.pyscope.analyzer.report;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleReporterTest {

    @Test
    void testPrintsEverySection() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new ConsoleReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8)).print(ReportFixtures.sample());
        String out = buffer.toString(StandardCharsets.UTF_8);

        assertTrue(out.contains("d.py:1 -> totally_undefined_name"));
        assertTrue(out.contains("pkg/c.py:4 -> unused_fn (function)"));
        assertTrue(out.contains("Cycle 1: a.py -> b.py -> a.py"));
        assertTrue(out.contains("[wildcard-import] pkg/c.py:2"));
        int table = out.indexOf("[COUPLING]");
        assertTrue(out.indexOf("pkg/c.py ", table) < out.indexOf("d.py ", table),
                "coupling table starts with the most unstable file");
        assertTrue(out.contains("Analyzed: 4 files | Skipped: 0 files"));
    }

    @Test
    void testPrintsProjectSummary() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new ConsoleReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8)).print(ReportFixtures.sample());
        String out = buffer.toString(StandardCharsets.UTF_8);

        assertTrue(out.contains("[SUMMARY] 5 Python files, 162 lines"));
        assertTrue(out.contains("Entry modules: main.py"));
        assertTrue(out.contains("Test files: 1"));
        assertTrue(out.contains("Config files: pyscope.yaml"));
        assertTrue(out.contains("    a.py (900 bytes)"));
        assertTrue(out.indexOf("[SUMMARY]") < out.indexOf("[UNDEFINED]"));
    }

    @Test
    void testEmptyReportOmitsFindingSections() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new ConsoleReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8)).print(ReportFixtures.empty());
        String out = buffer.toString(StandardCharsets.UTF_8);

        assertFalse(out.contains("[UNDEFINED]"));
        assertFalse(out.contains("[CYCLES]"));
        assertFalse(out.contains("[SUMMARY]"));
        assertTrue(out.contains("Coupling Metrics"));
    }
}
