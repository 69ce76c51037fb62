package com.pyscope.analyzer.report;

import com.pyscope.analyzer.core.AnalysisReport;
import com.pyscope.analyzer.core.Diagnostic;
import com.pyscope.analyzer.core.ProjectSummary;
import com.pyscope.analyzer.core.ProjectSummary.FileSize;
import com.pyscope.analyzer.core.UndefinedSymbol;
import com.pyscope.analyzer.core.UnusedSymbol;
import com.pyscope.analyzer.graph.Cycle;
import com.pyscope.analyzer.metrics.CouplingMetric;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Human-readable report: project summary, findings, cycles and the coupling table.
 */
public class ConsoleReporter {

    private final PrintStream out;

    public ConsoleReporter() {
        this(System.out);
    }

    public ConsoleReporter(PrintStream out) {
        this.out = out;
    }

    public void print(AnalysisReport report) {
        out.println("\n--- Project Analysis Results ---");
        printSummary(report);

        List<UndefinedSymbol> undefined = report.undefinedSymbols();
        if (!undefined.isEmpty()) {
            out.printf("%n[UNDEFINED] Found %d undefined symbols:%n", undefined.size());
            for (UndefinedSymbol s : undefined) {
                out.printf("  - %s:%d -> %s%n", report.relativize(s.file()), s.line(), s.symbol());
            }
        }

        List<UnusedSymbol> unused = report.unusedSymbols();
        if (!unused.isEmpty()) {
            out.printf("%n[UNUSED] Found %d unused symbols:%n", unused.size());
            for (UnusedSymbol s : unused) {
                out.printf("  - %s:%d -> %s (%s)%n", report.relativize(s.file()), s.line(), s.symbol(), s.kind().label());
            }
        }

        List<Cycle> cycles = report.cycles();
        if (!cycles.isEmpty()) {
            out.printf("%n[CYCLES] Found %d circular imports:%n", cycles.size());
            for (int i = 0; i < cycles.size(); i++) {
                String chain = cycles.get(i).path().stream()
                        .map(report::relativize)
                        .collect(Collectors.joining(" -> "));
                out.printf("  Cycle %d: %s%n", i + 1, chain);
            }
        }

        if (!report.diagnostics().isEmpty()) {
            out.printf("%n[DIAGNOSTICS] %d notes:%n", report.diagnostics().size());
            for (Diagnostic d : report.diagnostics()) {
                out.printf("  - [%s] %s:%d %s%n", d.kind().label(), report.relativize(d.file()), d.line(), d.message());
            }
        }

        out.println("\n[COUPLING] Coupling Metrics:");
        out.println("  %-60s %-5s %-5s %-12s".formatted("Module", "Ca", "Ce", "I"));
        out.println("  " + "-".repeat(85));
        for (CouplingMetric m : report.metricsByInstability()) {
            out.println("  %-60s %-5d %-5d %-12.2f".formatted(
                    truncate(report.relativize(m.file()), 60), m.afferent(), m.efferent(), m.instability()));
        }

        out.printf("%nAnalyzed: %d files | Skipped: %d files%n", report.filesAnalyzed(), report.filesSkipped());
    }

    private void printSummary(AnalysisReport report) {
        ProjectSummary summary = report.summary();
        if (summary.totalFiles() == 0) {
            return;
        }
        out.printf("%n[SUMMARY] %d Python files, %d lines%n", summary.totalFiles(), summary.totalLines());
        if (!summary.entryModules().isEmpty()) {
            out.println("  Entry modules: " + joined(report, summary.entryModules()));
        }
        out.printf("  Test files: %d%n", summary.testFiles().size());
        if (!summary.configFiles().isEmpty()) {
            out.println("  Config files: " + joined(report, summary.configFiles()));
        }
        out.println("  Largest files:");
        for (FileSize f : summary.largestFiles()) {
            out.printf("    %s (%d bytes)%n", report.relativize(f.file()), f.bytes());
        }
    }

    private static String joined(AnalysisReport report, List<Path> files) {
        return files.stream().map(report::relativize).collect(Collectors.joining(", "));
    }

    private String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return "..." + s.substring(s.length() - (len - 3));
    }
}
