package com.pyscope.analyzer.report;

import com.pyscope.analyzer.core.AnalysisReport;
import com.pyscope.analyzer.metrics.CouplingMetric;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Coupling metric table, most unstable files first.
 */
public class CsvReporter {

    public void generate(AnalysisReport report, Path outputPath) throws ReportWriteException {
        ReportFiles.writeAtomically(outputPath, render(report));
        System.out.println("CSV Report generated at: " + outputPath.toAbsolutePath());
    }

    public String render(AnalysisReport report) {
        StringBuilder csv = new StringBuilder();
        // Header
        csv.append("Module,Afferent Coupling (Ca),Efferent Coupling (Ce),Instability\n");

        // Rows
        for (CouplingMetric m : report.metricsByInstability()) {
            csv.append(String.format(Locale.ROOT, "%s,%d,%d,%.2f\n",
                    escape(report.relativize(m.file())),
                    m.afferent(),
                    m.efferent(),
                    m.instability()));
        }
        return csv.toString();
    }

    private String escape(String s) {
        if (s == null)
            return "";
        if (s.contains(",") || s.contains("\"") || s.contains("\n")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
