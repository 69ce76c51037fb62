package com.pyscope.analyzer.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pyscope.analyzer.core.AnalysisReport;
import com.pyscope.analyzer.core.Diagnostic;
import com.pyscope.analyzer.core.ProjectSummary;
import com.pyscope.analyzer.core.ProjectSummary.FileSize;
import com.pyscope.analyzer.core.UndefinedSymbol;
import com.pyscope.analyzer.core.UnusedSymbol;
import com.pyscope.analyzer.graph.Cycle;
import com.pyscope.analyzer.metrics.CouplingMetric;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Structured JSON document with stable field names.
 *
 * <pre>
 * {
 *   "undefined_symbols": [{"symbol", "file", "line"}],
 *   "unused_symbols":    [{"symbol", "file", "line", "kind"}],
 *   "circular_imports":  [["a.py", "b.py", "a.py"]],
 *   "coupling_metrics":  [{"module", "ca", "ce", "instability"}],
 *   "diagnostics":       [{"kind", "file", "line", "message"}],
 *   "project_symbols":   {"name": ["file", ...]},
 *   "project_summary":   {"total_py_files", "total_lines", "main_modules", "test_files",
 *                         "config_files", "largest_files": [{"file", "bytes"}]}
 * }
 * </pre>
 */
public class JsonReporter {

    private final ObjectMapper mapper;

    public JsonReporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonReporter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void generate(AnalysisReport report, Path outputPath) throws ReportWriteException {
        ReportFiles.writeAtomically(outputPath, render(report));
        System.out.println("JSON Report generated at: " + outputPath.toAbsolutePath());
    }

    public String render(AnalysisReport report) {
        try {
            return mapper.writeValueAsString(toDocument(report));
        } catch (JsonProcessingException e) {
            // only plain tree nodes are serialized
            throw new IllegalStateException("Could not serialize report", e);
        }
    }

    ObjectNode toDocument(AnalysisReport report) {
        ObjectNode root = mapper.createObjectNode();

        ArrayNode undefined = root.putArray("undefined_symbols");
        for (UndefinedSymbol s : report.undefinedSymbols()) {
            undefined.addObject()
                    .put("symbol", s.symbol())
                    .put("file", report.relativize(s.file()))
                    .put("line", s.line());
        }

        ArrayNode unused = root.putArray("unused_symbols");
        for (UnusedSymbol s : report.unusedSymbols()) {
            unused.addObject()
                    .put("symbol", s.symbol())
                    .put("file", report.relativize(s.file()))
                    .put("line", s.line())
                    .put("kind", s.kind().label());
        }

        ArrayNode cycles = root.putArray("circular_imports");
        for (Cycle cycle : report.cycles()) {
            ArrayNode chain = cycles.addArray();
            cycle.path().forEach(file -> chain.add(report.relativize(file)));
        }

        ArrayNode metrics = root.putArray("coupling_metrics");
        for (CouplingMetric m : report.metricsByInstability()) {
            metrics.addObject()
                    .put("module", report.relativize(m.file()))
                    .put("ca", m.afferent())
                    .put("ce", m.efferent())
                    .put("instability", m.instability());
        }

        ArrayNode diagnostics = root.putArray("diagnostics");
        for (Diagnostic d : report.diagnostics()) {
            diagnostics.addObject()
                    .put("kind", d.kind().label())
                    .put("file", report.relativize(d.file()))
                    .put("line", d.line())
                    .put("message", d.message());
        }

        ObjectNode symbols = root.putObject("project_symbols");
        for (Map.Entry<String, List<Path>> entry : report.projectSymbols().entrySet()) {
            ArrayNode files = symbols.putArray(entry.getKey());
            entry.getValue().forEach(file -> files.add(report.relativize(file)));
        }

        ProjectSummary summary = report.summary();
        ObjectNode summaryNode = root.putObject("project_summary")
                .put("total_py_files", summary.totalFiles())
                .put("total_lines", summary.totalLines());
        addPaths(summaryNode.putArray("main_modules"), report, summary.entryModules());
        addPaths(summaryNode.putArray("test_files"), report, summary.testFiles());
        addPaths(summaryNode.putArray("config_files"), report, summary.configFiles());
        ArrayNode largest = summaryNode.putArray("largest_files");
        for (FileSize f : summary.largestFiles()) {
            largest.addObject()
                    .put("file", report.relativize(f.file()))
                    .put("bytes", f.bytes());
        }
        return root;
    }

    private static void addPaths(ArrayNode array, AnalysisReport report, List<Path> files) {
        files.forEach(file -> array.add(report.relativize(file)));
    }
}
