package com.pyscope.analyzer.report;

import com.pyscope.analyzer.core.AnalysisReport;
import com.pyscope.analyzer.graph.Cycle;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mermaid flowchart of the import graph. Edges that belong to a recorded
 * cycle come after the plain edges and get a red dashed {@code linkStyle}.
 */
public class MermaidGenerator {

    static final String CYCLE_STYLE = "stroke:red,stroke-width:2px,stroke-dasharray: 5 5;";

    public void generate(AnalysisReport report, Path outputPath) throws ReportWriteException {
        ReportFiles.writeAtomically(outputPath, render(report) + "\n");
        System.out.println("Mermaid graph generated at: " + outputPath.toAbsolutePath());
    }

    public String render(AnalysisReport report) {
        Set<List<Path>> cycleEdges = new HashSet<>();
        for (Cycle cycle : report.cycles()) {
            cycleEdges.addAll(cycle.edges());
        }

        List<String> normal = new ArrayList<>();
        List<String> circular = new ArrayList<>();
        // dependencies are sorted by importer, then by target
        for (Map.Entry<Path, List<Path>> entry : report.dependencies().entrySet()) {
            Path importer = entry.getKey();
            for (Path imported : entry.getValue()) {
                String link = "    \"%s\" --> \"%s\";".formatted(
                        moduleName(report.relativize(importer)), moduleName(report.relativize(imported)));
                if (cycleEdges.contains(List.of(importer, imported))) {
                    circular.add(link);
                } else {
                    normal.add(link);
                }
            }
        }

        List<String> lines = new ArrayList<>();
        lines.add("graph TD;");
        lines.addAll(normal);
        lines.addAll(circular);
        // linkStyle indexes follow definition order
        for (int i = 0; i < circular.size(); i++) {
            lines.add("    linkStyle " + (normal.size() + i) + " " + CYCLE_STYLE);
        }
        return String.join("\n", lines);
    }

    /**
     * Dotted module name of a root-relative path: {@code pkg/mod.py} is
     * {@code pkg.mod}, {@code pkg/__init__.py} is {@code pkg}.
     */
    static String moduleName(String relativePath) {
        String s = relativePath;
        if (s.endsWith("/__init__.py")) {
            s = s.substring(0, s.length() - "/__init__.py".length());
        } else if (s.endsWith(".py")) {
            s = s.substring(0, s.length() - ".py".length());
        }
        return s.replace('/', '.').replace("\"", "'");
    }
}
