package com.pyscope.analyzer.report;

import com.pyscope.analyzer.core.AnalysisReport;
import com.pyscope.analyzer.core.Diagnostic;
import com.pyscope.analyzer.core.ProjectSummary;
import com.pyscope.analyzer.core.ProjectSummary.FileSize;
import com.pyscope.analyzer.core.UndefinedSymbol;
import com.pyscope.analyzer.core.UnusedSymbol;
import com.pyscope.analyzer.graph.Cycle;
import com.pyscope.analyzer.metrics.CouplingMetric;
import com.pyscope.analyzer.symbols.DefinitionKind;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * a.py and b.py import each other, pkg/c.py imports a.py, d.py stands alone.
 * The summary also counts tests/test_a.py; main.py is listed as entry module only.
 */
final class ReportFixtures {

    static final Path ROOT = Path.of("/work/project");
    static final Path A = ROOT.resolve("a.py");
    static final Path B = ROOT.resolve("b.py");
    static final Path C = ROOT.resolve("pkg/c.py");
    static final Path D = ROOT.resolve("d.py");
    static final Path TEST = ROOT.resolve("tests/test_a.py");
    static final Path MAIN = ROOT.resolve("main.py");

    private ReportFixtures() {
    }

    static AnalysisReport sample() {
        return new AnalysisReport(
                ROOT,
                List.of(new UndefinedSymbol("totally_undefined_name", D, 1)),
                List.of(new UnusedSymbol("unused_fn", C, 4, DefinitionKind.FUNCTION)),
                List.of(new Cycle(List.of(A, B, A))),
                Map.of(
                        A, CouplingMetric.of(A, 2, 1),
                        B, CouplingMetric.of(B, 1, 1),
                        C, CouplingMetric.of(C, 0, 1),
                        D, CouplingMetric.of(D, 0, 0)),
                Map.of(
                        A, List.of(B),
                        B, List.of(A),
                        C, List.of(A),
                        D, List.of()),
                List.of(Diagnostic.wildcardImport(C, 2, "a")),
                Map.of("unused_fn", List.of(C)),
                4,
                0,
                new ProjectSummary(5, 162,
                        List.of(new FileSize(A, 900), new FileSize(C, 500), new FileSize(TEST, 320),
                                new FileSize(B, 300), new FileSize(D, 40)),
                        List.of(TEST),
                        List.of(MAIN),
                        List.of(ROOT.resolve("pyscope.yaml"))));
    }

    static AnalysisReport empty() {
        return new AnalysisReport(ROOT, List.of(), List.of(), List.of(), Map.of(), Map.of(), List.of(), Map.of(), 0, 0,
                ProjectSummary.empty());
    }
}
