package com.pyscope.analyzer.core;

import com.pyscope.analyzer.graph.Cycle;
import com.pyscope.analyzer.graph.CycleSearch;
import com.pyscope.analyzer.graph.DependencyGraph;
import com.pyscope.analyzer.imports.ImportDeclaration;
import com.pyscope.analyzer.imports.ImportResolver;
import com.pyscope.analyzer.metrics.CouplingCalculator;
import com.pyscope.analyzer.metrics.CouplingMetric;
import com.pyscope.analyzer.symbols.Definition;
import com.pyscope.analyzer.symbols.DefinitionKind;
import com.pyscope.analyzer.symbols.FileSymbols;
import com.pyscope.analyzer.symbols.SymbolCollector;
import com.pyscope.analyzer.symbols.Use;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the symbol pass and import resolution for every file in parallel, then
 * merges the results into one {@link AnalysisReport}.
 *
 * <p>Per-file work shares nothing but the read-only resolver. After all
 * futures are joined, the undefined and unused passes, the dependency graph,
 * cycles and coupling metrics are computed sequentially.</p>
 */
public class ProjectAnalyzer {

    private static final Comparator<UndefinedSymbol> UNDEFINED_ORDER = Comparator
            .comparing(UndefinedSymbol::file)
            .thenComparingInt(UndefinedSymbol::line)
            .thenComparing(UndefinedSymbol::symbol);

    private static final Comparator<UnusedSymbol> UNUSED_ORDER = Comparator
            .comparing(UnusedSymbol::file)
            .thenComparingInt(UnusedSymbol::line)
            .thenComparing(UnusedSymbol::symbol);

    private static final Comparator<Diagnostic> DIAGNOSTIC_ORDER = Comparator
            .comparing(Diagnostic::file)
            .thenComparingInt(Diagnostic::line)
            .thenComparing(d -> d.kind().label());

    private final Path projectRoot;
    private final AnalyzerConfig config;
    private final ImportResolver resolver;
    private final Builtins builtins;

    public ProjectAnalyzer(Path projectRoot, AnalyzerConfig config) {
        this(projectRoot, config, new ImportResolver(projectRoot));
    }

    public ProjectAnalyzer(Path projectRoot, AnalyzerConfig config, ImportResolver resolver) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.config = config;
        this.resolver = resolver;
        this.builtins = Builtins.withExtras(config.getExtraBuiltins());
    }

    /** What one worker hands back for one file. */
    private record FileAnalysis(FileSymbols symbols, Set<Path> dependencies, List<Diagnostic> diagnostics) {
    }

    /**
     * Analyzes the given units. Unparseable units and worker failures become
     * {@code file-skipped} diagnostics; the rest of the project is still
     * analyzed.
     *
     * @throws InterruptedException if interrupted while waiting for workers
     */
    public AnalysisReport analyze(List<SourceUnit> units) throws InterruptedException {
        return analyze(units, ProjectSummary.empty());
    }

    /**
     * Same as {@link #analyze(List)}, carrying the given project summary into
     * the report.
     *
     * @throws InterruptedException if interrupted while waiting for workers
     */
    public AnalysisReport analyze(List<SourceUnit> units, ProjectSummary summary) throws InterruptedException {
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<FileAnalysis> analyses = new ArrayList<>();

        List<SourceUnit> parsed = new ArrayList<>();
        for (SourceUnit unit : units) {
            if (unit.isParsed()) {
                parsed.add(unit);
            } else {
                diagnostics.add(Diagnostic.fileSkipped(unit.file(), unit.errorLine(), unit.error()));
            }
        }

        int threads = Math.max(1, Math.min(config.effectiveWorkers(), parsed.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<FileAnalysis>> futures = new ArrayList<>();
            for (SourceUnit unit : parsed) {
                futures.add(executor.submit(() -> analyzeFile(unit)));
            }
            for (int i = 0; i < futures.size(); i++) {
                Path file = parsed.get(i).file();
                try {
                    analyses.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    System.err.println("Warning: skipping " + relativize(file) + ": " + cause.getMessage());
                    diagnostics.add(Diagnostic.fileSkipped(file, 0, "analysis failed: " + cause.getMessage()));
                }
            }
        } finally {
            executor.shutdownNow();
        }

        for (FileAnalysis analysis : analyses) {
            diagnostics.addAll(analysis.diagnostics());
        }
        diagnostics.sort(DIAGNOSTIC_ORDER);

        DependencyGraph graph = buildGraph(analyses);
        List<Cycle> cycles = findCycles(graph);
        Map<Path, CouplingMetric> metrics = new CouplingCalculator().calculate(graph);

        Map<Path, List<Path>> dependencies = new TreeMap<>();
        graph.adjacency().forEach((file, targets) -> dependencies.put(file, List.copyOf(targets)));

        return new AnalysisReport(
                projectRoot,
                findUndefined(analyses),
                findUnused(analyses),
                cycles,
                metrics,
                dependencies,
                diagnostics,
                projectSymbols(analyses),
                analyses.size(),
                units.size() - analyses.size(),
                summary);
    }

    private List<Cycle> findCycles(DependencyGraph graph) {
        if (config.getCycleMode() != CycleMode.ELEMENTARY) {
            return graph.findCycles();
        }
        CycleSearch search = graph.findElementaryCycles(config.getMaxElementaryCycles());
        if (search.truncated()) {
            System.err.println("Warning: elementary cycle search stopped at " + search.cycles().size()
                    + " cycles, raise cycles.max_elementary to see more");
        }
        return search.cycles();
    }

    private FileAnalysis analyzeFile(SourceUnit unit) {
        Path file = unit.file();
        FileSymbols symbols = new SymbolCollector().collect(file, unit.tree());

        Set<Path> dependencies = new TreeSet<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ImportDeclaration declaration : symbols.imports()) {
            if (declaration.isWildcard() && config.getWildcardPolicy() == WildcardPolicy.FLAG) {
                diagnostics.add(Diagnostic.wildcardImport(file, declaration.line(), displayModule(declaration)));
            }
            dependencies.addAll(resolver.resolveAll(declaration, file));
        }
        return new FileAnalysis(symbols, dependencies, diagnostics);
    }

    private static String displayModule(ImportDeclaration declaration) {
        return ".".repeat(declaration.level()) + declaration.module();
    }

    private DependencyGraph buildGraph(List<FileAnalysis> analyses) {
        DependencyGraph graph = new DependencyGraph();
        for (FileAnalysis analysis : analyses) {
            Path file = analysis.symbols().file();
            graph.addNode(file);
            for (Path target : analysis.dependencies()) {
                graph.addEdge(file, target);
            }
        }
        return graph;
    }

    /**
     * Pending uses that no file defines and that are not builtins, once per
     * (file, line, name).
     */
    private List<UndefinedSymbol> findUndefined(List<FileAnalysis> analyses) {
        Set<String> defined = new HashSet<>();
        for (FileAnalysis analysis : analyses) {
            for (Definition definition : analysis.symbols().definitions()) {
                defined.add(definition.name());
            }
        }

        Set<UndefinedSymbol> undefined = new LinkedHashSet<>();
        for (FileAnalysis analysis : analyses) {
            for (Use use : analysis.symbols().pendingUses()) {
                if (!defined.contains(use.name()) && !builtins.contains(use.name())) {
                    undefined.add(new UndefinedSymbol(use.name(), use.file(), use.line()));
                }
            }
        }
        List<UndefinedSymbol> result = new ArrayList<>(undefined);
        result.sort(UNDEFINED_ORDER);
        return result;
    }

    /**
     * Functions and classes at any depth, and module-level variables, whose
     * name is never read anywhere in the project.
     */
    private List<UnusedSymbol> findUnused(List<FileAnalysis> analyses) {
        Set<String> used = new HashSet<>();
        for (FileAnalysis analysis : analyses) {
            FileSymbols symbols = analysis.symbols();
            symbols.resolvedUses().forEach(u -> used.add(u.name()));
            symbols.pendingUses().forEach(u -> used.add(u.name()));
            symbols.memberUses().forEach(u -> used.add(u.name()));
        }

        PrivateNamePolicy policy = config.getPrivateNamePolicy();
        List<UnusedSymbol> unused = new ArrayList<>();
        for (FileAnalysis analysis : analyses) {
            for (Definition definition : analysis.symbols().definitions()) {
                if (!isUnusedCandidate(definition) || used.contains(definition.name())
                        || policy.isPrivate(definition.name())) {
                    continue;
                }
                unused.add(new UnusedSymbol(definition.name(), definition.file(), definition.line(), definition.kind()));
            }
        }
        unused.sort(UNUSED_ORDER);
        return unused;
    }

    private static boolean isUnusedCandidate(Definition definition) {
        return switch (definition.kind()) {
            case FUNCTION, CLASS -> true;
            case VARIABLE -> definition.isModuleLevel();
            default -> false;
        };
    }

    private Map<String, List<Path>> projectSymbols(List<FileAnalysis> analyses) {
        Map<String, Set<Path>> index = new TreeMap<>();
        for (FileAnalysis analysis : analyses) {
            for (Definition definition : analysis.symbols().definitions()) {
                if (definition.isModuleLevel() && definition.kind() != DefinitionKind.IMPORT_ALIAS) {
                    index.computeIfAbsent(definition.name(), k -> new TreeSet<>()).add(definition.file());
                }
            }
        }
        Map<String, List<Path>> result = new TreeMap<>();
        index.forEach((name, files) -> result.put(name, List.copyOf(files)));
        return result;
    }

    private String relativize(Path file) {
        Path rel = file.startsWith(projectRoot) ? projectRoot.relativize(file) : file;
        return rel.toString().replace('\\', '/');
    }
}
