package com.pyscope.analyzer;

import com.pyscope.analyzer.analyzers.ProjectSummarizer;
import com.pyscope.analyzer.analyzers.PythonAstParser;
import com.pyscope.analyzer.analyzers.SourceEnumerator;
import com.pyscope.analyzer.analyzers.SourceParser;
import com.pyscope.analyzer.core.AnalysisReport;
import com.pyscope.analyzer.core.AnalyzerConfig;
import com.pyscope.analyzer.core.ProjectAnalyzer;
import com.pyscope.analyzer.core.ProjectSummary;
import com.pyscope.analyzer.core.SourceUnit;
import com.pyscope.analyzer.report.ConsoleReporter;
import com.pyscope.analyzer.report.CsvReporter;
import com.pyscope.analyzer.report.HtmlGraphReporter;
import com.pyscope.analyzer.report.JsonReporter;
import com.pyscope.analyzer.report.MermaidGenerator;
import com.pyscope.analyzer.report.ReportWriteException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * PyScope - static analysis of a Python project: undefined and unused
 * symbols, circular imports and coupling metrics.
 *
 * Usage: java -jar pyscope-app.jar --project &lt;dir&gt; [--output &lt;dir&gt;] [--json] [--csv]
 * [--mermaid] [--html] [--workers &lt;n&gt;] [--fail-on-findings]
 */
public class App {

    static final int EXIT_OK = 0;
    static final int EXIT_FINDINGS = 1;
    static final int EXIT_ERROR = 2;

    public static void main(String[] args) {
        System.exit(run(args, new PythonAstParserFactory()));
    }

    /** Lets tests swap the interpreter-backed parser. */
    interface ParserFactory {
        SourceParser create(AnalyzerConfig config);
    }

    private static final class PythonAstParserFactory implements ParserFactory {
        @Override
        public SourceParser create(AnalyzerConfig config) {
            return new PythonAstParser(config);
        }
    }

    static int run(String[] args, ParserFactory parsers) {
        System.out.println("=== PyScope ===");

        CliArgs cliArgs = parseArgs(args);
        if (cliArgs == null) {
            printUsage();
            return EXIT_ERROR;
        }

        try {
            return new App().run(cliArgs, parsers);
        } catch (ReportWriteException e) {
            System.err.println("Error: report not written, earlier output kept: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Error: interrupted");
            return EXIT_ERROR;
        }
    }

    private static void printUsage() {
        System.err.println("""
                Usage: java -jar pyscope-app.jar --project <dir> [options]

                Arguments:
                  --project <dir>     Root of the Python project to analyze (required)
                  --output <dir>      Output directory for report files (default: current directory)
                  --json              Write pyscope-report.json
                  --csv               Write pyscope-metrics.csv
                  --mermaid           Write pyscope-graph.mmd
                  --html              Write pyscope-graph.html
                  --workers <n>       Worker threads, 0 = available processors (overrides pyscope.yaml)
                  --fail-on-findings  Exit with 1 when undefined symbols or cycles are found
                """);
    }

    record CliArgs(
            Path projectDir,
            Path outputDir,
            boolean json,
            boolean csv,
            boolean mermaid,
            boolean html,
            Integer workers, // null = use configuration
            boolean failOnFindings) {
    }

    static CliArgs parseArgs(String[] args) {
        Path projectDir = null;
        Path outputDir = Path.of(".");
        boolean json = false;
        boolean csv = false;
        boolean mermaid = false;
        boolean html = false;
        Integer workers = null;
        boolean failOnFindings = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--project" -> {
                    if (i + 1 >= args.length)
                        return null;
                    projectDir = Path.of(args[++i]);
                }
                case "--output" -> {
                    if (i + 1 >= args.length)
                        return null;
                    outputDir = Path.of(args[++i]);
                }
                case "--json" -> json = true;
                case "--csv" -> csv = true;
                case "--mermaid" -> mermaid = true;
                case "--html" -> html = true;
                case "--workers" -> {
                    if (i + 1 >= args.length)
                        return null;
                    try {
                        workers = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid --workers value: " + args[i]);
                        return null;
                    }
                    if (workers < 0)
                        return null;
                }
                case "--fail-on-findings" -> failOnFindings = true;
                default -> {
                    System.err.println("Unknown argument: " + args[i]);
                    return null;
                }
            }
        }

        if (projectDir == null) {
            return null;
        }
        return new CliArgs(projectDir, outputDir, json, csv, mermaid, html, workers, failOnFindings);
    }

    private int run(CliArgs args, ParserFactory parsers) throws IOException, InterruptedException {
        Path projectRoot = args.projectDir().toAbsolutePath().normalize();
        if (!Files.isDirectory(projectRoot)) {
            System.err.println("Error: not a directory: " + args.projectDir());
            return EXIT_ERROR;
        }

        AnalyzerConfig config = AnalyzerConfig.load(projectRoot);
        if (args.workers() != null) {
            config.withWorkers(args.workers());
        }

        System.out.println("\n>>> PHASE 1: COLLECTING SOURCES <<<");
        SourceParser parser = parsers.create(config);
        List<Path> files = new SourceEnumerator(config, parser.getSupportedExtensions()).enumerate(projectRoot);
        System.out.printf("Found %d %s files under %s%n", files.size(), parser.getLanguageId(), projectRoot);
        ProjectSummary summary = new ProjectSummarizer(config).summarize(projectRoot, files);
        if (!parser.isAvailable()) {
            System.err.println("Warning: " + parser.getLanguageId() + " parser not available, every file will be skipped");
        }

        System.out.println("\n>>> PHASE 2: PARSING <<<");
        List<SourceUnit> units = parser.parseBatch(files);
        long parsed = units.stream().filter(SourceUnit::isParsed).count();
        System.out.printf("Parsed: %d files | Unparseable: %d files%n", parsed, units.size() - parsed);

        System.out.println("\n>>> PHASE 3: ANALYZING SYMBOLS AND IMPORTS <<<");
        AnalysisReport report = new ProjectAnalyzer(projectRoot, config).analyze(units, summary);
        new ConsoleReporter().print(report);

        if (args.json() || args.csv() || args.mermaid() || args.html()) {
            System.out.println("\n>>> PHASE 4: GENERATING REPORTS <<<");
            Path out = args.outputDir();
            if (args.json()) {
                new JsonReporter().generate(report, out.resolve("pyscope-report.json"));
            }
            if (args.csv()) {
                new CsvReporter().generate(report, out.resolve("pyscope-metrics.csv"));
            }
            if (args.mermaid()) {
                new MermaidGenerator().generate(report, out.resolve("pyscope-graph.mmd"));
            }
            if (args.html()) {
                new HtmlGraphReporter().generate(report, out.resolve("pyscope-graph.html"));
            }
        }

        if (args.failOnFindings() && report.hasFindings()) {
            System.out.printf("%nFindings: %d undefined symbols, %d cycles%n",
                    report.undefinedSymbols().size(), report.cycles().size());
            return EXIT_FINDINGS;
        }
        return EXIT_OK;
    }
}
