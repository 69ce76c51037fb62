package com.pyscope.analyzer.report;

import com.pyscope.analyzer.core.AnalysisReport;

import java.nio.file.Path;

/**
 * Standalone HTML page rendering the Mermaid import graph in the browser.
 */
public class HtmlGraphReporter {

    private final MermaidGenerator mermaid;

    public HtmlGraphReporter() {
        this(new MermaidGenerator());
    }

    public HtmlGraphReporter(MermaidGenerator mermaid) {
        this.mermaid = mermaid;
    }

    public void generate(AnalysisReport report, Path outputPath) throws ReportWriteException {
        ReportFiles.writeAtomically(outputPath, render(report));
        System.out.println("HTML graph generated at: " + outputPath.toAbsolutePath());
    }

    public String render(AnalysisReport report) {
        String title = "Dependency Graph: " + escape(String.valueOf(report.projectRoot().getFileName()));
        return TEMPLATE
                .replace("{{TITLE}}", title)
                .replace("{{SUMMARY}}", "%d files, %d circular imports".formatted(
                        report.filesAnalyzed(), report.cycles().size()))
                .replace("{{GRAPH}}", escape(mermaid.render(report)));
    }

    private static String escape(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private static final String TEMPLATE = """
            <!DOCTYPE html>
            <html>
            <head>
                <meta charset="utf-8">
                <title>{{TITLE}}</title>
                <script type="module">
                    import mermaid from 'https://cdn.jsdelivr.net/npm/mermaid@10/dist/mermaid.esm.min.mjs';
                    mermaid.initialize({ startOnLoad: true });
                </script>
                <style>
                    body { font-family: sans-serif; margin: 20px; background-color: #f4f4f4; }
                    h1 { color: #333; }
                    .summary { color: #666; margin-bottom: 16px; }
                    .mermaid { background-color: #fff; padding: 20px; border-radius: 8px;
                               box-shadow: 0 2px 4px rgba(0,0,0,0.1); }
                </style>
            </head>
            <body>
                <h1>{{TITLE}}</h1>
                <div class="summary">{{SUMMARY}}. Dashed red edges are part of an import cycle.</div>
                <pre class="mermaid">
            {{GRAPH}}
                </pre>
            </body>
            </html>
            """;
}
