package com.pyscope.analyzer.report;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HtmlGraphReporterTest {

    @Test
    void testEmbedsEscapedMermaidGraph() {
        String html = new HtmlGraphReporter().render(ReportFixtures.sample());

        assertTrue(html.startsWith("<!DOCTYPE html>"));
        assertTrue(html.contains("mermaid@10"), "loads mermaid from the CDN");
        assertTrue(html.contains("<pre class=\"mermaid\">"));
        assertTrue(html.contains("\"a\" --&gt; \"b\";"), "arrows are escaped inside the page");
        assertTrue(html.contains("4 files, 1 circular imports"));
        assertFalse(html.contains("{{"), "all placeholders replaced");
    }
}
