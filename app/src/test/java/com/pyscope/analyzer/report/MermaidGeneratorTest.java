package com.pyscope.analyzer.report;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MermaidGeneratorTest {

    @Test
    void testNormalEdgesFirstThenStyledCycleEdges() {
        String graph = new MermaidGenerator().render(ReportFixtures.sample());

        assertEquals(List.of(
                "graph TD;",
                "    \"pkg.c\" --> \"a\";",
                "    \"a\" --> \"b\";",
                "    \"b\" --> \"a\";",
                "    linkStyle 1 stroke:red,stroke-width:2px,stroke-dasharray: 5 5;",
                "    linkStyle 2 stroke:red,stroke-width:2px,stroke-dasharray: 5 5;"),
                graph.lines().toList());
    }

    @Test
    void testEmptyGraph() {
        assertEquals("graph TD;", new MermaidGenerator().render(ReportFixtures.empty()));
    }

    @Test
    void testModuleNames() {
        assertEquals("pkg.mod", MermaidGenerator.moduleName("pkg/mod.py"));
        assertEquals("pkg", MermaidGenerator.moduleName("pkg/__init__.py"));
        assertEquals("main", MermaidGenerator.moduleName("main.py"));
    }
}
