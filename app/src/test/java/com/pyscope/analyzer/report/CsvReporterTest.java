package com.pyscope.analyzer.report;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvReporterTest {

    @Test
    void testMetricTable() {
        List<String> lines = new CsvReporter().render(ReportFixtures.sample()).lines().toList();

        assertEquals(5, lines.size());
        assertEquals("Module,Afferent Coupling (Ca),Efferent Coupling (Ce),Instability", lines.get(0));
        assertEquals("pkg/c.py,0,1,1.00", lines.get(1));
        assertEquals("b.py,1,1,0.50", lines.get(2));
        assertEquals("a.py,2,1,0.33", lines.get(3));
        assertEquals("d.py,0,0,0.00", lines.get(4));
    }
}
