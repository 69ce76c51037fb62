package com.pyscope.analyzer.analyzers;

import com.pyscope.analyzer.core.AnalyzerConfig;
import com.pyscope.analyzer.core.ProjectSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProjectSummarizerTest {

    @TempDir
    Path tempDir;

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file.toAbsolutePath().normalize();
    }

    @Test
    void testSummarizesProjectTree() throws IOException {
        Path big = write("big.py", "v = 0\n".repeat(10));
        Path main = write("main.py", "import app\nprint(1)\n");
        Path app = write("pkg/app.py", "x = 1");
        Path test = write("tests/test_main.py", "def test_x():\n    pass\n");
        Path data = write("data.json", "{}");
        Path setup = write("setup.cfg", "[metadata]\n");
        write("venv/lib/settings.json", "{}");
        write("README.md", "# demo\n");

        AnalyzerConfig config = AnalyzerConfig.defaults();
        List<Path> sources = new SourceEnumerator(config, Set.of(".py")).enumerate(tempDir);
        ProjectSummary summary = new ProjectSummarizer(config).summarize(tempDir, sources);

        assertEquals(4, summary.totalFiles());
        assertEquals(15, summary.totalLines());
        assertEquals(List.of(test), summary.testFiles());
        assertEquals(List.of(main, app), summary.entryModules(), "app.py counts wherever it lives");
        assertEquals(List.of(data, setup), summary.configFiles(), "ignored dirs are pruned");
        assertEquals(big, summary.largestFiles().get(0).file());
        assertEquals(60, summary.largestFiles().get(0).bytes());
    }

    @Test
    void testKeepsOnlyTheFiveLargestFiles() throws IOException {
        for (int i = 1; i <= 7; i++) {
            write("m" + i + ".py", "#".repeat(i * 10));
        }

        AnalyzerConfig config = AnalyzerConfig.defaults();
        List<Path> sources = new SourceEnumerator(config, Set.of(".py")).enumerate(tempDir);
        ProjectSummary summary = new ProjectSummarizer(config).summarize(tempDir, sources);

        assertEquals(7, summary.totalFiles());
        assertEquals(5, summary.largestFiles().size());
        assertEquals(70, summary.largestFiles().get(0).bytes());
        assertEquals(30, summary.largestFiles().get(4).bytes());
    }

    @Test
    void testCountLines() {
        assertEquals(0, ProjectSummarizer.countLines(new byte[0]));
        assertEquals(1, ProjectSummarizer.countLines("a".getBytes(StandardCharsets.UTF_8)));
        assertEquals(1, ProjectSummarizer.countLines("a\n".getBytes(StandardCharsets.UTF_8)));
        assertEquals(2, ProjectSummarizer.countLines("a\nb".getBytes(StandardCharsets.UTF_8)));
    }
}
