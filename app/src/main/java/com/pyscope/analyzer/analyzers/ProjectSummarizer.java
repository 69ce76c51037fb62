package com.pyscope.analyzer.analyzers;

import com.pyscope.analyzer.core.AnalyzerConfig;
import com.pyscope.analyzer.core.ProjectSummary;
import com.pyscope.analyzer.core.ProjectSummary.FileSize;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Surveys a project tree: file and line counts, the largest modules, test
 * files, entry modules and configuration files. Walks with the same ignore
 * rules as {@link SourceEnumerator}.
 */
public class ProjectSummarizer {

    static final int LARGEST_FILES = 5;
    static final Set<String> ENTRY_MODULES = Set.of("main.py", "app.py", "__main__.py", "run.py");
    static final Set<String> CONFIG_EXTENSIONS = Set.of(".ini", ".cfg", ".conf", ".yaml", ".yml", ".json", ".toml");

    private static final Comparator<FileSize> BIGGEST_FIRST = Comparator
            .comparingLong(FileSize::bytes).reversed()
            .thenComparing(FileSize::file);

    private final AnalyzerConfig config;

    public ProjectSummarizer(AnalyzerConfig config) {
        this.config = config;
    }

    /**
     * @param projectRoot root of the project
     * @param sourceFiles the Python files found by the source enumerator
     * @throws IOException if the project root cannot be walked
     */
    public ProjectSummary summarize(Path projectRoot, List<Path> sourceFiles) throws IOException {
        Path root = projectRoot.toAbsolutePath().normalize();

        long totalLines = 0;
        List<FileSize> sizes = new ArrayList<>();
        List<Path> testFiles = new ArrayList<>();
        List<Path> entryModules = new ArrayList<>();
        for (Path file : sourceFiles) {
            try {
                byte[] content = Files.readAllBytes(file);
                totalLines += countLines(content);
                sizes.add(new FileSize(file, content.length));
            } catch (IOException e) {
                System.err.println("Warning: cannot size " + file + ": " + e.getMessage());
                continue;
            }

            String relative = root.relativize(file).toString().toLowerCase(Locale.ROOT);
            if (relative.contains("test")) {
                testFiles.add(file);
            } else if (ENTRY_MODULES.contains(file.getFileName().toString())) {
                entryModules.add(file);
            }
        }
        sizes.sort(BIGGEST_FIRST);

        List<Path> configFiles = new SourceEnumerator(config, CONFIG_EXTENSIONS).enumerate(root);

        return new ProjectSummary(sourceFiles.size(), totalLines,
                sizes.subList(0, Math.min(LARGEST_FILES, sizes.size())),
                testFiles, entryModules, configFiles);
    }

    /** Counts lines the way a text reader does: a trailing partial line counts. */
    static long countLines(byte[] content) {
        long lines = 0;
        for (byte b : content) {
            if (b == '\n') {
                lines++;
            }
        }
        if (content.length > 0 && content[content.length - 1] != '\n') {
            lines++;
        }
        return lines;
    }
}
