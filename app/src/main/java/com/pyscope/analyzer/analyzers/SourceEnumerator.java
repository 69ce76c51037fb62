package com.pyscope.analyzer.analyzers;

import com.pyscope.analyzer.core.AnalyzerConfig;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Lists the source files of a project: canonical absolute paths in
 * lexicographic order, with ignore directories pruned and exclusion globs
 * applied to root-relative paths.
 */
public class SourceEnumerator {

    private final AnalyzerConfig config;
    private final Set<String> extensions;

    public SourceEnumerator(AnalyzerConfig config, Set<String> extensions) {
        this.config = config;
        this.extensions = Set.copyOf(extensions);
    }

    public List<Path> enumerate(Path projectRoot) throws IOException {
        Path root = projectRoot.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + projectRoot);
        }

        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                if (config.getIgnoreDirs().contains(name) || config.shouldExclude(root.relativize(dir))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && hasSupportedExtension(file)
                        && !config.shouldExclude(root.relativize(file))) {
                    files.add(file.normalize());
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                System.err.println("Warning: cannot read " + file + ": " + exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        Collections.sort(files);
        return files;
    }

    private boolean hasSupportedExtension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && extensions.contains(name.substring(dot));
    }
}
