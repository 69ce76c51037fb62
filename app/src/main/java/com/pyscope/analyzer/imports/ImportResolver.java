package com.pyscope.analyzer.imports;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Maps import statements to concrete files inside the project root.
 *
 * <p>Resolution is a pure function of the module reference, the relative
 * level, the importing file, the project root and file existence. Anything
 * that does not land on an existing file under the root is external and
 * resolves to nothing.</p>
 */
public class ImportResolver {

    private static final String SOURCE_SUFFIX = ".py";
    private static final String PACKAGE_INIT = "__init__.py";

    private final Path projectRoot;
    private final Predicate<Path> fileExists;

    public ImportResolver(Path projectRoot) {
        this(projectRoot, Files::isRegularFile);
    }

    /**
     * @param projectRoot root every resolved file must live under
     * @param fileExists  existence check, replaceable in tests
     */
    public ImportResolver(Path projectRoot, Predicate<Path> fileExists) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.fileExists = fileExists;
    }

    /**
     * Resolves one module reference.
     *
     * @param module        dotted module name, may be empty for relative imports
     * @param level         0 for absolute, N for N leading dots
     * @param importingFile file containing the import
     * @return the module file ({@code x.py}, preferred) or package init
     *         ({@code x/__init__.py}), or empty if external
     */
    public Optional<Path> resolve(String module, int level, Path importingFile) {
        String dotted = module == null ? "" : module;
        Path base;
        if (level > 0) {
            Path dir = importingFile.toAbsolutePath().normalize().getParent();
            for (int i = 0; i < level - 1 && dir != null; i++) {
                dir = dir.getParent();
            }
            if (dir == null) {
                return Optional.empty();
            }
            if (dotted.isEmpty()) {
                return existingInsideRoot(dir.resolve(PACKAGE_INIT));
            }
            base = append(dir, dotted);
        } else {
            if (dotted.isEmpty()) {
                return Optional.empty();
            }
            base = append(projectRoot, dotted);
        }

        Path fileForm = base.resolveSibling(base.getFileName() + SOURCE_SUFFIX);
        Optional<Path> asFile = existingInsideRoot(fileForm);
        if (asFile.isPresent()) {
            return asFile;
        }
        return existingInsideRoot(base.resolve(PACKAGE_INIT));
    }

    /**
     * Resolves every project file an import statement depends on.
     *
     * <p>{@code import a.b.c} depends on the most specific existing module
     * among {@code a.b.c}, {@code a.b} and {@code a}. {@code from M import n}
     * depends on {@code M.n} when that is a submodule, and on {@code M}
     * itself otherwise. Self-references are dropped.</p>
     */
    public List<Path> resolveAll(ImportDeclaration declaration, Path importingFile) {
        Set<Path> targets = new LinkedHashSet<>();
        if (!declaration.fromImport()) {
            List<String> parts = Arrays.asList(declaration.module().split("\\."));
            for (int i = parts.size(); i > 0; i--) {
                Optional<Path> hit = resolve(String.join(".", parts.subList(0, i)), declaration.level(), importingFile);
                if (hit.isPresent()) {
                    targets.add(hit.get());
                    break;
                }
            }
        } else {
            boolean needsBase = declaration.names().isEmpty();
            for (String name : declaration.names()) {
                if (ImportDeclaration.WILDCARD.equals(name)) {
                    needsBase = true;
                    continue;
                }
                String submodule = declaration.module().isEmpty() ? name : declaration.module() + "." + name;
                Optional<Path> hit = resolve(submodule, declaration.level(), importingFile);
                if (hit.isPresent()) {
                    targets.add(hit.get());
                } else {
                    needsBase = true;
                }
            }
            if (needsBase) {
                resolve(declaration.module(), declaration.level(), importingFile).ifPresent(targets::add);
            }
        }
        targets.remove(importingFile.toAbsolutePath().normalize());
        return new ArrayList<>(targets);
    }

    private Optional<Path> existingInsideRoot(Path candidate) {
        Path normalized = candidate.toAbsolutePath().normalize();
        if (!normalized.startsWith(projectRoot)) {
            return Optional.empty();
        }
        return fileExists.test(normalized) ? Optional.of(normalized) : Optional.empty();
    }

    private static Path append(Path dir, String dotted) {
        Path result = dir;
        for (String segment : dotted.split("\\.")) {
            if (!segment.isEmpty()) {
                result = result.resolve(segment);
            }
        }
        return result;
    }
}
