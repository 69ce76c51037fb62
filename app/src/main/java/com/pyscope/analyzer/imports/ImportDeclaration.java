package com.pyscope.analyzer.imports;

import java.util.List;

/**
 * A raw import statement as written in source.
 *
 * @param module     dotted module reference, empty for {@code from . import x}
 * @param level      0 for absolute imports, N for N leading dots
 * @param names      names listed after {@code import} in a from-import, empty otherwise
 * @param line       line of the statement
 * @param fromImport true for {@code from M import ...}
 */
public record ImportDeclaration(String module, int level, List<String> names, int line, boolean fromImport) {

    public static final String WILDCARD = "*";

    public ImportDeclaration {
        module = module == null ? "" : module;
        names = names == null ? List.of() : List.copyOf(names);
        if (level < 0) {
            throw new IllegalArgumentException("Import level must not be negative: " + level);
        }
    }

    public static ImportDeclaration plain(String module, int line) {
        return new ImportDeclaration(module, 0, List.of(), line, false);
    }

    public static ImportDeclaration from(String module, int level, List<String> names, int line) {
        return new ImportDeclaration(module, level, names, line, true);
    }

    public boolean isWildcard() {
        return names.contains(WILDCARD);
    }

    public boolean isRelative() {
        return level > 0;
    }
}
