package com.pyscope.analyzer.symbols;

import java.util.Locale;

/**
 * How a name came to be bound.
 */
public enum DefinitionKind {
    FUNCTION,
    CLASS,
    VARIABLE,
    IMPORT_ALIAS,
    PARAMETER;

    /**
     * Label used in reports, e.g. {@code import-alias}.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
