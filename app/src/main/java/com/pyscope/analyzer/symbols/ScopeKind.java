package com.pyscope.analyzer.symbols;

public enum ScopeKind {
    MODULE,
    FUNCTION,
    CLASS,
    LAMBDA,
    COMPREHENSION,
    /** Holds the {@code [T]} parameters of a generic function, class or type alias. */
    TYPE_PARAMETERS
}
