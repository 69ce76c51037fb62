package com.pyscope.analyzer.syntax;

/**
 * Named child positions of a {@link SyntaxNode}.
 */
public enum Slot {
    BODY,
    PARAMETERS,
    /** PEP 695 type parameters, bound in their own scope around the node. */
    TYPE_PARAMETERS,
    DECORATORS,
    /** Parameter defaults and annotations, evaluated in the enclosing scope. */
    DEFAULTS,
    BASES,
    TARGETS,
    VALUE,
    GENERATORS,
    ITER,
    CONDITIONS,
    ELEMENT,
    ALIASES,
    CHILDREN
}
