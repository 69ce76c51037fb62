package com.pyscope.analyzer.syntax;

/**
 * Node types the analysis distinguishes.
 * Everything the analysis does not care about is an {@link #EXPRESSION}
 * container whose children are visited in order.
 */
public enum NodeKind {
    MODULE,
    FUNCTION,
    CLASS,
    LAMBDA,
    COMPREHENSION,
    /** One {@code for ... in ... if ...} clause of a comprehension. */
    GENERATOR,
    ASSIGNMENT,
    NAME,
    ATTRIBUTE,
    PARAMETER,
    IMPORT,
    IMPORT_FROM,
    /** One {@code name [as alias]} entry of an import statement. */
    ALIAS,
    GLOBAL,
    /** {@code type Name[T] = value}; the value is evaluated lazily. */
    TYPE_ALIAS,
    EXPRESSION
}
