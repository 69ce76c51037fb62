package com.pyscope.analyzer.core;

import java.nio.file.Path;

/**
 * A name read somewhere but bound nowhere in the project and not a builtin.
 */
public record UndefinedSymbol(String symbol, Path file, int line) {
}
