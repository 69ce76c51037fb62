package com.pyscope.analyzer.core;

import com.pyscope.analyzer.symbols.DefinitionKind;

import java.nio.file.Path;

/**
 * A function, class or module-level variable whose name is never read.
 */
public record UnusedSymbol(String symbol, Path file, int line, DefinitionKind kind) {
}
