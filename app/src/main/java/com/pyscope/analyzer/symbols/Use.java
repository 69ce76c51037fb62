package com.pyscope.analyzer.symbols;

import java.nio.file.Path;

/**
 * A name read in load context.
 *
 * @param name    the identifier read
 * @param file    canonical path of the reading file
 * @param line    line of the read
 * @param scopeId innermost scope open at the point of use
 */
public record Use(String name, Path file, int line, int scopeId) {
}
