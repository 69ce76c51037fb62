package com.pyscope.analyzer.symbols;

import java.nio.file.Path;

/**
 * A name bound in some scope of a file.
 *
 * @param name      the bound identifier
 * @param file      canonical path of the defining file
 * @param scopeId   index of the originating scope in the file's scope arena
 * @param scopeKind kind of the originating scope
 * @param line      line of the binding
 * @param kind      what kind of binding created it
 */
public record Definition(String name, Path file, int scopeId, ScopeKind scopeKind, int line, DefinitionKind kind) {

    public boolean isModuleLevel() {
        return scopeKind == ScopeKind.MODULE;
    }
}
