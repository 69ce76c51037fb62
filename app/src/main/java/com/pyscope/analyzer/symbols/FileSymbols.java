package com.pyscope.analyzer.symbols;

import com.pyscope.analyzer.imports.ImportDeclaration;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything the symbol pass learned about one file.
 *
 * @param file          canonical path of the file
 * @param scopes        the file's scope arena, module scope first
 * @param definitions   every binding, first binding per scope and name
 * @param resolvedUses  loads that resolved through their own scope chain
 * @param pendingUses   loads left for project-wide resolution
 * @param memberUses    attribute reads ({@code x.attr}); count as uses, never as undefined
 * @param imports       raw import statements in source order
 */
public record FileSymbols(
        Path file,
        List<Scope> scopes,
        List<Definition> definitions,
        List<Use> resolvedUses,
        List<Use> pendingUses,
        List<Use> memberUses,
        List<ImportDeclaration> imports) {

    public FileSymbols {
        scopes = List.copyOf(scopes);
        definitions = List.copyOf(definitions);
        resolvedUses = List.copyOf(resolvedUses);
        pendingUses = List.copyOf(pendingUses);
        memberUses = List.copyOf(memberUses);
        imports = List.copyOf(imports);
    }
}
