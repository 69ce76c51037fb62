package com.pyscope.analyzer.symbols;

import com.pyscope.analyzer.imports.ImportDeclaration;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Scope-aware symbol table for a single file.
 *
 * <p>Scopes are kept in an arena indexed by id; each scope knows its parent
 * by index only. References are recorded together with the scope open at the
 * point of use and resolved in {@link #finish()}, once every binding of the
 * file is known. A name used before its binding in the same scope therefore
 * still resolves, matching whole-module hoisting.</p>
 *
 * <p>Not thread-safe; one table per file.</p>
 */
public class SymbolTable {

    private final Path file;
    private final List<Scope> scopes = new ArrayList<>();
    private final Deque<Scope> open = new ArrayDeque<>();

    private final List<Definition> definitions = new ArrayList<>();
    private final List<Use> uses = new ArrayList<>();
    private final List<Use> memberUses = new ArrayList<>();
    private final List<ImportDeclaration> imports = new ArrayList<>();

    private boolean finished;

    public SymbolTable(Path file) {
        this.file = file;
        Scope module = new Scope(0, ScopeKind.MODULE, Scope.NO_PARENT);
        scopes.add(module);
        open.push(module);
    }

    public Path getFile() {
        return file;
    }

    // === Scope management ===

    /**
     * Opens a new scope nested in the current one.
     *
     * @return the id of the new scope
     */
    public int enterScope(ScopeKind kind) {
        checkOpen();
        if (kind == ScopeKind.MODULE) {
            throw new IllegalArgumentException("Module scope is created with the table");
        }
        Scope scope = new Scope(scopes.size(), kind, current().id());
        scopes.add(scope);
        open.push(scope);
        return scope.id();
    }

    /**
     * Closes the innermost scope. The module scope is never closed.
     */
    public void exitScope() {
        checkOpen();
        if (open.size() == 1) {
            throw new IllegalStateException("Cannot exit the module scope of " + file);
        }
        open.pop();
    }

    public Scope current() {
        return open.peek();
    }

    public int depth() {
        return open.size();
    }

    // === Bindings and references ===

    /**
     * Binds a name in the innermost open scope, or in the module scope when the
     * innermost scope declared it {@code global}. Only the first binding of a
     * name per scope produces a {@link Definition}.
     */
    public void bind(String name, int line, DefinitionKind kind) {
        checkOpen();
        Scope target = current().isGlobal(name) ? scopes.get(0) : current();
        if (target.add(name)) {
            definitions.add(new Definition(name, file, target.id(), target.kind(), line, kind));
        }
    }

    /**
     * Marks a name as module-level for the rest of the innermost scope.
     */
    public void declareGlobal(String name, int line) {
        checkOpen();
        if (current().kind() != ScopeKind.MODULE) {
            current().declareGlobal(name);
        }
        // a global declaration is also a module-level binding
        Scope module = scopes.get(0);
        if (module.add(name)) {
            definitions.add(new Definition(name, file, module.id(), module.kind(), line, DefinitionKind.VARIABLE));
        }
    }

    /**
     * Records a load of {@code name}. Whether it resolves locally is decided
     * when the table is finished.
     */
    public void reference(String name, int line) {
        checkOpen();
        uses.add(new Use(name, file, line, current().id()));
    }

    /**
     * Records an attribute read such as {@code obj.name}.
     */
    public void referenceMember(String name, int line) {
        checkOpen();
        memberUses.add(new Use(name, file, line, current().id()));
    }

    public void addImport(ImportDeclaration declaration) {
        checkOpen();
        imports.add(declaration);
    }

    // === Resolution ===

    /**
     * Resolves {@code name} from the given scope outwards. Enclosing class
     * scopes are skipped: a method or nested comprehension does not see names
     * bound in a class body, only the class body itself does.
     */
    public boolean resolvesLocally(String name, int scopeId) {
        Scope scope = scopes.get(scopeId);
        if (scope.binds(name)) {
            return true;
        }
        for (int id = scope.parentId(); id != Scope.NO_PARENT; id = scopes.get(id).parentId()) {
            Scope enclosing = scopes.get(id);
            if (enclosing.kind() == ScopeKind.CLASS) {
                continue;
            }
            if (enclosing.binds(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Closes the table and splits the recorded loads into locally resolved and
     * pending ones.
     */
    public FileSymbols finish() {
        checkOpen();
        if (open.size() != 1) {
            throw new IllegalStateException(
                    "Unbalanced scopes in " + file + ": " + (open.size() - 1) + " still open");
        }
        finished = true;

        List<Use> resolved = new ArrayList<>();
        List<Use> pending = new ArrayList<>();
        for (Use use : uses) {
            if (resolvesLocally(use.name(), use.scopeId())) {
                resolved.add(use);
            } else {
                pending.add(use);
            }
        }
        return new FileSymbols(file, scopes, definitions, resolved, pending, memberUses, imports);
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("Symbol table for " + file + " is already finished");
        }
    }
}
