package com.pyscope.analyzer.symbols;

import com.pyscope.analyzer.imports.ImportDeclaration;
import com.pyscope.analyzer.syntax.NameContext;
import com.pyscope.analyzer.syntax.NodeKind;
import com.pyscope.analyzer.syntax.Slot;
import com.pyscope.analyzer.syntax.SyntaxNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks one file's syntax tree and feeds a {@link SymbolTable}.
 *
 * <p>Binding rules:</p>
 * <ul>
 * <li>function: name binds in the enclosing scope, decorators and defaults are
 * read there too; the body scope is seeded with every parameter</li>
 * <li>class: name binds in the enclosing scope, bases are read there; the body
 * gets its own scope</li>
 * <li>lambda: own scope seeded with its parameters, nothing binds outside</li>
 * <li>comprehension: own scope; loop targets (including destructuring) bind
 * there before the yielded element is visited</li>
 * <li>imports bind the alias, or the top-level package for {@code import a.b}</li>
 * <li>type parameters of a generic function, class or type alias bind in a
 * scope wrapped around its annotations, bases and body</li>
 * </ul>
 */
public class SymbolCollector {

    /**
     * Collects definitions, uses and raw imports of one file.
     *
     * @param file canonical path of the file
     * @param tree MODULE node of the file
     * @return the finished symbols of the file
     * @throws IllegalArgumentException if {@code tree} is not a MODULE node
     */
    public FileSymbols collect(Path file, SyntaxNode tree) {
        if (tree == null || tree.kind() != NodeKind.MODULE) {
            throw new IllegalArgumentException("Expected a MODULE tree for " + file);
        }
        SymbolTable table = new SymbolTable(file);
        visitAll(table, tree.get(Slot.BODY));
        return table.finish();
    }

    private void visitAll(SymbolTable table, List<SyntaxNode> nodes) {
        for (SyntaxNode node : nodes) {
            visit(table, node);
        }
    }

    private void visit(SymbolTable table, SyntaxNode node) {
        switch (node.kind()) {
            case MODULE -> visitAll(table, node.get(Slot.BODY));
            case FUNCTION -> visitFunction(table, node);
            case CLASS -> visitClass(table, node);
            case LAMBDA -> visitLambda(table, node);
            case COMPREHENSION -> visitComprehension(table, node);
            case ASSIGNMENT -> {
                visitAll(table, node.get(Slot.VALUE));
                visitAll(table, node.get(Slot.TARGETS));
            }
            case NAME -> visitName(table, node);
            case ATTRIBUTE -> {
                visitAll(table, node.get(Slot.VALUE));
                if (node.context() != NameContext.STORE && node.name() != null) {
                    table.referenceMember(node.name(), node.line());
                }
            }
            case PARAMETER -> bindIfNamed(table, node, DefinitionKind.PARAMETER);
            case TYPE_ALIAS -> visitTypeAlias(table, node);
            case IMPORT -> visitImport(table, node);
            case IMPORT_FROM -> visitImportFrom(table, node);
            case GLOBAL -> {
                for (SyntaxNode name : node.get(Slot.CHILDREN)) {
                    if (name.name() != null) {
                        table.declareGlobal(name.name(), name.line());
                    }
                }
            }
            default -> visitChildren(table, node);
        }
    }

    private void visitChildren(SymbolTable table, SyntaxNode node) {
        for (Slot slot : Slot.values()) {
            visitAll(table, node.get(slot));
        }
    }

    private void visitName(SymbolTable table, SyntaxNode node) {
        if (node.name() == null) {
            return;
        }
        if (node.context() == NameContext.STORE) {
            table.bind(node.name(), node.line(), DefinitionKind.VARIABLE);
        } else {
            // del x needs x to exist, so it reads like a load
            table.reference(node.name(), node.line());
        }
    }

    private void visitFunction(SymbolTable table, SyntaxNode node) {
        visitAll(table, node.get(Slot.DECORATORS));
        bindIfNamed(table, node, DefinitionKind.FUNCTION);

        boolean generic = enterTypeParameters(table, node);
        visitAll(table, node.get(Slot.DEFAULTS));
        table.enterScope(ScopeKind.FUNCTION);
        bindParameters(table, node);
        visitAll(table, node.get(Slot.BODY));
        table.exitScope();
        exitTypeParameters(table, generic);
    }

    private void visitClass(SymbolTable table, SyntaxNode node) {
        visitAll(table, node.get(Slot.DECORATORS));
        bindIfNamed(table, node, DefinitionKind.CLASS);

        boolean generic = enterTypeParameters(table, node);
        visitAll(table, node.get(Slot.BASES));
        table.enterScope(ScopeKind.CLASS);
        visitAll(table, node.get(Slot.BODY));
        table.exitScope();
        exitTypeParameters(table, generic);
    }

    private void visitTypeAlias(SymbolTable table, SyntaxNode node) {
        bindIfNamed(table, node, DefinitionKind.VARIABLE);

        boolean generic = enterTypeParameters(table, node);
        visitAll(table, node.get(Slot.VALUE));
        exitTypeParameters(table, generic);
    }

    /**
     * Opens the scope holding {@code [T, *Ts, **P]} when the node declares any.
     * Annotations, bases and the body all nest inside it.
     */
    private boolean enterTypeParameters(SymbolTable table, SyntaxNode node) {
        List<SyntaxNode> typeParameters = node.get(Slot.TYPE_PARAMETERS);
        if (typeParameters.isEmpty()) {
            return false;
        }
        table.enterScope(ScopeKind.TYPE_PARAMETERS);
        for (SyntaxNode parameter : typeParameters) {
            bindIfNamed(table, parameter, DefinitionKind.PARAMETER);
        }
        return true;
    }

    private void exitTypeParameters(SymbolTable table, boolean generic) {
        if (generic) {
            table.exitScope();
        }
    }

    private void visitLambda(SymbolTable table, SyntaxNode node) {
        visitAll(table, node.get(Slot.DEFAULTS));

        table.enterScope(ScopeKind.LAMBDA);
        bindParameters(table, node);
        visitAll(table, node.get(Slot.BODY));
        table.exitScope();
    }

    private void visitComprehension(SymbolTable table, SyntaxNode node) {
        table.enterScope(ScopeKind.COMPREHENSION);
        for (SyntaxNode generator : node.get(Slot.GENERATORS)) {
            visitAll(table, generator.get(Slot.ITER));
            visitAll(table, generator.get(Slot.TARGETS));
            visitAll(table, generator.get(Slot.CONDITIONS));
        }
        visitAll(table, node.get(Slot.ELEMENT));
        table.exitScope();
    }

    private void bindParameters(SymbolTable table, SyntaxNode node) {
        for (SyntaxNode parameter : node.get(Slot.PARAMETERS)) {
            bindIfNamed(table, parameter, DefinitionKind.PARAMETER);
        }
    }

    private void bindIfNamed(SymbolTable table, SyntaxNode node, DefinitionKind kind) {
        if (node.name() != null && !node.name().isEmpty()) {
            table.bind(node.name(), node.line(), kind);
        }
    }

    private void visitImport(SymbolTable table, SyntaxNode node) {
        for (SyntaxNode alias : node.get(Slot.ALIASES)) {
            String module = alias.name();
            if (module == null || module.isEmpty()) {
                continue;
            }
            // import a.b.c binds "a"; import a.b.c as x binds "x"
            String bound = alias.alias() != null ? alias.alias() : topLevel(module);
            table.bind(bound, lineOf(alias, node), DefinitionKind.IMPORT_ALIAS);
            table.addImport(ImportDeclaration.plain(module, lineOf(alias, node)));
        }
    }

    private void visitImportFrom(SymbolTable table, SyntaxNode node) {
        List<String> names = new ArrayList<>();
        for (SyntaxNode alias : node.get(Slot.ALIASES)) {
            String name = alias.name();
            if (name == null || name.isEmpty()) {
                continue;
            }
            names.add(name);
            if (!ImportDeclaration.WILDCARD.equals(name)) {
                String bound = alias.alias() != null ? alias.alias() : name;
                table.bind(bound, lineOf(alias, node), DefinitionKind.IMPORT_ALIAS);
            }
        }
        table.addImport(ImportDeclaration.from(node.name(), node.level(), names, node.line()));
    }

    private static String topLevel(String dotted) {
        int dot = dotted.indexOf('.');
        return dot < 0 ? dotted : dotted.substring(0, dot);
    }

    private static int lineOf(SyntaxNode alias, SyntaxNode statement) {
        return alias.line() > 0 ? alias.line() : statement.line();
    }
}
