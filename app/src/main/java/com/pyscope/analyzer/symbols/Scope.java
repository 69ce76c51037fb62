package com.pyscope.analyzer.symbols;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One lexical binding region of a file.
 * Scopes refer to their parent by arena index and never own each other.
 */
public final class Scope {

    /** Parent index of the module scope. */
    public static final int NO_PARENT = -1;

    private final int id;
    private final ScopeKind kind;
    private final int parentId;
    private final Set<String> names = new LinkedHashSet<>();
    private final Set<String> globals = new HashSet<>();

    Scope(int id, ScopeKind kind, int parentId) {
        this.id = id;
        this.kind = kind;
        this.parentId = parentId;
    }

    public int id() {
        return id;
    }

    public ScopeKind kind() {
        return kind;
    }

    public int parentId() {
        return parentId;
    }

    /**
     * Bound names in order of first binding.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(names);
    }

    public boolean binds(String name) {
        return names.contains(name);
    }

    boolean add(String name) {
        return names.add(name);
    }

    void declareGlobal(String name) {
        globals.add(name);
    }

    boolean isGlobal(String name) {
        return globals.contains(name);
    }
}
