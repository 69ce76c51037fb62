package com.pyscope.analyzer.syntax;

public enum NameContext {
    LOAD,
    STORE,
    DELETE
}
