package com.pyscope.analyzer.core;

/**
 * What to do with {@code from module import *}.
 */
public enum WildcardPolicy {
    /** Emit a wildcard-import diagnostic. */
    FLAG,
    /** Drop it silently. */
    IGNORE
}
