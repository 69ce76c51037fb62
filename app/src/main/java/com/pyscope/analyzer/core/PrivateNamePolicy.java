package com.pyscope.analyzer.core;

/**
 * Which names count as private and stay out of the unused-symbol report.
 */
public enum PrivateNamePolicy {
    /** Every name is reported. */
    NONE,
    /** Only {@code __dunder__} names are private. */
    DUNDER,
    /** Any name starting with an underscore is private. */
    UNDERSCORE;

    public boolean isPrivate(String name) {
        return switch (this) {
            case NONE -> false;
            case DUNDER -> name.length() > 4 && name.startsWith("__") && name.endsWith("__");
            case UNDERSCORE -> name.startsWith("_");
        };
    }
}
