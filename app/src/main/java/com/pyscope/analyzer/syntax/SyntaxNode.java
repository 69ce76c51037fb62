package com.pyscope.analyzer.syntax;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable node of a parsed source file.
 * The tree is produced by a parser front-end and only read by the analysis.
 */
public record SyntaxNode(
        /** What construct this node represents */
        NodeKind kind,

        /** Identifier, function/class name, dotted module for imports, or null */
        String name,

        /** {@code as} name of an import alias, or null */
        String alias,

        /** Relative import level (0 = absolute) */
        int level,

        /** Load/store/delete context of a NAME node */
        NameContext context,

        /** 1-based source line, 0 when unknown */
        int line,

        /** Child nodes grouped by role */
        Map<Slot, List<SyntaxNode>> slots) {

    public SyntaxNode {
        if (kind == null) {
            throw new IllegalArgumentException("Node kind is required");
        }
        if (context == null) {
            context = NameContext.LOAD;
        }
        Map<Slot, List<SyntaxNode>> copy = new EnumMap<>(Slot.class);
        if (slots != null) {
            slots.forEach((slot, nodes) -> {
                if (nodes != null && !nodes.isEmpty()) {
                    copy.put(slot, List.copyOf(nodes));
                }
            });
        }
        slots = copy.isEmpty() ? Map.of() : Map.copyOf(copy);
    }

    /**
     * Children in the given slot, empty if none.
     */
    public List<SyntaxNode> get(Slot slot) {
        return slots.getOrDefault(slot, List.of());
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }
}
