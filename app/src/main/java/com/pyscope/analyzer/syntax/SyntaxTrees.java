package com.pyscope.analyzer.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static factories for building syntax trees by hand.
 * Used by the JSON reader and by tests that need no parser.
 */
public final class SyntaxTrees {

    private SyntaxTrees() {
    }

    public static Builder builder(NodeKind kind) {
        return new Builder(kind);
    }

    public static SyntaxNode module(SyntaxNode... body) {
        return builder(NodeKind.MODULE).line(1).add(Slot.BODY, body).build();
    }

    public static SyntaxNode def(String name, int line, List<SyntaxNode> parameters, SyntaxNode... body) {
        return builder(NodeKind.FUNCTION).name(name).line(line)
                .add(Slot.PARAMETERS, parameters)
                .add(Slot.BODY, body)
                .build();
    }

    public static SyntaxNode classDef(String name, int line, List<SyntaxNode> bases, SyntaxNode... body) {
        return builder(NodeKind.CLASS).name(name).line(line)
                .add(Slot.BASES, bases)
                .add(Slot.BODY, body)
                .build();
    }

    public static SyntaxNode lambda(int line, List<SyntaxNode> parameters, SyntaxNode body) {
        return builder(NodeKind.LAMBDA).line(line)
                .add(Slot.PARAMETERS, parameters)
                .add(Slot.BODY, body)
                .build();
    }

    /**
     * A list/set/generator comprehension (one element) or a dict comprehension
     * (key and value elements).
     */
    public static SyntaxNode comprehension(int line, List<SyntaxNode> elements, SyntaxNode... generators) {
        return builder(NodeKind.COMPREHENSION).line(line)
                .add(Slot.ELEMENT, elements)
                .add(Slot.GENERATORS, generators)
                .build();
    }

    public static SyntaxNode generator(SyntaxNode target, SyntaxNode iter, SyntaxNode... conditions) {
        return builder(NodeKind.GENERATOR).line(target.line())
                .add(Slot.TARGETS, target)
                .add(Slot.ITER, iter)
                .add(Slot.CONDITIONS, conditions)
                .build();
    }

    public static SyntaxNode assign(SyntaxNode target, SyntaxNode value) {
        return assign(List.of(target), value);
    }

    public static SyntaxNode assign(List<SyntaxNode> targets, SyntaxNode value) {
        int line = targets.isEmpty() ? 0 : targets.get(0).line();
        Builder b = builder(NodeKind.ASSIGNMENT).line(line).add(Slot.TARGETS, targets);
        if (value != null) {
            b.add(Slot.VALUE, value);
        }
        return b.build();
    }

    public static SyntaxNode typeAlias(String name, int line, List<SyntaxNode> typeParameters, SyntaxNode value) {
        return builder(NodeKind.TYPE_ALIAS).name(name).line(line)
                .add(Slot.TYPE_PARAMETERS, typeParameters)
                .add(Slot.VALUE, value)
                .build();
    }

    public static SyntaxNode load(String name, int line) {
        return builder(NodeKind.NAME).name(name).line(line).context(NameContext.LOAD).build();
    }

    public static SyntaxNode store(String name, int line) {
        return builder(NodeKind.NAME).name(name).line(line).context(NameContext.STORE).build();
    }

    public static SyntaxNode delete(String name, int line) {
        return builder(NodeKind.NAME).name(name).line(line).context(NameContext.DELETE).build();
    }

    public static SyntaxNode attribute(SyntaxNode value, String attribute, int line) {
        return builder(NodeKind.ATTRIBUTE).name(attribute).line(line).add(Slot.VALUE, value).build();
    }

    public static SyntaxNode param(String name, int line) {
        return builder(NodeKind.PARAMETER).name(name).line(line).build();
    }

    public static List<SyntaxNode> params(int line, String... names) {
        return Arrays.stream(names).map(n -> param(n, line)).toList();
    }

    public static SyntaxNode importStmt(int line, SyntaxNode... aliases) {
        return builder(NodeKind.IMPORT).line(line).add(Slot.ALIASES, aliases).build();
    }

    public static SyntaxNode importFrom(String module, int level, int line, SyntaxNode... aliases) {
        return builder(NodeKind.IMPORT_FROM).name(module).level(level).line(line)
                .add(Slot.ALIASES, aliases)
                .build();
    }

    public static SyntaxNode alias(String name, String asName, int line) {
        return builder(NodeKind.ALIAS).name(name).alias(asName).line(line).build();
    }

    public static SyntaxNode global(int line, String... names) {
        Builder b = builder(NodeKind.GLOBAL).line(line);
        for (String n : names) {
            b.add(Slot.CHILDREN, store(n, line));
        }
        return b.build();
    }

    public static SyntaxNode expr(int line, SyntaxNode... children) {
        return builder(NodeKind.EXPRESSION).line(line).add(Slot.CHILDREN, children).build();
    }

    /**
     * Mutable builder for a single node.
     */
    public static final class Builder {
        private final NodeKind kind;
        private String name;
        private String alias;
        private int level;
        private NameContext context = NameContext.LOAD;
        private int line;
        private final Map<Slot, List<SyntaxNode>> slots = new EnumMap<>(Slot.class);

        private Builder(NodeKind kind) {
            this.kind = kind;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder alias(String alias) {
            this.alias = alias;
            return this;
        }

        public Builder level(int level) {
            this.level = level;
            return this;
        }

        public Builder context(NameContext context) {
            this.context = context;
            return this;
        }

        public Builder line(int line) {
            this.line = line;
            return this;
        }

        public Builder add(Slot slot, SyntaxNode... nodes) {
            return add(slot, Arrays.asList(nodes));
        }

        public Builder add(Slot slot, List<SyntaxNode> nodes) {
            if (nodes != null && !nodes.isEmpty()) {
                slots.computeIfAbsent(slot, s -> new ArrayList<>()).addAll(nodes);
            }
            return this;
        }

        public SyntaxNode build() {
            return new SyntaxNode(kind, name, alias, level, context, line, slots);
        }
    }
}
