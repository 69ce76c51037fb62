package com.pyscope.analyzer.syntax;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Locale;

/**
 * Reads the JSON tree dump written by {@code python_ast_dump.py}.
 *
 * <p>Each node is an object with a {@code kind} plus optional {@code name},
 * {@code alias}, {@code level}, {@code ctx} and {@code line} fields; child
 * lists are stored under the lower-case {@link Slot} names. A document with an
 * {@code error} field reports a file the front-end could not parse.</p>
 */
public class SyntaxTreeReader {

    /**
     * Every syntax level takes two JSON levels (node object plus slot array),
     * and the dump script allows a recursion depth of 10000.
     */
    public static final int MAX_NESTING_DEPTH = 20_000;

    private final ObjectMapper mapper;

    public SyntaxTreeReader() {
        this(new ObjectMapper(JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxNestingDepth(MAX_NESTING_DEPTH)
                        .build())
                .build()));
    }

    public SyntaxTreeReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public SyntaxNode read(String json) throws SyntaxTreeException {
        return read(parse(json));
    }

    /**
     * Parses one line of dump output without converting it, so callers can
     * look at the {@code path} field first.
     */
    public JsonNode parse(String json) throws SyntaxTreeException {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SyntaxTreeException("Unreadable tree dump: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new SyntaxTreeException("Tree dump is not a JSON object", 0);
        }
        return root;
    }

    /**
     * Converts a dump document, either a bare MODULE node or a
     * {@code {"tree": ...}} / {@code {"error": ...}} wrapper.
     */
    public SyntaxNode read(JsonNode document) throws SyntaxTreeException {
        if (document.hasNonNull("error")) {
            throw new SyntaxTreeException(document.get("error").asText(), document.path("line").asInt(0));
        }
        JsonNode root = document.has("tree") ? document.get("tree") : document;
        if (!root.isObject()) {
            throw new SyntaxTreeException("Tree dump is not a JSON object", 0);
        }
        SyntaxNode tree;
        try {
            tree = convert(root);
        } catch (StackOverflowError e) {
            throw new SyntaxTreeException("Tree dump too deep to convert", 0);
        }
        if (tree.kind() != NodeKind.MODULE) {
            throw new SyntaxTreeException("Tree dump root must be MODULE, got " + tree.kind(), tree.line());
        }
        return tree;
    }

    private SyntaxNode convert(JsonNode json) {
        SyntaxTrees.Builder b = SyntaxTrees.builder(kindOf(json.path("kind").asText("")));
        if (json.hasNonNull("name")) {
            b.name(json.get("name").asText());
        }
        if (json.hasNonNull("alias")) {
            b.alias(json.get("alias").asText());
        }
        b.level(json.path("level").asInt(0));
        b.line(json.path("line").asInt(0));
        b.context(contextOf(json.path("ctx").asText("load")));

        for (Slot slot : Slot.values()) {
            JsonNode children = json.get(slot.name().toLowerCase(Locale.ROOT));
            if (children == null || !children.isArray()) {
                continue;
            }
            for (JsonNode child : children) {
                if (child.isObject()) {
                    b.add(slot, convert(child));
                }
            }
        }
        return b.build();
    }

    // Unknown kinds are treated as plain containers so newer grammar never fails a file
    private static NodeKind kindOf(String text) {
        try {
            return NodeKind.valueOf(text.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NodeKind.EXPRESSION;
        }
    }

    private static NameContext contextOf(String text) {
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "store" -> NameContext.STORE;
            case "del", "delete" -> NameContext.DELETE;
            default -> NameContext.LOAD;
        };
    }
}
