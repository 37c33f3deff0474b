package com.routergen.core.schema;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ToolKind - the closed set of tool variants a router can emit.
 *
 * Each kind carries:
 *   tag               - wire value of the "tool_name" discriminator
 *   complexReasoning  - whether generating a good example for this kind needs a
 *                       logic-strong backend (path fidelity, judgement calls)
 *   reasoningKeywords - words a reasoning trace must contain (any one of) to count
 *                       as referencing this kind
 *
 * Lookup by tag is a map hit. Unknown tags return empty, never a default kind.
 */
public enum ToolKind {

    CODEBASE_SEARCH("codebase_search", false,
            List.of("search", "find", "locate", "look", "grep", "trace", "codebase")),

    FILE_MANAGER("file_manager", true,
            List.of("file", "read", "write", "patch", "list", "edit", "update", "open", "directory")),

    SANDBOX_EXEC("sandbox_exec", false,
            List.of("sandbox", "run", "execute", "test", "evaluate", "script", "snippet")),

    ASK_HUMAN("ask_human", true,
            List.of("ask", "clarif", "confirm", "human", "approval", "escalat", "question"));

    private static final Map<String, ToolKind> BY_TAG;

    static {
        Map<String, ToolKind> byTag = new HashMap<>();
        for (ToolKind kind : values()) {
            byTag.put(kind.tag, kind);
        }
        BY_TAG = Collections.unmodifiableMap(byTag);
    }

    private final String       tag;
    private final boolean      complexReasoning;
    private final List<String> reasoningKeywords;

    ToolKind(String tag, boolean complexReasoning, List<String> reasoningKeywords) {
        this.tag               = tag;
        this.complexReasoning  = complexReasoning;
        this.reasoningKeywords = reasoningKeywords;
    }

    public String getTag()                     { return tag; }
    public boolean requiresComplexReasoning()  { return complexReasoning; }
    public List<String> getReasoningKeywords() { return reasoningKeywords; }

    public static Optional<ToolKind> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        return Optional.ofNullable(BY_TAG.get(tag));
    }
}
