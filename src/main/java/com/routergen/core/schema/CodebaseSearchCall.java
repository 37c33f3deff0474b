package com.routergen.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class CodebaseSearchCall extends ToolCall {

    public static final String FIELD_QUERY        = "query";
    public static final String FIELD_MODE         = "mode";
    public static final String FIELD_FILE_PATTERN = "file_pattern";

    private final String     query;
    private final SearchMode mode;
    private final String     filePattern;

    public CodebaseSearchCall(String query, SearchMode mode, String filePattern) {
        this.query       = query;
        this.mode        = mode;
        this.filePattern = filePattern;
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.CODEBASE_SEARCH;
    }

    public String     getQuery()       { return query; }
    public SearchMode getMode()        { return mode; }
    public String     getFilePattern() { return filePattern; }

    @Override
    public Map<String, Object> arguments() {
        LinkedHashMap<String, Object> args = new LinkedHashMap<>();
        putIfPresent(args, FIELD_QUERY, query);
        putIfPresent(args, FIELD_MODE, mode != null ? mode.getWire() : null);
        putIfPresent(args, FIELD_FILE_PATTERN, filePattern);
        return Collections.unmodifiableMap(args);
    }

    @Override
    public CodebaseSearchCall withoutFields(Set<String> fieldNames) {
        return new CodebaseSearchCall(
                query,
                mode,
                fieldNames.contains(FIELD_FILE_PATTERN) ? null : filePattern
        );
    }
}
