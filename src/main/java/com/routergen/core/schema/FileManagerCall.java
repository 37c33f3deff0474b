package com.routergen.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * file_manager call. {@code content} is only meaningful for WRITE,
 * {@code targetString}/{@code replacementString} only for PATCH.
 * An empty replacement string is a legal patch (deletion).
 */
public final class FileManagerCall extends ToolCall {

    public static final String FIELD_OPERATION          = "operation";
    public static final String FIELD_PATH               = "path";
    public static final String FIELD_CONTENT            = "content";
    public static final String FIELD_TARGET_STRING      = "target_string";
    public static final String FIELD_REPLACEMENT_STRING = "replacement_string";

    private final FileOperation operation;
    private final String        path;
    private final String        content;
    private final String        targetString;
    private final String        replacementString;

    public FileManagerCall(
            FileOperation operation,
            String        path,
            String        content,
            String        targetString,
            String        replacementString
    ) {
        this.operation         = operation;
        this.path              = path;
        this.content           = content;
        this.targetString      = targetString;
        this.replacementString = replacementString;
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.FILE_MANAGER;
    }

    public FileOperation getOperation()         { return operation; }
    public String        getPath()              { return path; }
    public String        getContent()           { return content; }
    public String        getTargetString()      { return targetString; }
    public String        getReplacementString() { return replacementString; }

    @Override
    public Map<String, Object> arguments() {
        LinkedHashMap<String, Object> args = new LinkedHashMap<>();
        putIfPresent(args, FIELD_OPERATION, operation != null ? operation.getWire() : null);
        putIfPresent(args, FIELD_PATH, path);
        putIfPresent(args, FIELD_CONTENT, content);
        putIfPresent(args, FIELD_TARGET_STRING, targetString);
        putIfPresent(args, FIELD_REPLACEMENT_STRING, replacementString);
        return Collections.unmodifiableMap(args);
    }

    @Override
    public FileManagerCall withoutFields(Set<String> fieldNames) {
        // content/target/replacement are only optional outside the operation that needs them
        boolean keepContent     = operation == FileOperation.WRITE;
        boolean keepPatchFields = operation == FileOperation.PATCH;
        return new FileManagerCall(
                operation,
                path,
                !keepContent && fieldNames.contains(FIELD_CONTENT) ? null : content,
                !keepPatchFields && fieldNames.contains(FIELD_TARGET_STRING) ? null : targetString,
                !keepPatchFields && fieldNames.contains(FIELD_REPLACEMENT_STRING) ? null : replacementString
        );
    }
}
