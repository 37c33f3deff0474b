package com.routergen.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class SandboxExecCall extends ToolCall {

    public static final String FIELD_CODE    = "code";
    public static final String FIELD_TIMEOUT = "timeout";

    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    private final String  code;
    private final Integer timeout;

    public SandboxExecCall(String code, Integer timeout) {
        this.code    = code;
        this.timeout = timeout;
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.SANDBOX_EXEC;
    }

    public String getCode() { return code; }

    /** Declared timeout, or null when the call relies on the default. */
    public Integer getTimeout() { return timeout; }

    public int effectiveTimeout() {
        return timeout != null ? timeout : DEFAULT_TIMEOUT_SECONDS;
    }

    @Override
    public Map<String, Object> arguments() {
        LinkedHashMap<String, Object> args = new LinkedHashMap<>();
        putIfPresent(args, FIELD_CODE, code);
        putIfPresent(args, FIELD_TIMEOUT, timeout);
        return Collections.unmodifiableMap(args);
    }

    @Override
    public SandboxExecCall withoutFields(Set<String> fieldNames) {
        return new SandboxExecCall(code, fieldNames.contains(FIELD_TIMEOUT) ? null : timeout);
    }
}
