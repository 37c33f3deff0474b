package com.routergen.core.schema;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ToolCall - closed tagged union over {@link ToolKind}.
 *
 * Subclasses live in this package only (package-private constructor):
 *   CodebaseSearchCall, FileManagerCall, SandboxExecCall, AskHumanCall.
 *
 * Instances are immutable. {@link #arguments()} exposes the non-null argument
 * fields in declaration order, using wire field names, and is the single view
 * used for serialization, fingerprinting and equality.
 */
public abstract class ToolCall {

    ToolCall() {
    }

    public abstract ToolKind getKind();

    /** Argument fields with non-null values, wire names, declaration order. */
    public abstract Map<String, Object> arguments();

    /**
     * Copy of this call with the named optional fields cleared.
     * Required fields are never cleared; unknown names are ignored.
     */
    public abstract ToolCall withoutFields(Set<String> fieldNames);

    protected static void putIfPresent(LinkedHashMap<String, Object> args, String name, Object value) {
        if (value != null) {
            args.put(name, value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolCall)) return false;
        ToolCall other = (ToolCall) o;
        return getKind() == other.getKind() && arguments().equals(other.arguments());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKind(), arguments());
    }

    @Override
    public String toString() {
        return getKind().getTag() + arguments();
    }
}
