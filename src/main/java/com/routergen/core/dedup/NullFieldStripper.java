package com.routergen.core.dedup;

import com.routergen.config.ValidationPolicy;
import com.routergen.core.example.Example;
import com.routergen.core.schema.ToolCall;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Removes optional argument fields whose value is a null sentinel
 * ("null", "none", "n/a", empty ...). Idempotent.
 *
 * Fields required by the variant, including conditionally required ones such
 * as an empty patch replacement, are never removed; {@link ToolCall#withoutFields}
 * decides that.
 */
@Component
public class NullFieldStripper {

    private final ValidationPolicy policy;

    public NullFieldStripper(ValidationPolicy policy) {
        this.policy = policy;
    }

    public Example strip(Example example) {
        ToolCall call = example.getToolCall();
        ToolCall stripped = strip(call);
        return stripped.equals(call) ? example : example.withToolCall(stripped);
    }

    public ToolCall strip(ToolCall call) {
        Set<String> sentinelFields = call.arguments().entrySet().stream()
                .filter(e -> e.getValue() instanceof String && policy.isNullSentinel((String) e.getValue()))
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());
        return sentinelFields.isEmpty() ? call : call.withoutFields(sentinelFields);
    }

    /** True when stripping would change nothing. */
    public boolean isClean(ToolCall call) {
        return strip(call).equals(call);
    }
}
