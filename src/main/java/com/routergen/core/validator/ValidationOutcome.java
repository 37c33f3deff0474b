package com.routergen.core.validator;

import com.routergen.core.example.Example;
import com.routergen.core.schema.ToolKind;

import java.util.List;

/**
 * Result of validating one raw model output.
 *
 * Accepted outcomes carry the typed Example and its routing tag; rejected
 * outcomes carry the reason and every field-level detail collected.
 */
public final class ValidationOutcome {

    private final Example         example;
    private final ToolKind        routingTag;
    private final RejectionReason reason;
    private final List<String>    details;

    private ValidationOutcome(Example example, ToolKind routingTag, RejectionReason reason, List<String> details) {
        this.example    = example;
        this.routingTag = routingTag;
        this.reason     = reason;
        this.details    = List.copyOf(details);
    }

    public static ValidationOutcome accepted(Example example, ToolKind routingTag) {
        return new ValidationOutcome(example, routingTag, null, List.of());
    }

    public static ValidationOutcome rejected(RejectionReason reason, List<String> details) {
        return new ValidationOutcome(null, null, reason, details);
    }

    public static ValidationOutcome rejected(RejectionReason reason, String detail) {
        return rejected(reason, List.of(detail));
    }

    public boolean         isAccepted()    { return reason == null; }
    public Example         getExample()    { return example; }
    public ToolKind        getRoutingTag() { return routingTag; }
    public RejectionReason getReason()     { return reason; }
    public List<String>    getDetails()    { return details; }

    @Override
    public String toString() {
        return isAccepted()
                ? "ACCEPTED[" + routingTag.getTag() + "]"
                : "REJECTED[" + reason + "] " + details;
    }
}
