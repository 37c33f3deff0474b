package com.routergen.core.schema;

import java.util.List;

/**
 * "When field X equals V, these other fields must be present."
 *
 * nonEmptyFields must carry a non-sentinel value; presentFields only need to
 * exist as strings (empty allowed, e.g. a patch that deletes text).
 */
public final class ConditionalRequirement {

    private final String       whenField;
    private final String       whenValue;
    private final List<String> nonEmptyFields;
    private final List<String> presentFields;

    private ConditionalRequirement(String whenField, String whenValue,
                                   List<String> nonEmptyFields, List<String> presentFields) {
        this.whenField      = whenField;
        this.whenValue      = whenValue;
        this.nonEmptyFields = List.copyOf(nonEmptyFields);
        this.presentFields  = List.copyOf(presentFields);
    }

    public static ConditionalRequirement when(String field, String value,
                                              List<String> nonEmptyFields, List<String> presentFields) {
        return new ConditionalRequirement(field, value, nonEmptyFields, presentFields);
    }

    public String       getWhenField()      { return whenField; }
    public String       getWhenValue()      { return whenValue; }
    public List<String> getNonEmptyFields() { return nonEmptyFields; }
    public List<String> getPresentFields()  { return presentFields; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("if ")
                .append(whenField).append(" == '").append(whenValue).append("' then ");
        if (!nonEmptyFields.isEmpty()) {
            sb.append(String.join(", ", nonEmptyFields)).append(" must be non-empty");
        }
        if (!presentFields.isEmpty()) {
            if (!nonEmptyFields.isEmpty()) sb.append("; ");
            sb.append(String.join(", ", presentFields)).append(" must be present (empty allowed)");
        }
        return sb.toString();
    }
}
