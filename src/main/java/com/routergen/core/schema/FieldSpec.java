package com.routergen.core.schema;

import java.util.List;

/**
 * Structural constraint for one argument field of a variant.
 *
 * Always construct via the static factories; they are the vocabulary used by
 * {@link SchemaRegistry} to declare variants.
 */
public final class FieldSpec {

    public enum FieldType { STRING, INTEGER }

    private final String       name;
    private final FieldType    type;
    private final boolean      required;
    private final List<String> allowedValues;
    private final String       description;

    private FieldSpec(String name, FieldType type, boolean required, List<String> allowedValues, String description) {
        this.name          = name;
        this.type          = type;
        this.required      = required;
        this.allowedValues = allowedValues;
        this.description   = description;
    }

    public static FieldSpec requiredText(String name, String description) {
        return new FieldSpec(name, FieldType.STRING, true, List.of(), description);
    }

    public static FieldSpec optionalText(String name, String description) {
        return new FieldSpec(name, FieldType.STRING, false, List.of(), description);
    }

    public static FieldSpec requiredLiteral(String name, List<String> values, String description) {
        return new FieldSpec(name, FieldType.STRING, true, List.copyOf(values), description);
    }

    public static FieldSpec optionalInteger(String name, String description) {
        return new FieldSpec(name, FieldType.INTEGER, false, List.of(), description);
    }

    public String       getName()          { return name; }
    public FieldType    getType()          { return type; }
    public boolean      isRequired()       { return required; }
    public List<String> getAllowedValues() { return allowedValues; }
    public String       getDescription()   { return description; }

    public boolean isLiteral() {
        return !allowedValues.isEmpty();
    }

    public boolean allows(String value) {
        return allowedValues.isEmpty() || allowedValues.contains(value);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(": ");
        if (isLiteral()) {
            sb.append(String.join(" | ", allowedValues));
        } else {
            sb.append(type == FieldType.INTEGER ? "integer" : "string");
        }
        sb.append(required ? " (required)" : " (optional, omit when unused)");
        if (description != null && !description.isBlank()) {
            sb.append(": ").append(description);
        }
        return sb.toString();
    }
}
