package com.routergen.core.validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.routergen.config.ValidationPolicy;
import com.routergen.core.schema.ConditionalRequirement;
import com.routergen.core.schema.FieldSpec;
import com.routergen.core.schema.SchemaRegistry;
import com.routergen.core.schema.VariantSchema;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Checks a parsed record against one {@link VariantSchema} and collects every
 * field error instead of stopping at the first. Null sentinels ("null", "n/a",
 * empty) count as absent for required checks.
 */
final class StructuralChecker {

    static final String FIELD_QUERY     = "query";
    static final String FIELD_REASONING = "reasoning";
    static final String FIELD_TOOL_CALL = "toolCall";

    private final ValidationPolicy policy;

    StructuralChecker(ValidationPolicy policy) {
        this.policy = policy;
    }

    List<String> check(JsonNode root, VariantSchema schema) {
        List<String> errors = new ArrayList<>();

        requireText(root, FIELD_QUERY, FIELD_QUERY, errors);
        requireText(root, FIELD_REASONING, FIELD_REASONING, errors);

        JsonNode args = root.path(FIELD_TOOL_CALL).get(SchemaRegistry.ARGUMENTS_FIELD);
        String argsPath = FIELD_TOOL_CALL + "." + SchemaRegistry.ARGUMENTS_FIELD;
        if (args == null || args.isNull()) {
            errors.add(argsPath + ": missing");
            return errors;
        }
        if (!args.isObject()) {
            errors.add(argsPath + ": expected object, got " + args.getNodeType());
            return errors;
        }

        for (FieldSpec field : schema.getFields()) {
            checkField(args, field, argsPath + "." + field.getName(), errors);
        }

        Iterator<String> names = args.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (schema.field(name).isEmpty()) {
                errors.add(argsPath + "." + name + ": unknown field for " + schema.getKind().getTag());
            }
        }

        for (ConditionalRequirement condition : schema.getConditions()) {
            checkCondition(args, condition, argsPath, errors);
        }
        return errors;
    }

    // =========================================================================
    // Field rules
    // =========================================================================

    private void requireText(JsonNode node, String field, String path, List<String> errors) {
        JsonNode value = node.get(field);
        if (isAbsent(value)) {
            errors.add(path + ": required field missing");
        } else if (!value.isTextual()) {
            errors.add(path + ": expected string, got " + value.getNodeType());
        }
    }

    private void checkField(JsonNode args, FieldSpec field, String path, List<String> errors) {
        JsonNode value = args.get(field.getName());

        if (isAbsent(value)) {
            if (field.isRequired()) {
                errors.add(path + ": required field missing");
            }
            return;
        }

        switch (field.getType()) {
            case STRING -> {
                if (!value.isTextual()) {
                    errors.add(path + ": expected string, got " + value.getNodeType());
                } else if (!field.allows(value.asText())) {
                    errors.add(path + ": '" + value.asText() + "' is not one of "
                            + String.join("|", field.getAllowedValues()));
                }
            }
            case INTEGER -> {
                if (!value.isIntegralNumber() || !value.canConvertToInt()) {
                    errors.add(path + ": expected integer, got " + value.getNodeType() + " " + value);
                }
            }
        }
    }

    private void checkCondition(JsonNode args, ConditionalRequirement condition, String argsPath, List<String> errors) {
        JsonNode trigger = args.get(condition.getWhenField());
        if (trigger == null || !trigger.isTextual() || !trigger.asText().equals(condition.getWhenValue())) {
            return;
        }

        String when = " (required when " + condition.getWhenField() + "=" + condition.getWhenValue() + ")";
        for (String name : condition.getNonEmptyFields()) {
            if (isAbsent(args.get(name))) {
                errors.add(argsPath + "." + name + ": missing or empty" + when);
            }
        }
        for (String name : condition.getPresentFields()) {
            JsonNode value = args.get(name);
            if (value == null || !value.isTextual()) {
                errors.add(argsPath + "." + name + ": missing" + when);
            }
        }
    }

    /** Missing, JSON null, or a textual null sentinel. */
    private boolean isAbsent(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) return true;
        return value.isTextual() && policy.isNullSentinel(value.asText());
    }
}
