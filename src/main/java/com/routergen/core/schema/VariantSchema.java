package com.routergen.core.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * VariantSchema - everything the Validator needs for one {@link ToolKind}:
 * structural field constraints, conditional requirements, the binder that turns
 * structurally valid arguments into a typed {@link ToolCall}, and the domain rule.
 */
public final class VariantSchema {

    private final ToolKind                     kind;
    private final List<FieldSpec>              fields;
    private final List<ConditionalRequirement> conditions;
    private final Function<JsonNode, ToolCall> binder;
    private final DomainRule                   domainRule;

    VariantSchema(
            ToolKind                     kind,
            List<FieldSpec>              fields,
            List<ConditionalRequirement> conditions,
            Function<JsonNode, ToolCall> binder,
            DomainRule                   domainRule
    ) {
        this.kind       = kind;
        this.fields     = List.copyOf(fields);
        this.conditions = List.copyOf(conditions);
        this.binder     = binder;
        this.domainRule = domainRule;
    }

    public ToolKind                     getKind()       { return kind; }
    public List<FieldSpec>              getFields()     { return fields; }
    public List<ConditionalRequirement> getConditions() { return conditions; }
    public DomainRule                   getDomainRule() { return domainRule; }

    public Optional<FieldSpec> field(String name) {
        return fields.stream().filter(f -> f.getName().equals(name)).findFirst();
    }

    /** Names of fields that are optional at the top level of the schema. */
    public Set<String> optionalFieldNames() {
        return fields.stream()
                .filter(f -> !f.isRequired())
                .map(FieldSpec::getName)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Bind structurally valid arguments. Callers must have run structural
     * validation first; binding unchecked input may throw.
     */
    public ToolCall bind(JsonNode arguments) {
        return binder.apply(arguments);
    }

    /** Prompt-ready description of the wire shape of this variant. */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("tool_name: \"").append(kind.getTag()).append("\"\n");
        sb.append("arguments:\n");
        for (FieldSpec field : fields) {
            sb.append("  - ").append(field).append("\n");
        }
        for (ConditionalRequirement condition : conditions) {
            sb.append("  * ").append(condition).append("\n");
        }
        return sb.toString();
    }
}
