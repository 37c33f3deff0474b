package com.routergen.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.routergen.config.ValidationPolicy;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SchemaRegistry - the single source of truth for tool-call variants.
 *
 * Declares, per {@link ToolKind}, the wire fields, conditional requirements,
 * the binder from raw JSON to a typed {@link ToolCall}, and the domain rule.
 * The Validator consults this registry and nothing else, and the prompt
 * builder renders the same declarations, so the two cannot drift apart.
 *
 * Wire shape: {"tool_name": "&lt;tag&gt;", "arguments": {...}}
 */
@Component
public class SchemaRegistry {

    public static final String DISCRIMINATOR_FIELD = "tool_name";
    public static final String ARGUMENTS_FIELD     = "arguments";

    private final Map<ToolKind, VariantSchema> schemas;

    public SchemaRegistry(ValidationPolicy policy) {
        Map<ToolKind, VariantSchema> map = new EnumMap<>(ToolKind.class);
        map.put(ToolKind.CODEBASE_SEARCH, codebaseSearch(policy));
        map.put(ToolKind.FILE_MANAGER,    fileManager(policy));
        map.put(ToolKind.SANDBOX_EXEC,    sandboxExec(policy));
        map.put(ToolKind.ASK_HUMAN,       askHuman(policy));
        this.schemas = Collections.unmodifiableMap(map);
    }

    /** Resolve a discriminator tag. Empty for unknown tags. */
    public Optional<VariantSchema> schemaFor(String tag) {
        return ToolKind.fromTag(tag).map(schemas::get);
    }

    public VariantSchema schemaFor(ToolKind kind) {
        return schemas.get(kind);
    }

    public Map<ToolKind, VariantSchema> all() {
        return schemas;
    }

    // =========================================================================
    // Variant declarations
    // =========================================================================

    private static VariantSchema codebaseSearch(ValidationPolicy policy) {
        return new VariantSchema(
                ToolKind.CODEBASE_SEARCH,
                List.of(
                        FieldSpec.requiredText(CodebaseSearchCall.FIELD_QUERY,
                                "the literal symbol or the concept to look for"),
                        FieldSpec.requiredLiteral(CodebaseSearchCall.FIELD_MODE,
                                wireValues(SearchMode.values()),
                                "exact/hybrid when the user names a symbol, semantic for concepts"),
                        FieldSpec.optionalText(CodebaseSearchCall.FIELD_FILE_PATTERN,
                                "glob restricting the search, e.g. src/**/*.py")
                ),
                List.of(),
                args -> new CodebaseSearchCall(
                        text(args, CodebaseSearchCall.FIELD_QUERY),
                        SearchMode.fromWire(text(args, CodebaseSearchCall.FIELD_MODE)),
                        text(args, CodebaseSearchCall.FIELD_FILE_PATTERN)),
                DomainRules.codebaseSearch(policy)
        );
    }

    private static VariantSchema fileManager(ValidationPolicy policy) {
        return new VariantSchema(
                ToolKind.FILE_MANAGER,
                List.of(
                        FieldSpec.requiredLiteral(FileManagerCall.FIELD_OPERATION,
                                wireValues(FileOperation.values()),
                                "what to do with the path"),
                        FieldSpec.requiredText(FileManagerCall.FIELD_PATH,
                                "path copied verbatim from the user request"),
                        FieldSpec.optionalText(FileManagerCall.FIELD_CONTENT,
                                "full file content, write only"),
                        FieldSpec.optionalText(FileManagerCall.FIELD_TARGET_STRING,
                                "exact text to replace, patch only"),
                        FieldSpec.optionalText(FileManagerCall.FIELD_REPLACEMENT_STRING,
                                "replacement text, patch only")
                ),
                List.of(
                        ConditionalRequirement.when(FileManagerCall.FIELD_OPERATION, FileOperation.WRITE.getWire(),
                                List.of(FileManagerCall.FIELD_CONTENT), List.of()),
                        ConditionalRequirement.when(FileManagerCall.FIELD_OPERATION, FileOperation.PATCH.getWire(),
                                List.of(FileManagerCall.FIELD_TARGET_STRING),
                                List.of(FileManagerCall.FIELD_REPLACEMENT_STRING))
                ),
                args -> new FileManagerCall(
                        FileOperation.fromWire(text(args, FileManagerCall.FIELD_OPERATION)),
                        text(args, FileManagerCall.FIELD_PATH),
                        text(args, FileManagerCall.FIELD_CONTENT),
                        text(args, FileManagerCall.FIELD_TARGET_STRING),
                        text(args, FileManagerCall.FIELD_REPLACEMENT_STRING)),
                DomainRules.fileManager(policy)
        );
    }

    private static VariantSchema sandboxExec(ValidationPolicy policy) {
        return new VariantSchema(
                ToolKind.SANDBOX_EXEC,
                List.of(
                        FieldSpec.requiredText(SandboxExecCall.FIELD_CODE,
                                "self-contained snippet to run"),
                        FieldSpec.optionalInteger(SandboxExecCall.FIELD_TIMEOUT,
                                "seconds, default " + SandboxExecCall.DEFAULT_TIMEOUT_SECONDS
                                        + ", max " + policy.getMaxSandboxTimeout())
                ),
                List.of(),
                args -> new SandboxExecCall(
                        text(args, SandboxExecCall.FIELD_CODE),
                        integer(args, SandboxExecCall.FIELD_TIMEOUT)),
                DomainRules.sandboxExec(policy)
        );
    }

    private static VariantSchema askHuman(ValidationPolicy policy) {
        return new VariantSchema(
                ToolKind.ASK_HUMAN,
                List.of(
                        FieldSpec.requiredText(AskHumanCall.FIELD_QUESTION,
                                "the clarifying or confirming question"),
                        FieldSpec.optionalText(AskHumanCall.FIELD_CONTEXT,
                                "why the agent cannot proceed alone")
                ),
                List.of(),
                args -> new AskHumanCall(
                        text(args, AskHumanCall.FIELD_QUESTION),
                        text(args, AskHumanCall.FIELD_CONTEXT)),
                DomainRules.askHuman(policy)
        );
    }

    // =========================================================================
    // Binding helpers
    // =========================================================================

    private static List<String> wireValues(SearchMode[] modes) {
        String[] values = new String[modes.length];
        for (int i = 0; i < modes.length; i++) values[i] = modes[i].getWire();
        return List.of(values);
    }

    private static List<String> wireValues(FileOperation[] operations) {
        String[] values = new String[operations.length];
        for (int i = 0; i < operations.length; i++) values[i] = operations[i].getWire();
        return List.of(values);
    }

    /** JSON null and missing fields both bind to null. */
    private static String text(JsonNode args, String field) {
        JsonNode node = args.get(field);
        return (node == null || node.isNull()) ? null : node.asText();
    }

    private static Integer integer(JsonNode args, String field) {
        JsonNode node = args.get(field);
        return (node == null || node.isNull()) ? null : node.asInt();
    }
}
