package com.routergen.core.validator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routergen.config.ValidationPolicy;
import com.routergen.core.example.Example;
import com.routergen.core.example.GenerationTask;
import com.routergen.core.format.ChatTemplateRenderer;
import com.routergen.core.schema.SchemaRegistry;
import com.routergen.core.schema.ToolCall;
import com.routergen.core.schema.VariantSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Validator - turns raw model text into a typed {@link Example} or a rejection.
 *
 * Phases, in order, each gating the next:
 *   1. parse      strip fences / leading prose, read one JSON object       -> SCHEMA_MISMATCH
 *   2. dispatch   toolCall.tool_name looked up in the SchemaRegistry       -> DISCRIMINATOR_AMBIGUOUS
 *   3. structure  every field error of the variant, aggregated             -> SCHEMA_MISMATCH
 *   4. semantics  target match, query length, template tokens, reasoning quality,
 *                 domain rule                                              -> DOMAIN_LOGIC_VIOLATION
 *
 * Never coerces: an invalid record is rejected, not repaired.
 */
@Component
public class Validator {

    private static final Logger log = LoggerFactory.getLogger(Validator.class);

    private final SchemaRegistry    schemaRegistry;
    private final ValidationPolicy  policy;
    private final ObjectMapper      objectMapper;
    private final StructuralChecker structuralChecker;

    public Validator(SchemaRegistry schemaRegistry, ValidationPolicy policy, ObjectMapper objectMapper) {
        this.schemaRegistry    = schemaRegistry;
        this.policy            = policy;
        this.objectMapper      = objectMapper;
        this.structuralChecker = new StructuralChecker(policy);
    }

    public ValidationOutcome validate(String raw, GenerationTask task) {

        // ── 1. parse ──────────────────────────────────────────────────────
        JsonNode root;
        try {
            root = parse(raw);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return reject(task, RejectionReason.SCHEMA_MISMATCH, List.of("unparseable JSON: " + e.getMessage()));
        }
        if (root == null || !root.isObject()) {
            return reject(task, RejectionReason.SCHEMA_MISMATCH, List.of("top-level value is not a JSON object"));
        }

        // ── 2. dispatch ───────────────────────────────────────────────────
        JsonNode tag = root.path(StructuralChecker.FIELD_TOOL_CALL).get(SchemaRegistry.DISCRIMINATOR_FIELD);
        if (tag == null || !tag.isTextual()) {
            return reject(task, RejectionReason.DISCRIMINATOR_AMBIGUOUS,
                    List.of(StructuralChecker.FIELD_TOOL_CALL + "." + SchemaRegistry.DISCRIMINATOR_FIELD
                            + ": missing or not a string"));
        }
        Optional<VariantSchema> found = schemaRegistry.schemaFor(tag.asText());
        if (found.isEmpty()) {
            return reject(task, RejectionReason.DISCRIMINATOR_AMBIGUOUS,
                    List.of("unknown tool_name '" + tag.asText() + "'"));
        }
        VariantSchema schema = found.get();

        // ── 3. structure ──────────────────────────────────────────────────
        List<String> errors = structuralChecker.check(root, schema);
        if (!errors.isEmpty()) {
            return reject(task, RejectionReason.SCHEMA_MISMATCH, errors);
        }

        ToolCall call;
        try {
            call = schema.bind(root.path(StructuralChecker.FIELD_TOOL_CALL).get(SchemaRegistry.ARGUMENTS_FIELD));
        } catch (IllegalArgumentException e) {
            return reject(task, RejectionReason.SCHEMA_MISMATCH, List.of("binding failed: " + e.getMessage()));
        }

        String query     = root.get(StructuralChecker.FIELD_QUERY).asText().trim();
        String reasoning = root.get(StructuralChecker.FIELD_REASONING).asText().trim();

        // ── 4. semantics ──────────────────────────────────────────────────
        if (call.getKind() != task.getTargetKind()) {
            return reject(task, RejectionReason.DOMAIN_LOGIC_VIOLATION,
                    List.of("emitted " + call.getKind().getTag() + " but the task targets "
                            + task.getTargetKind().getTag()));
        }
        if (query.length() < policy.getMinQueryLength()) {
            return reject(task, RejectionReason.DOMAIN_LOGIC_VIOLATION,
                    List.of("query shorter than " + policy.getMinQueryLength() + " characters"));
        }

        String tokenProblem = controlTokenProblem(query, reasoning, call);
        if (tokenProblem != null) {
            return reject(task, RejectionReason.DOMAIN_LOGIC_VIOLATION, List.of(tokenProblem));
        }

        String reasoningProblem = ReasoningCheck.check(reasoning, query, call.getKind(), policy);
        if (reasoningProblem != null) {
            return reject(task, RejectionReason.DOMAIN_LOGIC_VIOLATION, List.of(reasoningProblem));
        }

        String violation = schema.getDomainRule().check(call, query);
        if (violation != null) {
            return reject(task, RejectionReason.DOMAIN_LOGIC_VIOLATION, List.of(violation));
        }

        Example example = new Example(query, reasoning, call, task.getDomain(), task.getPersona());
        log.debug("[Validator] {} accepted as {}", task, call.getKind().getTag());
        return ValidationOutcome.accepted(example, call.getKind());
    }

    /**
     * Text that the chat template would refuse to render. The argument values
     * are checked together because the renderer sees them in one assistant turn.
     */
    private static String controlTokenProblem(String query, String reasoning, ToolCall call) {
        if (ChatTemplateRenderer.hasControlTokens(query)) {
            return "query contains chat-template control tokens";
        }
        StringBuilder assistant = new StringBuilder(reasoning);
        call.arguments().values().forEach(v -> assistant.append('\n').append(v));
        if (ChatTemplateRenderer.hasControlTokens(assistant.toString())) {
            return "reasoning or arguments contain chat-template control tokens";
        }
        return null;
    }

    // =========================================================================
    // Parsing
    // =========================================================================

    private JsonNode parse(String raw) throws JsonProcessingException {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("empty output");
        }
        String json = raw.trim();

        // Strip markdown fences
        if (json.startsWith("```")) {
            json = json.replaceAll("^```[a-zA-Z]*\\n?", "").replaceAll("```\\s*$", "").trim();
        }

        // Skip leading prose to first '{'
        int start = json.indexOf('{');
        if (start > 0) json = json.substring(start);

        return objectMapper.readTree(json);
    }

    private ValidationOutcome reject(GenerationTask task, RejectionReason reason, List<String> details) {
        log.debug("[Validator] {} rejected {}: {}", task, reason, details);
        return ValidationOutcome.rejected(reason, details);
    }
}
