package com.routergen.core.generator;

import com.routergen.config.ValidationPolicy;
import com.routergen.core.example.GenerationTask;
import com.routergen.core.schema.SchemaRegistry;
import com.routergen.core.schema.ToolKind;
import org.springframework.stereotype.Component;

/**
 * PromptBuilder - renders the generation prompt for one task.
 *
 * The schema section is rendered from {@link SchemaRegistry}, the same
 * declarations the Validator enforces. The "Target Tool:" line is part of the
 * contract with the offline mock backend; keep its format.
 */
@Component
public class PromptBuilder {

    private final SchemaRegistry   schemaRegistry;
    private final ValidationPolicy policy;

    public PromptBuilder(SchemaRegistry schemaRegistry, ValidationPolicy policy) {
        this.schemaRegistry = schemaRegistry;
        this.policy         = policy;
    }

    public String build(GenerationTask task) {
        ToolKind kind = task.getTargetKind();

        StringBuilder sb = new StringBuilder();
        sb.append("# ROLE: Synthetic data generator for an AI coding-agent router\n\n");
        sb.append("You generate ONE training example that maps a user query to a structured tool call.\n\n");

        sb.append("## CONTEXT\n");
        sb.append("- Domain: ").append(task.getDomain()).append("\n");
        sb.append("- Persona: ").append(task.getPersona()).append("\n");
        sb.append("- Target Tool: ").append(kind.getTag()).append("\n");
        sb.append("- Intent: ").append(intent(kind)).append("\n");
        sb.append("- Query Style: ").append(task.getQueryStyle()).append("\n\n");

        sb.append("## LOGIC & CONSISTENCY RULES\n");
        sb.append(toolLogic(kind)).append("\n");

        sb.append("## STYLE\n");
        sb.append(styleGuide(task.getQueryStyle())).append("\n");

        sb.append("## REASONING QUALITY\n");
        sb.append("The reasoning must be between ").append(policy.getMinReasoningWords())
                .append(" and ").append(policy.getMaxReasoningWords()).append(" words.\n");
        sb.append("""
                Explain what you are doing, why this tool fits, and how it helps.
                Name the action of the tool in your own words; do not restate the user query.
                Formula: "I need to [ACTION] because [REASON], so I'll [TOOL] to [OUTCOME]."

                """);

        sb.append("## OUTPUT SCHEMA\n");
        sb.append(schemaRegistry.schemaFor(kind).describe()).append("\n");
        sb.append("Respond with exactly one JSON object of this shape:\n");
        sb.append("{\"query\": \"<user query>\", \"reasoning\": \"<your reasoning>\", ")
                .append("\"toolCall\": {\"").append(SchemaRegistry.DISCRIMINATOR_FIELD).append("\": \"")
                .append(kind.getTag()).append("\", \"").append(SchemaRegistry.ARGUMENTS_FIELD)
                .append("\": {...}}}\n\n");

        sb.append("""
                ## NEGATIVE CONSTRAINTS
                1. Do NOT emit null values. Omit optional fields you do not need.
                2. Do NOT wrap the output in Markdown code fences.
                3. Do NOT add prose before or after the JSON object.
                """);
        return sb.toString();
    }

    // =========================================================================
    // Per-tool guidance
    // =========================================================================

    private String intent(ToolKind kind) {
        return switch (kind) {
            case CODEBASE_SEARCH -> "Look up functions, trace where logic lives, inspect configs, "
                    + "explore unfamiliar modules, locate error messages, map data flows.";
            case SANDBOX_EXEC -> "Evaluate code snippets, validate algorithms, run quick calculations, "
                    + "reproduce bugs, verify regex patterns, simulate edge cases.";
            case FILE_MANAGER -> "Apply small fixes, adjust configuration values, update constants, "
                    + "add logging, rename variables, remove dead code in a named file.";
            case ASK_HUMAN -> "Requests blocked by missing context, unclear business rules, "
                    + "security-sensitive actions or operations that need human approval.";
        };
    }

    private String toolLogic(ToolKind kind) {
        return switch (kind) {
            case CODEBASE_SEARCH -> """
                    codebase_search is for discovery when the user does not know the file path.
                    Mode selection:
                    - exact: the query names a literal symbol (class User, authenticate(), CONFIG_KEY)
                    - hybrid: a literal symbol plus surrounding intent (where is UserService wired into checkout)
                    - semantic: concepts only, no identifiers (how does auth work, payment retry logic)
                    Include file_pattern only when the user scopes the search (in tests, *.yaml files).
                    Never use search when the query contains a full path or asks to modify code.
                    """;
            case FILE_MANAGER -> """
                    file_manager performs direct file operations: list, read, write, patch.
                    The user query MUST contain the exact path; copy it verbatim into "path".
                    - list / read: only path
                    - write: path + content
                    - patch: path + target_string + replacement_string (replacement may be empty)
                    Never invent a path the user did not state. No "..".
                    """;
            case SANDBOX_EXEC -> """
                    sandbox_exec runs a small, self-contained Python snippet.
                    Use print() for output, keep it focused, no filesystem or shell access,
                    no os.system, eval( or __import__. timeout is optional (default 30 seconds).
                    """;
            case ASK_HUMAN -> """
                    ask_human escalates: dangerous operations (delete, drop, truncate), ambiguous
                    requests, missing business rules, or permission-gated actions.
                    The user query is the TRIGGER; the question is what the agent asks back.
                    Phrase the question as a real question and use context to say why you ask.
                    """;
        };
    }

    private String styleGuide(String styleName) {
        return QueryStyleCatalog.find(styleName)
                .map(style -> "Write the query in the '" + style.getName() + "' style: " + style.getDescription()
                        + ".\nExamples of the style (do not copy): " + String.join(" | ", style.getExamples()) + "\n")
                .orElse("Write the query naturally, as the persona would.\n");
    }
}
