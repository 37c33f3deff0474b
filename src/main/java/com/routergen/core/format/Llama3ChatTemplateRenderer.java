package com.routergen.core.format;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.routergen.core.dedup.NullFieldStripper;
import com.routergen.core.example.Example;
import com.routergen.core.example.ExampleCodec;
import org.springframework.stereotype.Component;

/**
 * Llama-3 instruct layout.
 *
 * The assistant turn is compact JSON: {"reasoning":...,"toolCall":{"tool_name":...,"arguments":{...}}}
 */
@Component
public class Llama3ChatTemplateRenderer implements ChatTemplateRenderer {

    static final String SYSTEM_PROMPT = """
            You are the routing brain of an autonomous AI engineer.
            Route each user query to exactly one tool and explain the choice.

            OUTPUT RULES:
            1. Specific actions (search, file edit, code execution) choose the matching tool.
            2. Ambiguous, dangerous or permission-gated requests use the 'ask_human' tool.
            3. Output STRICT JSON only: {"reasoning": ..., "toolCall": {"tool_name": ..., "arguments": {...}}}.""";

    private static final String HEADER_START = "<|start_header_id|>";
    private static final String HEADER_END   = "<|end_header_id|>\n\n";
    private static final String EOT          = "<|eot_id|>";

    private final ExampleCodec      codec;
    private final NullFieldStripper stripper;
    private final ObjectMapper      objectMapper;

    public Llama3ChatTemplateRenderer(ExampleCodec codec, NullFieldStripper stripper, ObjectMapper objectMapper) {
        this.codec        = codec;
        this.stripper     = stripper;
        this.objectMapper = objectMapper;
    }

    @Override
    public String render(Example example) {
        if (example == null) {
            throw new IllegalStateException("Cannot render a null example");
        }
        if (!stripper.isClean(example.getToolCall())) {
            throw new IllegalStateException("Example still carries null-sentinel fields: " + example.getToolCall());
        }
        requireTemplateSafe("query", example.getQuery());
        requireTemplateSafe("reasoning", example.getReasoning());

        ObjectNode assistant = objectMapper.createObjectNode();
        assistant.put(ExampleCodec.FIELD_REASONING, example.getReasoning());
        assistant.set(ExampleCodec.FIELD_TOOL_CALL, codec.toolCallJson(example.getToolCall()));
        String assistantJson = assistant.toString();
        requireTemplateSafe("toolCall", assistantJson);

        return turn("system", SYSTEM_PROMPT)
                + turn("user", example.getQuery())
                + turn("assistant", assistantJson);
    }

    @Override
    public ChatTurns parse(String rendered) {
        String system    = section(rendered, "system");
        String user      = section(rendered, "user");
        String assistant = section(rendered, "assistant");
        return new ChatTurns(system, user, assistant);
    }

    // =========================================================================
    // Layout
    // =========================================================================

    private static String turn(String role, String content) {
        return HEADER_START + role + HEADER_END + content + EOT;
    }

    private static String section(String rendered, String role) {
        String open = HEADER_START + role + HEADER_END;
        int start = rendered.indexOf(open);
        if (start < 0) {
            throw new IllegalArgumentException("No " + role + " turn in rendered text");
        }
        start += open.length();
        int end = rendered.indexOf(EOT, start);
        if (end < 0) {
            throw new IllegalArgumentException("Unterminated " + role + " turn in rendered text");
        }
        return rendered.substring(start, end);
    }

    private static void requireTemplateSafe(String part, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Cannot render example with empty " + part);
        }
        if (ChatTemplateRenderer.hasControlTokens(value)) {
            throw new IllegalStateException(part + " contains chat-template control tokens");
        }
    }
}
