package com.routergen.core.example;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.routergen.core.schema.SchemaRegistry;
import com.routergen.core.schema.ToolCall;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Wire form of {@link Example} and {@link ToolCall}.
 *
 *   {"query": ..., "reasoning": ..., "toolCall": {"tool_name": ..., "arguments": {...}},
 *    "domain": ..., "persona": ...}
 *
 * Only non-null argument fields are written.
 */
@Component
public class ExampleCodec {

    public static final String FIELD_QUERY     = "query";
    public static final String FIELD_REASONING = "reasoning";
    public static final String FIELD_TOOL_CALL = "toolCall";
    public static final String FIELD_DOMAIN    = "domain";
    public static final String FIELD_PERSONA   = "persona";

    private final ObjectMapper objectMapper;

    public ExampleCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toJson(Example example) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(FIELD_QUERY, example.getQuery());
        node.put(FIELD_REASONING, example.getReasoning());
        node.set(FIELD_TOOL_CALL, toolCallJson(example.getToolCall()));
        node.put(FIELD_DOMAIN, example.getDomain());
        node.put(FIELD_PERSONA, example.getPersona());
        return node;
    }

    public ObjectNode toolCallJson(ToolCall call) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(SchemaRegistry.DISCRIMINATOR_FIELD, call.getKind().getTag());
        ObjectNode args = node.putObject(SchemaRegistry.ARGUMENTS_FIELD);
        for (Map.Entry<String, Object> arg : call.arguments().entrySet()) {
            args.set(arg.getKey(), objectMapper.valueToTree(arg.getValue()));
        }
        return node;
    }

    /** Single-line JSON, as written to JSONL. */
    public String toLine(Example example) {
        return toJson(example).toString();
    }
}
