package com.routergen.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline backend for the test profile and local dry runs.
 *
 * Reads the "Target Tool:" line of the prompt and answers with a well-formed,
 * domain-consistent record for that tool. A counter shared by every mock
 * instance varies the content, so two mock backends never produce the same
 * example.
 */
public class MockLLMClient implements LLMClient {

    private static final Pattern TARGET_TOOL = Pattern.compile("Target Tool:\\s*([a-z_]+)");

    private static final AtomicInteger COUNTER = new AtomicInteger();

    private final String       model;
    private final ObjectMapper objectMapper;

    public MockLLMClient(String model, ObjectMapper objectMapper) {
        this.model        = model == null || model.isBlank() ? "mock" : model;
        this.objectMapper = objectMapper;
    }

    @Override
    public String generate(String prompt, double temperature) {
        Matcher m = TARGET_TOOL.matcher(prompt);
        String tool = m.find() ? m.group(1) : "codebase_search";
        int n = COUNTER.incrementAndGet();

        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode call = root.putObject("toolCall");
        call.put("tool_name", tool);
        ObjectNode args = call.putObject("arguments");

        switch (tool) {
            case "file_manager" -> fileManager(root, args, n);
            case "sandbox_exec" -> sandboxExec(root, args, n);
            case "ask_human"    -> askHuman(root, args, n);
            default             -> codebaseSearch(root, args, n);
        }

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new BackendException(BackendErrorKind.MALFORMED_RESPONSE, "Mock could not serialize record", e);
        }
    }

    @Override
    public String getModel() {
        return model;
    }

    // =========================================================================
    // Per-tool records
    // =========================================================================

    private void codebaseSearch(ObjectNode root, ObjectNode args, int n) {
        if (n % 2 == 0) {
            String symbol = "refreshSession" + n;
            root.put("query", "Where is " + symbol + "() defined? It keeps returning stale tokens.");
            root.put("reasoning", "The user names a concrete function, so I will search the codebase "
                    + "in exact mode to locate its definition directly.");
            args.put("query", symbol);
            args.put("mode", "exact");
        } else {
            root.put("query", "where do we handle retry backoff for outbound payment calls, batch " + n + "?");
            root.put("reasoning", "No identifier is given, only a behaviour, so a semantic search "
                    + "across the codebase should find the relevant logic.");
            args.put("query", "retry backoff for outbound payment calls");
            args.put("mode", "semantic");
        }
    }

    private void fileManager(ObjectNode root, ObjectNode args, int n) {
        String path = "config/service_" + n + ".yaml";
        switch (n % 4) {
            case 0 -> {
                root.put("query", "Show me what is in " + path + " please");
                root.put("reasoning", "The user gave an explicit path, so I will read that file "
                        + "directly instead of searching for it.");
                args.put("operation", "read");
                args.put("path", path);
            }
            case 1 -> {
                String dir = "tests/unit_" + n + "/";
                root.put("query", "List everything under " + dir + " so I can see the fixtures");
                root.put("reasoning", "A concrete directory was named, so listing it with the file "
                        + "manager answers the request without any search.");
                args.put("operation", "list");
                args.put("path", dir);
            }
            case 2 -> {
                root.put("query", "Create " + path + " with a single key enabled set to true");
                root.put("reasoning", "The user wants new content at a known location, so I will write "
                        + "the file with exactly the requested key.");
                args.put("operation", "write");
                args.put("path", path);
                args.put("content", "enabled: true\n");
            }
            default -> {
                root.put("query", "In " + path + " change timeout: 30 to timeout: 60");
                root.put("reasoning", "The path and both values are stated, so a targeted patch of "
                        + "the file is the smallest safe edit.");
                args.put("operation", "patch");
                args.put("path", path);
                args.put("target_string", "timeout: 30");
                args.put("replacement_string", "timeout: 60");
            }
        }
    }

    private void sandboxExec(ObjectNode root, ObjectNode args, int n) {
        root.put("query", "Quick sanity check: what does sum(range(" + n + ")) give in Python?");
        root.put("reasoning", "This is a small computation that is easiest to verify by running "
                + "the snippet in the sandbox and reading the printed result.");
        args.put("code", "print(sum(range(" + n + ")))");
        if (n % 3 == 0) {
            args.put("timeout", 10);
        }
    }

    private void askHuman(ObjectNode root, ObjectNode args, int n) {
        root.put("query", "Delete the staging tables left over from migration " + n);
        root.put("reasoning", "Dropping tables is destructive and the scope is unclear, so I must "
                + "confirm with a human before touching anything.");
        args.put("question", "Which staging tables from migration " + n + " should be removed, and do you approve?");
        args.put("context", "Deletion cannot be undone.");
    }
}
