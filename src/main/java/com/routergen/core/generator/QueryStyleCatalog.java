package com.routergen.core.generator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Catalogue of query phrasing styles used to diversify prompts.
 */
public final class QueryStyleCatalog {

    private static final Map<String, QueryStyle> STYLES = new LinkedHashMap<>();

    static {
        // communication
        add("direct", "Straightforward command or statement",
                "Find the auth handler", "Show me the config", "Search for User class");
        add("question", "Phrased as an interrogative",
                "Where is the auth handler?", "How does caching work?");
        add("problem", "Describes an issue or blocker",
                "I can't find the auth handler", "The tests are failing");
        add("context", "Provides background before the request",
                "We're refactoring auth, need to find the handler");
        add("urgent", "Time-sensitive with pressure indicators",
                "ASAP: find auth handler", "URGENT: production is down");
        add("confused", "Uncertain, seeking guidance",
                "Not sure where auth stuff is...", "I think it's in utils?");
        add("exploratory", "Open-ended investigation",
                "Let's see how auth works", "Curious about the payment flow");

        // tone
        add("overly_polite", "Excessive courtesy, apologetic",
                "Sorry to bother, but could you possibly find...");
        add("emotional", "Frustrated, excited, or stressed tone",
                "This is driving me crazy!", "Finally found the issue!");
        add("sarcastic", "Dry humor or ironic phrasing",
                "Oh great, another memory leak", "Perfect, more tech debt");

        // structure
        add("narrative", "Long story with embedded request",
                "So I was debugging yesterday and noticed the cache wasn't invalidating, which led me to...");
        add("fragmented", "Incomplete thoughts, stream of consciousness",
                "auth handler... somewhere in backend? maybe utils...");
        add("acronym_heavy", "Filled with jargon and abbreviations",
                "Need the JWT impl ASAP for SSO integration");
        add("code_mixed", "Natural language mixed with code snippets",
                "Find where we call authenticate() with the user param", "Search for imports of redis.Redis");
        add("minimal", "One or two words, ultra terse",
                "auth handler", "timeout");
        add("verbose", "Overly detailed, far longer than needed",
                "I would like to respectfully request a comprehensive search of the entire codebase...");
        add("checklist", "Bulleted or numbered list of items",
                "1. Find auth handler 2. Check config 3. Run tests");
        add("error_dump", "Pastes a stack trace or error log",
                "Getting: TypeError: cannot read property 'user' of undefined at auth.js:45");

        // routing hints
        add("implicit_search", "Implies search without saying 'search'",
                "Where is the auth handler", "Show me the payment logic");
        add("implicit_execute", "Implies code execution without an explicit request",
                "Try running this snippet", "Test this regex");
        add("implicit_modify", "Assumes permission to edit files",
                "Change timeout to 60 in config/app.yaml");
        add("implicit_escalate", "Blocked tone, needs help without asking",
                "Not sure what to do here", "This seems risky");
        add("permission_uncertain", "Asks if an action is allowed",
                "Can I delete this?", "Am I allowed to drop this table?");
        add("validation_request", "Wants to verify or test something",
                "Check if this regex works", "Validate the JSON schema");
    }

    private QueryStyleCatalog() {
    }

    private static void add(String name, String description, String... examples) {
        STYLES.put(name, new QueryStyle(name, description, List.of(examples)));
    }

    public static List<String> names() {
        return List.copyOf(STYLES.keySet());
    }

    public static Optional<QueryStyle> find(String name) {
        return Optional.ofNullable(STYLES.get(name));
    }

    public static String pick(Random random) {
        List<String> names = names();
        return names.get(random.nextInt(names.size()));
    }
}
