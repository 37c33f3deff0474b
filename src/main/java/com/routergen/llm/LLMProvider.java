package com.routergen.llm;

import java.util.Locale;

/**
 * Wire protocols a backend can speak. Selected per backend by
 * routergen.backend.&lt;id&gt;.provider.
 */
public enum LLMProvider {

    OPENAI_COMPATIBLE("openai"),
    GEMINI("gemini"),
    OLLAMA("ollama"),
    MOCK("mock");

    private final String key;

    LLMProvider(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static LLMProvider fromKey(String key) {
        String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        for (LLMProvider provider : values()) {
            if (provider.key.equals(normalized)) {
                return provider;
            }
        }
        // groq speaks the OpenAI chat-completions protocol
        if (normalized.equals("groq")) {
            return OPENAI_COMPATIBLE;
        }
        throw new IllegalArgumentException("Unknown LLM provider: '" + key + "'");
    }
}
