package com.routergen.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routergen.config.BackendDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Creates one {@link LLMClient} per configured backend.
 */
@Component
public class LLMClientFactory {

    private static final Logger log = LoggerFactory.getLogger(LLMClientFactory.class);

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper      objectMapper;
    private final RestTemplate      restTemplate = new RestTemplate();

    public LLMClientFactory(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.webClientBuilder = webClientBuilder;
        this.objectMapper     = objectMapper;
    }

    public LLMClient create(BackendDefinition definition) {
        log.info("[LLM] Creating client for backend {}", definition);

        return switch (definition.getProvider()) {
            case OPENAI_COMPATIBLE -> new OpenAiCompatibleLLMClient(
                    webClientBuilder.clone(), definition.getBaseUrl(), definition.getModel(),
                    definition.getApiKey(), definition.getRequestTimeout());
            case GEMINI -> new GeminiLLMClient(
                    webClientBuilder.clone(), definition.getBaseUrl(), definition.getModel(),
                    definition.getApiKey(), definition.getRequestTimeout());
            case OLLAMA -> new OllamaLLMClient(
                    restTemplate, objectMapper, definition.getBaseUrl(), definition.getModel());
            case MOCK -> new MockLLMClient(definition.getModel(), objectMapper);
        };
    }
}
