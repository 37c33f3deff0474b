package com.routergen.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client for OpenAI-compatible endpoints (Groq by default).
 * JSON mode is requested so the model answers with a bare object.
 */
public class OpenAiCompatibleLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleLLMClient.class);

    private static final String DEFAULT_BASE_URL = "https://api.groq.com/openai/v1";

    private final WebClient webClient;
    private final String    baseUrl;
    private final String    model;
    private final String    apiKey;
    private final Duration  timeout;

    public OpenAiCompatibleLLMClient(WebClient.Builder builder, String baseUrl, String model,
                                     String apiKey, Duration timeout) {
        this.webClient = builder.build();
        this.baseUrl   = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl;
        this.model     = model;
        this.apiKey    = apiKey;
        this.timeout   = timeout;
    }

    @Override
    public String generate(String prompt, double temperature) {

        log.debug("[OpenAI] model={} | temperature={} | promptLen={}", model, temperature, prompt.length());

        Map<String, Object> body = Map.of(
            "model", model,
            "temperature", temperature,
            "response_format", Map.of("type", "json_object"),
            "messages", List.of(
                Map.of("role", "user", "content", prompt)
            )
        );

        JsonNode response;
        try {
            response = webClient
                    .post()
                    .uri(baseUrl + "/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (Exception ex) {
            BackendException classified = BackendException.classify("OpenAI-compatible", ex);
            log.warn("[OpenAI] Request failed | model={} | kind={} | cause={}",
                    model, classified.getKind(), BackendException.rootMessage(ex));
            throw classified;
        }

        JsonNode content = response == null ? null : response.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            throw new BackendException(BackendErrorKind.MALFORMED_RESPONSE,
                    "No choices[0].message.content in response from " + model);
        }
        return content.asText();
    }

    @Override
    public String getModel() {
        return model;
    }
}
