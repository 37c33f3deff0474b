package com.routergen.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini generateContent client.
 *
 * One request per call. Transient failures are classified and rethrown; the
 * BackendPool decides whether to cool down or fail over.
 */
public class GeminiLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiLLMClient.class);

    private final WebClient webClient;
    private final String    baseUrl;
    private final String    model;
    private final String    apiKey;
    private final Duration  timeout;

    public GeminiLLMClient(WebClient.Builder builder, String baseUrl, String model, String apiKey, Duration timeout) {
        this.webClient = builder.build();
        this.baseUrl   = baseUrl == null || baseUrl.isBlank()
                ? "https://generativelanguage.googleapis.com/v1beta"
                : baseUrl;
        this.model     = model;
        this.apiKey    = apiKey;
        this.timeout   = timeout;
    }

    @Override
    public String generate(String prompt, double temperature) {

        log.debug("[Gemini] model={} | temperature={} | promptLen={}", model, temperature, prompt.length());

        Map<String, Object> body = Map.of(
            "contents", List.of(
                Map.of(
                    "parts", List.of(
                        Map.of("text", prompt)
                    )
                )
            ),
            "generationConfig", Map.of(
                "temperature", temperature,
                "responseMimeType", "application/json"
            )
        );

        Map<?, ?> response;
        try {
            response = webClient
                    .post()
                    .uri(baseUrl + "/models/" + model + ":generateContent?key=" + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(timeout)
                    .block();
        } catch (Exception ex) {
            BackendException classified = BackendException.classify("Gemini", ex);
            log.warn("[Gemini] Request failed | model={} | kind={} | cause={}",
                    model, classified.getKind(), BackendException.rootMessage(ex));
            throw classified;
        }

        return extractText(response);
    }

    @Override
    public String getModel() {
        return model;
    }

    @SuppressWarnings("unchecked")
    private String extractText(Map<?, ?> response) {
        try {
            var candidates = (List<Map<String, Object>>) response.get("candidates");
            var content = (Map<String, Object>) candidates.get(0).get("content");
            var parts = (List<Map<String, Object>>) content.get("parts");
            return parts.get(0).get("text").toString();
        } catch (Exception e) {
            log.warn("[Gemini] Malformed response: {}", response);
            throw new BackendException(BackendErrorKind.MALFORMED_RESPONSE, "Malformed Gemini response", e);
        }
    }
}
