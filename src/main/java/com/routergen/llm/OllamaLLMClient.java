package com.routergen.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.*;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * OllamaLLMClient - backend served by a local Ollama server (/api/generate, non-streaming).
 */
public class OllamaLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLLMClient.class);

    private final String       baseUrl;
    private final String       model;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public OllamaLLMClient(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl, String model) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl      = baseUrl == null || baseUrl.isBlank() ? "http://localhost:11434" : baseUrl;
        this.model        = model == null || model.isBlank() ? "llama3:8b" : model;
    }

    @Override
    public String generate(String prompt, double temperature) {
        String url = baseUrl + "/api/generate";

        Map<String, Object> body = new HashMap<>();
        body.put("model",   model);
        body.put("prompt",  prompt);
        body.put("format",  "json");
        body.put("stream",  false);
        body.put("options", Map.of("temperature", temperature));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        log.debug("[Ollama] model={} temperature={} promptLen={}", model, temperature, prompt.length());

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
        } catch (Exception e) {
            BackendException classified = BackendException.classify("Ollama", e);
            log.warn("[Ollama] Call failed | kind={} | cause={}", classified.getKind(), e.getMessage());
            throw classified;
        }

        try {
            JsonNode root = objectMapper.readTree(response.getBody());
            String result = root.has("response") ? root.get("response").asText() : "";
            log.debug("[Ollama] responseLen={}", result.length());
            return result;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new BackendException(BackendErrorKind.MALFORMED_RESPONSE,
                    "Ollama returned unreadable body: " + e.getMessage(), e);
        }
    }

    @Override
    public String getModel() {
        return model;
    }
}
