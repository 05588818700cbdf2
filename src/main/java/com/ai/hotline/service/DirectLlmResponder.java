package com.ai.hotline.service;

import com.ai.hotline.config.HotlineProperties;
import com.ai.hotline.dto.ChatMessage;
import com.ai.hotline.exception.BackendUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates replies with an Ollama-style completion endpoint ({@code POST {llm-url}/api/generate}).
 */
public class DirectLlmResponder implements ResponderClient {

    private static final Logger log = LoggerFactory.getLogger(DirectLlmResponder.class);

    static final String BACKEND = "llm";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String generateUrl;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final String systemPrompt;

    public DirectLlmResponder(RestTemplateBuilder builder, HotlineProperties properties) {
        HotlineProperties.Llm llm = properties.getLlm();
        this.restTemplate = builder
                .setConnectTimeout(llm.getConnectTimeout())
                .setReadTimeout(llm.getReadTimeout())
                .build();
        this.generateUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(llm.getUrl()), "/") + "/api/generate";
        this.model = llm.getModel();
        this.temperature = llm.getTemperature();
        this.maxTokens = llm.getMaxTokens();
        this.systemPrompt = properties.getSystemPrompt();
    }

    @Override
    public String respond(String message, List<ChatMessage> history) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> options = new HashMap<>();
        options.put("temperature", temperature);
        options.put("max_tokens", maxTokens);

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("prompt", buildPrompt(message, history));
        body.put("stream", false);
        body.put("options", options);

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(generateUrl, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(StringUtils.defaultString(response.getBody()));
            String reply = root.path("response").asText("").trim();
            if (reply.isEmpty()) {
                throw new BackendUnavailableException(BACKEND, "response field missing or blank");
            }
            log.debug("Model {} replied with {} chars", model, reply.length());
            return reply;
        } catch (RestClientException e) {
            throw new BackendUnavailableException(BACKEND, e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new BackendUnavailableException(BACKEND, "unreadable response body", e);
        }
    }

    /**
     * Persona, then any history as {@code User:}/{@code Assistant:} lines, then the new message.
     */
    String buildPrompt(String message, List<ChatMessage> history) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(StringUtils.defaultString(systemPrompt)).append("\n\n");
        if (history != null) {
            for (ChatMessage msg : history) {
                String speaker = "assistant".equalsIgnoreCase(msg.getRole()) ? "Assistant" : "User";
                prompt.append(speaker).append(": ").append(msg.getContent()).append("\n");
            }
        }
        prompt.append("User: ").append(message).append("\nAssistant:");
        return prompt.toString();
    }

    @Override
    public String name() {
        return BACKEND;
    }
}
