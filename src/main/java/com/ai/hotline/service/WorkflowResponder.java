package com.ai.hotline.service;

import com.ai.hotline.config.HotlineProperties;
import com.ai.hotline.dto.ChatMessage;
import com.ai.hotline.exception.BackendUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
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
 * Runs a Langflow chat flow ({@code POST {langflow-url}/api/v1/run/{flow-id}}) and reads
 * the reply from {@code outputs[0].outputs[0].results.message.text}.
 *
 * <p>History is not forwarded; a flow keeps its own memory if it needs one.
 */
public class WorkflowResponder implements ResponderClient {

    static final String BACKEND = "langflow";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String runUrl;

    public WorkflowResponder(RestTemplateBuilder builder, HotlineProperties properties) {
        HotlineProperties.Langflow langflow = properties.getLangflow();
        if (StringUtils.isBlank(langflow.getFlowId())) {
            throw new IllegalArgumentException("hotline.langflow.flow-id must be set to use the workflow responder");
        }
        this.restTemplate = builder
                .setConnectTimeout(langflow.getConnectTimeout())
                .setReadTimeout(langflow.getReadTimeout())
                .build();
        this.runUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(langflow.getUrl()), "/")
                + "/api/v1/run/" + langflow.getFlowId().trim();
    }

    @Override
    public String respond(String message, List<ChatMessage> history) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("input_value", message);
        body.put("output_type", "chat");
        body.put("input_type", "chat");

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(runUrl, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(StringUtils.defaultString(response.getBody()));
            JsonNode text = root.path("outputs").path(0)
                    .path("outputs").path(0)
                    .path("results").path("message").path("text");
            if (!text.isTextual() || text.asText().isBlank()) {
                throw new BackendUnavailableException(BACKEND, "workflow output has no message text");
            }
            return text.asText().trim();
        } catch (RestClientException e) {
            throw new BackendUnavailableException(BACKEND, e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new BackendUnavailableException(BACKEND, "unreadable response body", e);
        }
    }

    @Override
    public String name() {
        return BACKEND;
    }
}
