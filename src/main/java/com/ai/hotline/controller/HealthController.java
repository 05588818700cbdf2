package com.ai.hotline.controller;

import com.ai.hotline.config.HotlineProperties;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final HotlineProperties properties;

    public HealthController(HotlineProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("tts", properties.getTts().getUrl());
        services.put("asr", properties.getAsr().getUrl());
        services.put("llm", properties.getLlm().getUrl());
        services.put("langflow", StringUtils.isNotBlank(properties.getLangflow().getFlowId())
                ? properties.getLangflow().getUrl()
                : "not configured");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("service", "ai-hotline-webhook");
        body.put("services", services);
        return body;
    }
}
