package com.ai.hotline.config;

import com.ai.hotline.service.DirectLlmResponder;
import com.ai.hotline.service.ResponderClient;
import com.ai.hotline.service.WorkflowResponder;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the reply backend once per process: the workflow when a flow id is configured,
 * otherwise the model endpoint directly.
 */
@Configuration
public class ResponderConfig {

    private static final Logger log = LoggerFactory.getLogger(ResponderConfig.class);

    @Bean
    public ResponderClient responderClient(RestTemplateBuilder builder, HotlineProperties properties) {
        if (StringUtils.isNotBlank(properties.getLangflow().getFlowId())) {
            log.info("Replies via Langflow flow {} at {}", properties.getLangflow().getFlowId(),
                    properties.getLangflow().getUrl());
            return new WorkflowResponder(builder, properties);
        }
        log.info("Replies via model {} at {}", properties.getLlm().getModel(), properties.getLlm().getUrl());
        return new DirectLlmResponder(builder, properties);
    }
}
