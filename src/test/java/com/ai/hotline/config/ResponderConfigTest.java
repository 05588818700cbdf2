package com.ai.hotline.config;

import com.ai.hotline.service.DirectLlmResponder;
import com.ai.hotline.service.ResponderClient;
import com.ai.hotline.service.WorkflowResponder;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;

import static org.assertj.core.api.Assertions.assertThat;

class ResponderConfigTest {

    private final ResponderConfig config = new ResponderConfig();

    @Test
    void flowIdSelectsWorkflowResponder() {
        HotlineProperties properties = new HotlineProperties();
        properties.getLangflow().setFlowId("flow-123");

        ResponderClient responder = config.responderClient(new RestTemplateBuilder(), properties);

        assertThat(responder).isInstanceOf(WorkflowResponder.class);
        assertThat(responder.name()).isEqualTo("langflow");
    }

    @Test
    void blankFlowIdSelectsDirectResponder() {
        HotlineProperties properties = new HotlineProperties();
        properties.getLangflow().setFlowId("   ");

        ResponderClient responder = config.responderClient(new RestTemplateBuilder(), properties);

        assertThat(responder).isInstanceOf(DirectLlmResponder.class);
        assertThat(responder.name()).isEqualTo("llm");
    }
}
