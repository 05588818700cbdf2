package com.ai.hotline.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Process-wide settings for the hotline webhook. Read once at startup.
 *
 * <p>Every value can be overridden through the environment variables referenced
 * in application.properties ({@code BASE_URL}, {@code TTS_URL}, {@code LLM_URL}, ...).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "hotline")
public class HotlineProperties {

    /** Public base URL used to build webhook callbacks and artifact links. */
    private String baseUrl = "http://localhost:8080";

    /** Persona instruction prepended to every language-model prompt. */
    private String systemPrompt = "You are a helpful AI voice assistant.";

    /**
     * Upper bound for one webhook turn. A turn still running after this answers with the
     * fallback apology document; keep it below {@code spring.mvc.async.request-timeout}.
     */
    private Duration turnTimeout = Duration.ofSeconds(100);

    private Backend tts = new Backend("http://localhost:5000", Duration.ofSeconds(30));
    private Backend asr = new Backend("http://localhost:9000", Duration.ofSeconds(30));
    private Llm llm = new Llm();
    private Langflow langflow = new Langflow();
    private Audio audio = new Audio();
    private TurnPool turnPool = new TurnPool();

    /**
     * Base URL with any trailing slash removed.
     */
    public String normalizedBaseUrl() {
        return baseUrl == null ? "" : baseUrl.trim().replaceAll("/+$", "");
    }

    @Getter
    @Setter
    public static class Backend {
        private String url;
        private String language = "en";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout;

        public Backend() {
        }

        public Backend(String url, Duration readTimeout) {
            this.url = url;
            this.readTimeout = readTimeout;
        }
    }

    @Getter
    @Setter
    public static class Llm {
        private String url = "http://localhost:11434";
        private String model = "llama3.1:8b";
        private double temperature = 0.7;
        private int maxTokens = 150;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Langflow {
        private String url = "http://localhost:7860";
        /** When set, replies come from this workflow instead of the direct model endpoint. */
        private String flowId = "";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Audio {
        private String dir = "./audio_cache";
        private boolean evictionEnabled = true;
        private Duration ttl = Duration.ofHours(24);
        private Duration sweepInterval = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class TurnPool {
        private int corePoolSize = 8;
        private int maxPoolSize = 32;
        /** 0 hands turns straight to a new thread up to {@code maxPoolSize}. */
        private int queueCapacity = 0;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "turn-pool-";
    }
}
