package com.ai.hotline.service;

import com.ai.hotline.config.HotlineProperties;
import com.ai.hotline.exception.BackendUnavailableException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Text-to-speech over HTTP: {@code POST {tts-url}/tts {text, language}} returns WAV bytes.
 * One attempt per call, bounded by the configured read timeout.
 */
@Service
public class SpeechSynthesisClient {

    private static final Logger log = LoggerFactory.getLogger(SpeechSynthesisClient.class);

    static final String BACKEND = "tts";

    private final RestTemplate restTemplate;
    private final String ttsUrl;

    public SpeechSynthesisClient(RestTemplateBuilder builder, HotlineProperties properties) {
        HotlineProperties.Backend tts = properties.getTts();
        this.restTemplate = builder
                .setConnectTimeout(tts.getConnectTimeout())
                .setReadTimeout(tts.getReadTimeout())
                .build();
        this.ttsUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(tts.getUrl()), "/") + "/tts";
    }

    /**
     * @return WAV audio for {@code text}
     * @throws BackendUnavailableException on timeout, transport error, non-2xx status or empty audio
     */
    public byte[] synthesize(String text, String language) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.parseMediaType("audio/wav"), MediaType.APPLICATION_OCTET_STREAM));

        Map<String, Object> body = new HashMap<>();
        body.put("text", text);
        body.put("language", language);

        ResponseEntity<byte[]> response;
        try {
            response = restTemplate.postForEntity(ttsUrl, new HttpEntity<>(body, headers), byte[].class);
        } catch (RestClientException e) {
            throw new BackendUnavailableException(BACKEND, e.getMessage(), e);
        }
        byte[] audio = response.getBody();
        if (audio == null || audio.length == 0) {
            throw new BackendUnavailableException(BACKEND, "empty audio response");
        }
        log.debug("Synthesized {} chars -> {} bytes", text.length(), audio.length);
        return audio;
    }
}
