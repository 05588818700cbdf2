package com.ai.hotline.service;

import com.ai.hotline.config.HotlineProperties;
import com.ai.hotline.exception.BackendUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Speech-to-text against a Whisper ASR web service ({@code POST {asr-url}/asr}).
 */
@Service
public class SpeechRecognitionClient {

    static final String BACKEND = "asr";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String asrUrl;
    private final String language;

    public SpeechRecognitionClient(RestTemplateBuilder builder, HotlineProperties properties) {
        HotlineProperties.Backend asr = properties.getAsr();
        this.restTemplate = builder
                .setConnectTimeout(asr.getConnectTimeout())
                .setReadTimeout(asr.getReadTimeout())
                .build();
        this.asrUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(asr.getUrl()), "/") + "/asr";
        this.language = asr.getLanguage();
    }

    /**
     * @return transcript, possibly empty when the audio held no speech
     * @throws BackendUnavailableException on timeout, transport error, non-2xx status or unreadable body
     */
    public String transcribe(byte[] wavAudio) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("task", "transcribe");
        form.add("language", language);
        form.add("audio_file", new ByteArrayResource(wavAudio) {
            @Override
            public String getFilename() {
                return "audio.wav";
            }
        });

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(asrUrl, new HttpEntity<>(form, headers), String.class);
            JsonNode root = mapper.readTree(StringUtils.defaultString(response.getBody()));
            if (!root.has("text")) {
                throw new BackendUnavailableException(BACKEND, "response has no text field");
            }
            return root.path("text").asText("").trim();
        } catch (RestClientException e) {
            throw new BackendUnavailableException(BACKEND, e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new BackendUnavailableException(BACKEND, "unreadable response body", e);
        }
    }
}
