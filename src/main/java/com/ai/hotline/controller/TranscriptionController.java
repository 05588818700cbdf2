package com.ai.hotline.controller;

import com.ai.hotline.exception.ValidationException;
import com.ai.hotline.service.SpeechRecognitionClient;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Transcribes a raw WAV upload through the configured ASR backend.
 */
@RestController
public class TranscriptionController {

    private final SpeechRecognitionClient recognitionClient;

    public TranscriptionController(SpeechRecognitionClient recognitionClient) {
        this.recognitionClient = recognitionClient;
    }

    @PostMapping(value = "/transcribe",
            consumes = {"audio/wav", "audio/x-wav", MediaType.APPLICATION_OCTET_STREAM_VALUE},
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> transcribe(@RequestBody(required = false) byte[] audio) {
        if (audio == null || audio.length == 0) {
            throw new ValidationException("Empty audio body", null);
        }
        return Map.of("text", recognitionClient.transcribe(audio));
    }
}
