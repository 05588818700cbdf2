package com.ai.hotline.controller;

import com.ai.hotline.store.AudioArtifact;
import com.ai.hotline.store.AudioArtifactStore;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Serves synthesized replies to the telephony provider.
 */
@RestController
public class AudioController {

    static final MediaType AUDIO_WAV = MediaType.parseMediaType("audio/wav");

    private final AudioArtifactStore store;

    public AudioController(AudioArtifactStore store) {
        this.store = store;
    }

    @GetMapping("/audio/{filename:.+}")
    public ResponseEntity<byte[]> audio(@PathVariable String filename) {
        AudioArtifact artifact = store.get(filename);
        return ResponseEntity.ok()
                .contentType(AUDIO_WAV)
                .contentLength(artifact.getBytes().length)
                .body(artifact.getBytes());
    }
}
