package com.ai.hotline.controller;

import com.ai.hotline.exception.ArtifactNotFoundException;
import com.ai.hotline.store.AudioArtifact;
import com.ai.hotline.store.AudioArtifactStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AudioController.class)
class AudioControllerTest {

    private static final String ARTIFACT_ID = "0f8fad5b-d9cb-469f-a165-70867728950e";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AudioArtifactStore store;

    @Test
    void servesStoredWavBytes() throws Exception {
        byte[] wav = {'R', 'I', 'F', 'F', 0, 1, 2};
        when(store.get(ARTIFACT_ID + ".wav")).thenReturn(AudioArtifact.builder()
                .id(ARTIFACT_ID).bytes(wav).createdAt(Instant.now()).build());

        mockMvc.perform(get("/audio/" + ARTIFACT_ID + ".wav"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("audio/wav"))
                .andExpect(content().bytes(wav));
    }

    @Test
    void unknownArtifactIsNotFound() throws Exception {
        when(store.get(ARTIFACT_ID + ".wav")).thenThrow(new ArtifactNotFoundException(ARTIFACT_ID + ".wav"));

        mockMvc.perform(get("/audio/" + ARTIFACT_ID + ".wav"))
                .andExpect(status().isNotFound())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.errorCode").value("ArtifactNotFoundException"))
                .andExpect(jsonPath("$.message").value("Audio not found"));
    }
}
