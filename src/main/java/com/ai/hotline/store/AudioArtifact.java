package com.ai.hotline.store;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * A synthesized WAV reply. Written once and never modified.
 */
@Getter
@Builder
public class AudioArtifact {

    private final String id;
    private final byte[] bytes;
    private final Instant createdAt;
}
