package com.ai.hotline.store;

import com.ai.hotline.config.HotlineProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class AudioCacheSweeperTest {

    @Test
    void sweepEvictsWithConfiguredTtl() {
        AudioArtifactStore store = mock(AudioArtifactStore.class);
        HotlineProperties properties = new HotlineProperties();
        properties.getAudio().setTtl(Duration.ofMinutes(90));

        new AudioCacheSweeper(store, properties).sweep();

        verify(store).evictOlderThan(Duration.ofMinutes(90));
    }

    @Test
    void zeroTtlDisablesSweep() {
        AudioArtifactStore store = mock(AudioArtifactStore.class);
        HotlineProperties properties = new HotlineProperties();
        properties.getAudio().setTtl(Duration.ZERO);

        new AudioCacheSweeper(store, properties).sweep();

        verifyNoInteractions(store);
    }
}
