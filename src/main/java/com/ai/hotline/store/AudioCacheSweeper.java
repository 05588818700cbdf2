package com.ai.hotline.store;

import com.ai.hotline.config.HotlineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.time.Duration;

/**
 * Periodically removes call audio older than {@code hotline.audio.ttl}.
 */
@Component
@ConditionalOnProperty(name = "hotline.audio.eviction-enabled", havingValue = "true", matchIfMissing = true)
public class AudioCacheSweeper {

    private static final Logger log = LoggerFactory.getLogger(AudioCacheSweeper.class);

    private final AudioArtifactStore store;
    private final Duration ttl;

    public AudioCacheSweeper(AudioArtifactStore store, HotlineProperties properties) {
        this.store = store;
        this.ttl = properties.getAudio().getTtl();
    }

    @Scheduled(fixedDelayString = "${hotline.audio.sweep-interval:PT1H}",
            initialDelayString = "${hotline.audio.sweep-interval:PT1H}")
    public void sweep() {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            return;
        }
        try {
            int removed = store.evictOlderThan(ttl);
            if (removed > 0) {
                log.info("Evicted {} audio artifacts older than {}", removed, ttl);
            }
        } catch (UncheckedIOException e) {
            log.error("Audio cache sweep failed", e);
        }
    }
}
