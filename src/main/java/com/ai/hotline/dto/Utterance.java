package com.ai.hotline.dto;

import lombok.Getter;
import lombok.ToString;

/**
 * Caller speech decoded from a provider webhook. Empty text means no speech was detected.
 */
@Getter
@ToString
public final class Utterance {

    public static final String UNKNOWN_CALL = "unknown";

    private final String text;
    private final String callId;

    public Utterance(String text, String callId) {
        this.text = text == null ? "" : text.trim();
        this.callId = callId == null || callId.isBlank() ? UNKNOWN_CALL : callId;
    }

    public static Utterance silence(String callId) {
        return new Utterance("", callId);
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
