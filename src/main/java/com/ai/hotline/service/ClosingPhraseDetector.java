package com.ai.hotline.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether the caller wants to end the call. Plain case-insensitive substring
 * matching: "okay bye now" ends the call, and so does "read me the goodbye letter".
 */
@Component
public class ClosingPhraseDetector {

    static final List<String> CLOSING_PHRASES = List.of(
            "goodbye", "bye", "hang up", "end call", "that's all"
    );

    public boolean isClosing(String utterance) {
        if (utterance == null || utterance.isBlank()) {
            return false;
        }
        String normalized = utterance.toLowerCase(Locale.ROOT).replace('’', '\'');
        for (String phrase : CLOSING_PHRASES) {
            if (normalized.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
