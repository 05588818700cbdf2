package com.ai.hotline.dto;

import java.util.Optional;

/**
 * What the caller hears next and whether the call ends afterwards.
 * Providers play {@code audioRef} when present and otherwise speak {@code spokenText}
 * with their own voice.
 */
public final class TurnOutcome {

    public enum Kind {
        GREETING,
        REPLY,
        REPROMPT,
        FAREWELL
    }

    private final Kind kind;
    private final String spokenText;
    private final String audioRef;
    private final boolean shouldTerminate;

    private TurnOutcome(Kind kind, String spokenText, String audioRef, boolean shouldTerminate) {
        if (spokenText == null || spokenText.isBlank()) {
            throw new IllegalArgumentException("spokenText must not be blank");
        }
        this.kind = kind;
        this.spokenText = spokenText;
        this.audioRef = audioRef == null || audioRef.isBlank() ? null : audioRef;
        this.shouldTerminate = shouldTerminate;
    }

    public static TurnOutcome of(Kind kind, String spokenText) {
        return new TurnOutcome(kind, spokenText, null, kind == Kind.FAREWELL);
    }

    public TurnOutcome withAudioRef(String audioRef) {
        return new TurnOutcome(kind, spokenText, audioRef, shouldTerminate);
    }

    public Kind getKind() {
        return kind;
    }

    public String getSpokenText() {
        return spokenText;
    }

    public Optional<String> getAudioRef() {
        return Optional.ofNullable(audioRef);
    }

    public boolean hasAudio() {
        return audioRef != null;
    }

    public boolean isShouldTerminate() {
        return shouldTerminate;
    }

    @Override
    public String toString() {
        return "TurnOutcome{kind=" + kind + ", terminate=" + shouldTerminate
                + ", audio=" + (audioRef != null) + ", text='" + spokenText + "'}";
    }
}
