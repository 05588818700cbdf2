package com.ai.hotline.service;

import com.ai.hotline.component.ResponsePhrases;
import com.ai.hotline.config.HotlineProperties;
import com.ai.hotline.dto.TurnOutcome;
import com.ai.hotline.dto.Utterance;
import com.ai.hotline.exception.BackendUnavailableException;
import com.ai.hotline.store.AudioArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;

/**
 * Decides what the caller hears next for one utterance. Holds no per-call state:
 * every turn is judged on its own text, and replies are requested without history.
 *
 * <p>Backend failures never escape a turn. A failed reply becomes a fixed apology,
 * a failed synthesis leaves the outcome without audio so the provider speaks the
 * text with its own voice.
 */
@Service
public class DialogueTurnEngine {

    private static final Logger log = LoggerFactory.getLogger(DialogueTurnEngine.class);

    private static final String AUDIO_PATH = "/audio/";

    private final ResponderClient responder;
    private final SpeechSynthesisClient synthesisClient;
    private final AudioArtifactStore artifactStore;
    private final ClosingPhraseDetector closingPhraseDetector;
    private final ResponsePhrases phrases;
    private final String baseUrl;
    private final String language;

    public DialogueTurnEngine(ResponderClient responder,
                              SpeechSynthesisClient synthesisClient,
                              AudioArtifactStore artifactStore,
                              ClosingPhraseDetector closingPhraseDetector,
                              ResponsePhrases phrases,
                              HotlineProperties properties) {
        this.responder = responder;
        this.synthesisClient = synthesisClient;
        this.artifactStore = artifactStore;
        this.closingPhraseDetector = closingPhraseDetector;
        this.phrases = phrases;
        this.baseUrl = properties.normalizedBaseUrl();
        this.language = properties.getTts().getLanguage();
    }

    /**
     * Opening line of a call.
     */
    public TurnOutcome greet(String callId) {
        return withSpeech(callId, TurnOutcome.of(TurnOutcome.Kind.GREETING, phrases.greeting()));
    }

    /**
     * One listen-respond cycle for already transcribed speech.
     */
    public TurnOutcome processTurn(Utterance utterance) {
        String callId = utterance.getCallId();
        TurnOutcome outcome;
        if (utterance.isEmpty()) {
            log.info("[{}] No speech detected, re-prompting", callId);
            outcome = TurnOutcome.of(TurnOutcome.Kind.REPROMPT, phrases.couldYouRepeat());
        } else if (closingPhraseDetector.isClosing(utterance.getText())) {
            log.info("[{}] Closing phrase in '{}', ending call", callId, utterance.getText());
            outcome = TurnOutcome.of(TurnOutcome.Kind.FAREWELL, phrases.farewell());
        } else {
            outcome = TurnOutcome.of(TurnOutcome.Kind.REPLY, reply(callId, utterance.getText()));
        }
        return withSpeech(callId, outcome);
    }

    private String reply(String callId, String text) {
        try {
            String reply = responder.respond(text);
            log.info("[{}] {} reply: {}", callId, responder.name(), reply);
            return reply;
        } catch (BackendUnavailableException e) {
            log.error("[{}] Reply backend unavailable: {}", callId, e.getMessage());
            return phrases.apology();
        }
    }

    private TurnOutcome withSpeech(String callId, TurnOutcome outcome) {
        try {
            byte[] audio = synthesisClient.synthesize(outcome.getSpokenText(), language);
            String id = artifactStore.put(audio);
            return outcome.withAudioRef(baseUrl + AUDIO_PATH + id + ".wav");
        } catch (BackendUnavailableException e) {
            log.warn("[{}] Synthesis unavailable, provider voice will be used: {}", callId, e.getMessage());
        } catch (UncheckedIOException e) {
            log.error("[{}] Could not store synthesized audio", callId, e);
        }
        return outcome;
    }
}
