package com.ai.hotline.service;

import com.ai.hotline.component.ResponsePhrases;
import com.ai.hotline.dto.CallerInfo;
import com.ai.hotline.dto.TurnOutcome;
import com.ai.hotline.dto.Utterance;
import com.ai.hotline.exception.ValidationException;
import com.ai.hotline.provider.ProviderAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Provider-agnostic webhook flow: decode, run one turn, encode. Every path ends in a
 * control document, so the provider is never left without instructions.
 */
@Service
public class CallFlowService {

    private static final Logger log = LoggerFactory.getLogger(CallFlowService.class);

    private final DialogueTurnEngine engine;
    private final ResponsePhrases phrases;

    public CallFlowService(DialogueTurnEngine engine, ResponsePhrases phrases) {
        this.engine = engine;
        this.phrases = phrases;
    }

    public <P> String answerCall(ProviderAdapter<P> adapter, P payload) {
        CallerInfo caller;
        try {
            caller = adapter.decodeCaller(payload);
        } catch (ValidationException e) {
            log.warn("[{}] {} call payload rejected: {}", Utterance.UNKNOWN_CALL, adapter.name(), e.getMessage());
            caller = new CallerInfo(null, null);
        }
        log.info("[{}] Incoming {} call from {}", caller.getCallId(), adapter.name(), caller.getFrom());

        try {
            return adapter.encodeGreeting(engine.greet(caller.getCallId()));
        } catch (RuntimeException e) {
            log.error("[{}] Greeting failed, falling back to provider voice", caller.getCallId(), e);
            return fallbackGreeting(adapter);
        }
    }

    public <P> String handleSpeech(ProviderAdapter<P> adapter, P payload) {
        Utterance utterance;
        try {
            utterance = adapter.decodeInbound(payload);
        } catch (ValidationException e) {
            log.warn("[{}] {} speech payload rejected: {}", e.getCallId(), adapter.name(), e.getMessage());
            utterance = Utterance.silence(e.getCallId());
        }
        log.info("[{}] {} speech: '{}'", utterance.getCallId(), adapter.name(), utterance.getText());

        try {
            TurnOutcome outcome = engine.processTurn(utterance);
            log.debug("[{}] {}", utterance.getCallId(), outcome);
            return adapter.encodeTurnOutcome(outcome);
        } catch (RuntimeException e) {
            log.error("[{}] Turn failed, apologising and listening again", utterance.getCallId(), e);
            return fallbackTurn(adapter);
        }
    }

    /**
     * Greeting spoken with the provider's voice, for when answering the call failed or took too long.
     */
    public <P> String fallbackGreeting(ProviderAdapter<P> adapter) {
        return adapter.encodeGreeting(TurnOutcome.of(TurnOutcome.Kind.GREETING, phrases.greeting()));
    }

    /**
     * Apology that keeps the call listening, for when a turn failed or took too long.
     */
    public <P> String fallbackTurn(ProviderAdapter<P> adapter) {
        return adapter.encodeTurnOutcome(TurnOutcome.of(TurnOutcome.Kind.REPLY, phrases.apology()));
    }
}
