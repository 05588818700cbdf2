package com.ai.hotline.provider;

import com.ai.hotline.dto.CallerInfo;
import com.ai.hotline.dto.TurnOutcome;
import com.ai.hotline.dto.Utterance;
import org.springframework.http.MediaType;

/**
 * Translates between one telephony provider's webhook protocol and the provider-agnostic
 * dialogue types.
 *
 * <p>Encoded documents always end with the call either listening for speech or hung up.
 * Audio is played when the outcome carries an {@code audioRef}; otherwise the text is
 * spoken with the provider's own voice.
 *
 * @param <P> raw inbound payload type
 */
public interface ProviderAdapter<P> {

    String name();

    MediaType contentType();

    /**
     * @throws com.ai.hotline.exception.ValidationException when the payload cannot be read
     */
    CallerInfo decodeCaller(P payload);

    /**
     * @throws com.ai.hotline.exception.ValidationException when the payload carries no speech field
     *                                                      or cannot be read
     */
    Utterance decodeInbound(P payload);

    /** Greeting, a gather pointing at this provider's turn endpoint, then goodbye and hangup. */
    String encodeGreeting(TurnOutcome greeting);

    /** Play or say the outcome, then hang up or gather again. */
    String encodeTurnOutcome(TurnOutcome outcome);
}
