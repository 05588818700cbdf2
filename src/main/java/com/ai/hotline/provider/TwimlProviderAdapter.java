package com.ai.hotline.provider;

import com.ai.hotline.component.ResponsePhrases;
import com.ai.hotline.config.HotlineProperties;
import com.ai.hotline.dto.CallerInfo;
import com.ai.hotline.dto.TurnOutcome;
import com.ai.hotline.dto.Utterance;
import com.ai.hotline.exception.ValidationException;
import com.twilio.http.HttpMethod;
import com.twilio.twiml.TwiMLException;
import com.twilio.twiml.VoiceResponse;
import com.twilio.twiml.voice.Gather;
import com.twilio.twiml.voice.Hangup;
import com.twilio.twiml.voice.Play;
import com.twilio.twiml.voice.Say;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;

/**
 * Twilio voice webhooks: form-encoded requests in, TwiML out.
 */
@Component
public class TwimlProviderAdapter implements ProviderAdapter<Map<String, String>> {

    public static final String VOICE_PATH = "/voice";
    public static final String GATHER_PATH = "/gather";

    static final String SPEECH_RESULT = "SpeechResult";
    static final String CALL_SID = "CallSid";
    static final String FROM = "From";

    private final ResponsePhrases phrases;
    private final String gatherUrl;

    public TwimlProviderAdapter(ResponsePhrases phrases, HotlineProperties properties) {
        this.phrases = phrases;
        this.gatherUrl = properties.normalizedBaseUrl() + GATHER_PATH;
    }

    @Override
    public String name() {
        return "twilio";
    }

    @Override
    public MediaType contentType() {
        return MediaType.APPLICATION_XML;
    }

    @Override
    public CallerInfo decodeCaller(Map<String, String> params) {
        if (params == null) {
            return new CallerInfo(null, null);
        }
        return new CallerInfo(params.get(CALL_SID), params.get(FROM));
    }

    @Override
    public Utterance decodeInbound(Map<String, String> params) {
        String callSid = params != null ? params.get(CALL_SID) : null;
        if (params == null || !params.containsKey(SPEECH_RESULT)) {
            throw new ValidationException("Missing " + SPEECH_RESULT, callSid);
        }
        return new Utterance(params.get(SPEECH_RESULT), callSid);
    }

    @Override
    public String encodeGreeting(TurnOutcome greeting) {
        return render(speak(new VoiceResponse.Builder(), greeting)
                .gather(gather(new Say.Builder(phrases.listening()).build()))
                .say(new Say.Builder(phrases.noSpeechGoodbye()).build())
                .hangup(new Hangup.Builder().build())
                .build());
    }

    @Override
    public String encodeTurnOutcome(TurnOutcome outcome) {
        VoiceResponse.Builder builder = speak(new VoiceResponse.Builder(), outcome);
        if (outcome.isShouldTerminate()) {
            return render(builder.hangup(new Hangup.Builder().build()).build());
        }
        String fallback = outcome.getKind() == TurnOutcome.Kind.REPROMPT
                ? phrases.stillNothingGoodbye()
                : phrases.stillThere();
        return render(builder
                .gather(gather(null))
                .say(new Say.Builder(fallback).build())
                .hangup(new Hangup.Builder().build())
                .build());
    }

    private VoiceResponse.Builder speak(VoiceResponse.Builder builder, TurnOutcome outcome) {
        if (outcome.hasAudio()) {
            return builder.play(new Play.Builder(outcome.getAudioRef().get()).build());
        }
        return builder.say(new Say.Builder(outcome.getSpokenText()).voice(Say.Voice.ALICE).build());
    }

    private Gather gather(Say prompt) {
        Gather.Builder builder = new Gather.Builder()
                .inputs(Collections.singletonList(Gather.Input.SPEECH))
                .action(gatherUrl)
                .method(HttpMethod.POST)
                .speechTimeout("auto")
                .language(Gather.Language.EN_US);
        if (prompt != null) {
            builder.say(prompt);
        }
        return builder.build();
    }

    private static String render(VoiceResponse response) {
        try {
            return response.toXml();
        } catch (TwiMLException e) {
            throw new IllegalStateException("Failed to render TwiML", e);
        }
    }
}
