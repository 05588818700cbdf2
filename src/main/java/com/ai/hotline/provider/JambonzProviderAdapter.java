package com.ai.hotline.provider;

import com.ai.hotline.component.ResponsePhrases;
import com.ai.hotline.config.HotlineProperties;
import com.ai.hotline.dto.CallerInfo;
import com.ai.hotline.dto.TurnOutcome;
import com.ai.hotline.dto.Utterance;
import com.ai.hotline.exception.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Jambonz application webhooks: JSON in, JSON verb arrays out.
 */
@Component
public class JambonzProviderAdapter implements ProviderAdapter<String> {

    public static final String CALL_PATH = "/jambonz";
    public static final String GATHER_PATH = "/jambonz-gather";

    private static final String LANGUAGE = "en-US";
    private static final String VOICE = "en-US-Wavenet-D";
    private static final String VENDOR = "google";
    private static final int GATHER_TIMEOUT_SECONDS = 10;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ResponsePhrases phrases;
    private final String actionHook;

    public JambonzProviderAdapter(ResponsePhrases phrases, HotlineProperties properties) {
        this.phrases = phrases;
        this.actionHook = properties.normalizedBaseUrl() + GATHER_PATH;
    }

    @Override
    public String name() {
        return "jambonz";
    }

    @Override
    public MediaType contentType() {
        return MediaType.APPLICATION_JSON;
    }

    @Override
    public CallerInfo decodeCaller(String body) {
        JsonNode root = parse(body);
        return new CallerInfo(root.path("call_sid").asText(null), root.path("from").asText(null));
    }

    @Override
    public Utterance decodeInbound(String body) {
        JsonNode root = parse(body);
        String callSid = root.path("call_sid").asText(null);
        JsonNode speech = root.path("speech");
        if (speech.isMissingNode() || speech.isNull()) {
            // gather ended without recognized speech (timeout or no input)
            return Utterance.silence(callSid);
        }
        String transcript = speech.path("alternatives").path(0).path("transcript").asText("");
        return new Utterance(transcript, callSid);
    }

    @Override
    public String encodeGreeting(TurnOutcome greeting) {
        ArrayNode verbs = mapper.createArrayNode();
        verbs.add(speak(greeting));

        ObjectNode gather = gather();
        gather.put("speechTimeout", "auto");
        ObjectNode recognizer = gather.putObject("recognizer");
        recognizer.put("vendor", VENDOR);
        recognizer.put("language", LANGUAGE);
        verbs.add(gather);

        verbs.add(say(phrases.noSpeechGoodbye(), false));
        verbs.add(hangup());
        return write(verbs);
    }

    @Override
    public String encodeTurnOutcome(TurnOutcome outcome) {
        ArrayNode verbs = mapper.createArrayNode();
        verbs.add(speak(outcome));
        if (!outcome.isShouldTerminate()) {
            verbs.add(gather());
            String fallback = outcome.getKind() == TurnOutcome.Kind.REPROMPT
                    ? phrases.stillNothingGoodbye()
                    : phrases.stillThere();
            verbs.add(say(fallback, false));
        }
        verbs.add(hangup());
        return write(verbs);
    }

    private ObjectNode speak(TurnOutcome outcome) {
        if (outcome.hasAudio()) {
            ObjectNode play = mapper.createObjectNode();
            play.put("verb", "play");
            play.put("url", outcome.getAudioRef().get());
            return play;
        }
        return say(outcome.getSpokenText(), true);
    }

    private ObjectNode say(String text, boolean withSynthesizer) {
        ObjectNode say = mapper.createObjectNode();
        say.put("verb", "say");
        say.put("text", text);
        if (withSynthesizer) {
            ObjectNode synthesizer = say.putObject("synthesizer");
            synthesizer.put("vendor", VENDOR);
            synthesizer.put("language", LANGUAGE);
            synthesizer.put("voice", VOICE);
        }
        return say;
    }

    private ObjectNode gather() {
        ObjectNode gather = mapper.createObjectNode();
        gather.put("verb", "gather");
        gather.putArray("input").add("speech");
        gather.put("actionHook", actionHook);
        gather.put("timeout", GATHER_TIMEOUT_SECONDS);
        return gather;
    }

    private ObjectNode hangup() {
        ObjectNode hangup = mapper.createObjectNode();
        hangup.put("verb", "hangup");
        return hangup;
    }

    private JsonNode parse(String body) {
        if (StringUtils.isBlank(body)) {
            return MissingNode.getInstance();
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Unreadable Jambonz payload", null, e);
        }
    }

    private String write(ArrayNode verbs) {
        try {
            return mapper.writeValueAsString(verbs);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render Jambonz verbs", e);
        }
    }
}
