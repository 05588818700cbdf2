package com.ai.hotline.provider;

import com.ai.hotline.component.ResponsePhrases;
import com.ai.hotline.config.HotlineProperties;
import com.ai.hotline.dto.CallerInfo;
import com.ai.hotline.dto.TurnOutcome;
import com.ai.hotline.dto.Utterance;
import com.ai.hotline.exception.ValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JambonzProviderAdapterTest {

    private static final String AUDIO_URL = "http://hotline.test/audio/0f8fad5b-d9cb-469f-a165-70867728950e.wav";

    private final ObjectMapper mapper = new ObjectMapper();
    private JambonzProviderAdapter adapter;

    @BeforeEach
    void setUp() {
        HotlineProperties properties = new HotlineProperties();
        properties.setBaseUrl("http://hotline.test");
        adapter = new JambonzProviderAdapter(new ResponsePhrases(), properties);
    }

    @Test
    void decodesFirstTranscript() {
        Utterance utterance = adapter.decodeInbound(
                "{\"call_sid\":\"jb-1\",\"speech\":{\"alternatives\":[{\"transcript\":\"opening hours\"},"
                        + "{\"transcript\":\"opening ours\"}]}}");

        assertThat(utterance.getText()).isEqualTo("opening hours");
        assertThat(utterance.getCallId()).isEqualTo("jb-1");
    }

    @Test
    void gatherWithoutSpeechIsSilence() {
        Utterance utterance = adapter.decodeInbound("{\"call_sid\":\"jb-1\",\"reason\":\"timeout\"}");

        assertThat(utterance.isEmpty()).isTrue();
        assertThat(utterance.getCallId()).isEqualTo("jb-1");
    }

    @Test
    void blankBodyIsSilence() {
        assertThat(adapter.decodeInbound("").isEmpty()).isTrue();
    }

    @Test
    void malformedJsonIsValidationError() {
        assertThatThrownBy(() -> adapter.decodeInbound("{not json"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void decodesCaller() {
        CallerInfo caller = adapter.decodeCaller("{\"call_sid\":\"jb-7\",\"from\":\"+15550100\"}");

        assertThat(caller.getCallId()).isEqualTo("jb-7");
        assertThat(caller.getFrom()).isEqualTo("+15550100");
    }

    @Test
    void greetingPlaysThenGathersWithRecognizer() throws Exception {
        TurnOutcome greeting = TurnOutcome.of(TurnOutcome.Kind.GREETING, "Hello there").withAudioRef(AUDIO_URL);

        JsonNode verbs = mapper.readTree(adapter.encodeGreeting(greeting));

        assertThat(verbs).hasSize(4);
        assertThat(verbs.get(0).path("verb").asText()).isEqualTo("play");
        assertThat(verbs.get(0).path("url").asText()).isEqualTo(AUDIO_URL);
        JsonNode gather = verbs.get(1);
        assertThat(gather.path("verb").asText()).isEqualTo("gather");
        assertThat(gather.path("input").get(0).asText()).isEqualTo("speech");
        assertThat(gather.path("actionHook").asText()).isEqualTo("http://hotline.test/jambonz-gather");
        assertThat(gather.path("timeout").asInt()).isEqualTo(10);
        assertThat(gather.path("speechTimeout").asText()).isEqualTo("auto");
        assertThat(gather.path("recognizer").path("vendor").asText()).isEqualTo("google");
        assertThat(gather.path("recognizer").path("language").asText()).isEqualTo("en-US");
        assertThat(verbs.get(2).path("text").asText()).isEqualTo("I didn't hear anything. Goodbye!");
        assertThat(verbs.get(3).path("verb").asText()).isEqualTo("hangup");
    }

    @Test
    void sayCarriesSynthesizerWhenNoAudio() throws Exception {
        JsonNode verbs = mapper.readTree(
                adapter.encodeTurnOutcome(TurnOutcome.of(TurnOutcome.Kind.REPLY, "It opens at nine")));

        JsonNode say = verbs.get(0);
        assertThat(say.path("verb").asText()).isEqualTo("say");
        assertThat(say.path("text").asText()).isEqualTo("It opens at nine");
        assertThat(say.path("synthesizer").path("voice").asText()).isEqualTo("en-US-Wavenet-D");
        assertThat(verbs.get(1).path("verb").asText()).isEqualTo("gather");
        assertThat(verbs.get(2).path("text").asText()).isEqualTo("Are you still there?");
        assertThat(verbs.get(3).path("verb").asText()).isEqualTo("hangup");
    }

    @Test
    void farewellEndsWithHangupAndNoGather() throws Exception {
        JsonNode verbs = mapper.readTree(
                adapter.encodeTurnOutcome(TurnOutcome.of(TurnOutcome.Kind.FAREWELL, "Goodbye now")));

        assertThat(verbs).hasSize(2);
        assertThat(verbs.get(0).path("verb").asText()).isEqualTo("say");
        assertThat(verbs.get(1).path("verb").asText()).isEqualTo("hangup");
    }

    @Test
    void repromptFallbackSaysGoodbye() throws Exception {
        JsonNode verbs = mapper.readTree(
                adapter.encodeTurnOutcome(TurnOutcome.of(TurnOutcome.Kind.REPROMPT, "Say again please")));

        assertThat(verbs.get(2).path("text").asText()).isEqualTo("Still nothing. Goodbye!");
    }
}
