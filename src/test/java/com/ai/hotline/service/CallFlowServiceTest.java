package com.ai.hotline.service;

import com.ai.hotline.component.ResponsePhrases;
import com.ai.hotline.config.HotlineProperties;
import com.ai.hotline.dto.TurnOutcome;
import com.ai.hotline.dto.Utterance;
import com.ai.hotline.provider.JambonzProviderAdapter;
import com.ai.hotline.provider.TwimlProviderAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CallFlowServiceTest {

    @Mock
    private DialogueTurnEngine engine;

    private final ResponsePhrases phrases = new ResponsePhrases();
    private TwimlProviderAdapter twilio;
    private JambonzProviderAdapter jambonz;
    private CallFlowService service;

    @BeforeEach
    void setUp() {
        HotlineProperties properties = new HotlineProperties();
        properties.setBaseUrl("http://hotline.test");
        twilio = new TwimlProviderAdapter(phrases, properties);
        jambonz = new JambonzProviderAdapter(phrases, properties);
        service = new CallFlowService(engine, phrases);
    }

    @Test
    void missingSpeechFieldIsTreatedAsSilence() {
        when(engine.processTurn(any())).thenReturn(TurnOutcome.of(TurnOutcome.Kind.REPROMPT, phrases.couldYouRepeat()));
        Map<String, String> params = new HashMap<>();
        params.put("CallSid", "CA42");

        String twiml = service.handleSpeech(twilio, params);

        ArgumentCaptor<Utterance> captor = ArgumentCaptor.forClass(Utterance.class);
        verify(engine).processTurn(captor.capture());
        assertThat(captor.getValue().isEmpty()).isTrue();
        assertThat(captor.getValue().getCallId()).isEqualTo("CA42");
        assertThat(twiml).contains("<Gather");
    }

    @Test
    void unreadableJambonzBodyStillGetsVerbs() {
        when(engine.processTurn(any())).thenReturn(TurnOutcome.of(TurnOutcome.Kind.REPROMPT, phrases.couldYouRepeat()));

        String verbs = service.handleSpeech(jambonz, "{not json");

        assertThat(verbs).startsWith("[").contains("\"verb\":\"gather\"").endsWith("{\"verb\":\"hangup\"}]");
    }

    @Test
    void unexpectedTurnFailureApologisesAndListensAgain() {
        when(engine.processTurn(any())).thenThrow(new IllegalStateException("boom"));
        Map<String, String> params = new HashMap<>();
        params.put("CallSid", "CA42");
        params.put("SpeechResult", "hello");

        String twiml = service.handleSpeech(twilio, params);

        assertThat(twiml).contains("had trouble understanding").contains("<Gather").contains("<Hangup/>");
    }

    @Test
    void greetingFailureFallsBackToProviderVoice() {
        when(engine.greet(anyString())).thenThrow(new IllegalStateException("boom"));

        String verbs = service.answerCall(jambonz, "{\"call_sid\":\"abc\",\"from\":\"+15550001111\"}");

        assertThat(verbs).contains("\"verb\":\"say\"").contains("How can I help you today?")
                .contains("\"actionHook\":\"http://hotline.test/jambonz-gather\"");
    }

    @Test
    void greetingUsesCallIdFromPayload() {
        when(engine.greet("CA7")).thenReturn(TurnOutcome.of(TurnOutcome.Kind.GREETING, phrases.greeting())
                .withAudioRef("http://hotline.test/audio/x.wav"));
        Map<String, String> params = new HashMap<>();
        params.put("CallSid", "CA7");
        params.put("From", "+15550001111");

        String twiml = service.answerCall(twilio, params);

        assertThat(twiml).contains("<Play>http://hotline.test/audio/x.wav</Play>");
    }
}
