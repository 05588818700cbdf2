package com.ai.hotline.component;

import org.springframework.stereotype.Component;

/**
 * Fixed phrases spoken on the hotline. Everything else the caller hears comes from the responder.
 */
@Component
public class ResponsePhrases {

    public String greeting() {
        return "Hello! I'm your AI assistant. How can I help you today?";
    }

    public String listening() {
        return "I'm listening.";
    }

    public String couldYouRepeat() {
        return "I didn't catch that. Could you repeat?";
    }

    public String farewell() {
        return "Thank you for calling! Have a great day. Goodbye!";
    }

    public String apology() {
        return "I'm sorry, I had trouble understanding. Could you repeat that?";
    }

    /** Spoken by the provider when the caller never answers the greeting. */
    public String noSpeechGoodbye() {
        return "I didn't hear anything. Goodbye!";
    }

    /** Spoken by the provider when a re-prompt also goes unanswered. */
    public String stillNothingGoodbye() {
        return "Still nothing. Goodbye!";
    }

    public String stillThere() {
        return "Are you still there?";
    }
}
