package com.ai.hotline.service;

import com.ai.hotline.dto.ChatMessage;

import java.util.Collections;
import java.util.List;

/**
 * Produces the assistant's reply to one caller message. Exactly one implementation
 * is active per process, chosen at startup.
 */
public interface ResponderClient {

    /**
     * @param history earlier exchanges, oldest first; may be empty
     * @throws com.ai.hotline.exception.BackendUnavailableException when no usable reply was obtained
     */
    String respond(String message, List<ChatMessage> history);

    default String respond(String message) {
        return respond(message, Collections.emptyList());
    }

    /** Short backend name used in logs. */
    String name();
}
