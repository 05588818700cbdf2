package com.ai.hotline.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One prior exchange line handed to a responder as optional history.
 */
@Getter
@AllArgsConstructor
public class ChatMessage {

    private final String role;
    private final String content;
}
