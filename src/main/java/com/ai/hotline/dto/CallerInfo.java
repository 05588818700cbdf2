package com.ai.hotline.dto;

import lombok.Getter;
import lombok.ToString;

/**
 * Identity fields of an incoming call, used for log correlation only.
 */
@Getter
@ToString
public final class CallerInfo {

    private final String callId;
    private final String from;

    public CallerInfo(String callId, String from) {
        this.callId = callId == null || callId.isBlank() ? Utterance.UNKNOWN_CALL : callId;
        this.from = from == null || from.isBlank() ? "unknown" : from;
    }
}
