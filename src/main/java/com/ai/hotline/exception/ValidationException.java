package com.ai.hotline.exception;

/**
 * An inbound webhook payload is missing or cannot be read.
 */
public class ValidationException extends HotlineException {

    private final String callId;

    public ValidationException(String message, String callId) {
        super(message);
        this.callId = callId;
    }

    public ValidationException(String message, String callId, Throwable cause) {
        super(message, cause);
        this.callId = callId;
    }

    public String getCallId() {
        return callId;
    }
}
