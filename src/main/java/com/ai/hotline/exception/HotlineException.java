package com.ai.hotline.exception;

/**
 * Base type for hotline application errors. Unchecked so that webhook handlers
 * decide where each failure turns into a fallback document.
 */
public class HotlineException extends RuntimeException {

    public HotlineException(String message) {
        super(message);
    }

    public HotlineException(String message, Throwable cause) {
        super(message, cause);
    }
}
