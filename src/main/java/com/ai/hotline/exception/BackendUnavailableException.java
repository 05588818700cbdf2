package com.ai.hotline.exception;

/**
 * A synthesis, recognition or respond call failed: timeout, connection error,
 * non-2xx status or a body that cannot be used.
 */
public class BackendUnavailableException extends HotlineException {

    private final String backend;

    public BackendUnavailableException(String backend, String message) {
        super(backend + ": " + message);
        this.backend = backend;
    }

    public BackendUnavailableException(String backend, String message, Throwable cause) {
        super(backend + ": " + message, cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
