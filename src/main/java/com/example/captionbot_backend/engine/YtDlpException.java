package com.example.captionbot_backend.engine;

public class YtDlpException extends Exception {

    public enum Reason {
        /** Binary missing or not executable. */
        UNAVAILABLE,
        TIMEOUT,
        AUTH_WALL,
        FAILED,
        BAD_OUTPUT
    }

    private final Reason reason;

    public YtDlpException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public YtDlpException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
