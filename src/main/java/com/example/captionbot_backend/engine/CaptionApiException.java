package com.example.captionbot_backend.engine;

public class CaptionApiException extends RuntimeException {

    public enum Reason {
        CAPTIONS_DISABLED,
        VIDEO_UNAVAILABLE,
        REQUEST_BLOCKED,
        MALFORMED_RESPONSE,
        REQUEST_FAILED
    }

    private final Reason reason;

    public CaptionApiException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CaptionApiException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
