package com.example.captionbot_backend.exception;

/**
 * Base type for all captionbot domain errors. Handled centrally by the API exception handler.
 */
public class CaptionbotException extends RuntimeException {

    public CaptionbotException(String message) {
        super(message);
    }

    public CaptionbotException(String message, Throwable cause) {
        super(message, cause);
    }
}
