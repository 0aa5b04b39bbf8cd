package com.example.captionbot_backend.exception;

/**
 * The analysis collaborator failed or answered with something that could not be parsed.
 */
public class AnalysisException extends CaptionbotException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
