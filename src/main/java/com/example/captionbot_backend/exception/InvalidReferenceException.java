package com.example.captionbot_backend.exception;

/**
 * The caller passed something that is neither a supported video URL nor a bare video id.
 */
public class InvalidReferenceException extends CaptionbotException {
    private final String reference;

    public InvalidReferenceException(String reference, String reason) {
        super("Invalid video reference '" + reference + "': " + reason);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
