package com.example.captionbot_backend.exception;

public class StorageException extends CaptionbotException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
