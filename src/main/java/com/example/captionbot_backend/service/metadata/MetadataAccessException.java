package com.example.captionbot_backend.service.metadata;

public class MetadataAccessException extends RuntimeException {

    public MetadataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
