package com.example.captionbot_backend.exception;

public class TranscriptNotFoundException extends CaptionbotException {
    private final String videoId;

    public TranscriptNotFoundException(String videoId, String what) {
        super("No " + what + " stored for video " + videoId);
        this.videoId = videoId;
    }

    public String getVideoId() {
        return videoId;
    }
}
