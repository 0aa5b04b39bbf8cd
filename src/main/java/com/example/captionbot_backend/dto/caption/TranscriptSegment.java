package com.example.captionbot_backend.dto.caption;

/**
 * One timed caption line. Times are in seconds and never negative.
 */
public record TranscriptSegment(String text, double start, double duration) {

    public TranscriptSegment {
        text = text == null ? "" : text;
        if (Double.isNaN(start) || start < 0) {
            throw new IllegalArgumentException("start must be >= 0 but was " + start);
        }
        if (Double.isNaN(duration) || duration < 0) {
            throw new IllegalArgumentException("duration must be >= 0 but was " + duration);
        }
    }
}
