package com.example.captionbot_backend.service.metadata;

/**
 * Title and channel of a video; either may be null when no source knew it.
 */
public record MetadataResult(String videoId, String title, String channel) {

    public MetadataResult {
        title = blankToNull(title);
        channel = blankToNull(channel);
    }

    public static MetadataResult empty(String videoId) {
        return new MetadataResult(videoId, null, null);
    }

    public MetadataResult merge(MetadataResult other) {
        if (other == null) {
            return this;
        }
        return new MetadataResult(
                videoId != null ? videoId : other.videoId(),
                firstNonNull(title, other.title()),
                firstNonNull(channel, other.channel())
        );
    }

    public boolean hasAnyData() {
        return title != null || channel != null;
    }

    public boolean isComplete() {
        return title != null && channel != null;
    }

    private static <T> T firstNonNull(T a, T b) {
        return a != null ? a : b;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
