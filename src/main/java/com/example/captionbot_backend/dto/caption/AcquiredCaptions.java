package com.example.captionbot_backend.dto.caption;

import java.util.List;

/**
 * Normalized result of a successful acquisition, tagged with the tier that produced it.
 * Title and channel are only known when the tier saw them; otherwise the store looks them up.
 */
public record AcquiredCaptions(String videoId, List<TranscriptSegment> segments, String languageCode, Tier resolvedBy,
                               String title, String channel) {

    public AcquiredCaptions {
        segments = List.copyOf(segments);
    }

    public AcquiredCaptions(String videoId, List<TranscriptSegment> segments, String languageCode, Tier resolvedBy) {
        this(videoId, segments, languageCode, resolvedBy, null, null);
    }
}
