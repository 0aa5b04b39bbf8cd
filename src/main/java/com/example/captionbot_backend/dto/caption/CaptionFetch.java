package com.example.captionbot_backend.dto.caption;

import java.util.List;

public record CaptionFetch(List<TranscriptSegment> segments, String languageCode) {

    public CaptionFetch {
        segments = List.copyOf(segments);
    }
}
