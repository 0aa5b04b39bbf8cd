package com.example.captionbot_backend.dto.web;

import java.time.Instant;

/**
 * @param fromCache  true when the stored transcript was returned without fetching
 * @param resolvedBy caption tier that produced a fresh transcript, null for stored ones
 */
public record TranscriptResponse(
        Long id,
        String videoId,
        String title,
        String channel,
        String language,
        Instant extractionDate,
        String text,
        boolean fromCache,
        String resolvedBy,
        String artifactPath
) {
}
