package com.example.captionbot_backend.dto.web;

import java.time.Instant;

public record TranscriptSummary(Long id, String videoId, String title, String channel, String language, Instant extractionDate) {
}
