package com.example.captionbot_backend.dto.web;

import java.time.Instant;
import java.util.List;

public record VerdictResponse(
        String videoId,
        String title,
        String channel,
        Long transcriptId,
        Long verdictId,
        String answer,
        String reasoning,
        List<String> evidence,
        String model,
        Integer tokensUsed,
        Instant analysisDate,
        boolean cached
) {
}
