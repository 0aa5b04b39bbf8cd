package com.example.captionbot_backend.dto.web;

import jakarta.validation.constraints.NotBlank;

public record AnalysisRequest(@NotBlank String reference, boolean forceExtract, boolean forceAnalysis) {
}
