package com.example.captionbot_backend.dto.web;

import jakarta.validation.constraints.NotBlank;

public record TranscriptAcquireRequest(@NotBlank String reference, boolean overwrite) {
}
