package com.example.captionbot_backend.dto.web;

import java.time.Instant;

/**
 * Error body of every failed API call.
 *
 * @param code    stable machine readable code
 * @param details per-tier causes for acquisition failures, otherwise null
 */
public record ApiError(String code, String message, Object details, Instant timestamp) {
}
