package com.example.captionbot_backend.dto.caption;

/**
 * A caption track as enumerated by the captions API.
 *
 * @param generated true for automatic speech recognition tracks
 * @param baseUrl   location of the timed text payload
 */
public record CaptionTrack(String languageCode, String languageName, boolean generated, String baseUrl) {
}
