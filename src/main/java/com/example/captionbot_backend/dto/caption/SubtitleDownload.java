package com.example.captionbot_backend.dto.caption;

/**
 * Raw subtitle file obtained through the subtitle tool.
 *
 * @param ext     format of {@code rawText}, e.g. {@code vtt}
 * @param rawText undecoded cue text
 * @param title   video title from the same info dump, null when yt-dlp did not report one
 * @param channel uploader or channel name from the same info dump, may be null
 */
public record SubtitleDownload(String languageCode, String ext, String rawText, boolean automatic,
                               String title, String channel) {

    public SubtitleDownload(String languageCode, String ext, String rawText, boolean automatic) {
        this(languageCode, ext, rawText, automatic, null, null);
    }
}
