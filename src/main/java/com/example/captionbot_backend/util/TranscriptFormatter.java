package com.example.captionbot_backend.util;

import com.example.captionbot_backend.dto.caption.TranscriptSegment;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class TranscriptFormatter {
    public static final String EMPTY_PLACEHOLDER = "<no transcript available>";
    private static final Pattern UNSAFE_TITLE_CHARS = Pattern.compile("(?U)[^\\w\\s-]");
    private static final int MAX_TITLE_LENGTH = 60;

    private TranscriptFormatter() {}

    /** Segment text joined by newlines, as stored in the transcripts table. */
    public static String plainText(List<TranscriptSegment> segments) {
        return segments.stream().map(TranscriptSegment::text).collect(Collectors.joining("\n"));
    }

    /** One {@code [MM:SS] text} line per segment; minutes are not wrapped at the hour. */
    public static String timestamped(List<TranscriptSegment> segments) {
        if (segments == null || segments.isEmpty()) {
            return EMPTY_PLACEHOLDER;
        }
        return segments.stream()
                .map(s -> "[" + stamp(s.start()) + "] " + s.text())
                .collect(Collectors.joining("\n"));
    }

    public static String stamp(double seconds) {
        long whole = (long) Math.floor(Math.max(0d, seconds));
        return String.format("%02d:%02d", whole / 60, whole % 60);
    }

    public static String artifactFileName(String videoId, String title) {
        String safeId = videoId.replace('/', '_').replace('\\', '_');
        String safeTitle = UNSAFE_TITLE_CHARS.matcher(title == null ? "" : title).replaceAll("").replace(' ', '_');
        if (safeTitle.length() > MAX_TITLE_LENGTH) {
            safeTitle = safeTitle.substring(0, MAX_TITLE_LENGTH);
        }
        return "transcript_" + safeId + "_" + safeTitle + ".txt";
    }
}
