package com.example.captionbot_backend.util;

import com.example.captionbot_backend.dto.caption.TranscriptSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for cue based subtitle text (WebVTT, and SRT which shares the block layout).
 * Blocks are separated by blank lines; an optional cue identifier line may precede the timing line.
 */
public final class CueTextParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(CueTextParser.class);

    private static final String STAMP = "((?:\\d{1,9}:)?\\d{1,2}:\\d{2}[.,]\\d{1,3})";
    private static final Pattern TIMING = Pattern.compile("^\\s*" + STAMP + "\\s*-->\\s*" + STAMP + "(?:\\s+.*)?$");
    private static final Pattern BLOCK_SEPARATOR = Pattern.compile("\\n[ \\t]*\\n");
    private static final String[] HEADER_BLOCKS = {"WEBVTT", "NOTE", "STYLE", "REGION"};

    private CueTextParser() {}

    public static List<TranscriptSegment> parseCues(String rawText) {
        List<TranscriptSegment> out = new ArrayList<>();
        if (rawText == null || rawText.isBlank()) {
            return out;
        }
        String normalized = rawText.replace("\uFEFF", "").replace("\r\n", "\n").replace('\r', '\n');

        for (String block : BLOCK_SEPARATOR.split(normalized)) {
            List<String> lines = nonEmptyLines(block);
            if (lines.isEmpty() || isHeaderBlock(lines.get(0))) {
                continue;
            }

            int timingIdx = -1;
            Matcher timing = TIMING.matcher(lines.get(0));
            if (timing.matches()) {
                timingIdx = 0;
            } else if (lines.size() > 1) {
                timing = TIMING.matcher(lines.get(1));
                if (timing.matches()) {
                    timingIdx = 1;
                }
            }
            if (timingIdx < 0) {
                LOGGER.debug("Skipping cue block without timing line block='{}'", abbreviate(block));
                continue;
            }

            double start;
            double end;
            try {
                start = toSeconds(timing.group(1));
                end = toSeconds(timing.group(2));
            } catch (NumberFormatException e) {
                LOGGER.debug("Skipping cue block with unreadable timing block='{}' reason={}", abbreviate(block), e.getMessage());
                continue;
            }
            List<String> textLines = new ArrayList<>();
            for (String line : lines.subList(timingIdx + 1, lines.size())) {
                String cleaned = CaptionEntryNormalizer.clean(line);
                if (!cleaned.isEmpty()) {
                    textLines.add(cleaned);
                }
            }
            if (textLines.isEmpty()) {
                LOGGER.debug("Skipping cue without text at start={}", start);
                continue;
            }
            out.add(new TranscriptSegment(String.join(" ", textLines), start, Math.max(0d, end - start)));
        }
        return out;
    }

    /**
     * {@code HH:MM:SS.mmm} or {@code MM:SS.mmm}, comma accepted as decimal separator.
     */
    static double toSeconds(String stamp) {
        String[] parts = stamp.replace(',', '.').split(":");
        double seconds = Double.parseDouble(parts[parts.length - 1]);
        long minutes = Long.parseLong(parts[parts.length - 2]);
        long hours = parts.length > 2 ? Long.parseLong(parts[parts.length - 3]) : 0L;
        return hours * 3600d + minutes * 60d + seconds;
    }

    private static boolean isHeaderBlock(String firstLine) {
        String upper = firstLine.trim().toUpperCase(Locale.ROOT);
        for (String header : HEADER_BLOCKS) {
            if (upper.equals(header) || upper.startsWith(header + " ") || upper.startsWith(header + "\t")) {
                return true;
            }
        }
        return false;
    }

    private static List<String> nonEmptyLines(String block) {
        List<String> lines = new ArrayList<>();
        for (String line : block.split("\n")) {
            if (!line.isBlank()) {
                lines.add(line.strip());
            }
        }
        return lines;
    }

    private static String abbreviate(String block) {
        String flat = block.replace('\n', ' ').trim();
        return flat.length() <= 80 ? flat : flat.substring(0, 80) + "...";
    }
}
