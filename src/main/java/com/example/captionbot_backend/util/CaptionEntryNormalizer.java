package com.example.captionbot_backend.util;

import com.example.captionbot_backend.dto.caption.TranscriptSegment;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Converts every caption entry shape the upstream sources produce into {@link TranscriptSegment}s.
 * <p>
 * Accepted shapes: objects with {@code text}/{@code start}/{@code duration} (or {@code dur}),
 * millisecond variants ({@code tStartMs}/{@code dDurationMs}, {@code t}/{@code d}), timed text XML
 * elements read as trees (text content under the empty key), json3 events with {@code segs},
 * positional tuples {@code [text, start, duration]}, and a single object where a list was expected.
 * Entries that cannot be read are logged and skipped.
 */
public final class CaptionEntryNormalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(CaptionEntryNormalizer.class);
    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String[] TEXT_KEYS = {"text", "", "utf8"};
    private static final String[] START_SECONDS_KEYS = {"start"};
    private static final String[] START_MILLIS_KEYS = {"tStartMs", "startMs", "t"};
    private static final String[] DURATION_SECONDS_KEYS = {"duration", "dur"};
    private static final String[] DURATION_MILLIS_KEYS = {"dDurationMs", "durationMs", "d"};

    private CaptionEntryNormalizer() {}

    public static List<TranscriptSegment> normalize(JsonNode payload) {
        List<TranscriptSegment> out = new ArrayList<>();
        if (payload == null || payload.isMissingNode() || payload.isNull()) {
            return out;
        }
        int skipped = 0;
        for (JsonNode entry : entries(payload)) {
            TranscriptSegment segment = toSegment(entry);
            if (segment == null) {
                skipped++;
            } else {
                out.add(segment);
            }
        }
        if (skipped > 0) {
            LOGGER.debug("Caption entries skipped count={} kept={}", skipped, out.size());
        }
        return out;
    }

    /**
     * Unwraps known container shapes down to the list of entries.
     */
    static List<JsonNode> entries(JsonNode payload) {
        List<JsonNode> list = new ArrayList<>();
        if (payload.isArray()) {
            if (isTuple(payload)) {
                list.add(payload);
            } else {
                payload.forEach(list::add);
            }
            return list;
        }
        if (payload.isObject()) {
            for (String container : new String[]{"events", "body", "p"}) {
                JsonNode child = payload.get(container);
                if (child != null && (child.isArray() || child.isObject())) {
                    return entries(child);
                }
            }
            JsonNode text = payload.get("text");
            if (text != null && (text.isArray() || (text.isObject() && !hasTiming(payload)))) {
                return entries(text);
            }
        }
        list.add(payload);
        return list;
    }

    private static TranscriptSegment toSegment(JsonNode entry) {
        try {
            if (entry.isArray()) {
                return fromTuple(entry);
            }
            if (entry.isObject()) {
                return fromObject(entry);
            }
            LOGGER.warn("Skipping caption entry without timing type={}", entry.getNodeType());
            return null;
        } catch (NumberFormatException e) {
            LOGGER.warn("Skipping caption entry with unreadable timing entry={} reason={}", abbreviate(entry), e.getMessage());
            return null;
        }
    }

    private static TranscriptSegment fromTuple(JsonNode tuple) {
        if (tuple.size() < 2) {
            LOGGER.warn("Skipping caption tuple with {} elements", tuple.size());
            return null;
        }
        String text = clean(tuple.get(0).asText(""));
        double start = number(tuple.get(1));
        double duration = tuple.size() > 2 ? number(tuple.get(2)) : 0d;
        return build(text, start, duration, tuple);
    }

    private static TranscriptSegment fromObject(JsonNode node) {
        String text = readText(node);
        OptionalDouble start = seconds(node, START_SECONDS_KEYS, START_MILLIS_KEYS);
        if (start.isEmpty()) {
            LOGGER.warn("Skipping caption entry without start entry={}", abbreviate(node));
            return null;
        }
        double duration = seconds(node, DURATION_SECONDS_KEYS, DURATION_MILLIS_KEYS).orElse(0d);
        return build(text, start.getAsDouble(), duration, node);
    }

    private static TranscriptSegment build(String text, double start, double duration, JsonNode raw) {
        if (Double.isNaN(start) || Double.isInfinite(start) || Double.isNaN(duration) || Double.isInfinite(duration)) {
            LOGGER.warn("Skipping caption entry with non-finite timing entry={}", abbreviate(raw));
            return null;
        }
        if (text.isBlank()) {
            LOGGER.debug("Skipping blank caption entry at start={}", start);
            return null;
        }
        return new TranscriptSegment(text, Math.max(0d, start), Math.max(0d, duration));
    }

    private static String readText(JsonNode node) {
        for (String key : TEXT_KEYS) {
            JsonNode value = node.get(key);
            if (value != null && value.isValueNode()) {
                return clean(value.asText(""));
            }
        }
        JsonNode segs = node.get("segs");
        if (segs != null && segs.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode seg : segs) {
                sb.append(seg.path("utf8").asText(""));
            }
            return clean(sb.toString());
        }
        return "";
    }

    private static OptionalDouble seconds(JsonNode node, String[] secondKeys, String[] millisKeys) {
        for (String key : secondKeys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull()) {
                return OptionalDouble.of(number(value));
            }
        }
        for (String key : millisKeys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull()) {
                return OptionalDouble.of(number(value) / 1000d);
            }
        }
        return OptionalDouble.empty();
    }

    private static double number(JsonNode value) {
        if (value.isNumber()) {
            return value.asDouble();
        }
        return Double.parseDouble(value.asText().trim());
    }

    private static boolean isTuple(JsonNode array) {
        if (array.size() < 2 || !array.get(0).isTextual()) {
            return false;
        }
        JsonNode second = array.get(1);
        return second.isNumber() || (second.isTextual() && isNumeric(second.asText()));
    }

    private static boolean isNumeric(String value) {
        try {
            Double.parseDouble(value.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean hasTiming(JsonNode node) {
        for (String key : START_SECONDS_KEYS) {
            if (node.has(key)) return true;
        }
        for (String key : START_MILLIS_KEYS) {
            if (node.has(key)) return true;
        }
        return false;
    }

    static String clean(String raw) {
        String unescaped = HtmlUtils.htmlUnescape(raw);
        String stripped = TAG_PATTERN.matcher(unescaped).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    private static String abbreviate(JsonNode node) {
        String s = node.toString();
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
