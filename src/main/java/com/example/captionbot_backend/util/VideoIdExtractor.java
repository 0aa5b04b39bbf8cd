package com.example.captionbot_backend.util;

import com.example.captionbot_backend.exception.InvalidReferenceException;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a watch/embed/short URL or a bare token into a canonical video id. Never returns an empty id.
 */
public final class VideoIdExtractor {
    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");
    private static final Set<String> LONG_HOSTS = Set.of("youtube.com", "www.youtube.com", "m.youtube.com");
    private static final String SHORT_HOST = "youtu.be";

    private VideoIdExtractor() {}

    public static String extract(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new InvalidReferenceException(String.valueOf(reference), "reference is empty");
        }
        String trimmed = reference.trim();
        if (!looksLikeUrl(trimmed)) {
            return requireValidId(trimmed, trimmed);
        }

        URI uri = parse(trimmed);
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();

        if (SHORT_HOST.equals(host)) {
            return requireValidId(trimmed, firstSegment(path.length() > 1 ? path.substring(1) : ""));
        }
        if (LONG_HOSTS.contains(host)) {
            if ("/watch".equals(path) || "/watch/".equals(path)) {
                return requireValidId(trimmed, queryParam(uri.getRawQuery(), "v"));
            }
            if (path.startsWith("/embed/")) {
                return requireValidId(trimmed, firstSegment(path.substring("/embed/".length())));
            }
            if (path.startsWith("/v/")) {
                return requireValidId(trimmed, firstSegment(path.substring("/v/".length())));
            }
            throw new InvalidReferenceException(trimmed, "unsupported path " + path);
        }
        throw new InvalidReferenceException(trimmed, "unsupported host " + (host.isEmpty() ? "<none>" : host));
    }

    private static boolean looksLikeUrl(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.contains("://")) {
            return true;
        }
        return lower.contains("/") || lower.startsWith(SHORT_HOST) || LONG_HOSTS.stream().anyMatch(lower::startsWith);
    }

    private static URI parse(String value) {
        String withScheme = value.contains("://") ? value : "https://" + value;
        try {
            URI uri = new URI(withScheme);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new InvalidReferenceException(value, "unsupported scheme " + scheme);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new InvalidReferenceException(value, "malformed URL");
        }
    }

    private static String firstSegment(String path) {
        int slash = path.indexOf('/');
        return slash >= 0 ? path.substring(0, slash) : path;
    }

    private static String queryParam(String rawQuery, String name) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return null;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            if (name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
                return eq >= 0 ? URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8) : "";
            }
        }
        return null;
    }

    private static String requireValidId(String reference, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            throw new InvalidReferenceException(reference, "no video id found");
        }
        if (!ID_PATTERN.matcher(candidate).matches()) {
            throw new InvalidReferenceException(reference, "video id contains unsupported characters");
        }
        return candidate;
    }
}
