package com.example.captionbot_backend.service.metadata;

import com.example.captionbot_backend.engine.YtDlpClient;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.HtmlUtils;

/**
 * Scrapes the watch page: Open Graph title, the channel name from the {@code itemprop="name"} link
 * inside the author block, and the document title as a last resort.
 */
@Component
@Order(200)
class WatchPageMetadataProvider implements MetadataProvider {

    private static final Duration TIMEOUT = Duration.ofSeconds(15);
    private static final Pattern META_PATTERN = Pattern.compile("(?i)<meta\\s+[^>]*>");
    private static final Pattern LINK_PATTERN = Pattern.compile("(?i)<link\\s+[^>]*>");
    private static final Pattern ATTR_PATTERN = Pattern.compile("(?i)([a-z0-9:-]+)\\s*=\\s*['\"]([^'\"]*)['\"]");
    private static final Pattern TITLE_PATTERN = Pattern.compile("(?is)<title[^>]*>(.*?)</title>");
    private static final Pattern OWNER_JSON_PATTERN = Pattern.compile("\"ownerChannelName\"\\s*:\\s*\"([^\"]+)\"");
    private static final String TITLE_SUFFIX = " - YouTube";

    private final WebClient webClient;

    WatchPageMetadataProvider(@Qualifier("metadataWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Optional<MetadataResult> resolve(String videoId) {
        try {
            String body = webClient.get()
                    .uri(YtDlpClient.watchUrl(videoId))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(TIMEOUT);
            if (body == null || body.isBlank()) {
                return Optional.empty();
            }
            MetadataResult partial = parse(videoId, body);
            return partial.hasAnyData() ? Optional.of(partial) : Optional.empty();
        } catch (WebClientResponseException ex) {
            if (ex.getStatusCode().is4xxClientError()) {
                return Optional.empty();
            }
            throw new MetadataAccessException("watch page lookup failed", ex);
        } catch (WebClientRequestException ex) {
            throw new MetadataAccessException("watch page lookup failed", ex);
        }
    }

    MetadataResult parse(String videoId, String body) {
        String title = firstNonBlank(
                findAttr(META_PATTERN, body, "og:title"),
                findAttr(META_PATTERN, body, "twitter:title"),
                extractTitle(body)
        );
        String channel = firstNonBlank(
                findAttr(LINK_PATTERN, body, "name"),
                ownerFromPlayerJson(body)
        );
        return new MetadataResult(videoId, title, channel);
    }

    /**
     * Finds the first tag whose {@code property}, {@code name} or {@code itemprop} equals the key and
     * returns its {@code content}.
     */
    private String findAttr(Pattern tagPattern, String body, String key) {
        Matcher matcher = tagPattern.matcher(body);
        while (matcher.find()) {
            Matcher attrMatcher = ATTR_PATTERN.matcher(matcher.group());
            String property = null;
            String content = null;
            while (attrMatcher.find()) {
                String name = attrMatcher.group(1).toLowerCase(Locale.ROOT);
                String value = attrMatcher.group(2);
                if (("property".equals(name) || "name".equals(name) || "itemprop".equals(name)) && !value.isBlank()) {
                    property = value;
                } else if ("content".equals(name) && !value.isBlank()) {
                    content = value;
                }
            }
            if (property != null && property.equalsIgnoreCase(key) && content != null) {
                return HtmlUtils.htmlUnescape(content);
            }
        }
        return null;
    }

    private String extractTitle(String body) {
        Matcher matcher = TITLE_PATTERN.matcher(body);
        if (!matcher.find()) {
            return null;
        }
        String title = HtmlUtils.htmlUnescape(matcher.group(1).trim());
        if (title.endsWith(TITLE_SUFFIX)) {
            title = title.substring(0, title.length() - TITLE_SUFFIX.length());
        }
        return title.isBlank() || "YouTube".equals(title) ? null : title;
    }

    private String ownerFromPlayerJson(String body) {
        Matcher matcher = OWNER_JSON_PATTERN.matcher(body);
        return matcher.find() ? matcher.group(1) : null;
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
