package com.example.captionbot_backend.engine;

import com.example.captionbot_backend.config.CaptionProperties;
import com.example.captionbot_backend.dto.caption.FailureKind;
import com.example.captionbot_backend.dto.caption.SubtitleDownload;
import com.example.captionbot_backend.dto.caption.Tier;
import com.example.captionbot_backend.dto.caption.TierResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Last resort tier: asks yt-dlp which subtitle files exist, picks one and downloads its raw text.
 */
@Service
public class SubtitleToolAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleToolAdapter.class);
    private static final String PREFERRED_EXT = "vtt";

    private final YtDlpClient ytDlp;
    private final WebClient webClient;
    private final Duration downloadTimeout;

    public SubtitleToolAdapter(YtDlpClient ytDlp,
                               @Qualifier("subtitleWebClient") WebClient webClient,
                               CaptionProperties props) {
        this.ytDlp = ytDlp;
        this.webClient = webClient;
        this.downloadTimeout = props.getDownloadTimeout();
    }

    /**
     * @param timeout bound for the yt-dlp run; also caps the raw file download, which otherwise uses
     *                {@code captions.download-timeout}
     */
    public TierResult<SubtitleDownload> downloadSubtitles(String videoId, List<String> languages, Duration timeout) {
        JsonNode info;
        try {
            info = ytDlp.dumpJson(videoId, List.of(
                    "--write-subs",
                    "--write-auto-subs",
                    "--sub-langs", String.join(",", languages)
            ), timeout);
        } catch (YtDlpException e) {
            FailureKind kind = e.getReason() == YtDlpException.Reason.UNAVAILABLE
                    ? FailureKind.FALLBACK_TOOL_UNAVAILABLE
                    : FailureKind.FALLBACK_EXTRACTION_FAILED;
            LOGGER.warn("Subtitle tool failed videoId={} kind={} reason={}", videoId, kind, e.getReason());
            return TierResult.failure(Tier.FALLBACK_TOOL, kind, e.getMessage(), e);
        }

        SubtitleChoice choice = choose(info, languages);
        if (choice == null) {
            return TierResult.failure(Tier.FALLBACK_TOOL, FailureKind.NO_CAPTIONS_OFFERED,
                    "yt-dlp lists no subtitles for " + videoId, null);
        }

        Duration fetchTimeout = downloadTimeout(timeout);
        String raw;
        try {
            raw = webClient.get()
                    .uri(URI.create(choice.url()))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(body -> new IllegalStateException("Subtitle download failed status=" + resp.statusCode())))
                    .bodyToMono(String.class)
                    .block(fetchTimeout);
        } catch (RuntimeException e) {
            LOGGER.warn("Subtitle download failed videoId={} lang={} ext={} reason={}",
                    videoId, choice.languageCode(), choice.ext(), e.getMessage());
            return TierResult.failure(Tier.FALLBACK_TOOL, FailureKind.FALLBACK_EXTRACTION_FAILED,
                    "subtitle download failed: " + e.getMessage(), e);
        }
        if (raw == null || raw.isBlank()) {
            return TierResult.failure(Tier.FALLBACK_TOOL, FailureKind.FALLBACK_EXTRACTION_FAILED,
                    "subtitle file for " + choice.languageCode() + " is empty", null);
        }

        LOGGER.info("Subtitle file downloaded videoId={} lang={} ext={} automatic={} chars={}",
                videoId, choice.languageCode(), choice.ext(), choice.automatic(), raw.length());
        return TierResult.success(new SubtitleDownload(choice.languageCode(), choice.ext(), raw, choice.automatic(),
                textOrNull(info, "title"), channelOf(info)));
    }

    Duration downloadTimeout(Duration callerTimeout) {
        if (callerTimeout == null || callerTimeout.isNegative() || callerTimeout.isZero()) {
            return downloadTimeout;
        }
        return callerTimeout.compareTo(downloadTimeout) < 0 ? callerTimeout : downloadTimeout;
    }

    private static String channelOf(JsonNode info) {
        String uploader = textOrNull(info, "uploader");
        return uploader != null ? uploader : textOrNull(info, "channel");
    }

    private static String textOrNull(JsonNode info, String field) {
        String value = info.path(field).asText("");
        return value.isBlank() ? null : value;
    }

    /**
     * Requested language in manual subtitles, then in automatic captions, then any manual track,
     * then any automatic one. Within a track the vtt resource wins, otherwise the first resource.
     */
    SubtitleChoice choose(JsonNode info, List<String> languages) {
        JsonNode manual = info.path("subtitles");
        JsonNode automatic = info.path("automatic_captions");

        for (String lang : languages) {
            SubtitleChoice choice = pickFormat(lang, manual.path(lang), false);
            if (choice != null) return choice;
        }
        for (String lang : languages) {
            SubtitleChoice choice = pickFormat(lang, automatic.path(lang), true);
            if (choice != null) return choice;
        }
        SubtitleChoice any = firstAvailable(manual, false);
        return any != null ? any : firstAvailable(automatic, true);
    }

    private SubtitleChoice firstAvailable(JsonNode tracks, boolean automatic) {
        if (!tracks.isObject()) {
            return null;
        }
        Iterator<Map.Entry<String, JsonNode>> it = tracks.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            SubtitleChoice choice = pickFormat(entry.getKey(), entry.getValue(), automatic);
            if (choice != null) return choice;
        }
        return null;
    }

    private SubtitleChoice pickFormat(String lang, JsonNode formats, boolean automatic) {
        if (!formats.isArray() || formats.isEmpty()) {
            return null;
        }
        JsonNode first = null;
        for (JsonNode format : formats) {
            if (!format.hasNonNull("url")) {
                continue;
            }
            if (PREFERRED_EXT.equalsIgnoreCase(format.path("ext").asText(""))) {
                return new SubtitleChoice(lang, PREFERRED_EXT, format.get("url").asText(), automatic);
            }
            if (first == null) {
                first = format;
            }
        }
        return first == null ? null
                : new SubtitleChoice(lang, first.path("ext").asText("unknown"), first.get("url").asText(), automatic);
    }

    record SubtitleChoice(String languageCode, String ext, String url, boolean automatic) { }
}
