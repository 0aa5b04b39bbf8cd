package com.example.captionbot_backend.engine;

import com.example.captionbot_backend.config.CaptionProperties;
import com.example.captionbot_backend.dto.caption.CaptionTrack;
import com.example.captionbot_backend.engine.Interfaces.CaptionApiClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Captions API backed by the InnerTube player endpoint (track listing) and the timed text
 * endpoint (track payloads, classic XML format).
 */
@Service
public class YouTubeCaptionApiClient implements CaptionApiClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(YouTubeCaptionApiClient.class);
    private static final String PLAYER_PATH = "/youtubei/v1/player?prettyPrint=false";
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(200);
    private static final int RETRY_MAX_ATTEMPTS = 1;

    private final WebClient client;
    private final CaptionProperties props;
    private final ObjectMapper om;
    private final XmlMapper xml = new XmlMapper();

    public YouTubeCaptionApiClient(@Qualifier("captionApiWebClient") WebClient client,
                                   CaptionProperties props,
                                   ObjectMapper om) {
        this.client = client;
        this.props = props;
        this.om = om;
    }

    @Override
    public List<CaptionTrack> listTracks(String videoId, Duration timeout) {
        JsonNode player = requestPlayer(videoId, timeout);

        JsonNode playability = player.path("playabilityStatus");
        String status = playability.path("status").asText("");
        if (!status.isEmpty() && !"OK".equals(status)) {
            String reason = playability.path("reason").asText(status);
            if (reason.toLowerCase(Locale.ROOT).contains("not a bot")) {
                throw new CaptionApiException(CaptionApiException.Reason.REQUEST_BLOCKED,
                        "Captions API blocked the request for " + videoId + ": " + reason);
            }
            throw new CaptionApiException(CaptionApiException.Reason.VIDEO_UNAVAILABLE,
                    "Video " + videoId + " is unavailable: " + reason);
        }

        JsonNode captionTracks = player.path("captions").path("playerCaptionsTracklistRenderer").path("captionTracks");
        if (!captionTracks.isArray() || captionTracks.isEmpty()) {
            throw new CaptionApiException(CaptionApiException.Reason.CAPTIONS_DISABLED,
                    "Captions are disabled for video " + videoId);
        }

        List<CaptionTrack> tracks = new ArrayList<>();
        for (JsonNode node : captionTracks) {
            String baseUrl = node.path("baseUrl").asText("");
            String code = node.path("languageCode").asText("");
            if (baseUrl.isEmpty() || code.isEmpty()) {
                LOGGER.debug("Ignoring caption track without url or language videoId={} node={}", videoId, node);
                continue;
            }
            tracks.add(new CaptionTrack(
                    code,
                    trackName(node.path("name"), code),
                    "asr".equals(node.path("kind").asText("")),
                    baseUrl.replace("&fmt=srv3", "")
            ));
        }
        LOGGER.debug("Caption tracks listed videoId={} count={}", videoId, tracks.size());
        return tracks;
    }

    @Override
    public JsonNode fetchTrack(CaptionTrack track, Duration timeout) {
        String body;
        try {
            body = client.get()
                    .uri(URI.create(track.baseUrl()))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(b -> new CaptionApiException(CaptionApiException.Reason.REQUEST_FAILED,
                                            "Timed text request failed status=%s lang=%s".formatted(resp.statusCode(), track.languageCode()))))
                    .bodyToMono(String.class)
                    .block(timeout);
        } catch (CaptionApiException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CaptionApiException(CaptionApiException.Reason.REQUEST_FAILED,
                    "Timed text request failed lang=" + track.languageCode() + ": " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new CaptionApiException(CaptionApiException.Reason.MALFORMED_RESPONSE,
                    "Empty caption payload lang=" + track.languageCode());
        }
        try {
            String trimmed = body.trim();
            return trimmed.startsWith("{") || trimmed.startsWith("[") ? om.readTree(trimmed) : xml.readTree(trimmed);
        } catch (IOException e) {
            throw new CaptionApiException(CaptionApiException.Reason.MALFORMED_RESPONSE,
                    "Unreadable caption payload lang=" + track.languageCode(), e);
        }
    }

    private JsonNode requestPlayer(String videoId, Duration timeout) {
        ObjectNode request = om.createObjectNode();
        ObjectNode clientNode = request.putObject("context").putObject("client");
        clientNode.put("clientName", props.getInnertubeClientName());
        clientNode.put("clientVersion", props.getInnertubeClientVersion());
        clientNode.put("hl", "en");
        request.put("videoId", videoId);

        String body;
        try {
            body = client.post()
                    .uri(PLAYER_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request.toString())
                    .retrieve()
                    .bodyToMono(String.class)
                    .retryWhen(Retry.backoff(RETRY_MAX_ATTEMPTS, RETRY_BACKOFF)
                            .filter(t -> t instanceof WebClientRequestException)
                            .doBeforeRetry(signal -> LOGGER.warn("Captions API retry attempt={} videoId={} message={}",
                                    signal.totalRetriesInARow() + 1, videoId,
                                    signal.failure() == null ? "" : signal.failure().getMessage())))
                    .block(timeout);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == 429) {
                throw new CaptionApiException(CaptionApiException.Reason.REQUEST_BLOCKED,
                        "Captions API rate limited video " + videoId, e);
            }
            throw new CaptionApiException(CaptionApiException.Reason.REQUEST_FAILED,
                    "Captions API error status=" + e.getStatusCode().value() + " videoId=" + videoId, e);
        } catch (RuntimeException e) {
            throw new CaptionApiException(CaptionApiException.Reason.REQUEST_FAILED,
                    "Captions API request failed videoId=" + videoId + ": " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new CaptionApiException(CaptionApiException.Reason.MALFORMED_RESPONSE,
                    "Empty player response for " + videoId);
        }
        try {
            return om.readTree(body);
        } catch (IOException e) {
            throw new CaptionApiException(CaptionApiException.Reason.MALFORMED_RESPONSE,
                    "Unreadable player response for " + videoId, e);
        }
    }

    private String trackName(JsonNode name, String fallback) {
        if (name.hasNonNull("simpleText")) {
            return name.get("simpleText").asText();
        }
        JsonNode runs = name.path("runs");
        if (runs.isArray() && !runs.isEmpty()) {
            return runs.get(0).path("text").asText(fallback);
        }
        return fallback;
    }
}
