package com.example.captionbot_backend.service.metadata;

import com.example.captionbot_backend.engine.YtDlpClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

@Component
@Order(10)
class NoembedMetadataProvider implements MetadataProvider {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    NoembedMetadataProvider(@Qualifier("metadataWebClient") WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<MetadataResult> resolve(String videoId) {
        String endpoint = "https://noembed.com/embed?url="
                + URLEncoder.encode(YtDlpClient.watchUrl(videoId), StandardCharsets.UTF_8);
        try {
            String payload = webClient.get()
                    .uri(URI.create(endpoint))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(TIMEOUT);
            if (payload == null || payload.isBlank()) {
                return Optional.empty();
            }
            JsonNode node = objectMapper.readTree(payload);
            if (node.hasNonNull("error")) {
                return Optional.empty();
            }
            MetadataResult partial = new MetadataResult(videoId, textOrNull(node, "title"), textOrNull(node, "author_name"));
            return partial.hasAnyData() ? Optional.of(partial) : Optional.empty();
        } catch (WebClientResponseException ex) {
            HttpStatusCode status = ex.getStatusCode();
            if (status.is4xxClientError()) {
                return Optional.empty();
            }
            throw new MetadataAccessException("noembed lookup failed", ex);
        } catch (WebClientRequestException | java.io.IOException ex) {
            throw new MetadataAccessException("noembed lookup failed", ex);
        }
    }

    private String textOrNull(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        var value = node.get(field).asText();
        return value != null && !value.isBlank() ? value : null;
    }
}
