package com.example.captionbot_backend.service.metadata;

import com.example.captionbot_backend.config.CaptionProperties;
import com.example.captionbot_backend.engine.YtDlpClient;
import com.example.captionbot_backend.engine.YtDlpException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@Component
@Order(300)
class YtDlpMetadataProvider implements MetadataProvider {

    private final YtDlpClient ytDlp;
    private final Duration timeout;

    YtDlpMetadataProvider(YtDlpClient ytDlp, CaptionProperties props) {
        this.ytDlp = ytDlp;
        this.timeout = props.getToolTimeout();
    }

    @Override
    public Optional<MetadataResult> resolve(String videoId) {
        try {
            JsonNode info = ytDlp.dumpJson(videoId, List.of(), timeout);
            String title = textOrNull(info, "title");
            String channel = textOrNull(info, "uploader");
            if (channel == null) {
                channel = textOrNull(info, "channel");
            }
            MetadataResult partial = new MetadataResult(videoId, title, channel);
            return partial.hasAnyData() ? Optional.of(partial) : Optional.empty();
        } catch (YtDlpException ex) {
            throw new MetadataAccessException("yt-dlp metadata lookup failed (" + ex.getReason() + ")", ex);
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
