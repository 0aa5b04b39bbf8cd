package com.example.captionbot_backend.service;

import com.example.captionbot_backend.config.StorageProperties;
import com.example.captionbot_backend.dto.caption.TranscriptSegment;
import com.example.captionbot_backend.util.TranscriptFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the human readable {@code [MM:SS] text} rendering of a transcript next to the database row.
 * Failures never propagate: the artifact is a convenience copy.
 */
@Component
public class TranscriptArtifactWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptArtifactWriter.class);

    private final Path transcriptsDir;

    public TranscriptArtifactWriter(StorageProperties props) {
        this.transcriptsDir = Path.of(props.getBaseDir()).resolve(props.getTranscriptsPrefix()).toAbsolutePath().normalize();
    }

    public Path locationFor(String videoId, String title) {
        return transcriptsDir.resolve(TranscriptFormatter.artifactFileName(videoId, title));
    }

    public Path write(String videoId, String title, List<TranscriptSegment> segments) {
        Path target = locationFor(videoId, title);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, TranscriptFormatter.timestamped(segments), StandardCharsets.UTF_8);
            LOGGER.info("Transcript artifact written videoId={} path={}", videoId, target);
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Transcript artifact write failed videoId={} path={}", videoId, target, e);
            writePlaceholder(target, e);
        }
        return target;
    }

    private void writePlaceholder(Path target, Exception failure) {
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, "Error processing transcript: " + failure.getMessage(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.error("Transcript error placeholder write failed path={}", target, e);
        }
    }
}
