package com.example.captionbot_backend.service;

import com.example.captionbot_backend.config.StorageProperties;
import com.example.captionbot_backend.dto.caption.TranscriptSegment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class TranscriptArtifactWriterTest {

    @TempDir
    private Path tempDir;

    @Test
    void writesTimestampedLinesUnderTranscriptsPrefix() throws Exception {
        TranscriptArtifactWriter writer = new TranscriptArtifactWriter(storage(tempDir.toString()));

        Path written = writer.write("vid", "Demo: Part 1", List.of(
                new TranscriptSegment("intro", 0, 2),
                new TranscriptSegment("main point", 125.5, 3)));

        assertThat(written).isEqualTo(tempDir.resolve("transcripts/transcript_vid_Demo_Part_1.txt"));
        assertThat(Files.readString(written)).isEqualTo("[00:00] intro\n[02:05] main point");
    }

    @Test
    void emptyTranscriptWritesPlaceholder() throws Exception {
        TranscriptArtifactWriter writer = new TranscriptArtifactWriter(storage(tempDir.toString()));

        Path written = writer.write("vid", "Empty", List.of());

        assertThat(Files.readString(written)).isEqualTo("<no transcript available>");
    }

    @Test
    void unwritableLocationDoesNotFail() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        TranscriptArtifactWriter writer = new TranscriptArtifactWriter(storage(blocker.toString()));

        assertThatCode(() -> writer.write("vid", "Title", List.of(new TranscriptSegment("a", 0, 1))))
                .doesNotThrowAnyException();
    }

    private static StorageProperties storage(String baseDir) {
        StorageProperties props = new StorageProperties();
        props.setBaseDir(baseDir);
        return props;
    }
}
