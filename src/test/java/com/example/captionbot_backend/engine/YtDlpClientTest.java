package com.example.captionbot_backend.engine;

import com.example.captionbot_backend.engine.YtDlpClient.ProcessResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class YtDlpClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    @TempDir
    private Path tempDir;

    @Test
    void dumpJsonBuildsCommandAndReadsLastJsonLine() throws Exception {
        FakeYtDlp client = new FakeYtDlp(null,
                new ProcessResult(0, "[youtube] abc: Downloading webpage\n{\"id\": \"abc\", \"title\": \"Demo\"}\n", false));

        JsonNode info = client.dumpJson("abc", List.of("--write-subs"), TIMEOUT);

        assertEquals("Demo", info.path("title").asText());
        assertThat(client.commands.get(0)).containsExactly(
                "yt-dlp", "--skip-download", "--dump-single-json", "--no-warnings", "--no-playlist",
                "--write-subs", "https://www.youtube.com/watch?v=abc");
    }

    @Test
    void cookiesFileIsPassedWhenPresent() throws Exception {
        Path cookies = Files.writeString(tempDir.resolve("cookies.txt"), "# Netscape HTTP Cookie File");
        FakeYtDlp client = new FakeYtDlp(cookies.toString(), new ProcessResult(0, "{}", false));

        client.dumpJson("abc", List.of(), TIMEOUT);

        List<String> cmd = client.commands.get(0);
        assertThat(cmd).containsSubsequence("--cookies", cookies.toAbsolutePath().toString(), "https://www.youtube.com/watch?v=abc");
    }

    @Test
    void missingCookiesFileIsIgnored() throws Exception {
        FakeYtDlp client = new FakeYtDlp(tempDir.resolve("nope.txt").toString(), new ProcessResult(0, "{}", false));

        client.dumpJson("abc", List.of(), TIMEOUT);

        assertThat(client.commands.get(0)).doesNotContain("--cookies");
    }

    @Test
    void missingBinaryIsUnavailable() {
        FakeYtDlp client = new FakeYtDlp(null, null);

        YtDlpException ex = assertThrows(YtDlpException.class, () -> client.dumpJson("abc", List.of(), TIMEOUT));
        assertEquals(YtDlpException.Reason.UNAVAILABLE, ex.getReason());
    }

    @Test
    void timeoutIsReported() {
        FakeYtDlp client = new FakeYtDlp(null, new ProcessResult(-1, "partial", true));

        YtDlpException ex = assertThrows(YtDlpException.class, () -> client.dumpJson("abc", List.of(), TIMEOUT));
        assertEquals(YtDlpException.Reason.TIMEOUT, ex.getReason());
    }

    @Test
    void botCheckIsReportedAsAuthWall() {
        FakeYtDlp client = new FakeYtDlp(null, new ProcessResult(1,
                "ERROR: [youtube] abc: Sign in to confirm you\u2019re not a bot. Use --cookies-from-browser", false));

        YtDlpException ex = assertThrows(YtDlpException.class, () -> client.dumpJson("abc", List.of(), TIMEOUT));
        assertEquals(YtDlpException.Reason.AUTH_WALL, ex.getReason());
    }

    @Test
    void otherNonZeroExitIsFailed() {
        FakeYtDlp client = new FakeYtDlp(null, new ProcessResult(2, "ERROR: Video unavailable", false));

        YtDlpException ex = assertThrows(YtDlpException.class, () -> client.dumpJson("abc", List.of(), TIMEOUT));
        assertEquals(YtDlpException.Reason.FAILED, ex.getReason());
        assertThat(ex.getMessage()).contains("exit=2").contains("Video unavailable");
    }

    @Test
    void outputWithoutJsonIsBadOutput() {
        FakeYtDlp client = new FakeYtDlp(null, new ProcessResult(0, "nothing useful", false));

        YtDlpException ex = assertThrows(YtDlpException.class, () -> client.dumpJson("abc", List.of(), TIMEOUT));
        assertEquals(YtDlpException.Reason.BAD_OUTPUT, ex.getReason());
    }

    @Test
    void truncatedJsonIsBadOutput() {
        FakeYtDlp client = new FakeYtDlp(null, new ProcessResult(0, "{\"id\": \"abc\"", false));

        YtDlpException ex = assertThrows(YtDlpException.class, () -> client.dumpJson("abc", List.of(), TIMEOUT));
        assertEquals(YtDlpException.Reason.BAD_OUTPUT, ex.getReason());
    }

    /** Records commands; a null result simulates a binary that cannot be started. */
    @Test
    void interruptedWaitKillsTheChildProcess() {
        InterruptedProcess process = new InterruptedProcess();
        YtDlpClient client = new YtDlpClient("yt-dlp", null, new ObjectMapper()) {
            @Override
            protected Process startProcess(List<String> cmd) {
                return process;
            }
        };

        try {
            YtDlpException ex = assertThrows(YtDlpException.class, () -> client.dumpJson("abc", List.of(), TIMEOUT));

            assertEquals(YtDlpException.Reason.FAILED, ex.getReason());
            assertTrue(process.destroyed);
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    /** Child process whose wait is interrupted before it exits. */
    private static final class InterruptedProcess extends Process {
        volatile boolean destroyed;

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            throw new InterruptedException("shutdown");
        }

        @Override
        public Process destroyForcibly() {
            destroyed = true;
            return this;
        }

        @Override
        public OutputStream getOutputStream() {
            return OutputStream.nullOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return InputStream.nullInputStream();
        }

        @Override
        public InputStream getErrorStream() {
            return InputStream.nullInputStream();
        }

        @Override
        public int waitFor() throws InterruptedException {
            throw new InterruptedException("shutdown");
        }

        @Override
        public int exitValue() {
            throw new IllegalThreadStateException("still running");
        }

        @Override
        public void destroy() {
            destroyed = true;
        }
    }

    static class FakeYtDlp extends YtDlpClient {
        final List<List<String>> commands = new ArrayList<>();
        private final ProcessResult result;

        FakeYtDlp(String cookiesFile, ProcessResult result) {
            super("yt-dlp", cookiesFile, new ObjectMapper());
            this.result = result;
        }

        @Override
        protected ProcessResult runProcess(List<String> cmd, Duration timeout) throws IOException {
            commands.add(List.copyOf(cmd));
            if (result == null) {
                throw new IOException("Cannot run program \"yt-dlp\": error=2, No such file or directory");
            }
            return result;
        }
    }
}
