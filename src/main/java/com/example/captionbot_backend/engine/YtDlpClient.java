package com.example.captionbot_backend.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * Runs yt-dlp in JSON dump mode for a single video. Shared by the subtitle fallback and the
 * metadata lookup.
 */
@Component
public class YtDlpClient {
    private static final Logger log = LoggerFactory.getLogger(YtDlpClient.class);
    private static final int LOG_SNIPPET_MAX = 4_000;

    private final String ytdlp;
    private final String ytdlpCookiesFile;
    private final ObjectMapper objectMapper;

    public YtDlpClient(@Value("${downloader.ytdlp.bin:yt-dlp}") String ytdlp,
                       @Value("${YTDLP_COOKIES_FILE:#{null}}") String ytdlpCookiesFile,
                       ObjectMapper objectMapper) {
        this.ytdlp = ytdlp;
        this.ytdlpCookiesFile = ytdlpCookiesFile;
        this.objectMapper = objectMapper;
    }

    /**
     * Dumps the info JSON of one video.
     *
     * @param extraArgs options placed before the URL, after the base dump options
     */
    public JsonNode dumpJson(String videoId, List<String> extraArgs, Duration timeout) throws YtDlpException {
        List<String> cmd = new ArrayList<>(List.of(
                ytdlp,
                "--skip-download",
                "--dump-single-json",
                "--no-warnings",
                "--no-playlist"
        ));
        cmd.addAll(extraArgs);
        maybeAddCookies(cmd);
        String url = watchUrl(videoId);
        cmd.add(url);

        ProcessResult result;
        try {
            result = runProcess(cmd, timeout);
        } catch (IOException e) {
            throw new YtDlpException(YtDlpException.Reason.UNAVAILABLE,
                    "yt-dlp could not be started bin=" + ytdlp + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new YtDlpException(YtDlpException.Reason.FAILED, "Interrupted while running yt-dlp for " + url, e);
        }

        if (result.timedOut()) {
            throw new YtDlpException(YtDlpException.Reason.TIMEOUT,
                    "yt-dlp timeout after " + timeout.toSeconds() + "s for " + url + " log=" + truncateLog(result.output()));
        }
        if (result.code() != 0) {
            String output = result.output();
            if (isAuthWall(output)) {
                throw new YtDlpException(YtDlpException.Reason.AUTH_WALL,
                        "YouTube requires authentication/cookies for " + url + " log=" + truncateLog(output));
            }
            throw new YtDlpException(YtDlpException.Reason.FAILED,
                    "yt-dlp exit=" + result.code() + " for " + url + " log=" + truncateLog(output));
        }

        String json = lastJsonLine(result.output());
        if (json == null) {
            throw new YtDlpException(YtDlpException.Reason.BAD_OUTPUT,
                    "yt-dlp printed no JSON for " + url + " log=" + truncateLog(result.output()));
        }
        try {
            JsonNode info = objectMapper.readTree(json);
            log.debug("yt-dlp info OK videoId={} bytes={}", videoId, json.length());
            return info;
        } catch (IOException e) {
            throw new YtDlpException(YtDlpException.Reason.BAD_OUTPUT, "yt-dlp printed unreadable JSON for " + url, e);
        }
    }

    public static String watchUrl(String videoId) {
        return "https://www.youtube.com/watch?v=" + videoId;
    }

    protected Process startProcess(List<String> cmd) throws IOException {
        return new ProcessBuilder(cmd).redirectErrorStream(true).start();
    }

    protected ProcessResult runProcess(List<String> cmd, Duration timeout) throws IOException, InterruptedException {
        Process p = startProcess(cmd);
        StringJoiner joiner = new StringJoiner(System.lineSeparator());
        Thread reader = new Thread(() -> {
            try (var buffered = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = buffered.readLine()) != null) {
                    joiner.add(line);
                }
            } catch (IOException e) {
                // exit code and timeout decide the outcome; keep what was read
                log.debug("yt-dlp output stream closed early: {}", e.getMessage());
            }
        });
        reader.start();

        boolean finished;
        try {
            finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            p.destroyForcibly();
            throw e;
        }
        if (!finished) {
            p.destroyForcibly();
            p.waitFor(5, TimeUnit.SECONDS);
        }
        reader.join();
        int code = finished ? p.exitValue() : -1;
        return new ProcessResult(code, joiner.toString(), !finished);
    }

    private String lastJsonLine(String output) {
        if (output == null) {
            return null;
        }
        String[] lines = output.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].trim();
            if (line.startsWith("{")) {
                return line;
            }
        }
        return null;
    }

    private String truncateLog(String output) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        if (output.length() <= LOG_SNIPPET_MAX) {
            return output;
        }
        return output.substring(0, LOG_SNIPPET_MAX) + "...";
    }

    private boolean isAuthWall(String output) {
        if (output == null) {
            return false;
        }
        String normalized = output.toLowerCase(Locale.ROOT)
                .replace('\u2019', '\'');
        return normalized.contains("sign in to confirm you're not a bot")
                || normalized.contains("--cookies-from-browser")
                || normalized.contains("use --cookies");
    }

    private void maybeAddCookies(List<String> cmd) {
        if (ytdlpCookiesFile == null || ytdlpCookiesFile.isBlank()) {
            return;
        }
        Path cookiesPath = Path.of(ytdlpCookiesFile).toAbsolutePath();
        if (Files.exists(cookiesPath)) {
            cmd.add("--cookies");
            cmd.add(cookiesPath.toString());
        } else {
            log.warn("yt-dlp cookies file configured but missing path={}", cookiesPath);
        }
    }

    protected record ProcessResult(int code, String output, boolean timedOut) { }
}
