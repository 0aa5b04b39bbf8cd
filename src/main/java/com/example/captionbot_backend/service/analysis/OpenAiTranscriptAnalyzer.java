package com.example.captionbot_backend.service.analysis;

import com.example.captionbot_backend.config.AnalysisProperties;
import com.example.captionbot_backend.exception.AnalysisException;
import com.example.captionbot_backend.model.TranscriptRecord;
import com.example.captionbot_backend.model.VerdictAnswer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sends a transcript to the chat completions endpoint in JSON mode and parses the verdict.
 */
@Service
public class OpenAiTranscriptAnalyzer implements TranscriptAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiTranscriptAnalyzer.class);
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(200);
    private static final int RETRY_MAX_ATTEMPTS = 2;

    private final WebClient client;
    private final AnalysisProperties props;
    private final ObjectMapper om;

    public OpenAiTranscriptAnalyzer(@Qualifier("analysisWebClient") WebClient client,
                                    AnalysisProperties props,
                                    ObjectMapper om) {
        this.client = client;
        this.props = props;
        this.om = om;
    }

    @Override
    public VerdictDraft analyze(TranscriptRecord transcript) {
        if (!props.hasApiKey()) {
            throw new AnalysisException("OpenAI API key is not configured (analysis.openai.api-key)");
        }

        ObjectNode request = om.createObjectNode();
        request.put("model", props.getModel());
        request.put("temperature", props.getTemperature());
        request.putObject("response_format").put("type", "json_object");
        ArrayNode messages = request.putArray("messages");
        messages.addObject().put("role", "system").put("content", AnalysisPrompts.SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", AnalysisPrompts.userContent(
                transcript.getTitle(), transcript.getChannel(), transcript.getText(), props.getMaxTranscriptChars()));

        Mono<String> mono = client.post()
                .uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request.toString())
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> resp.statusCode().is5xxServerError() || resp.statusCode().value() == 429
                                        ? new RetryableStatusException("OpenAI analysis error %s: %s".formatted(resp.statusCode(), body))
                                        : new AnalysisException("OpenAI analysis error %s: %s".formatted(resp.statusCode(), body))))
                .bodyToMono(String.class)
                .retryWhen(Retry.backoff(RETRY_MAX_ATTEMPTS, RETRY_BACKOFF)
                        .filter(this::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn(
                                "OpenAI analysis retry attempt={} videoId={} type={} message={}",
                                signal.totalRetriesInARow() + 1,
                                transcript.getVideoId(),
                                signal.failure() == null ? "unknown" : signal.failure().getClass().getSimpleName(),
                                signal.failure() == null ? "" : signal.failure().getMessage())));

        String body;
        try {
            body = mono.block(Duration.ofSeconds(props.getTimeoutSeconds()));
        } catch (AnalysisException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AnalysisException("OpenAI analysis request failed for " + transcript.getVideoId() + ": " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new AnalysisException("Empty response from OpenAI analysis");
        }
        return parse(body, transcript.getVideoId());
    }

    VerdictDraft parse(String body, String videoId) {
        try {
            JsonNode root = om.readTree(body);
            String content = root.path("choices").path(0).path("message").path("content").asText("");
            if (content.isBlank()) {
                throw new AnalysisException("OpenAI analysis returned no content for " + videoId);
            }
            JsonNode verdict = om.readTree(content);
            VerdictAnswer answer = VerdictAnswer.fromLabel(verdict.path("answer").isTextual() ? verdict.get("answer").asText() : null);
            if (!verdict.path("reasoning").isTextual()) {
                throw new AnalysisException("OpenAI analysis reasoning missing for " + videoId);
            }
            List<String> evidence = new ArrayList<>();
            for (JsonNode item : verdict.path("evidence")) {
                evidence.add(item.asText());
            }
            String model = root.hasNonNull("model") ? root.get("model").asText() : props.getModel();
            Integer tokens = root.path("usage").hasNonNull("total_tokens") ? root.path("usage").get("total_tokens").asInt() : null;
            LOGGER.info("OpenAI analysis done videoId={} answer={} evidence={} tokens={}", videoId, answer.label(), evidence.size(), tokens);
            return new VerdictDraft(answer, verdict.get("reasoning").asText(), evidence, model, tokens);
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.error("OpenAI output parse failed videoId={}", videoId, e);
            throw new AnalysisException("Model returned invalid JSON for " + videoId, e);
        }
    }

    private boolean isRetryable(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (cursor instanceof RetryableStatusException
                    || cursor instanceof PrematureCloseException
                    || cursor instanceof WebClientRequestException) {
                return true;
            }
            cursor = cursor.getCause();
        }
        return false;
    }

    private static class RetryableStatusException extends RuntimeException {
        RetryableStatusException(String message) {
            super(message);
        }
    }
}
