package com.example.captionbot_backend.service.analysis;

import com.example.captionbot_backend.config.AnalysisProperties;
import com.example.captionbot_backend.exception.AnalysisException;
import com.example.captionbot_backend.model.TranscriptRecord;
import com.example.captionbot_backend.model.VerdictAnswer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OpenAiTranscriptAnalyzerTest {

    private static final ObjectMapper OM = new ObjectMapper();
    private static final String COMPLETION = """
            {"model": "gpt-4o-2024-08-06",
             "usage": {"total_tokens": 1234},
             "choices": [{"message": {"role": "assistant",
               "content": "{\\"answer\\": \\"No\\", \\"reasoning\\": \\"Nothing targets a group.\\", \\"evidence\\": [\\"quote one\\", \\"quote two\\"]}"}}]}
            """;

    private final TranscriptRecord transcript = new TranscriptRecord("abc", "A Title", "A Channel",
            "line one\nline two", "en", Instant.parse("2024-01-01T00:00:00Z"));

    @Test
    void sendsJsonModeRequestAndParsesVerdict() throws Exception {
        AtomicReference<String> sent = new AtomicReference<>();
        ExchangeStrategies strategies = ExchangeStrategies.withDefaults();
        ExchangeFunction exchange = request -> {
            MockClientHttpRequest captured = new MockClientHttpRequest(request.method(), request.url());
            request.body().insert(captured, new BodyInserter.Context() {
                @Override
                public List<HttpMessageWriter<?>> messageWriters() {
                    return strategies.messageWriters();
                }

                @Override
                public Optional<ServerHttpRequest> serverRequest() {
                    return Optional.empty();
                }

                @Override
                public Map<String, Object> hints() {
                    return Map.of();
                }
            }).block();
            sent.set(captured.getBodyAsString().block());
            return Mono.just(ok(COMPLETION));
        };

        VerdictDraft draft = analyzer(exchange, props()).analyze(transcript);

        assertThat(draft.answer()).isEqualTo(VerdictAnswer.NO);
        assertThat(draft.reasoning()).isEqualTo("Nothing targets a group.");
        assertThat(draft.evidence()).containsExactly("quote one", "quote two");
        assertThat(draft.model()).isEqualTo("gpt-4o-2024-08-06");
        assertThat(draft.tokensUsed()).isEqualTo(1234);

        JsonNode request = OM.readTree(sent.get());
        assertThat(request.path("model").asText()).isEqualTo("gpt-4o");
        assertThat(request.path("response_format").path("type").asText()).isEqualTo("json_object");
        assertThat(request.path("messages").get(0).path("content").asText()).contains("incitement to genocide");
        assertThat(request.path("messages").get(1).path("content").asText())
                .startsWith("Video: A Title\nChannel: A Channel\n\nTranscript:\nline one");
    }

    @Test
    void retriesServerErrorsThenSucceeds() {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchange = request -> {
            int attempt = attempts.incrementAndGet();
            if (attempt == 1) {
                return Mono.error(PrematureCloseException.TEST_EXCEPTION);
            }
            if (attempt == 2) {
                return Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).body("busy").build());
            }
            return Mono.just(ok(COMPLETION));
        };

        VerdictDraft draft = analyzer(exchange, props()).analyze(transcript);

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(draft.answer()).isEqualTo(VerdictAnswer.NO);
    }

    @Test
    void doesNotRetryClientErrors() {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchange = request -> {
            attempts.incrementAndGet();
            return Mono.just(ClientResponse.create(HttpStatus.BAD_REQUEST)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body("{\"error\":\"bad\"}")
                    .build());
        };

        AnalysisException ex = assertThrows(AnalysisException.class, () -> analyzer(exchange, props()).analyze(transcript));

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(ex.getMessage()).contains("400");
    }

    @Test
    void missingApiKeyFailsBeforeAnyRequest() {
        AtomicInteger attempts = new AtomicInteger();
        AnalysisProperties props = props();
        props.setApiKey(" ");

        assertThrows(AnalysisException.class, () -> analyzer(request -> {
            attempts.incrementAndGet();
            return Mono.just(ok(COMPLETION));
        }, props).analyze(transcript));
        assertThat(attempts.get()).isZero();
    }

    @Test
    void parseRejectsAnswersOutsideTheSchema() {
        OpenAiTranscriptAnalyzer analyzer = analyzer(request -> Mono.empty(), props());
        String maybe = "{\"choices\": [{\"message\": {\"content\": \"{\\\"answer\\\": \\\"Maybe\\\", \\\"reasoning\\\": \\\"x\\\", \\\"evidence\\\": []}\"}}]}";
        String notJson = "{\"choices\": [{\"message\": {\"content\": \"I think no\"}}]}";
        String noReasoning = "{\"choices\": [{\"message\": {\"content\": \"{\\\"answer\\\": \\\"Yes\\\"}\"}}]}";

        assertThrows(AnalysisException.class, () -> analyzer.parse(maybe, "abc"));
        assertThrows(AnalysisException.class, () -> analyzer.parse(notJson, "abc"));
        assertThrows(AnalysisException.class, () -> analyzer.parse(noReasoning, "abc"));
    }

    @Test
    void parseAcceptsLabelCaseAndFallsBackToConfiguredModel() {
        OpenAiTranscriptAnalyzer analyzer = analyzer(request -> Mono.empty(), props());
        String body = "{\"choices\": [{\"message\": {\"content\": \"{\\\"answer\\\": \\\"cannot determine\\\", \\\"reasoning\\\": \\\"too short\\\", \\\"evidence\\\": []}\"}}]}";

        VerdictDraft draft = analyzer.parse(body, "abc");

        assertThat(draft.answer()).isEqualTo(VerdictAnswer.CANNOT_DETERMINE);
        assertThat(draft.model()).isEqualTo("gpt-4o");
        assertThat(draft.tokensUsed()).isNull();
        assertThat(draft.evidence()).isEmpty();
    }

    @Test
    void longTranscriptsAreTruncatedWithMarker() {
        String content = AnalysisPrompts.userContent("T", "C", "abcdefghij", 4);

        assertThat(content).endsWith("Transcript:\nabcd" + AnalysisPrompts.TRUNCATION_MARKER);
    }

    private static AnalysisProperties props() {
        AnalysisProperties props = new AnalysisProperties();
        props.setApiKey("sk-test");
        return props;
    }

    private static OpenAiTranscriptAnalyzer analyzer(ExchangeFunction exchange, AnalysisProperties props) {
        WebClient client = WebClient.builder()
                .baseUrl("https://api.openai.test")
                .exchangeFunction(exchange)
                .build();
        return new OpenAiTranscriptAnalyzer(client, props, OM);
    }

    private static ClientResponse ok(String body) {
        return ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
