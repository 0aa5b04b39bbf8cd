package com.example.captionbot_backend.util;

import com.example.captionbot_backend.dto.caption.TranscriptSegment;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CaptionEntryNormalizerTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void readsObjectsWithSecondsTiming() throws Exception {
        JsonNode payload = json.readTree("""
                [{"text": "Hello &amp; hi", "start": 1.5, "duration": 2.0},
                 {"text": "next", "start": "3.5", "dur": "1"}]
                """);

        List<TranscriptSegment> segments = CaptionEntryNormalizer.normalize(payload);

        assertThat(segments).containsExactly(
                new TranscriptSegment("Hello & hi", 1.5, 2.0),
                new TranscriptSegment("next", 3.5, 1.0));
    }

    @Test
    void readsJson3EventsWithSegsAndMillis() throws Exception {
        JsonNode payload = json.readTree("""
                {"wireMagic": "pb3", "events": [
                  {"tStartMs": 0, "dDurationMs": 1200, "segs": [{"utf8": "one "}, {"utf8": "two"}]},
                  {"tStartMs": 1200, "dDurationMs": 500, "segs": [{"utf8": "\\n"}]},
                  {"tStartMs": 2500, "segs": [{"utf8": "three"}]}
                ]}
                """);

        List<TranscriptSegment> segments = CaptionEntryNormalizer.normalize(payload);

        assertThat(segments).extracting(TranscriptSegment::text).containsExactly("one two", "three");
        assertThat(segments.get(0).duration()).isCloseTo(1.2, within(1e-9));
        assertThat(segments.get(1).start()).isCloseTo(2.5, within(1e-9));
        assertThat(segments.get(1).duration()).isZero();
    }

    @Test
    void readsTimedTextXmlTree() throws Exception {
        JsonNode payload = new XmlMapper().readTree("""
                <transcript>
                  <text start="0.5" dur="1.5">first &amp;#39;quoted&amp;#39;</text>
                  <text start="2.0" dur="1.0">second</text>
                </transcript>
                """);

        List<TranscriptSegment> segments = CaptionEntryNormalizer.normalize(payload);

        assertThat(segments).extracting(TranscriptSegment::text).containsExactly("first 'quoted'", "second");
        assertThat(segments.get(0).start()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void readsFormat3XmlParagraphs() throws Exception {
        JsonNode payload = new XmlMapper().readTree("""
                <timedtext format="3"><body>
                  <p t="1000" d="2000">alpha</p>
                  <p t="3000" d="500">beta</p>
                </body></timedtext>
                """);

        List<TranscriptSegment> segments = CaptionEntryNormalizer.normalize(payload);

        assertThat(segments).containsExactly(
                new TranscriptSegment("alpha", 1.0, 2.0),
                new TranscriptSegment("beta", 3.0, 0.5));
    }

    @Test
    void readsPositionalTuplesAndSingleTuple() throws Exception {
        assertThat(CaptionEntryNormalizer.normalize(json.readTree("[[\"a\", 1, 2], [\"b\", 3, 1]]")))
                .extracting(TranscriptSegment::text).containsExactly("a", "b");
        assertThat(CaptionEntryNormalizer.normalize(json.readTree("[\"solo\", 4, 1]")))
                .containsExactly(new TranscriptSegment("solo", 4.0, 1.0));
    }

    @Test
    void singleObjectIsTreatedAsOneEntry() throws Exception {
        assertThat(CaptionEntryNormalizer.normalize(json.readTree("{\"text\": \"only\", \"start\": 0}")))
                .containsExactly(new TranscriptSegment("only", 0.0, 0.0));
    }

    @Test
    void skipsUnreadableEntriesAndKeepsTheRest() throws Exception {
        JsonNode payload = json.readTree("""
                [{"text": "no timing"},
                 {"text": "bad", "start": "soon"},
                 42,
                 {"text": "   ", "start": 1},
                 {"text": "good", "start": -1, "duration": -3}]
                """);

        List<TranscriptSegment> segments = CaptionEntryNormalizer.normalize(payload);

        assertThat(segments).containsExactly(new TranscriptSegment("good", 0.0, 0.0));
    }

    @Test
    void nullOrMissingPayloadYieldsNothing() {
        assertThat(CaptionEntryNormalizer.normalize(null)).isEmpty();
        assertThat(CaptionEntryNormalizer.normalize(MissingNode.getInstance())).isEmpty();
    }

    @Test
    void cleanStripsTagsAndCollapsesWhitespace() {
        assertThat(CaptionEntryNormalizer.clean("  <i>it&#39;s</i>\n  fine  ")).isEqualTo("it's fine");
    }
}
