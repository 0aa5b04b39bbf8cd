package com.example.captionbot_backend.service.analysis;

import com.example.captionbot_backend.exception.AnalysisException;
import com.example.captionbot_backend.exception.StorageException;
import com.example.captionbot_backend.model.AnalysisVerdict;
import com.example.captionbot_backend.model.TranscriptRecord;
import com.example.captionbot_backend.repository.AnalysisVerdictRepository;
import com.example.captionbot_backend.service.TranscriptAcquisitionService;
import com.example.captionbot_backend.service.TranscriptStore;
import com.example.captionbot_backend.util.VideoIdExtractor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Acquires a transcript and returns its verdict, reusing the cached one unless a new analysis is forced.
 * The cache key is the current transcript row of a video: its most recent verdict wins.
 */
@Service
public class AnalysisService {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisService.class);
    private static final TypeReference<List<String>> EVIDENCE_TYPE = new TypeReference<>() {};

    private final TranscriptAcquisitionService acquisition;
    private final TranscriptStore store;
    private final AnalysisVerdictRepository verdicts;
    private final TranscriptAnalyzer analyzer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AnalysisService(TranscriptAcquisitionService acquisition,
                           TranscriptStore store,
                           AnalysisVerdictRepository verdicts,
                           TranscriptAnalyzer analyzer,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this.acquisition = acquisition;
        this.store = store;
        this.verdicts = verdicts;
        this.analyzer = analyzer;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Optional<AnalysisOutcome> latestVerdictForVideo(String reference) {
        String videoId = VideoIdExtractor.extract(reference);
        return store.latestByVideoId(videoId)
                .flatMap(transcript -> findLatest(transcript)
                        .map(verdict -> new AnalysisOutcome(transcript, verdict, true)));
    }

    /**
     * @param forceExtract  re-fetch captions and replace the stored transcript (drops its verdicts)
     * @param forceAnalysis run the analyzer even when a verdict is cached
     */
    public AnalysisOutcome analyze(String reference, boolean forceExtract, boolean forceAnalysis) {
        TranscriptRecord transcript = acquisition.acquireTranscript(reference, forceExtract);

        if (!forceAnalysis) {
            Optional<AnalysisVerdict> cached = findLatest(transcript);
            if (cached.isPresent()) {
                LOGGER.info("Using cached verdict videoId={} transcriptId={} verdictId={}",
                        transcript.getVideoId(), transcript.getId(), cached.get().getId());
                return new AnalysisOutcome(transcript, cached.get(), true);
            }
        }

        VerdictDraft draft = analyzer.analyze(transcript);
        AnalysisVerdict verdict = new AnalysisVerdict(transcript, draft.answer(), draft.reasoning(),
                writeEvidence(draft.evidence()), draft.model(), draft.tokensUsed(), clock.instant());
        try {
            AnalysisVerdict saved = verdicts.save(verdict);
            LOGGER.info("Verdict stored videoId={} transcriptId={} verdictId={} answer={}",
                    transcript.getVideoId(), transcript.getId(), saved.getId(), saved.getAnswer().label());
            return new AnalysisOutcome(transcript, saved, false);
        } catch (DataAccessException e) {
            throw new StorageException("Saving verdict failed for video " + transcript.getVideoId(), e);
        }
    }

    public List<String> evidenceOf(AnalysisVerdict verdict) {
        String json = verdict.getEvidenceJson();
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, EVIDENCE_TYPE);
        } catch (JsonProcessingException e) {
            LOGGER.warn("Stored evidence is not a JSON list verdictId={}", verdict.getId());
            return List.of(json);
        }
    }

    private Optional<AnalysisVerdict> findLatest(TranscriptRecord transcript) {
        try {
            return verdicts.findFirstByTranscriptIdOrderByAnalysisDateDescIdDesc(transcript.getId());
        } catch (DataAccessException e) {
            throw new StorageException("Verdict lookup failed for video " + transcript.getVideoId(), e);
        }
    }

    private String writeEvidence(List<String> evidence) {
        try {
            return objectMapper.writeValueAsString(evidence);
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Evidence could not be serialized", e);
        }
    }

    /**
     * @param cached true when the verdict came from the store rather than a new analyzer call
     */
    public record AnalysisOutcome(TranscriptRecord transcript, AnalysisVerdict verdict, boolean cached) { }
}
