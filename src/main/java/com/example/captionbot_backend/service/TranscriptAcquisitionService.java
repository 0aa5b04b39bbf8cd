package com.example.captionbot_backend.service;

import com.example.captionbot_backend.config.CaptionProperties;
import com.example.captionbot_backend.dto.caption.AcquiredCaptions;
import com.example.captionbot_backend.dto.caption.CaptionFetch;
import com.example.captionbot_backend.dto.caption.FailureKind;
import com.example.captionbot_backend.dto.caption.SubtitleDownload;
import com.example.captionbot_backend.dto.caption.Tier;
import com.example.captionbot_backend.dto.caption.TierError;
import com.example.captionbot_backend.dto.caption.TierResult;
import com.example.captionbot_backend.dto.caption.TranscriptSegment;
import com.example.captionbot_backend.engine.CaptionSourceAdapter;
import com.example.captionbot_backend.engine.SubtitleToolAdapter;
import com.example.captionbot_backend.exception.TranscriptAcquisitionException;
import com.example.captionbot_backend.model.TranscriptRecord;
import com.example.captionbot_backend.util.CueTextParser;
import com.example.captionbot_backend.util.VideoIdExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point of the transcript pipeline. Resolves the reference, returns the stored transcript
 * unless an overwrite is requested, and otherwise walks the caption tiers in priority order:
 * <pre>
 * TRY_PREFERRED -> TRY_LISTING -> TRY_FALLBACK_TOOL -> PARSE -> SUCCESS | FAILED
 * </pre>
 * A terminal failure in the preferred tier (captions disabled, video unavailable) ends the walk
 * without touching the other tiers.
 */
@Service
public class TranscriptAcquisitionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptAcquisitionService.class);

    enum AcquisitionState {
        TRY_PREFERRED,
        TRY_LISTING,
        TRY_FALLBACK_TOOL,
        PARSE,
        SUCCESS,
        FAILED
    }

    private final CaptionSourceAdapter captions;
    private final SubtitleToolAdapter subtitleTool;
    private final TranscriptStore store;
    private final CaptionProperties props;

    public TranscriptAcquisitionService(CaptionSourceAdapter captions,
                                        SubtitleToolAdapter subtitleTool,
                                        TranscriptStore store,
                                        CaptionProperties props) {
        this.captions = captions;
        this.subtitleTool = subtitleTool;
        this.store = store;
        this.props = props;
    }

    public TranscriptRecord acquireTranscript(String reference, boolean overwrite) {
        return acquire(reference, overwrite, null).record();
    }

    public TranscriptRecord acquireTranscript(String reference, boolean overwrite, Duration timeout) {
        return acquire(reference, overwrite, timeout).record();
    }

    /**
     * @param timeout per tier bound; null uses the configured API and tool timeouts
     */
    public Acquisition acquire(String reference, boolean overwrite, Duration timeout) {
        String videoId = VideoIdExtractor.extract(reference);

        if (!overwrite) {
            Optional<TranscriptRecord> cached = store.latestByVideoId(videoId);
            if (cached.isPresent()) {
                LOGGER.info("Using stored transcript videoId={} id={}", videoId, cached.get().getId());
                return new Acquisition(cached.get(), true, null, store.artifactLocation(cached.get()));
            }
        }

        AcquiredCaptions acquired = resolveCaptions(videoId, props.getLanguages(), timeout);
        TranscriptStore.SaveOutcome outcome = store.save(acquired.segments(), videoId, acquired.title(), acquired.channel(),
                acquired.languageCode(), overwrite);
        return new Acquisition(outcome.record(), !outcome.inserted(), acquired.resolvedBy(), outcome.location());
    }

    AcquiredCaptions resolveCaptions(String videoId, List<String> languages, Duration timeout) {
        Duration apiTimeout = timeout != null ? timeout : props.getApiTimeout();
        Duration toolTimeout = timeout != null ? timeout : props.getToolTimeout();

        List<TierError> errors = new ArrayList<>();
        AcquisitionState state = AcquisitionState.TRY_PREFERRED;
        SubtitleDownload download = null;
        AcquiredCaptions result = null;

        while (state != AcquisitionState.SUCCESS && state != AcquisitionState.FAILED) {
            LOGGER.debug("Acquisition step videoId={} state={}", videoId, state);
            switch (state) {
                case TRY_PREFERRED -> {
                    TierResult<CaptionFetch> preferred = captions.fetchPreferred(videoId, languages, apiTimeout);
                    if (preferred.isSuccess()) {
                        result = accepted(videoId, preferred.value(), Tier.PREFERRED);
                        state = AcquisitionState.SUCCESS;
                    } else {
                        errors.add(preferred.error());
                        state = preferred.error().kind().isTerminal() ? AcquisitionState.FAILED : AcquisitionState.TRY_LISTING;
                    }
                }
                case TRY_LISTING -> {
                    TierResult<CaptionFetch> listed = captions.listAndFetchAny(videoId, languages, apiTimeout);
                    if (listed.isSuccess()) {
                        result = accepted(videoId, listed.value(), Tier.LISTING);
                        state = AcquisitionState.SUCCESS;
                    } else {
                        errors.add(listed.error());
                        state = AcquisitionState.TRY_FALLBACK_TOOL;
                    }
                }
                case TRY_FALLBACK_TOOL -> {
                    TierResult<SubtitleDownload> tool = subtitleTool.downloadSubtitles(videoId, languages, toolTimeout);
                    if (tool.isSuccess()) {
                        download = tool.value();
                        state = AcquisitionState.PARSE;
                    } else {
                        errors.add(tool.error());
                        state = AcquisitionState.FAILED;
                    }
                }
                case PARSE -> {
                    List<TranscriptSegment> segments;
                    try {
                        segments = CueTextParser.parseCues(download.rawText());
                    } catch (RuntimeException e) {
                        LOGGER.warn("Subtitle file unreadable videoId={} ext={} reason={}", videoId, download.ext(), e.toString());
                        errors.add(new TierError(Tier.FALLBACK_TOOL, FailureKind.FALLBACK_EXTRACTION_FAILED,
                                "cue parsing failed for " + download.ext() + " file: " + e.getMessage(), e));
                        state = AcquisitionState.FAILED;
                        break;
                    }
                    if (segments.isEmpty()) {
                        errors.add(TierError.of(Tier.FALLBACK_TOOL, FailureKind.EMPTY_FALLBACK_RESULT,
                                "no cues in " + download.ext() + " file for " + download.languageCode()));
                        state = AcquisitionState.FAILED;
                    } else {
                        result = new AcquiredCaptions(videoId, segments, download.languageCode(), Tier.FALLBACK_TOOL,
                                download.title(), download.channel());
                        LOGGER.info("Captions resolved videoId={} tier={} lang={} segments={}",
                                videoId, Tier.FALLBACK_TOOL, download.languageCode(), segments.size());
                        state = AcquisitionState.SUCCESS;
                    }
                }
                default -> throw new IllegalStateException("Unexpected acquisition state " + state);
            }
        }

        if (state == AcquisitionState.FAILED) {
            TranscriptAcquisitionException failure = new TranscriptAcquisitionException(videoId, errors);
            LOGGER.warn("Caption acquisition failed videoId={} terminal={} message={}", videoId, failure.isTerminal(), failure.getMessage());
            throw failure;
        }
        return result;
    }

    private AcquiredCaptions accepted(String videoId, CaptionFetch fetch, Tier tier) {
        LOGGER.info("Captions resolved videoId={} tier={} lang={} segments={}",
                videoId, tier, fetch.languageCode(), fetch.segments().size());
        return new AcquiredCaptions(videoId, fetch.segments(), fetch.languageCode(), tier);
    }

    /**
     * @param fromCache  true when an already stored row was returned
     * @param resolvedBy tier that produced the captions, null for cache hits
     */
    public record Acquisition(TranscriptRecord record, boolean fromCache, Tier resolvedBy, Path artifact) { }
}
