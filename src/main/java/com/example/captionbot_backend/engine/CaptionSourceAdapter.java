package com.example.captionbot_backend.engine;

import com.example.captionbot_backend.dto.caption.CaptionFetch;
import com.example.captionbot_backend.dto.caption.CaptionTrack;
import com.example.captionbot_backend.dto.caption.FailureKind;
import com.example.captionbot_backend.dto.caption.Tier;
import com.example.captionbot_backend.dto.caption.TierResult;
import com.example.captionbot_backend.dto.caption.TranscriptSegment;
import com.example.captionbot_backend.engine.Interfaces.CaptionApiClient;
import com.example.captionbot_backend.util.CaptionEntryNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The two caption API tiers: direct fetch by preferred language and listing with any-language
 * fallback. Every failure is classified into a {@link TierResult}; nothing is thrown to the caller.
 */
@Service
public class CaptionSourceAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(CaptionSourceAdapter.class);

    private final CaptionApiClient client;

    public CaptionSourceAdapter(CaptionApiClient client) {
        this.client = client;
    }

    public TierResult<CaptionFetch> fetchPreferred(String videoId, List<String> languages, Duration timeout) {
        List<CaptionTrack> tracks;
        try {
            tracks = client.listTracks(videoId, timeout);
        } catch (CaptionApiException e) {
            return classify(Tier.PREFERRED, e);
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected captions API failure videoId={}", videoId, e);
            return TierResult.failure(Tier.PREFERRED, FailureKind.UNEXPECTED, e.getMessage(), e);
        }

        Optional<CaptionTrack> match = findPreferred(tracks, languages);
        if (match.isEmpty()) {
            return TierResult.failure(Tier.PREFERRED, FailureKind.NO_MATCH_FOR_LANGUAGES,
                    "none of " + languages + " in " + codes(tracks), null);
        }

        CaptionTrack track = match.get();
        try {
            List<TranscriptSegment> segments = CaptionEntryNormalizer.normalize(client.fetchTrack(track, timeout));
            if (segments.isEmpty()) {
                return TierResult.failure(Tier.PREFERRED, FailureKind.MALFORMED_CAPTIONS,
                        "track " + track.languageCode() + " has no usable entries", null);
            }
            LOGGER.info("Preferred captions fetched videoId={} lang={} generated={} segments={}",
                    videoId, track.languageCode(), track.generated(), segments.size());
            return TierResult.success(new CaptionFetch(segments, track.languageCode()));
        } catch (CaptionApiException e) {
            return classify(Tier.PREFERRED, e);
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected failure reading captions videoId={} lang={}", videoId, track.languageCode(), e);
            return TierResult.failure(Tier.PREFERRED, FailureKind.UNEXPECTED, e.getMessage(), e);
        }
    }

    public TierResult<CaptionFetch> listAndFetchAny(String videoId, List<String> languages, Duration timeout) {
        List<CaptionTrack> tracks;
        try {
            tracks = client.listTracks(videoId, timeout);
        } catch (CaptionApiException e) {
            return classify(Tier.LISTING, e);
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected captions listing failure videoId={}", videoId, e);
            return TierResult.failure(Tier.LISTING, FailureKind.UNEXPECTED, e.getMessage(), e);
        }
        LOGGER.info("Available caption tracks videoId={} tracks={}", videoId, codes(tracks));

        RuntimeException lastFailure = null;
        for (CaptionTrack track : candidateOrder(tracks, languages)) {
            try {
                List<TranscriptSegment> segments = CaptionEntryNormalizer.normalize(client.fetchTrack(track, timeout));
                if (!segments.isEmpty()) {
                    LOGGER.info("Listed captions fetched videoId={} lang={} generated={} segments={}",
                            videoId, track.languageCode(), track.generated(), segments.size());
                    return TierResult.success(new CaptionFetch(segments, track.languageCode()));
                }
                LOGGER.warn("Caption track yielded no segments videoId={} lang={}", videoId, track.languageCode());
            } catch (RuntimeException e) {
                lastFailure = e;
                LOGGER.warn("Caption track fetch failed videoId={} lang={} reason={}", videoId, track.languageCode(), e.getMessage());
            }
        }

        String message = tracks.isEmpty()
                ? "no tracks listed"
                : "no usable track among " + codes(tracks) + (lastFailure == null ? "" : ", last error: " + lastFailure.getMessage());
        return TierResult.failure(Tier.LISTING, FailureKind.NO_TRACKS_AVAILABLE, message, lastFailure);
    }

    /**
     * Manual tracks in preferred languages, then generated ones in preferred languages, then the rest
     * in listing order.
     */
    List<CaptionTrack> candidateOrder(List<CaptionTrack> tracks, List<String> languages) {
        Set<CaptionTrack> ordered = new LinkedHashSet<>();
        for (String lang : languages) {
            tracks.stream().filter(t -> !t.generated() && matches(t, lang)).forEach(ordered::add);
        }
        for (String lang : languages) {
            tracks.stream().filter(t -> t.generated() && matches(t, lang)).forEach(ordered::add);
        }
        ordered.addAll(tracks);
        return new ArrayList<>(ordered);
    }

    private Optional<CaptionTrack> findPreferred(List<CaptionTrack> tracks, List<String> languages) {
        for (String lang : languages) {
            Optional<CaptionTrack> manual = tracks.stream().filter(t -> !t.generated() && matches(t, lang)).findFirst();
            if (manual.isPresent()) {
                return manual;
            }
            Optional<CaptionTrack> generated = tracks.stream().filter(t -> t.generated() && matches(t, lang)).findFirst();
            if (generated.isPresent()) {
                return generated;
            }
        }
        return Optional.empty();
    }

    private static boolean matches(CaptionTrack track, String lang) {
        return track.languageCode().equalsIgnoreCase(lang);
    }

    private static <T> TierResult<T> classify(Tier tier, CaptionApiException e) {
        FailureKind kind = switch (e.getReason()) {
            case CAPTIONS_DISABLED -> FailureKind.SOURCE_DISABLED;
            case VIDEO_UNAVAILABLE -> FailureKind.SOURCE_UNAVAILABLE;
            case MALFORMED_RESPONSE -> FailureKind.MALFORMED_CAPTIONS;
            case REQUEST_BLOCKED, REQUEST_FAILED -> FailureKind.UNEXPECTED;
        };
        LOGGER.warn("Captions tier failed tier={} kind={} message={}", tier, kind, e.getMessage());
        return TierResult.failure(tier, kind, e.getMessage(), e);
    }

    private static String codes(List<CaptionTrack> tracks) {
        return tracks.stream()
                .map(t -> t.languageCode() + (t.generated() ? "(auto)" : ""))
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
