package com.example.captionbot_backend.exception;

import com.example.captionbot_backend.dto.caption.TierError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every tier that was attempted for a video failed. Carries the tier-tagged errors in the order
 * they happened; the cause is the low-level cause of the last attempted tier.
 */
public class TranscriptAcquisitionException extends CaptionbotException {
    private final String videoId;
    private final List<TierError> errors;

    public TranscriptAcquisitionException(String videoId, List<TierError> errors) {
        super(summarize(videoId, errors), lastCause(errors));
        this.videoId = videoId;
        this.errors = List.copyOf(errors);
    }

    public String getVideoId() {
        return videoId;
    }

    public List<TierError> getErrors() {
        return errors;
    }

    /** True when the pipeline stopped on a failure no other tier could have fixed. */
    public boolean isTerminal() {
        return !errors.isEmpty() && errors.get(errors.size() - 1).kind().isTerminal();
    }

    private static String summarize(String videoId, List<TierError> errors) {
        String tried = errors.stream()
                .map(e -> e.tier().label())
                .collect(Collectors.joining(", "));
        String causes = errors.stream()
                .map(TierError::describe)
                .collect(Collectors.joining("; "));
        return "No transcript for " + videoId + ": tried " + tried + "; all failed: " + causes;
    }

    private static Throwable lastCause(List<TierError> errors) {
        for (int i = errors.size() - 1; i >= 0; i--) {
            if (errors.get(i).cause() != null) {
                return errors.get(i).cause();
            }
        }
        return null;
    }
}
