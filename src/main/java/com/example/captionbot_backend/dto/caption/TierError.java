package com.example.captionbot_backend.dto.caption;

import java.util.Objects;

/**
 * Failure of one tier, tagged with the tier that produced it. {@code cause} may be null when the
 * tier failed without an underlying exception (for example zero tracks offered).
 */
public record TierError(Tier tier, FailureKind kind, String message, Throwable cause) {

    public TierError {
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(kind, "kind");
        message = message == null || message.isBlank() ? kind.name() : message;
    }

    public static TierError of(Tier tier, FailureKind kind, String message) {
        return new TierError(tier, kind, message, null);
    }

    public String describe() {
        return tier.label() + " " + kind + " (" + message + ")";
    }
}
