package com.example.captionbot_backend.dto.caption;

/**
 * Acquisition strategies in the order the pipeline attempts them.
 */
public enum Tier {
    PREFERRED("preferred languages"),
    LISTING("track listing"),
    FALLBACK_TOOL("subtitle tool");

    private final String label;

    Tier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
