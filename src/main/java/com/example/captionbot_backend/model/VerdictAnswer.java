package com.example.captionbot_backend.model;

import java.util.Locale;

public enum VerdictAnswer {
    YES("Yes"),
    NO("No"),
    CANNOT_DETERMINE("Cannot determine");

    private final String label;

    VerdictAnswer(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Accepts the label as the model writes it, case insensitive. */
    public static VerdictAnswer fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("answer is missing");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (VerdictAnswer answer : values()) {
            if (answer.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return answer;
            }
        }
        throw new IllegalArgumentException("unknown answer '" + label + "'");
    }
}
