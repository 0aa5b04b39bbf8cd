package com.example.captionbot_backend.service.analysis;

import com.example.captionbot_backend.model.VerdictAnswer;

import java.util.List;

/**
 * Analyzer output before it is tied to a transcript row.
 */
public record VerdictDraft(VerdictAnswer answer, String reasoning, List<String> evidence, String model, Integer tokensUsed) {

    public VerdictDraft {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
