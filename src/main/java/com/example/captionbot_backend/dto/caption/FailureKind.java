package com.example.captionbot_backend.dto.caption;

public enum FailureKind {
    /** Captions are turned off for the video; no other source will have them. */
    SOURCE_DISABLED(true),
    /** Video removed, private or otherwise unreachable. */
    SOURCE_UNAVAILABLE(true),
    NO_MATCH_FOR_LANGUAGES(false),
    MALFORMED_CAPTIONS(false),
    UNEXPECTED(false),
    NO_TRACKS_AVAILABLE(false),
    FALLBACK_TOOL_UNAVAILABLE(false),
    FALLBACK_EXTRACTION_FAILED(false),
    NO_CAPTIONS_OFFERED(false),
    EMPTY_FALLBACK_RESULT(false);

    private final boolean terminal;

    FailureKind(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
