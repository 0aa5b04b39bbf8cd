package com.example.captionbot_backend.service.analysis;

import com.example.captionbot_backend.exception.AnalysisException;
import com.example.captionbot_backend.model.TranscriptRecord;

public interface TranscriptAnalyzer {

    /**
     * @throws AnalysisException when the model cannot be reached or answers outside the schema
     */
    VerdictDraft analyze(TranscriptRecord transcript);
}
