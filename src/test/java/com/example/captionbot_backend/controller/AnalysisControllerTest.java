package com.example.captionbot_backend.controller;

import com.example.captionbot_backend.exception.AnalysisException;
import com.example.captionbot_backend.model.AnalysisVerdict;
import com.example.captionbot_backend.model.TranscriptRecord;
import com.example.captionbot_backend.model.VerdictAnswer;
import com.example.captionbot_backend.service.analysis.AnalysisService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AnalysisController.class)
@AutoConfigureMockMvc(addFilters = false)
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AnalysisService analysisService;

    @Test
    void analyzeReturnsVerdictWithEvidence() throws Exception {
        AnalysisService.AnalysisOutcome outcome = outcome(true);
        when(analysisService.analyze("abc", false, true)).thenReturn(outcome);
        when(analysisService.evidenceOf(any(AnalysisVerdict.class))).thenReturn(List.of("quote"));

        mockMvc.perform(post("/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reference\": \"abc\", \"forceAnalysis\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.videoId").value("abc"))
                .andExpect(jsonPath("$.transcriptId").value(3))
                .andExpect(jsonPath("$.answer").value("Cannot determine"))
                .andExpect(jsonPath("$.evidence[0]").value("quote"))
                .andExpect(jsonPath("$.cached").value(true));
    }

    @Test
    void analysisFailureMapsToBadGateway() throws Exception {
        when(analysisService.analyze("abc", false, false)).thenThrow(new AnalysisException("model down"));

        mockMvc.perform(post("/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reference\": \"abc\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("ANALYSIS_FAILED"));
    }

    @Test
    void latestVerdictOrNotFound() throws Exception {
        AnalysisService.AnalysisOutcome outcome = outcome(true);
        when(analysisService.latestVerdictForVideo("abc")).thenReturn(Optional.of(outcome));
        when(analysisService.evidenceOf(any(AnalysisVerdict.class))).thenReturn(List.of());
        when(analysisService.latestVerdictForVideo("none")).thenReturn(Optional.empty());

        mockMvc.perform(get("/v1/analysis/abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verdictId").value(11));
        mockMvc.perform(get("/v1/analysis/none"))
                .andExpect(status().isNotFound());
    }

    private static AnalysisService.AnalysisOutcome outcome(boolean cached) {
        TranscriptRecord transcript = mock(TranscriptRecord.class);
        when(transcript.getId()).thenReturn(3L);
        when(transcript.getVideoId()).thenReturn("abc");
        AnalysisVerdict verdict = mock(AnalysisVerdict.class);
        when(verdict.getId()).thenReturn(11L);
        when(verdict.getAnswer()).thenReturn(VerdictAnswer.CANNOT_DETERMINE);
        when(verdict.getReasoning()).thenReturn("too short");
        when(verdict.getAnalysisDate()).thenReturn(Instant.parse("2024-01-01T00:00:00Z"));
        return new AnalysisService.AnalysisOutcome(transcript, verdict, cached);
    }
}
