package com.example.captionbot_backend.controller;

import com.example.captionbot_backend.dto.web.AnalysisRequest;
import com.example.captionbot_backend.dto.web.VerdictResponse;
import com.example.captionbot_backend.exception.TranscriptNotFoundException;
import com.example.captionbot_backend.model.AnalysisVerdict;
import com.example.captionbot_backend.model.TranscriptRecord;
import com.example.captionbot_backend.service.analysis.AnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Transcript analysis: end-to-end run and cached verdict lookup.
 */
@RestController
@RequestMapping("/v1/analysis")
public class AnalysisController {
    private final AnalysisService analysisService;

    public AnalysisController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @Operation(summary = "Acquire the transcript of a video and analyze it, reusing a cached verdict when present")
    @ApiResponse(responseCode = "200", description = "Verdict available")
    @ApiResponse(responseCode = "400", description = "Invalid reference")
    @ApiResponse(responseCode = "422", description = "No transcript could be acquired")
    @ApiResponse(responseCode = "502", description = "Analysis model failed")
    @PostMapping
    public VerdictResponse analyze(@Valid @RequestBody AnalysisRequest request) {
        AnalysisService.AnalysisOutcome outcome = analysisService.analyze(
                request.reference(), request.forceExtract(), request.forceAnalysis());
        return toDto(outcome);
    }

    @Operation(summary = "Latest verdict for the current transcript of a video")
    @GetMapping("/{videoId}")
    public VerdictResponse latest(@PathVariable String videoId) {
        return analysisService.latestVerdictForVideo(videoId)
                .map(this::toDto)
                .orElseThrow(() -> new TranscriptNotFoundException(videoId, "verdict"));
    }

    private VerdictResponse toDto(AnalysisService.AnalysisOutcome outcome) {
        TranscriptRecord t = outcome.transcript();
        AnalysisVerdict v = outcome.verdict();
        return new VerdictResponse(t.getVideoId(), t.getTitle(), t.getChannel(), t.getId(), v.getId(),
                v.getAnswer().label(), v.getReasoning(), analysisService.evidenceOf(v), v.getModel(),
                v.getTokensUsed(), v.getAnalysisDate(), outcome.cached());
    }
}
