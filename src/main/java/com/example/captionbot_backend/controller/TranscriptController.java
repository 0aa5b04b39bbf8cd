package com.example.captionbot_backend.controller;

import com.example.captionbot_backend.dto.web.TranscriptAcquireRequest;
import com.example.captionbot_backend.dto.web.TranscriptResponse;
import com.example.captionbot_backend.dto.web.TranscriptSummary;
import com.example.captionbot_backend.exception.TranscriptNotFoundException;
import com.example.captionbot_backend.model.TranscriptRecord;
import com.example.captionbot_backend.service.TranscriptAcquisitionService;
import com.example.captionbot_backend.service.TranscriptStore;
import com.example.captionbot_backend.util.VideoIdExtractor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/transcripts")
public class TranscriptController {
    private final TranscriptAcquisitionService acquisition;
    private final TranscriptStore store;

    public TranscriptController(TranscriptAcquisitionService acquisition, TranscriptStore store) {
        this.acquisition = acquisition;
        this.store = store;
    }

    @Operation(summary = "Fetch captions for a video and store them, or return the stored transcript")
    @ApiResponse(responseCode = "200", description = "Transcript available")
    @ApiResponse(responseCode = "400", description = "Reference is not a supported video URL or id")
    @ApiResponse(responseCode = "404", description = "Captions disabled or video unavailable")
    @ApiResponse(responseCode = "422", description = "Every caption source failed")
    @PostMapping
    public TranscriptResponse acquire(@Valid @RequestBody TranscriptAcquireRequest request) {
        TranscriptAcquisitionService.Acquisition result = acquisition.acquire(request.reference(), request.overwrite(), null);
        TranscriptRecord t = result.record();
        return new TranscriptResponse(t.getId(), t.getVideoId(), t.getTitle(), t.getChannel(), t.getLanguage(),
                t.getExtractionDate(), t.getText(), result.fromCache(),
                result.resolvedBy() == null ? null : result.resolvedBy().name(),
                result.artifact() == null ? null : result.artifact().toString());
    }

    @Operation(summary = "Current stored transcript of a video")
    @GetMapping("/{videoId}")
    public TranscriptResponse getByVideoId(@PathVariable String videoId) {
        String id = VideoIdExtractor.extract(videoId);
        TranscriptRecord t = store.latestByVideoId(id)
                .orElseThrow(() -> new TranscriptNotFoundException(id, "transcript"));
        return new TranscriptResponse(t.getId(), t.getVideoId(), t.getTitle(), t.getChannel(), t.getLanguage(),
                t.getExtractionDate(), t.getText(), true, null, store.artifactLocation(t).toString());
    }

    @Operation(summary = "Most recently extracted transcripts")
    @GetMapping
    public List<TranscriptSummary> listRecent(@RequestParam(required = false, defaultValue = "10") int limit) {
        return store.listRecent(limit).stream()
                .map(t -> new TranscriptSummary(t.getId(), t.getVideoId(), t.getTitle(), t.getChannel(),
                        t.getLanguage(), t.getExtractionDate()))
                .toList();
    }
}
