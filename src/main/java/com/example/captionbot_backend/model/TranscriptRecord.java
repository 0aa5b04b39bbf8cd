package com.example.captionbot_backend.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * One extraction of a video's captions. Rows are never updated; a forced re-fetch deletes and
 * re-inserts, so the newest {@code extractionDate} per video is the current record.
 */
@Entity
@Table(name = "transcripts")
public class TranscriptRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;
    @Column(name = "video_id", nullable = false, length = 64, updatable = false)
    private String videoId;
    @Column(name = "video_title", length = 512)
    private String title;
    @Column(name = "channel_name")
    private String channel;
    @Column(name = "transcript_text", nullable = false, columnDefinition = "text")
    private String text;
    @Column(name = "transcript_language", length = 32)
    private String language;
    @Column(name = "extraction_date", nullable = false, updatable = false)
    private Instant extractionDate;

    protected TranscriptRecord() {}

    public TranscriptRecord(String videoId, String title, String channel, String text, String language, Instant extractionDate) {
        this.videoId = videoId;
        this.title = title;
        this.channel = channel;
        this.text = text;
        this.language = language;
        this.extractionDate = extractionDate;
    }

    public Long getId() { return id; }
    public String getVideoId() { return videoId; }
    public String getTitle() { return title; }
    public String getChannel() { return channel; }
    public String getText() { return text; }
    public String getLanguage() { return language; }
    public Instant getExtractionDate() { return extractionDate; }
}
