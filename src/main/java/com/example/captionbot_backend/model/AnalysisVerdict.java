package com.example.captionbot_backend.model;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "analysis_results")
public class AnalysisVerdict {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "transcript_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_analysis_transcript"))
    private TranscriptRecord transcript;
    @Enumerated(EnumType.STRING)
    @Column(name = "answer", nullable = false, length = 32)
    private VerdictAnswer answer;
    @Column(name = "reasoning", columnDefinition = "text")
    private String reasoning;
    // JSON array of quoted passages
    @Column(name = "evidence", columnDefinition = "text")
    private String evidenceJson;
    @Column(name = "model", length = 128)
    private String model;
    @Column(name = "tokens_used")
    private Integer tokensUsed;
    @Column(name = "analysis_date", nullable = false)
    private Instant analysisDate;

    protected AnalysisVerdict() {}

    public AnalysisVerdict(TranscriptRecord transcript, VerdictAnswer answer, String reasoning, String evidenceJson,
                           String model, Integer tokensUsed, Instant analysisDate) {
        this.transcript = transcript;
        this.answer = answer;
        this.reasoning = reasoning;
        this.evidenceJson = evidenceJson;
        this.model = model;
        this.tokensUsed = tokensUsed;
        this.analysisDate = analysisDate;
    }

    public Long getId() { return id; }
    public TranscriptRecord getTranscript() { return transcript; }
    public VerdictAnswer getAnswer() { return answer; }
    public String getReasoning() { return reasoning; }
    public String getEvidenceJson() { return evidenceJson; }
    public String getModel() { return model; }
    public Integer getTokensUsed() { return tokensUsed; }
    public Instant getAnalysisDate() { return analysisDate; }
}
