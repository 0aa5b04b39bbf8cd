package com.example.captionbot_backend.repository;

import com.example.captionbot_backend.model.AnalysisVerdict;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface AnalysisVerdictRepository extends JpaRepository<AnalysisVerdict, Long> {

    Optional<AnalysisVerdict> findFirstByTranscriptIdOrderByAnalysisDateDescIdDesc(Long transcriptId);

    long countByTranscriptId(Long transcriptId);

    /** Removes the verdicts of every transcript row of a video. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
       delete from AnalysisVerdict v
       where v.transcript.id in (
           select t.id from TranscriptRecord t where t.videoId = :videoId
       )
       """)
    int deleteByVideoId(@Param("videoId") String videoId);
}
