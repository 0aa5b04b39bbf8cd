package com.example.captionbot_backend.repository;

import com.example.captionbot_backend.model.TranscriptRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TranscriptRecordRepository extends JpaRepository<TranscriptRecord, Long> {
    boolean existsByVideoId(String videoId);

    long countByVideoId(String videoId);

    Optional<TranscriptRecord> findFirstByVideoIdOrderByExtractionDateDescIdDesc(String videoId);

    @Query("""
       select t
       from TranscriptRecord t
       order by t.extractionDate desc, t.id desc
       """)
    List<TranscriptRecord> findRecent(Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
       delete from TranscriptRecord t
       where t.videoId = :videoId
       """)
    int deleteByVideoId(@Param("videoId") String videoId);
}
