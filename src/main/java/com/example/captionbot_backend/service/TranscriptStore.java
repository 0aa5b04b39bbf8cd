package com.example.captionbot_backend.service;

import com.example.captionbot_backend.dto.caption.TranscriptSegment;
import com.example.captionbot_backend.exception.StorageException;
import com.example.captionbot_backend.model.TranscriptRecord;
import com.example.captionbot_backend.repository.AnalysisVerdictRepository;
import com.example.captionbot_backend.repository.TranscriptRecordRepository;
import com.example.captionbot_backend.service.metadata.MetadataResult;
import com.example.captionbot_backend.service.metadata.MetadataService;
import com.example.captionbot_backend.util.TranscriptFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Persists transcripts keyed by video id. The exists, delete-on-overwrite and insert steps of
 * {@link #save} run under a lock striped by video id and a single transaction.
 */
@Service
public class TranscriptStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptStore.class);
    static final String UNKNOWN_CHANNEL = "Unknown Channel";
    private static final int MAX_LIST_LIMIT = 100;
    private static final int LOCK_STRIPES = 64;

    private final TranscriptRecordRepository transcripts;
    private final AnalysisVerdictRepository verdicts;
    private final MetadataService metadata;
    private final TranscriptArtifactWriter artifacts;
    private final TransactionTemplate tx;
    private final Clock clock;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public TranscriptStore(TranscriptRecordRepository transcripts,
                           AnalysisVerdictRepository verdicts,
                           MetadataService metadata,
                           TranscriptArtifactWriter artifacts,
                           PlatformTransactionManager transactionManager,
                           Clock clock) {
        this.transcripts = transcripts;
        this.verdicts = verdicts;
        this.metadata = metadata;
        this.artifacts = artifacts;
        this.tx = new TransactionTemplate(transactionManager);
        this.clock = clock;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public boolean exists(String videoId) {
        try {
            return transcripts.existsByVideoId(videoId);
        } catch (DataAccessException e) {
            throw new StorageException("Lookup failed for video " + videoId, e);
        }
    }

    /** Most recently extracted row; ties on the timestamp go to the higher id. */
    public Optional<TranscriptRecord> latestByVideoId(String videoId) {
        try {
            return transcripts.findFirstByVideoIdOrderByExtractionDateDescIdDesc(videoId);
        } catch (DataAccessException e) {
            throw new StorageException("Lookup failed for video " + videoId, e);
        }
    }

    public Path artifactLocation(TranscriptRecord record) {
        return artifacts.locationFor(record.getVideoId(), record.getTitle());
    }

    public List<TranscriptRecord> listRecent(int limit) {
        int size = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        try {
            return transcripts.findRecent(PageRequest.of(0, size));
        } catch (DataAccessException e) {
            throw new StorageException("Listing transcripts failed", e);
        }
    }

    public SaveOutcome save(List<TranscriptSegment> segments, String videoId, String title, String channel,
                            String language, boolean overwrite) {
        ReentrantLock lock = lockFor(videoId);
        lock.lock();
        try {
            if (!overwrite) {
                Optional<TranscriptRecord> existing = transcripts.findFirstByVideoIdOrderByExtractionDateDescIdDesc(videoId);
                if (existing.isPresent()) {
                    TranscriptRecord record = existing.get();
                    LOGGER.info("Transcript already stored videoId={} id={} overwrite=false", videoId, record.getId());
                    return new SaveOutcome(artifactLocation(record), false, record);
                }
            }

            MetadataResult resolved = resolveMetadata(videoId, title, channel);
            String finalTitle = resolved.title() != null ? resolved.title() : unknownTitle(videoId);
            String finalChannel = resolved.channel() != null ? resolved.channel() : UNKNOWN_CHANNEL;

            Path location = artifacts.write(videoId, finalTitle, segments);
            String text = TranscriptFormatter.plainText(segments);

            TranscriptRecord saved = tx.execute(status -> {
                if (overwrite) {
                    int removedVerdicts = verdicts.deleteByVideoId(videoId);
                    int removed = transcripts.deleteByVideoId(videoId);
                    if (removed > 0) {
                        LOGGER.info("Overwriting transcript videoId={} removedRows={} removedVerdicts={}", videoId, removed, removedVerdicts);
                    }
                }
                return transcripts.saveAndFlush(new TranscriptRecord(videoId, finalTitle, finalChannel, text, language, clock.instant()));
            });
            LOGGER.info("Transcript stored videoId={} id={} lang={} segments={}", videoId, saved.getId(), language, segments.size());
            return new SaveOutcome(location, true, saved);
        } catch (DataAccessException | TransactionException e) {
            throw new StorageException("Saving transcript failed for video " + videoId, e);
        } finally {
            lock.unlock();
        }
    }

    /** Same id always maps to the same stripe; distinct ids may share one. */
    private ReentrantLock lockFor(String videoId) {
        return locks[Math.floorMod(videoId.hashCode(), LOCK_STRIPES)];
    }

    private MetadataResult resolveMetadata(String videoId, String title, String channel) {
        MetadataResult given = new MetadataResult(videoId, title, channel);
        if (given.isComplete()) {
            return given;
        }
        return given.merge(metadata.lookupTitleAndChannel(videoId));
    }

    static String unknownTitle(String videoId) {
        return "Unknown Title \u2013 " + videoId;
    }

    /**
     * @param location where the text artifact lives (deterministic for cache hits)
     * @param inserted false when an existing row was returned untouched
     */
    public record SaveOutcome(Path location, boolean inserted, TranscriptRecord record) { }
}
