package com.example.captionbot_backend.service.metadata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Best-effort title/channel lookup. Providers are asked in order until both fields are known;
 * failures are logged and never reach the caller.
 */
@Service
public class MetadataService {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataService.class);
    private static final Duration CACHE_TTL = Duration.ofMinutes(5);

    private final List<MetadataProvider> providers;
    private final Clock clock;
    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();

    public MetadataService(List<MetadataProvider> providers, Clock clock) {
        this.providers = new ArrayList<>(providers);
        AnnotationAwareOrderComparator.sort(this.providers);
        this.clock = clock;
    }

    public MetadataResult lookupTitleAndChannel(String videoId) {
        CacheEntry cached = cache.get(videoId);
        if (cached != null) {
            if (!cached.isExpired(clock.instant())) {
                return cached.result();
            }
            cache.remove(videoId, cached);
        }

        MetadataResult result = MetadataResult.empty(videoId);
        for (MetadataProvider provider : providers) {
            if (result.isComplete()) {
                break;
            }
            try {
                Optional<MetadataResult> partial = provider.resolve(videoId);
                if (partial.isPresent()) {
                    result = result.merge(partial.get());
                }
            } catch (MetadataAccessException ex) {
                LOGGER.warn("Metadata provider {} failed for {}: {}", provider.getClass().getSimpleName(), videoId, ex.getMessage());
            } catch (RuntimeException ex) {
                LOGGER.error("Metadata provider {} crashed for {}", provider.getClass().getSimpleName(), videoId, ex);
            }
        }

        if (result.hasAnyData()) {
            cache.put(videoId, new CacheEntry(result, clock.instant().plus(CACHE_TTL)));
        } else {
            LOGGER.info("No metadata found videoId={}", videoId);
        }
        return result;
    }

    int cachedEntries() {
        return cache.size();
    }

    private record CacheEntry(MetadataResult result, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return now.isAfter(expiresAt);
        }
    }
}
