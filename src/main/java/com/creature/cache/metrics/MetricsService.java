package com.creature.cache.metrics;

import com.creature.cache.api.LookupResult;
import com.creature.cache.cache.WriteResult;
import com.creature.cache.remote.FetchResult;

import java.time.Duration;

/**
 * Interface for recording creature cache metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordLookup(LookupResult.Status outcome, Duration duration);

    void recordCacheHit();

    void recordCacheMiss();

    void recordCacheCorrupt();

    void recordStoreUnavailable();

    void recordRemoteFetch(FetchResult.Status outcome, Duration duration);

    void recordWrite(WriteResult.Status status);
}
