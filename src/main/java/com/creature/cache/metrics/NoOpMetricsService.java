package com.creature.cache.metrics;

import com.creature.cache.api.LookupResult;
import com.creature.cache.cache.WriteResult;
import com.creature.cache.remote.FetchResult;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordLookup(LookupResult.Status outcome, Duration duration) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordCacheCorrupt() {
    }

    @Override
    public void recordStoreUnavailable() {
    }

    @Override
    public void recordRemoteFetch(FetchResult.Status outcome, Duration duration) {
    }

    @Override
    public void recordWrite(WriteResult.Status status) {
    }
}
