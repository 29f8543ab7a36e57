package com.creature.cache.metrics;

import com.creature.cache.api.LookupResult;
import com.creature.cache.cache.WriteResult;
import com.creature.cache.remote.FetchResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code creature.lookup.duration} - Timer (tag: outcome)</li>
 *   <li>{@code creature.cache.hit} - Counter</li>
 *   <li>{@code creature.cache.miss} - Counter</li>
 *   <li>{@code creature.cache.corrupt} - Counter</li>
 *   <li>{@code creature.store.unavailable} - Counter</li>
 *   <li>{@code creature.remote.fetch.duration} - Timer (tag: outcome)</li>
 *   <li>{@code creature.cache.write} - Counter (tag: status)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter cacheCorruptCounter;
    private final Counter storeUnavailableCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("creature.cache.hit")
                .description("Lookups answered from the persistent cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("creature.cache.miss")
                .description("Lookups with no cached row")
                .register(registry);
        this.cacheCorruptCounter = Counter.builder("creature.cache.corrupt")
                .description("Cached rows that could not be decoded and were refetched")
                .register(registry);
        this.storeUnavailableCounter = Counter.builder("creature.store.unavailable")
                .description("Lookups that skipped the cache because the store was unreachable")
                .register(registry);
    }

    @Override
    public void recordLookup(LookupResult.Status outcome, Duration duration) {
        timer("creature.lookup.duration", "Duration of creature lookups", outcome.name())
                .record(duration);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordCacheCorrupt() {
        cacheCorruptCounter.increment();
    }

    @Override
    public void recordStoreUnavailable() {
        storeUnavailableCounter.increment();
    }

    @Override
    public void recordRemoteFetch(FetchResult.Status outcome, Duration duration) {
        timer("creature.remote.fetch.duration", "Duration of remote creature fetches", outcome.name())
                .record(duration);
    }

    @Override
    public void recordWrite(WriteResult.Status status) {
        Counter counter = counterCache.computeIfAbsent(status.name(), k ->
                Counter.builder("creature.cache.write")
                        .description("Cache write attempts by result")
                        .tag("status", status.name())
                        .register(registry));
        counter.increment();
    }

    private Timer timer(String name, String description, String outcome) {
        return timerCache.computeIfAbsent(name + ":" + outcome, k ->
                Timer.builder(name)
                        .description(description)
                        .tag("outcome", outcome)
                        .register(registry));
    }
}
