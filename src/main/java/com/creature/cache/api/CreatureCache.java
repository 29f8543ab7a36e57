package com.creature.cache.api;

import com.creature.cache.cache.CacheReader;
import com.creature.cache.cache.CacheWriter;
import com.creature.cache.cache.CreatureTable;
import com.creature.cache.cache.FieldDecoder;
import com.creature.cache.cache.ReadResult;
import com.creature.cache.cache.WriteResult;
import com.creature.cache.core.model.CreatureRecord;
import com.creature.cache.health.ConnectionPoolHealthCheck;
import com.creature.cache.health.HealthCheckRegistry;
import com.creature.cache.health.HealthStatus;
import com.creature.cache.health.RemoteClientHealthCheck;
import com.creature.cache.health.StoreHealthCheck;
import com.creature.cache.logging.LogContext;
import com.creature.cache.metrics.MetricsService;
import com.creature.cache.metrics.NoOpMetricsService;
import com.creature.cache.remote.FetchResult;
import com.creature.cache.remote.RemoteClientHandle;
import com.creature.cache.remote.RemoteFetcher;
import com.creature.cache.store.HikariStoreConnectionProvider;
import com.creature.cache.store.StoreConfig;
import com.creature.cache.store.StoreConnectionProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Main entry point: read-through cache of creature records backed by a relational
 * store and a remote GraphQL source.
 *
 * <p>A lookup reads the store first. Hits are returned as-is. Misses and corrupt rows
 * are fetched remotely, then written with insert-or-ignore so concurrent lookups of
 * the same id leave exactly one row. An unreachable store only costs the cache; the
 * remote source still answers.</p>
 *
 * <pre>
 * try (CreatureCache cache = CreatureCache.builder()
 *         .storeConfig(StoreConfig.builder().jdbcUrl("jdbc:postgresql://localhost/pokedex").build())
 *         .clientHandle(RemoteClientHandle.initialize(() -> GraphQLHttpClient.builder().build()))
 *         .build()) {
 *     LookupResult result = cache.getCreature(25);
 * }
 * </pre>
 */
public class CreatureCache implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CreatureCache.class);

    private final StoreConnectionProvider storeProvider;
    private final boolean ownsStoreProvider;
    private final RemoteClientHandle clientHandle;
    private final CacheReader reader;
    private final CacheWriter writer;
    private final RemoteFetcher fetcher;
    private final MetricsService metricsService;
    private final HealthCheckRegistry healthCheckRegistry;

    private CreatureCache(Builder builder, StoreConnectionProvider storeProvider, boolean ownsStoreProvider,
                          String tableName) {
        this.storeProvider = storeProvider;
        this.ownsStoreProvider = ownsStoreProvider;
        this.clientHandle = builder.clientHandle;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        ObjectMapper objectMapper = builder.objectMapper != null
                ? builder.objectMapper : new ObjectMapper();
        FieldDecoder decoder = new FieldDecoder(objectMapper);
        CreatureTable table = new CreatureTable(tableName, storeProvider.getDialect());

        this.reader = new CacheReader(storeProvider, table, decoder);
        this.writer = new CacheWriter(storeProvider, table, objectMapper);
        this.fetcher = clientHandle.isAvailable()
                ? new RemoteFetcher(clientHandle.client(), decoder) : null;

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new StoreHealthCheck(storeProvider));
        healthCheckRegistry.register(new ConnectionPoolHealthCheck(storeProvider));
        healthCheckRegistry.register(new RemoteClientHealthCheck(clientHandle));

        log.info("CreatureCache initialized: table={} dialect={} remoteAvailable={}",
                table.getTableName(), storeProvider.getDialect(), clientHandle.isAvailable());
    }

    /**
     * Returns the creature with the given id from the cache, or from the remote source
     * when it is not cached (or its cached row is unreadable).
     *
     * @throws IllegalArgumentException if {@code id} is not positive
     */
    public LookupResult getCreature(int id) {
        if (id <= 0) {
            throw new IllegalArgumentException("Creature id must be positive: " + id);
        }

        long startNanos = System.nanoTime();
        try (LogContext ctx = LogContext.forLookup(LogContext.generateCorrelationId(), id)) {
            LookupResult result = lookup(id);
            if (result.source() != null) {
                ctx.with("source", result.source().name());
            }
            metricsService.recordLookup(result.status(), Duration.ofNanos(System.nanoTime() - startNanos));
            log.info("lookup.completed id={} status={} source={}", id, result.status(), result.source());
            return result;
        }
    }

    private LookupResult lookup(int id) {
        if (fetcher == null) {
            log.error("lookup.client_unavailable id={} reason='{}'", id, clientHandle.failureReason());
            return LookupResult.clientUnavailable("Remote client unavailable: " + clientHandle.failureReason());
        }

        ReadResult cached = reader.read(id);
        switch (cached.status()) {
            case HIT -> {
                metricsService.recordCacheHit();
                return LookupResult.fromCache(cached.record());
            }
            case MISS -> metricsService.recordCacheMiss();
            case CORRUPT -> metricsService.recordCacheCorrupt();
            case UNAVAILABLE -> metricsService.recordStoreUnavailable();
        }

        long fetchStart = System.nanoTime();
        FetchResult fetched = fetcher.fetch(id);
        metricsService.recordRemoteFetch(fetched.status(), Duration.ofNanos(System.nanoTime() - fetchStart));

        if (fetched.status() == FetchResult.Status.NOT_FOUND) {
            return LookupResult.notFound(id);
        }
        if (fetched.status() == FetchResult.Status.ERROR) {
            return LookupResult.remoteError(fetched.reason());
        }

        CreatureRecord record = fetched.record();
        store(record);
        return LookupResult.fromRemote(record);
    }

    private void store(CreatureRecord record) {
        WriteResult written = writer.write(record);
        metricsService.recordWrite(written.status());
        if (written.isFailure()) {
            log.warn("cache.write.failed id={} reason='{}' - returning uncached record",
                    record.id(), written.reason(), written.cause());
        }
    }

    /**
     * Runs all registered health checks.
     */
    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public HealthCheckRegistry getHealthCheckRegistry() {
        return healthCheckRegistry;
    }

    @Override
    public void close() {
        if (ownsStoreProvider) {
            storeProvider.close();
        }
        log.info("CreatureCache closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private static final String DEFAULT_TABLE_NAME = "pokemon";

        private StoreConnectionProvider storeProvider;
        private StoreConfig storeConfig;
        private Function<StoreConfig, StoreConnectionProvider> storeProviderFactory = HikariStoreConnectionProvider::new;
        private RemoteClientHandle clientHandle;
        private MetricsService metricsService;
        private ObjectMapper objectMapper;
        private String tableName;

        /**
         * Uses an existing provider. The cache does not close it.
         */
        public Builder storeProvider(StoreConnectionProvider storeProvider) {
            this.storeProvider = storeProvider;
            this.storeConfig = null;
            return this;
        }

        /**
         * Opens a pooled provider from {@code config} when {@link #build()} succeeds.
         * The cache closes it. The table name comes from {@code config} unless
         * {@link #tableName(String)} overrides it.
         */
        public Builder storeConfig(StoreConfig config) {
            this.storeConfig = config;
            this.storeProvider = null;
            return this;
        }

        Builder storeProviderFactory(Function<StoreConfig, StoreConnectionProvider> storeProviderFactory) {
            this.storeProviderFactory = storeProviderFactory;
            return this;
        }

        public Builder clientHandle(RemoteClientHandle clientHandle) {
            this.clientHandle = clientHandle;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        /**
         * Validates the settings, then opens the pool if one was configured.
         * The pool is closed again if the cache cannot be constructed.
         */
        public CreatureCache build() {
            Objects.requireNonNull(clientHandle, "clientHandle is required");
            if (storeProvider == null && storeConfig == null) {
                throw new NullPointerException("storeProvider or storeConfig is required");
            }
            String resolvedTable = resolveTableName();
            if (!StoreConfig.isValidTableName(resolvedTable)) {
                throw new IllegalArgumentException("Invalid table name: " + resolvedTable);
            }

            if (storeConfig == null) {
                return new CreatureCache(this, storeProvider, false, resolvedTable);
            }
            StoreConnectionProvider owned = storeProviderFactory.apply(storeConfig);
            try {
                return new CreatureCache(this, owned, true, resolvedTable);
            } catch (RuntimeException e) {
                owned.close();
                throw e;
            }
        }

        private String resolveTableName() {
            if (tableName != null) {
                return tableName;
            }
            return storeConfig != null ? storeConfig.getTableName() : DEFAULT_TABLE_NAME;
        }
    }
}
