package com.creature.cache.cdi;

import com.creature.cache.api.CreatureCache;
import com.creature.cache.metrics.MetricsService;
import com.creature.cache.metrics.MicrometerMetricsService;
import com.creature.cache.metrics.NoOpMetricsService;
import com.creature.cache.remote.GraphQLHttpClient;
import com.creature.cache.remote.RemoteClientHandle;
import com.creature.cache.store.StoreConfig;
import io.micrometer.core.instrument.Metrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the creature cache from MicroProfile Config properties.
 *
 * <p>At minimum the store URL must be provided:</p>
 * <pre>
 * creature-cache.store.jdbc-url=jdbc:postgresql://localhost:5432/pokedex
 * creature-cache.store.username=pokedex
 * creature-cache.store.password=secret
 * </pre>
 *
 * <p>The remote client is set up exactly once, here. If that fails the application still
 * starts, and every lookup answers {@code CLIENT_UNAVAILABLE}.</p>
 */
@ApplicationScoped
public class CreatureCacheProducer {

    private static final Logger log = LoggerFactory.getLogger(CreatureCacheProducer.class);

    // ── Store ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "creature-cache.store.jdbc-url")
    String jdbcUrl;

    @Inject
    @ConfigProperty(name = "creature-cache.store.username")
    Optional<String> username;

    @Inject
    @ConfigProperty(name = "creature-cache.store.password")
    Optional<String> password;

    @Inject
    @ConfigProperty(name = "creature-cache.store.table", defaultValue = "pokemon")
    String tableName;

    @Inject
    @ConfigProperty(name = "creature-cache.store.pool.max-size", defaultValue = "10")
    int poolMaxSize;

    @Inject
    @ConfigProperty(name = "creature-cache.store.pool.min-idle", defaultValue = "2")
    int poolMinIdle;

    @Inject
    @ConfigProperty(name = "creature-cache.store.pool.connection-timeout-millis", defaultValue = "2000")
    long poolConnectionTimeoutMillis;

    // ── Remote ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "creature-cache.remote.url", defaultValue = GraphQLHttpClient.DEFAULT_ENDPOINT)
    String remoteUrl;

    @Inject
    @ConfigProperty(name = "creature-cache.remote.timeout-seconds", defaultValue = "30")
    int remoteTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "creature-cache.remote.user-agent", defaultValue = GraphQLHttpClient.DEFAULT_USER_AGENT)
    String remoteUserAgent;

    @Inject
    @ConfigProperty(name = "creature-cache.remote.verify-schema", defaultValue = "true")
    boolean remoteVerifySchema;

    // ── Metrics ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "creature-cache.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public RemoteClientHandle remoteClientHandle() {
        log.info("Producing RemoteClientHandle: url={} verifySchema={}", remoteUrl, remoteVerifySchema);
        return RemoteClientHandle.initialize(() -> {
            GraphQLHttpClient client = GraphQLHttpClient.builder()
                    .endpoint(remoteUrl)
                    .timeout(Duration.ofSeconds(remoteTimeoutSeconds))
                    .userAgent(remoteUserAgent)
                    .build();
            if (remoteVerifySchema) {
                client.verifySchema();
            }
            return client;
        });
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (!metricsEnabled) {
            log.info("Metrics disabled");
            return new NoOpMetricsService();
        }
        return new MicrometerMetricsService(Metrics.globalRegistry);
    }

    @Produces
    @ApplicationScoped
    public CreatureCache creatureCache(RemoteClientHandle clientHandle, MetricsService metricsService) {
        StoreConfig storeConfig = StoreConfig.builder()
                .jdbcUrl(jdbcUrl)
                .username(username.orElse(null))
                .password(password.orElse(null))
                .maxPoolSize(poolMaxSize)
                .minIdle(poolMinIdle)
                .connectionTimeoutMillis(poolConnectionTimeoutMillis)
                .tableName(tableName)
                .build();
        log.info("Producing CreatureCache: store={}", storeConfig);

        return CreatureCache.builder()
                .storeConfig(storeConfig)
                .clientHandle(clientHandle)
                .metricsService(metricsService)
                .build();
    }

    public void closeCache(@Disposes CreatureCache cache) {
        log.info("Closing CreatureCache");
        cache.close();
    }
}
