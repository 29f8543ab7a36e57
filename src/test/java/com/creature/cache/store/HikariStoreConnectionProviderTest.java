package com.creature.cache.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HikariStoreConnectionProvider Tests")
class HikariStoreConnectionProviderTest {

    @Test
    @DisplayName("Should hand out working connections and report the dialect")
    void acquireWorks() {
        try (HikariStoreConnectionProvider provider = H2TestSupport.freshStore()) {
            assertEquals(SqlDialect.H2, provider.getDialect());
            try (StoreConnection connection = provider.acquire()) {
                assertTrue(connection.isValid());
                assertEquals(1, connection.execute("INSERT INTO pokemon (id, name) VALUES (?, ?)", List.of(1, "bulbasaur")));
            }
            assertEquals(1, H2TestSupport.countRows(provider, 1));
        }
    }

    @Test
    @DisplayName("Released connections should return to the pool")
    void connectionsReleased() {
        try (HikariStoreConnectionProvider provider = H2TestSupport.freshStore()) {
            for (int i = 0; i < 20; i++) {
                try (StoreConnection connection = provider.acquire()) {
                    connection.queryOne("SELECT 1 AS one", List.of());
                }
            }
            PoolStats stats = provider.getStats();
            assertEquals(0, stats.activeConnections());
            assertEquals(8, stats.maxPoolSize());
        }
    }

    @Test
    @DisplayName("Unreachable database should raise StoreUnavailableException")
    void unreachableDatabase() {
        StoreConfig config = StoreConfig.builder()
                .jdbcUrl("jdbc:h2:tcp://127.0.0.1:1/nothing")
                .username("sa")
                .password("")
                .minIdle(0)
                .connectionTimeoutMillis(250)
                .build();

        try (HikariStoreConnectionProvider provider = new HikariStoreConnectionProvider(config)) {
            assertThrows(StoreUnavailableException.class, provider::acquire);
        }
    }

    @Test
    @DisplayName("acquire after close should raise StoreUnavailableException")
    void acquireAfterClose() {
        HikariStoreConnectionProvider provider = H2TestSupport.freshStore();
        provider.close();

        assertThrows(StoreUnavailableException.class, provider::acquire);
    }
}
