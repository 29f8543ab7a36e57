package com.creature.cache.health;

import com.creature.cache.remote.RemoteClient;
import com.creature.cache.remote.RemoteClientHandle;
import com.creature.cache.store.H2TestSupport;
import com.creature.cache.store.HikariStoreConnectionProvider;
import com.creature.cache.store.PoolStats;
import com.creature.cache.store.StoreConnectionProvider;
import com.creature.cache.store.StoreUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("up() should create UP status")
        void upFactory() {
            HealthStatus status = HealthStatus.up();
            assertTrue(status.isUp());
            assertFalse(status.isDown());
            assertFalse(status.isDegraded());
            assertEquals("OK", status.message());
        }

        @Test
        @DisplayName("degraded() and down() should carry their reason")
        void degradedAndDown() {
            assertTrue(HealthStatus.degraded("slow").isDegraded());
            assertEquals("gone", HealthStatus.down("gone").message());
        }

        @Test
        @DisplayName("withDetail() should add details without losing existing ones")
        void withDetail() {
            HealthStatus status = HealthStatus.up()
                    .withDetail("latencyMs", 42L)
                    .withDetail("dialect", "H2");

            assertEquals(2, status.details().size());
            assertEquals(42L, status.details().get("latencyMs"));
            assertThrows(UnsupportedOperationException.class, () -> status.details().put("x", 1));
        }

        @Test
        @DisplayName("Only DOWN should stop serving lookups")
        void serving() {
            assertTrue(HealthStatus.up().isServing());
            assertTrue(HealthStatus.degraded("store unreachable").isServing());
            assertFalse(HealthStatus.down("client unavailable").isServing());
        }

        @Test
        @DisplayName("Status severity should order UP, DEGRADED, DOWN")
        void severity() {
            assertTrue(HealthStatus.Status.DOWN.isWorseThan(HealthStatus.Status.DEGRADED));
            assertTrue(HealthStatus.Status.DEGRADED.isWorseThan(HealthStatus.Status.UP));
            assertFalse(HealthStatus.Status.UP.isWorseThan(HealthStatus.Status.UP));
            assertFalse(HealthStatus.Status.DEGRADED.isWorseThan(HealthStatus.Status.DOWN));
        }

        @Test
        @DisplayName("summary() should report status, message and details")
        void summary() {
            Map<String, Object> summary = HealthStatus.degraded("slow").withDetail("latencyMs", 900L).summary();

            assertEquals("DEGRADED", summary.get("status"));
            assertEquals("slow", summary.get("message"));
            assertEquals(Map.of("latencyMs", 900L), summary.get("details"));
        }

        @Test
        @DisplayName("Missing message should become empty and status should be required")
        void nullHandling() {
            assertEquals("", HealthStatus.down(null).message());
            assertThrows(NullPointerException.class, () -> new HealthStatus(null, "x", Map.of()));
        }
    }

    @Nested
    @DisplayName("StoreHealthCheck")
    class StoreHealthCheckTests {

        @Test
        @DisplayName("Should be UP for a reachable store")
        void reachable() {
            try (HikariStoreConnectionProvider provider = H2TestSupport.freshStore()) {
                HealthStatus status = new StoreHealthCheck(provider).check();

                assertTrue(status.isUp());
                assertEquals("H2", status.details().get("dialect"));
                assertTrue(status.details().containsKey("latencyMs"));
            }
        }

        @Test
        @DisplayName("Should be DEGRADED, not DOWN, for an unreachable store")
        void unreachable() {
            StoreConnectionProvider provider = mock(StoreConnectionProvider.class);
            when(provider.acquire()).thenThrow(new StoreUnavailableException("refused"));

            HealthStatus status = new StoreHealthCheck(provider).check();

            assertTrue(status.isDegraded());
            assertTrue(status.message().contains("refused"));
        }
    }

    @Nested
    @DisplayName("ConnectionPoolHealthCheck")
    class ConnectionPoolHealthCheckTests {

        private HealthStatus checkWith(PoolStats stats) {
            StoreConnectionProvider provider = mock(StoreConnectionProvider.class);
            when(provider.getStats()).thenReturn(stats);
            return new ConnectionPoolHealthCheck(provider).check();
        }

        @Test
        @DisplayName("Should be UP at low utilization")
        void lowUtilization() {
            HealthStatus status = checkWith(new PoolStats(3, 1, 2, 0, 10));

            assertTrue(status.isUp());
            assertEquals(10, status.details().get("maxPoolSize"));
        }

        @Test
        @DisplayName("Should be DEGRADED at high utilization")
        void highUtilization() {
            assertTrue(checkWith(new PoolStats(10, 9, 1, 0, 10)).isDegraded());
        }

        @Test
        @DisplayName("Should be DEGRADED when threads are waiting")
        void waitingThreads() {
            HealthStatus status = checkWith(new PoolStats(2, 1, 1, 3, 10));

            assertTrue(status.isDegraded());
            assertTrue(status.message().contains("3 threads"));
        }
    }

    @Nested
    @DisplayName("RemoteClientHealthCheck")
    class RemoteClientHealthCheckTests {

        @Test
        @DisplayName("Should be UP with the endpoint when the client is available")
        void available() {
            RemoteClient client = mock(RemoteClient.class);
            when(client.getEndpoint()).thenReturn("http://example/graphql");

            HealthStatus status = new RemoteClientHealthCheck(RemoteClientHandle.of(client)).check();

            assertTrue(status.isUp());
            assertEquals("http://example/graphql", status.details().get("endpoint"));
        }

        @Test
        @DisplayName("Should be DOWN when client setup failed")
        void unavailable() {
            HealthStatus status = new RemoteClientHealthCheck(RemoteClientHandle.failed("timeout")).check();

            assertTrue(status.isDown());
            assertTrue(status.message().contains("timeout"));
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        private HealthCheck fixed(String name, HealthStatus status) {
            return new HealthCheck() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return status;
                }
            };
        }

        @Test
        @DisplayName("Empty registry should be UP")
        void empty() {
            assertTrue(new HealthCheckRegistry().checkAll().isUp());
        }

        @Test
        @DisplayName("Worst status should win and every check should be reported")
        @SuppressWarnings("unchecked")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("a", HealthStatus.up()));
            registry.register(fixed("b", HealthStatus.degraded("slow")));
            registry.register(fixed("c", HealthStatus.up()));

            HealthStatus aggregate = registry.checkAll();

            assertTrue(aggregate.isDegraded());
            assertEquals("b: slow", aggregate.message());
            assertEquals(3, aggregate.details().size());
            assertEquals("DEGRADED", ((Map<String, Object>) aggregate.details().get("b")).get("status"));
        }

        @Test
        @DisplayName("DOWN should outrank DEGRADED regardless of registration order")
        void downOutranksDegraded() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("remote", HealthStatus.down("unavailable")));
            registry.register(fixed("store", HealthStatus.degraded(null)));

            HealthStatus aggregate = registry.checkAll();

            assertTrue(aggregate.isDown());
            assertFalse(aggregate.isServing());
            assertEquals("remote: unavailable", aggregate.message());
        }

        @Test
        @DisplayName("A throwing check should count as DOWN")
        void throwingCheck() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(new HealthCheck() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("boom");
                }
            });

            HealthStatus aggregate = registry.checkAll();

            assertTrue(aggregate.isDown());
            assertTrue(aggregate.message().contains("boom"));
        }
    }
}
