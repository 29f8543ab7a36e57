package com.creature.cache.cache;

import com.creature.cache.core.model.CreatureRecord;
import com.creature.cache.store.H2TestSupport;
import com.creature.cache.store.HikariStoreConnectionProvider;
import com.creature.cache.store.SqlDialect;
import com.creature.cache.store.StoreConnection;
import com.creature.cache.store.StoreConnectionProvider;
import com.creature.cache.store.StoreException;
import com.creature.cache.store.StoreUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("CacheWriter Tests")
class CacheWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static CreatureRecord pikachu() {
        return CreatureRecord.builder()
                .id(25)
                .name("pikachu")
                .stat("hp", 35)
                .stat("attack", 55)
                .types(List.of("electric"))
                .image("default.png")
                .shinyImage("shiny.png")
                .build();
    }

    @Nested
    @DisplayName("Against H2")
    class H2Tests {

        private HikariStoreConnectionProvider provider;
        private CreatureTable table;
        private CacheWriter writer;

        @BeforeEach
        void setUp() {
            provider = H2TestSupport.freshStore();
            table = new CreatureTable("pokemon", provider.getDialect());
            writer = new CacheWriter(provider, table, objectMapper);
        }

        @AfterEach
        void tearDown() {
            provider.close();
        }

        @Test
        @DisplayName("Should write a new row that reads back as the same record")
        void writesRow() {
            WriteResult result = writer.write(pikachu());

            assertEquals(WriteResult.Status.WRITTEN, result.status());
            ReadResult read = new CacheReader(provider, table, new FieldDecoder(objectMapper)).read(25);
            assertEquals(pikachu(), read.record());
        }

        @Test
        @DisplayName("Second write of the same id should be already present, not an error")
        void duplicateIsAlreadyPresent() {
            writer.write(pikachu());

            CreatureRecord renamed = CreatureRecord.of(25, "raichu", Map.of("hp", 60), List.of("electric"), null, null);
            WriteResult second = writer.write(renamed);

            assertEquals(WriteResult.Status.ALREADY_PRESENT, second.status());
            assertFalse(second.isFailure());
            assertEquals("pikachu", H2TestSupport.row(provider, 25).get("name"));
            assertEquals(1, H2TestSupport.countRows(provider, 25));
        }

        @Test
        @DisplayName("Should store stats and types as JSON text")
        void storesJson() {
            writer.write(pikachu());

            Map<String, Object> row = H2TestSupport.row(provider, 25);
            assertEquals("{\"hp\":35,\"attack\":55}", row.get("stats"));
            assertEquals("[\"electric\"]", row.get("types"));
            assertEquals(90, ((Number) row.get("total_base_stats")).intValue());
        }

        @Test
        @DisplayName("Write to a missing table should fail")
        void missingTable() {
            CacheWriter wrongTable = new CacheWriter(provider, new CreatureTable("no_such_table", SqlDialect.H2), objectMapper);

            WriteResult result = wrongTable.write(pikachu());

            assertTrue(result.isFailure());
            assertNotNull(result.cause());
        }
    }

    @Nested
    @DisplayName("Against H2 with JSON columns")
    class H2JsonTests {

        private HikariStoreConnectionProvider provider;
        private CreatureTable table;

        @BeforeEach
        void setUp() {
            provider = H2TestSupport.freshJsonStore();
            table = new CreatureTable("pokemon", provider.getDialect());
        }

        @AfterEach
        void tearDown() {
            provider.close();
        }

        @Test
        @DisplayName("Should store JSON documents that read back as a hit")
        void writesJsonDocuments() {
            WriteResult result = new CacheWriter(provider, table, objectMapper).write(pikachu());

            assertEquals(WriteResult.Status.WRITTEN, result.status());
            ReadResult read = new CacheReader(provider, table, new FieldDecoder(objectMapper)).read(25);
            assertEquals(ReadResult.Status.HIT, read.status());
            assertEquals(pikachu(), read.record());
        }

        @Test
        @DisplayName("Should keep the first row when the same id is written twice")
        void duplicateIsAlreadyPresent() {
            CacheWriter writer = new CacheWriter(provider, table, objectMapper);
            writer.write(pikachu());

            assertEquals(WriteResult.Status.ALREADY_PRESENT, writer.write(pikachu()).status());
            assertEquals(1, H2TestSupport.countRows(provider, 25));
        }
    }

    @Nested
    @DisplayName("With a mocked store")
    @ExtendWith(MockitoExtension.class)
    class MockedStoreTests {

        @Mock
        private StoreConnectionProvider provider;

        @Mock
        private StoreConnection connection;

        private CacheWriter writer;

        @BeforeEach
        void setUp() {
            writer = new CacheWriter(provider, new CreatureTable("pokemon", SqlDialect.POSTGRESQL), objectMapper);
        }

        @Test
        @DisplayName("PostgreSQL insert should use ON CONFLICT DO NOTHING and treat 0 rows as present")
        @SuppressWarnings("unchecked")
        void postgresZeroRows() {
            when(provider.acquire()).thenReturn(connection);
            when(connection.execute(anyString(), anyList())).thenReturn(0);

            WriteResult result = writer.write(pikachu());

            ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
            ArgumentCaptor<List<Object>> params = ArgumentCaptor.forClass(List.class);
            verify(connection).execute(sql.capture(), params.capture());
            assertTrue(sql.getValue().endsWith("ON CONFLICT (id) DO NOTHING"));
            assertTrue(sql.getValue().contains("?, CAST(? AS jsonb), ?, CAST(? AS jsonb), ?, ?"));
            assertEquals("{\"hp\":35,\"attack\":55}", params.getValue().get(2));
            assertEquals(25, params.getValue().get(0));
            assertEquals(90, params.getValue().get(3));
            assertEquals(WriteResult.Status.ALREADY_PRESENT, result.status());
            verify(connection).close();
        }

        @Test
        @DisplayName("MySQL duplicate entry should be already present")
        void mysqlDuplicate() {
            StoreException duplicate = new StoreException("dup",
                    new SQLException("Duplicate entry '25' for key 'PRIMARY'", "23000", 1062));
            when(provider.acquire()).thenReturn(connection);
            when(connection.execute(anyString(), anyList())).thenThrow(duplicate);

            assertEquals(WriteResult.Status.ALREADY_PRESENT, writer.write(pikachu()).status());
        }

        @Test
        @DisplayName("Other constraint violations should fail")
        void otherConstraint() {
            StoreException notNull = new StoreException("not null",
                    new SQLException("null value in column", "23502"));
            when(provider.acquire()).thenReturn(connection);
            when(connection.execute(anyString(), anyList())).thenThrow(notNull);

            WriteResult result = writer.write(pikachu());

            assertEquals(WriteResult.Status.FAILED, result.status());
            assertSame(notNull, result.cause());
        }

        @Test
        @DisplayName("Unavailable store should fail without throwing")
        void storeUnavailable() {
            when(provider.acquire()).thenThrow(new StoreUnavailableException("refused"));

            WriteResult result = writer.write(pikachu());

            assertTrue(result.isFailure());
            assertTrue(result.reason().contains("refused"));
        }
    }
}
