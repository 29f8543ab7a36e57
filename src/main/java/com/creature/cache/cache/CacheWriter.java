package com.creature.cache.cache;

import com.creature.cache.core.model.CreatureRecord;
import com.creature.cache.store.StoreConnection;
import com.creature.cache.store.StoreConnectionProvider;
import com.creature.cache.store.StoreException;
import com.creature.cache.store.StoreUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Persists normalized creatures with insert-or-ignore semantics.
 *
 * <p>Concurrent writers racing on the same id never see a uniqueness error:
 * whichever insert loses is reported as {@link WriteResult.Status#ALREADY_PRESENT}.
 * Existing rows are never updated.</p>
 *
 * <p>Stats and types are serialized to JSON text; the insert statement converts them
 * for JSON-typed columns.</p>
 */
public class CacheWriter {
    private static final Logger log = LoggerFactory.getLogger(CacheWriter.class);

    private final StoreConnectionProvider provider;
    private final CreatureTable table;
    private final ObjectMapper objectMapper;

    public CacheWriter(StoreConnectionProvider provider, CreatureTable table, ObjectMapper objectMapper) {
        this.provider = provider;
        this.table = table;
        this.objectMapper = objectMapper;
    }

    /**
     * Writes {@code record} unless a row with its id already exists.
     */
    public WriteResult write(CreatureRecord record) {
        String statsJson;
        String typesJson;
        try {
            statsJson = objectMapper.writeValueAsString(record.stats());
            typesJson = objectMapper.writeValueAsString(record.types());
        } catch (JsonProcessingException e) {
            return WriteResult.failed("Could not serialize creature " + record.id() + ": " + e.getMessage(), e);
        }

        List<Object> params = Arrays.asList(
                record.id(),
                record.name(),
                statsJson,
                record.totalBaseStats(),
                typesJson,
                record.image(),
                record.shinyImage()
        );

        try (StoreConnection connection = provider.acquire()) {
            int inserted = connection.execute(table.insertIgnoring(), params);
            if (inserted == 0) {
                log.debug("cache.write.skipped id={} - row already present", record.id());
                return WriteResult.alreadyPresent();
            }
            log.debug("cache.write.inserted id={}", record.id());
            return WriteResult.written();
        } catch (StoreUnavailableException e) {
            return WriteResult.failed("Store unavailable: " + e.getMessage(), e);
        } catch (StoreException e) {
            if (e.isUniqueViolation()) {
                log.debug("cache.write.raced id={} - another writer inserted first", record.id());
                return WriteResult.alreadyPresent();
            }
            return WriteResult.failed(e.getMessage(), e);
        }
    }
}
