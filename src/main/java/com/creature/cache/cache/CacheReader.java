package com.creature.cache.cache;

import com.creature.cache.core.model.CreatureRecord;
import com.creature.cache.store.StoreConnection;
import com.creature.cache.store.StoreConnectionProvider;
import com.creature.cache.store.StoreException;
import com.creature.cache.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up cached creatures and validates the stored row.
 * Reads only; a corrupt row is reported, never repaired or removed.
 */
public class CacheReader {
    private static final Logger log = LoggerFactory.getLogger(CacheReader.class);

    private final StoreConnectionProvider provider;
    private final CreatureTable table;
    private final FieldDecoder decoder;

    public CacheReader(StoreConnectionProvider provider, CreatureTable table, FieldDecoder decoder) {
        this.provider = provider;
        this.table = table;
        this.decoder = decoder;
    }

    /**
     * Reads the cached row for {@code id}.
     */
    public ReadResult read(int id) {
        Optional<Map<String, Object>> row;
        try (StoreConnection connection = provider.acquire()) {
            row = connection.queryOne(table.selectById(), List.of(id));
        } catch (StoreUnavailableException e) {
            log.warn("cache.read.unavailable id={} error={}", id, e.getMessage());
            return ReadResult.unavailable(e.getMessage());
        } catch (StoreException e) {
            log.warn("cache.read.failed id={} sqlState={} error={}", id, e.getSqlState(), e.getMessage());
            return ReadResult.unavailable(e.getMessage());
        }

        if (row.isEmpty()) {
            log.debug("cache.miss id={}", id);
            return ReadResult.miss();
        }
        return toResult(id, row.get());
    }

    private ReadResult toResult(int id, Map<String, Object> row) {
        FieldDecoder.Decoded<Map<String, Integer>> stats = decoder.decodeStats(row.get(CreatureTable.STATS));
        if (!stats.isValid()) {
            return corrupt(id, stats.failure());
        }
        FieldDecoder.Decoded<List<String>> types = decoder.decodeTypes(row.get(CreatureTable.TYPES));
        if (!types.isValid()) {
            return corrupt(id, types.failure());
        }
        if (!(row.get(CreatureTable.NAME) instanceof String name)) {
            return corrupt(id, "name is missing");
        }
        if (!(row.get(CreatureTable.TOTAL_BASE_STATS) instanceof Number total)) {
            return corrupt(id, "total_base_stats is missing");
        }

        CreatureRecord record = new CreatureRecord(
                id,
                name,
                stats.value(),
                total.intValue(),
                types.value(),
                textOrNull(row.get(CreatureTable.IMAGE)),
                textOrNull(row.get(CreatureTable.SHINY_IMAGE))
        );
        log.debug("cache.hit id={} statsEncoding={} typesEncoding={}", id, stats.encoding(), types.encoding());
        return ReadResult.hit(record);
    }

    private ReadResult corrupt(int id, String reason) {
        log.warn("cache.corrupt id={} reason='{}' - refetching, row left in place", id, reason);
        return ReadResult.corrupt(reason);
    }

    private static String textOrNull(Object value) {
        return value != null ? value.toString() : null;
    }
}
