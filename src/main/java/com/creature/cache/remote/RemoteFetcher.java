package com.creature.cache.remote;

import com.creature.cache.cache.FieldDecoder;
import com.creature.cache.core.model.CreatureRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches one creature from the remote source and normalizes the response
 * into a {@link CreatureRecord}.
 *
 * <p>Failures are reported as {@link FetchResult.Status#ERROR} and never retried here.
 * A response that cannot be normalized completely yields no record at all.</p>
 */
public class RemoteFetcher {
    private static final Logger log = LoggerFactory.getLogger(RemoteFetcher.class);

    private final RemoteClient client;
    private final FieldDecoder decoder;

    public RemoteFetcher(RemoteClient client, FieldDecoder decoder) {
        this.client = client;
        this.decoder = decoder;
    }

    /**
     * Fetches the creature with the given id.
     */
    public FetchResult fetch(int id) {
        log.info("remote.fetch id={} endpoint={}", id, client.getEndpoint());

        JsonNode data;
        try {
            data = client.execute(CreatureQuery.DOCUMENT, Map.of(CreatureQuery.ID_VARIABLE, id));
        } catch (RuntimeException e) {
            log.error("remote.fetch.failed id={} error={}", id, e.getMessage(), e);
            return FetchResult.error(e.getMessage());
        }

        JsonNode matches = data == null ? null : data.get(CreatureQuery.ROOT);
        if (matches == null || matches.isNull() || (matches.isArray() && matches.isEmpty())) {
            log.info("remote.fetch.not_found id={}", id);
            return FetchResult.notFound();
        }

        try {
            if (!matches.isArray()) {
                throw new MalformedResponseException(CreatureQuery.ROOT + " is not a list");
            }
            return FetchResult.found(normalize(id, matches.get(0)));
        } catch (MalformedResponseException e) {
            log.error("remote.fetch.malformed id={} error={}", id, e.getMessage());
            return FetchResult.error("Malformed response: " + e.getMessage());
        }
    }

    private CreatureRecord normalize(int requestedId, JsonNode creature) {
        if (creature == null || !creature.isObject()) {
            throw new MalformedResponseException("creature entry is not an object");
        }

        JsonNode idNode = creature.path("id");
        if (!idNode.isIntegralNumber() || !idNode.canConvertToInt()) {
            throw new MalformedResponseException("id is missing or not an integer");
        }
        if (idNode.intValue() != requestedId) {
            throw new MalformedResponseException("asked for id " + requestedId + ", got " + idNode.intValue());
        }

        JsonNode nameNode = creature.path("name");
        if (!nameNode.isTextual()) {
            throw new MalformedResponseException("name is missing");
        }

        Map<String, Integer> stats = readStats(creature.path(CreatureQuery.STATS));
        List<String> types = readTypes(creature.path(CreatureQuery.TYPES));
        JsonNode sprites = readSprites(requestedId, creature.path(CreatureQuery.SPRITES));

        try {
            return CreatureRecord.of(
                    requestedId,
                    nameNode.textValue(),
                    stats,
                    types,
                    textOrNull(sprites.get(CreatureQuery.FRONT_DEFAULT)),
                    textOrNull(sprites.get(CreatureQuery.FRONT_SHINY))
            );
        } catch (ArithmeticException e) {
            throw new MalformedResponseException("total of base stats overflows an int");
        }
    }

    private Map<String, Integer> readStats(JsonNode entries) {
        Map<String, Integer> stats = new LinkedHashMap<>();
        for (JsonNode entry : listOrEmpty(entries, CreatureQuery.STATS)) {
            JsonNode statName = entry.path(CreatureQuery.STAT).path("name");
            JsonNode baseStat = entry.path(CreatureQuery.BASE_STAT);
            if (!statName.isTextual()) {
                throw new MalformedResponseException("stat entry without a name");
            }
            if (!baseStat.isIntegralNumber() || !baseStat.canConvertToInt()) {
                throw new MalformedResponseException("stat '" + statName.textValue() + "' has no integer base value");
            }
            stats.put(statName.textValue(), baseStat.intValue());
        }
        return stats;
    }

    private List<String> readTypes(JsonNode entries) {
        List<String> types = new ArrayList<>();
        for (JsonNode entry : listOrEmpty(entries, CreatureQuery.TYPES)) {
            JsonNode typeName = entry.path(CreatureQuery.TYPE).path("name");
            if (!typeName.isTextual()) {
                throw new MalformedResponseException("type entry without a name");
            }
            types.add(typeName.textValue());
        }
        return types;
    }

    /**
     * Returns the first sprite bundle as an object. A missing or undecodable bundle
     * becomes an empty object so the creature still normalizes, just without images.
     */
    private JsonNode readSprites(int id, JsonNode entries) {
        JsonNode bundle = entries.isArray() && !entries.isEmpty()
                ? entries.get(0).get(CreatureQuery.SPRITE_BUNDLE)
                : null;
        if (bundle == null || bundle.isNull()) {
            return JsonNodeFactory.instance.objectNode();
        }

        FieldDecoder.Decoded<JsonNode> decoded = decoder.decodeObject(bundle);
        if (!decoded.isValid()) {
            log.warn("remote.sprites.invalid id={} reason='{}' - continuing without images", id, decoded.failure());
            return JsonNodeFactory.instance.objectNode();
        }
        return decoded.value();
    }

    private static Iterable<JsonNode> listOrEmpty(JsonNode node, String field) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new MalformedResponseException(field + " is not a list");
        }
        return node;
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.textValue() : null;
    }

    private static class MalformedResponseException extends RuntimeException {
        MalformedResponseException(String message) {
            super(message);
        }
    }
}
