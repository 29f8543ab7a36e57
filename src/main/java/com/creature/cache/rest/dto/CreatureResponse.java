package com.creature.cache.rest.dto;

import com.creature.cache.api.LookupResult;
import com.creature.cache.core.model.CreatureRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for a creature lookup. {@code image} is the shiny sprite when one was asked for.
 */
public record CreatureResponse(
        int id,
        String name,
        Map<String, Integer> stats,
        @JsonProperty("total_base_stats") int totalBaseStats,
        List<String> types,
        String image,
        boolean shiny,
        String source
) {
    public static CreatureResponse from(LookupResult result, boolean shiny) {
        CreatureRecord record = result.record();
        return new CreatureResponse(
                record.id(),
                record.name(),
                record.stats(),
                record.totalBaseStats(),
                record.types(),
                record.imageFor(shiny),
                shiny,
                result.source().name()
        );
    }
}
