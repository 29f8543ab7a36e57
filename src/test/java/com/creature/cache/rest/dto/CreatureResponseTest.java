package com.creature.cache.rest.dto;

import com.creature.cache.api.LookupResult;
import com.creature.cache.core.model.CreatureRecord;
import com.creature.cache.health.HealthStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Response DTO Tests")
class CreatureResponseTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final CreatureRecord pikachu = CreatureRecord.builder()
            .id(25)
            .name("pikachu")
            .stat("hp", 35)
            .stat("attack", 55)
            .types(List.of("electric"))
            .image("p.png")
            .shinyImage("ps.png")
            .build();

    @Test
    @DisplayName("Should use the default sprite unless shiny is requested")
    void imageSelection() {
        LookupResult result = LookupResult.fromRemote(pikachu);

        assertEquals("p.png", CreatureResponse.from(result, false).image());
        CreatureResponse shiny = CreatureResponse.from(result, true);
        assertEquals("ps.png", shiny.image());
        assertTrue(shiny.shiny());
        assertEquals("REMOTE", shiny.source());
    }

    @Test
    @DisplayName("Should serialize total_base_stats in snake case")
    void serialization() throws Exception {
        JsonNode json = objectMapper.valueToTree(CreatureResponse.from(LookupResult.fromCache(pikachu), false));

        assertEquals(90, json.get("total_base_stats").intValue());
        assertEquals(35, json.get("stats").get("hp").intValue());
        assertEquals("electric", json.get("types").get(0).textValue());
        assertEquals("CACHE", json.get("source").textValue());
        assertFalse(json.has("totalBaseStats"));
    }

    @Test
    @DisplayName("HealthResponse should expose per-check results")
    void healthResponse() {
        HealthStatus status = HealthStatus.degraded("store: unreachable").withDetail("store", "DEGRADED");

        HealthResponse response = HealthResponse.from(status);

        assertEquals("DEGRADED", response.status());
        assertEquals("DEGRADED", response.checks().get("store"));
    }
}
