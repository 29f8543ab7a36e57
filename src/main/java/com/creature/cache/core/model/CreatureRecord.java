package com.creature.cache.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A creature's identity, stat block, type tags and sprite URLs.
 * This is the unit that is cached per id and returned to callers.
 *
 * <p>{@code totalBaseStats} is stored alongside the stats rather than recomputed.
 * Records built through {@link #of} compute it from the stats; records read back from
 * the store carry whatever total was persisted.</p>
 *
 * @param id             positive creature id, unique across the store
 * @param name           creature name
 * @param stats          stat name to base value, in the order they were received
 * @param totalBaseStats sum of the stat values at write time
 * @param types          type names, in order
 * @param image          default sprite URL, or null
 * @param shinyImage     shiny sprite URL, or null
 */
public record CreatureRecord(
        int id,
        String name,
        Map<String, Integer> stats,
        int totalBaseStats,
        List<String> types,
        String image,
        String shinyImage
) {
    public CreatureRecord {
        if (id <= 0) {
            throw new IllegalArgumentException("id must be > 0");
        }
        Objects.requireNonNull(name, "name is required");
        stats = stats != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(stats))
                : Map.of();
        types = types != null ? List.copyOf(types) : List.of();
    }

    /**
     * Creates a record whose total is the sum of the given stats.
     */
    public static CreatureRecord of(int id, String name, Map<String, Integer> stats,
                                    List<String> types, String image, String shinyImage) {
        return new CreatureRecord(id, name, stats, sumOf(stats), types, image, shinyImage);
    }

    /**
     * Sums stat values. An empty or null map sums to 0.
     *
     * @throws ArithmeticException if the sum does not fit in an int
     */
    public static int sumOf(Map<String, Integer> stats) {
        if (stats == null) {
            return 0;
        }
        int total = 0;
        for (Integer value : stats.values()) {
            total = Math.addExact(total, value);
        }
        return total;
    }

    /**
     * Returns the shiny sprite when {@code shiny} is set, the default sprite otherwise.
     */
    public String imageFor(boolean shiny) {
        return shiny ? shinyImage : image;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int id;
        private String name;
        private final Map<String, Integer> stats = new LinkedHashMap<>();
        private List<String> types;
        private String image;
        private String shinyImage;

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder stat(String statName, int baseValue) {
            this.stats.put(statName, baseValue);
            return this;
        }

        public Builder stats(Map<String, Integer> stats) {
            this.stats.clear();
            this.stats.putAll(stats);
            return this;
        }

        public Builder types(List<String> types) {
            this.types = types;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder shinyImage(String shinyImage) {
            this.shinyImage = shinyImage;
            return this;
        }

        public CreatureRecord build() {
            return CreatureRecord.of(id, name, stats, types, image, shinyImage);
        }
    }
}
