package com.creature.cache.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes structured fields that may be stored either as native structures
 * (maps, lists, JSON trees) or as JSON text.
 *
 * <p>Every decode goes through the same two steps: classify the raw value's
 * {@link Encoding}, turn it into a JSON tree, then check the tree has the expected
 * shape. The outcome is a {@link Decoded} carrying either the value or the reason
 * it could not be used.</p>
 */
public class FieldDecoder {

    /**
     * How a raw value arrived.
     */
    public enum Encoding { STRUCTURED, TEXT, UNSUPPORTED }

    /**
     * Result of decoding one field.
     *
     * @param encoding how the raw value was represented
     * @param value    decoded value, null when decoding failed
     * @param failure  reason decoding failed, null on success
     */
    public record Decoded<T>(Encoding encoding, T value, String failure) {

        static <T> Decoded<T> valid(Encoding encoding, T value) {
            return new Decoded<>(encoding, value, null);
        }

        static <T> Decoded<T> invalid(Encoding encoding, String failure) {
            return new Decoded<>(encoding, null, failure);
        }

        public boolean isValid() {
            return failure == null;
        }
    }

    private final ObjectMapper objectMapper;

    public FieldDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decodes a stat block: a JSON object whose values are all integers.
     */
    public Decoded<Map<String, Integer>> decodeStats(Object raw) {
        Encoding encoding = classify(raw);
        JsonNode node;
        try {
            node = toTree(raw, encoding);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            return Decoded.invalid(encoding, "stats not decodable: " + e.getMessage());
        }
        if (!node.isObject()) {
            return Decoded.invalid(encoding, "stats is not a mapping: " + node.getNodeType());
        }

        Map<String, Integer> stats = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.isIntegralNumber() || !value.canConvertToInt()) {
                return Decoded.invalid(encoding, "stat '" + field.getKey() + "' is not an integer");
            }
            stats.put(field.getKey(), value.intValue());
        }
        return Decoded.valid(encoding, stats);
    }

    /**
     * Decodes a type list: a JSON array of strings.
     */
    public Decoded<List<String>> decodeTypes(Object raw) {
        Encoding encoding = classify(raw);
        JsonNode node;
        try {
            node = toTree(raw, encoding);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            return Decoded.invalid(encoding, "types not decodable: " + e.getMessage());
        }
        if (!node.isArray()) {
            return Decoded.invalid(encoding, "types is not a sequence: " + node.getNodeType());
        }

        List<String> types = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                return Decoded.invalid(encoding, "type entry is not a string: " + element);
            }
            types.add(element.textValue());
        }
        return Decoded.valid(encoding, types);
    }

    /**
     * Decodes a JSON object such as a sprite bundle.
     */
    public Decoded<JsonNode> decodeObject(Object raw) {
        Encoding encoding = classify(raw);
        JsonNode node;
        try {
            node = toTree(raw, encoding);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            return Decoded.invalid(encoding, "not decodable: " + e.getMessage());
        }
        if (!node.isObject()) {
            return Decoded.invalid(encoding, "not an object: " + node.getNodeType());
        }
        return Decoded.valid(encoding, node);
    }

    /**
     * Classifies a raw value. Null and anything that is neither a structure nor text
     * is {@link Encoding#UNSUPPORTED}.
     */
    public static Encoding classify(Object raw) {
        if (raw instanceof JsonNode node) {
            return node.isTextual() ? Encoding.TEXT : Encoding.STRUCTURED;
        }
        if (raw instanceof Map<?, ?> || raw instanceof List<?>) {
            return Encoding.STRUCTURED;
        }
        if (raw instanceof CharSequence) {
            return Encoding.TEXT;
        }
        return Encoding.UNSUPPORTED;
    }

    private JsonNode toTree(Object raw, Encoding encoding) throws JsonProcessingException {
        return switch (encoding) {
            case STRUCTURED -> raw instanceof JsonNode node ? node : objectMapper.valueToTree(raw);
            case TEXT -> parseText(raw instanceof JsonNode node ? node.textValue() : raw.toString());
            case UNSUPPORTED -> throw new IllegalArgumentException("unsupported representation: "
                    + (raw == null ? "null" : raw.getClass().getSimpleName()));
        };
    }

    private JsonNode parseText(String text) throws JsonProcessingException {
        if (text.isBlank()) {
            throw new IllegalArgumentException("empty text");
        }
        return objectMapper.readTree(text);
    }
}
