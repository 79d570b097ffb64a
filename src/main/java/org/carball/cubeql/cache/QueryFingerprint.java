package org.carball.cubeql.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.carball.cubeql.exception.CompilationException;
import org.carball.cubeql.model.query.SemanticQuery;
import org.carball.cubeql.sql.DatabaseEngine;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Cache key for a compiled query: the schema version, the engine, the UTC date relative ranges
 * resolve against and an FNV-1a hash of the query's canonical JSON. Object keys are sorted and
 * nulls dropped; array order is kept because it decides column and parameter order.
 */
public record QueryFingerprint(long schemaVersion, DatabaseEngine engine, LocalDate asOf, String hash,
                               String canonicalJson) {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public static QueryFingerprint of(long schemaVersion, DatabaseEngine engine, LocalDate asOf, SemanticQuery query) {
        String canonical = canonicalJson(query);
        return new QueryFingerprint(schemaVersion, engine, asOf, fnv1a(canonical), canonical);
    }

    /**
     * The cache map key. Two fingerprints with equal keys are confirmed equal by {@link #canonicalJson}.
     */
    public String key() {
        return "v" + schemaVersion + ":" + engine.value() + ":" + asOf + ":" + hash;
    }

    static String canonicalJson(SemanticQuery query) {
        try {
            JsonNode tree = MAPPER.valueToTree(query);
            return MAPPER.writeValueAsString(canonicalize(tree));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CompilationException("invalid_query", "Query cannot be serialized: " + e.getMessage(), e);
        }
    }

    private static JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> fields = node.fieldNames();
            fields.forEachRemaining(names::add);
            names.sort(null);
            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                JsonNode value = node.get(name);
                if (value.isNull() || (value.isContainerNode() && value.isEmpty())) {
                    continue;
                }
                sorted.set(name, canonicalize(value));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            node.forEach(element -> array.add(canonicalize(element)));
            return array;
        }
        return node;
    }

    static String fnv1a(String text) {
        long hash = FNV_OFFSET_BASIS;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return String.format("%016x", hash);
    }
}
