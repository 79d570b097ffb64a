package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import org.carball.cubeql.model.schema.MemberRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A member that analysis modes need on every cube they touch, such as the binding key or the
 * time dimension. Either one {@code Cube.member} shared by all steps, or an explicit per-cube list
 * {@code [{"cube": "Signups", "dimension": "Signups.userId"}, ...]}.
 */
public final class MemberMapping {

    private final String single;
    private final Map<String, String> perCube;

    private MemberMapping(String single, Map<String, String> perCube) {
        this.single = single;
        this.perCube = perCube;
    }

    public static MemberMapping of(String member) {
        return new MemberMapping(member, Map.of());
    }

    public static MemberMapping perCube(Map<String, String> mapping) {
        return new MemberMapping(null, new LinkedHashMap<>(mapping));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MemberMapping fromJson(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return of(node.asText());
        }
        if (node.isArray()) {
            Map<String, String> mapping = new LinkedHashMap<>();
            for (JsonNode entry : node) {
                String dimension = entry.path("dimension").asText(null);
                String cube = entry.path("cube").asText(null);
                if (dimension == null) {
                    throw new IllegalArgumentException("Member mapping entries need a 'dimension': " + entry);
                }
                mapping.put(cube != null ? cube : MemberRef.parse(dimension).cubeName(), dimension);
            }
            return perCube(mapping);
        }
        throw new IllegalArgumentException("Expected a member name or a list of {cube, dimension}: " + node);
    }

    @JsonValue
    public Object toJson() {
        if (single != null) {
            return single;
        }
        List<Map<String, String>> entries = new ArrayList<>();
        perCube.forEach((cube, dimension) -> entries.add(Map.of("cube", cube, "dimension", dimension)));
        return entries;
    }

    public boolean isSingle() {
        return single != null;
    }

    public String getSingle() {
        return single;
    }

    /**
     * The member to use for a given cube. A single member only applies to its own cube.
     */
    public Optional<String> forCube(String cubeName) {
        if (single != null) {
            return MemberRef.isQualified(single) && MemberRef.parse(single).cubeName().equals(cubeName)
                    ? Optional.of(single) : Optional.empty();
        }
        return Optional.ofNullable(perCube.get(cubeName));
    }

    /**
     * The cube named by the first mapping, used when a step does not say which cube it reads.
     */
    public Optional<String> defaultCube() {
        if (single != null) {
            return MemberRef.isQualified(single) ? Optional.of(MemberRef.parse(single).cubeName()) : Optional.empty();
        }
        return perCube.keySet().stream().findFirst();
    }

    public List<String> members() {
        return single != null ? List.of(single) : List.copyOf(perCube.values());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MemberMapping other)) {
            return false;
        }
        return Objects.equals(single, other.single) && perCube.equals(other.perCube);
    }

    @Override
    public int hashCode() {
        return Objects.hash(single, perCube);
    }

    @Override
    public String toString() {
        return String.valueOf(toJson());
    }
}
