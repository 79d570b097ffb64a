package org.carball.cubeql.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.exception.SchemaException;
import org.carball.cubeql.model.schema.Cube;
import org.carball.cubeql.model.schema.Dimension;
import org.carball.cubeql.model.schema.DimensionType;
import org.carball.cubeql.model.schema.JoinColumn;
import org.carball.cubeql.model.schema.JoinType;
import org.carball.cubeql.model.schema.JunctionTable;
import org.carball.cubeql.model.schema.Measure;
import org.carball.cubeql.model.schema.MeasureType;
import org.carball.cubeql.model.schema.Relationship;
import org.carball.cubeql.model.schema.RelationshipType;
import org.carball.cubeql.model.schema.SchemaSnapshot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads cube definitions from YAML or JSON. A document holds either a {@code cubes} list or a
 * single cube at its root. Measures, dimensions and joins may be written as lists of objects
 * with a {@code name}, or as maps keyed by name.
 */
@Slf4j
public class CubeDefinitionLoader {

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    public List<Cube> load(Path file) throws IOException {
        log.debug("Reading cube definitions from {}", file);
        return parse(Files.readString(file), file.getFileName().toString());
    }

    /**
     * Loads every {@code .yml}, {@code .yaml} and {@code .json} file directly under the directory,
     * in file name order.
     */
    public List<Cube> loadDirectory(Path directory) throws IOException {
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(CubeDefinitionLoader::isDefinitionFile).sorted().toList();
        }
        List<Cube> cubes = new ArrayList<>();
        for (Path file : files) {
            cubes.addAll(load(file));
        }
        log.info("Loaded {} cubes from {} files in {}", cubes.size(), files.size(), directory);
        return cubes;
    }

    /**
     * Loads and validates in one step.
     *
     * @throws SchemaException when a definition is malformed or the cubes do not form a valid schema
     */
    public SchemaSnapshot loadSnapshot(Path path) throws IOException {
        List<Cube> cubes = Files.isDirectory(path) ? loadDirectory(path) : load(path);
        return SchemaSnapshot.of(1, cubes);
    }

    /**
     * YAML is a superset of JSON, so one reader handles both.
     */
    public List<Cube> parse(String content, String source) {
        JsonNode root;
        try {
            root = yaml.readTree(content);
        } catch (JsonProcessingException e) {
            throw new SchemaException("Cannot read " + source + ": " + e.getOriginalMessage());
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            return List.of();
        }

        List<String> problems = new ArrayList<>();
        List<Cube> cubes = new ArrayList<>();
        if (root.has("cubes")) {
            for (Map.Entry<String, JsonNode> entry : entries(root.get("cubes"))) {
                cube(entry.getKey(), entry.getValue(), problems, cubes);
            }
        } else {
            cube(null, root, problems, cubes);
        }

        if (!problems.isEmpty()) {
            problems.replaceAll(problem -> source + ": " + problem);
            throw new SchemaException(problems);
        }
        return cubes;
    }

    private void cube(String key, JsonNode node, List<String> problems, List<Cube> cubes) {
        String name = text(node, "name", key);
        if (name == null) {
            problems.add("cube without a name");
            return;
        }
        String sqlTable = text(node, "sqlTable", text(node, "sql_table", null));
        if (sqlTable == null) {
            problems.add("cube '" + name + "' has no sqlTable");
        }
        Cube.CubeBuilder cube = Cube.builder()
                .name(name)
                .title(text(node, "title", null))
                .description(text(node, "description", null))
                .sqlTable(sqlTable);

        for (Map.Entry<String, JsonNode> entry : entries(node.get("measures"))) {
            try {
                cube.measure(measure(entry.getKey(), entry.getValue()));
            } catch (IllegalArgumentException e) {
                problems.add("measure in cube '" + name + "': " + e.getMessage());
            }
        }
        for (Map.Entry<String, JsonNode> entry : entries(node.get("dimensions"))) {
            try {
                cube.dimension(dimension(entry.getKey(), entry.getValue()));
            } catch (IllegalArgumentException e) {
                problems.add("dimension in cube '" + name + "': " + e.getMessage());
            }
        }
        for (Map.Entry<String, JsonNode> entry : entries(node.get("joins"))) {
            try {
                cube.join(relationship(entry.getKey(), entry.getValue()));
            } catch (IllegalArgumentException e) {
                problems.add("join in cube '" + name + "': " + e.getMessage());
            }
        }
        cubes.add(cube.build());
    }

    private static Measure measure(String key, JsonNode node) {
        String name = required(node, "name", key);
        Measure.MeasureBuilder measure = Measure.builder()
                .name(name)
                .title(text(node, "title", null))
                .type(MeasureType.fromValue(required(node, "type", null)))
                .sql(text(node, "sql", null))
                .calculatedSql(text(node, "calculatedSql", null))
                .format(text(node, "format", null));
        JsonNode filters = node.get("filters");
        if (filters != null) {
            for (JsonNode filter : filters) {
                // Cube.js style filters are objects with a sql key
                measure.filter(filter.isObject() ? filter.path("sql").asText() : filter.asText());
            }
        }
        return measure.build();
    }

    private static Dimension dimension(String key, JsonNode node) {
        return Dimension.builder()
                .name(required(node, "name", key))
                .title(text(node, "title", null))
                .type(DimensionType.fromValue(required(node, "type", null)))
                .sql(text(node, "sql", null))
                .primaryKey(node.path("primaryKey").asBoolean(node.path("primary_key").asBoolean(false)))
                .build();
    }

    private static Relationship relationship(String key, JsonNode node) {
        String target = text(node, "targetCube", key);
        if (target == null) {
            throw new IllegalArgumentException("targetCube is required");
        }
        Relationship.RelationshipBuilder relationship = Relationship.builder()
                .name(text(node, "name", target))
                .targetCube(target)
                .type(RelationshipType.fromValue(required(node, "relationship", null)));
        String joinType = text(node, "sqlJoinType", null);
        if (joinType != null) {
            relationship.sqlJoinType(JoinType.fromValue(joinType));
        }
        relationship.joinColumns(joinColumns(node.get("on")));

        JsonNode through = node.get("through");
        if (through != null) {
            relationship.junctionTable(JunctionTable.builder()
                    .table(required(through, "table", null))
                    .sourceColumns(joinColumns(through.get("sourceColumns")))
                    .targetColumns(joinColumns(through.get("targetColumns")))
                    .build());
        }
        return relationship.build();
    }

    private static List<JoinColumn> joinColumns(JsonNode node) {
        List<JoinColumn> columns = new ArrayList<>();
        if (node == null) {
            return columns;
        }
        List<JsonNode> pairs = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(pairs::add);
        } else {
            pairs.add(node);
        }
        for (JsonNode column : pairs) {
            columns.add(new JoinColumn(required(column, "sourceColumn", null), required(column, "targetColumn", null)));
        }
        return columns;
    }

    private static List<Map.Entry<String, JsonNode>> entries(JsonNode node) {
        List<Map.Entry<String, JsonNode>> entries = new ArrayList<>();
        if (node == null || node.isNull()) {
            return entries;
        }
        if (node.isArray()) {
            node.forEach(element -> entries.add(new AbstractMap.SimpleEntry<>(null, element)));
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            fields.forEachRemaining(entries::add);
        }
        return entries;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }

    private static String required(JsonNode node, String field, String fallback) {
        String value = text(node, field, fallback);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    private static boolean isDefinitionFile(Path path) {
        String name = path.getFileName().toString().toLowerCase();
        return Files.isRegularFile(path) && (name.endsWith(".yml") || name.endsWith(".yaml") || name.endsWith(".json"));
    }
}
