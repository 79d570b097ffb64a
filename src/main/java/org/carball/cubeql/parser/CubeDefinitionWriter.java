package org.carball.cubeql.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.carball.cubeql.model.schema.Cube;
import org.carball.cubeql.model.schema.Dimension;
import org.carball.cubeql.model.schema.JoinColumn;
import org.carball.cubeql.model.schema.Measure;
import org.carball.cubeql.model.schema.Relationship;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes cubes in the document layout {@link CubeDefinitionLoader} reads.
 */
public class CubeDefinitionWriter {

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

    public String toYaml(List<Cube> cubes) throws JsonProcessingException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("cubes", cubes.stream().map(CubeDefinitionWriter::cube).toList());
        return yaml.writeValueAsString(document);
    }

    public void write(List<Cube> cubes, Path file) throws IOException {
        Files.writeString(file, toYaml(cubes));
    }

    private static Map<String, Object> cube(Cube cube) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("name", cube.getName());
        putIfPresent(node, "title", cube.getTitle());
        putIfPresent(node, "description", cube.getDescription());
        node.put("sqlTable", cube.getSqlTable());
        if (!cube.getMeasures().isEmpty()) {
            node.put("measures", cube.getMeasures().stream().map(CubeDefinitionWriter::measure).toList());
        }
        if (!cube.getDimensions().isEmpty()) {
            node.put("dimensions", cube.getDimensions().stream().map(CubeDefinitionWriter::dimension).toList());
        }
        if (!cube.getJoins().isEmpty()) {
            node.put("joins", cube.getJoins().stream().map(CubeDefinitionWriter::join).toList());
        }
        return node;
    }

    private static Map<String, Object> measure(Measure measure) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("name", measure.getName());
        putIfPresent(node, "title", measure.getTitle());
        node.put("type", measure.getType().getValue());
        putIfPresent(node, "sql", measure.getSql());
        putIfPresent(node, "calculatedSql", measure.getCalculatedSql());
        if (!measure.getFilters().isEmpty()) {
            node.put("filters", measure.getFilters());
        }
        putIfPresent(node, "format", measure.getFormat());
        return node;
    }

    private static Map<String, Object> dimension(Dimension dimension) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("name", dimension.getName());
        putIfPresent(node, "title", dimension.getTitle());
        node.put("type", dimension.getType().getValue());
        putIfPresent(node, "sql", dimension.getSql());
        if (dimension.isPrimaryKey()) {
            node.put("primaryKey", true);
        }
        return node;
    }

    private static Map<String, Object> join(Relationship join) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("name", join.getName());
        node.put("targetCube", join.getTargetCube());
        node.put("relationship", join.getType().getValue());
        if (join.getSqlJoinType() != null) {
            node.put("sqlJoinType", join.getSqlJoinType().value());
        }
        if (!join.getJoinColumns().isEmpty()) {
            node.put("on", columns(join.getJoinColumns()));
        }
        if (join.getJunctionTable() != null) {
            Map<String, Object> through = new LinkedHashMap<>();
            through.put("table", join.getJunctionTable().getTable());
            through.put("sourceColumns", columns(join.getJunctionTable().getSourceColumns()));
            through.put("targetColumns", columns(join.getJunctionTable().getTargetColumns()));
            node.put("through", through);
        }
        return node;
    }

    private static List<Map<String, Object>> columns(List<JoinColumn> columns) {
        List<Map<String, Object>> pairs = new ArrayList<>();
        for (JoinColumn column : columns) {
            Map<String, Object> pair = new LinkedHashMap<>();
            pair.put("sourceColumn", column.sourceColumn());
            pair.put("targetColumn", column.targetColumn());
            pairs.add(pair);
        }
        return pairs;
    }

    private static void putIfPresent(Map<String, Object> node, String key, String value) {
        if (value != null) {
            node.put(key, value);
        }
    }
}
