package org.carball.cubeql.model.schema;

import lombok.Getter;
import org.carball.cubeql.exception.SchemaException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * A versioned, immutable view of every cube known to the compiler. Built once, validated once,
 * and passed explicitly into every compilation. Reloading a schema produces a new snapshot.
 */
@Getter
public final class SchemaSnapshot {

    private final long version;
    private final Map<String, Cube> cubes;
    private final JoinGraph joinGraph;

    private SchemaSnapshot(long version, Map<String, Cube> cubes) {
        this.version = version;
        this.cubes = cubes;
        this.joinGraph = JoinGraph.of(cubes.values());
    }

    /**
     * Validates the cubes and freezes them into a snapshot.
     *
     * @throws SchemaException listing every problem found
     */
    public static SchemaSnapshot of(long version, Collection<Cube> cubes) {
        Map<String, Cube> byName = new TreeMap<>();
        List<String> problems = new ArrayList<>();

        for (Cube cube : cubes) {
            if (cube.getName() == null || cube.getName().isBlank()) {
                problems.add("Cube name is required");
                continue;
            }
            if (byName.put(cube.getName(), cube) != null) {
                problems.add("Duplicate cube '" + cube.getName() + "'");
            }
        }
        byName.values().forEach(cube -> validateCube(cube, byName, problems));
        if (problems.isEmpty()) {
            validateCalculatedMeasures(byName, problems);
        }

        if (!problems.isEmpty()) {
            throw new SchemaException(problems);
        }
        return new SchemaSnapshot(version, Collections.unmodifiableMap(byName));
    }

    public Optional<Cube> findCube(String name) {
        return Optional.ofNullable(cubes.get(name));
    }

    public boolean hasCube(String name) {
        return cubes.containsKey(name);
    }

    public Optional<Measure> findMeasure(String qualifiedName) {
        if (!MemberRef.isQualified(qualifiedName)) {
            return Optional.empty();
        }
        MemberRef ref = MemberRef.parse(qualifiedName);
        return findCube(ref.cubeName()).flatMap(c -> c.findMeasure(ref.memberName()));
    }

    public Optional<Dimension> findDimension(String qualifiedName) {
        if (!MemberRef.isQualified(qualifiedName)) {
            return Optional.empty();
        }
        MemberRef ref = MemberRef.parse(qualifiedName);
        return findCube(ref.cubeName()).flatMap(c -> c.findDimension(ref.memberName()));
    }

    public boolean isMeasure(String qualifiedName) {
        return findMeasure(qualifiedName).isPresent();
    }

    public boolean isDimension(String qualifiedName) {
        return findDimension(qualifiedName).isPresent();
    }

    private static void validateCube(Cube cube, Map<String, Cube> byName, List<String> problems) {
        String name = cube.getName();
        if (cube.getSqlTable() == null || cube.getSqlTable().isBlank()) {
            problems.add("Cube '" + name + "' must declare a sql table");
        }

        Set<String> members = new HashSet<>();
        for (Measure measure : cube.getMeasures()) {
            if (measure.getName() == null || measure.getName().isBlank()) {
                problems.add("Cube '" + name + "' has a measure without a name");
                continue;
            }
            if (!members.add(measure.getName())) {
                problems.add("Duplicate member '" + cube.qualify(measure.getName()) + "'");
            }
            if (measure.getType() == null) {
                problems.add("Measure '" + cube.qualify(measure.getName()) + "' is missing type");
            } else if (measure.getType() == MeasureType.CALCULATED) {
                if (measure.getCalculatedSql() == null || measure.getCalculatedSql().isBlank()) {
                    problems.add("Calculated measure '" + cube.qualify(measure.getName()) + "' needs calculatedSql");
                }
            } else if (measure.getType() != MeasureType.COUNT && (measure.getSql() == null || measure.getSql().isBlank())) {
                problems.add("Measure '" + cube.qualify(measure.getName()) + "' is missing sql");
            }
        }
        for (Dimension dimension : cube.getDimensions()) {
            if (dimension.getName() == null || dimension.getName().isBlank()) {
                problems.add("Cube '" + name + "' has a dimension without a name");
                continue;
            }
            if (!members.add(dimension.getName())) {
                problems.add("Duplicate member '" + cube.qualify(dimension.getName()) + "'");
            }
            if (dimension.getType() == null) {
                problems.add("Dimension '" + cube.qualify(dimension.getName()) + "' is missing type");
            }
            if (dimension.getSql() == null || dimension.getSql().isBlank()) {
                problems.add("Dimension '" + cube.qualify(dimension.getName()) + "' is missing sql");
            }
        }

        for (Relationship join : cube.getJoins()) {
            String label = "Join '" + name + "." + join.getName() + "'";
            if (join.getType() == null) {
                problems.add(label + " is missing relationship");
                continue;
            }
            if (!byName.containsKey(join.getTargetCube())) {
                problems.add(label + " targets unknown cube '" + join.getTargetCube() + "'");
            }
            if (join.getType() == RelationshipType.BELONGS_TO_MANY) {
                JunctionTable junction = join.getJunctionTable();
                if (junction == null || junction.getTable() == null
                        || junction.getSourceColumns().isEmpty() || junction.getTargetColumns().isEmpty()) {
                    problems.add(label + " is belongsToMany and needs a junction table with source and target columns");
                }
            } else if (join.getJoinColumns().isEmpty()) {
                problems.add(label + " needs at least one join column");
            }
        }
    }

    private static void validateCalculatedMeasures(Map<String, Cube> byName, List<String> problems) {
        Map<String, List<String>> dependencies = new HashMap<>();
        for (Cube cube : byName.values()) {
            for (Measure measure : cube.getMeasures()) {
                if (measure.getType() != MeasureType.CALCULATED) {
                    continue;
                }
                List<String> refs = MeasureReferences.of(cube.getName(), measure.getCalculatedSql());
                for (String ref : refs) {
                    MemberRef memberRef = MemberRef.parse(ref);
                    Cube target = byName.get(memberRef.cubeName());
                    if (target == null || target.findMeasure(memberRef.memberName()).isEmpty()) {
                        problems.add("Calculated measure '" + cube.qualify(measure.getName())
                                + "' references unknown measure '" + ref + "'");
                    }
                }
                dependencies.put(cube.qualify(measure.getName()), refs);
            }
        }

        Set<String> done = new HashSet<>();
        for (String measure : new TreeMap<>(dependencies).keySet()) {
            detectCycle(measure, dependencies, new ArrayList<>(), done, problems);
        }
    }

    private static void detectCycle(String measure, Map<String, List<String>> dependencies,
                                    List<String> stack, Set<String> done, List<String> problems) {
        if (done.contains(measure)) {
            return;
        }
        int index = stack.indexOf(measure);
        if (index >= 0) {
            List<String> cycle = new ArrayList<>(stack.subList(index, stack.size()));
            cycle.add(measure);
            problems.add("Circular dependency between calculated measures: " + String.join(" -> ", cycle));
            return;
        }
        stack.add(measure);
        for (String dependency : dependencies.getOrDefault(measure, List.of())) {
            detectCycle(dependency, dependencies, stack, done, problems);
        }
        stack.remove(stack.size() - 1);
        done.add(measure);
    }
}
