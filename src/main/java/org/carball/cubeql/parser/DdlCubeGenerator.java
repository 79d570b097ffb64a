package org.carball.cubeql.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.create.table.ColumnDefinition;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.table.ForeignKeyIndex;
import net.sf.jsqlparser.statement.create.table.Index;
import org.carball.cubeql.model.schema.Cube;
import org.carball.cubeql.model.schema.Dimension;
import org.carball.cubeql.model.schema.DimensionType;
import org.carball.cubeql.model.schema.JoinColumn;
import org.carball.cubeql.model.schema.JunctionTable;
import org.carball.cubeql.model.schema.Measure;
import org.carball.cubeql.model.schema.MeasureType;
import org.carball.cubeql.model.schema.Relationship;
import org.carball.cubeql.model.schema.RelationshipType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bootstraps cube definitions from CREATE TABLE statements: one cube per table with a
 * {@code count} measure and a dimension per column. Foreign keys become belongsTo joins with
 * the inverse hasMany on the referenced cube, and pure link tables become belongsToMany joins
 * between the two cubes they connect.
 */
@Slf4j
public class DdlCubeGenerator {

    private static final Pattern SQL_COMMENT = Pattern.compile("--[^\\n]*|/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern CREATE_TABLE = Pattern.compile(
            "\\bCREATE\\s+(?:(?:GLOBAL|LOCAL|TEMP|TEMPORARY|UNLOGGED)\\s+)*TABLE\\b", Pattern.CASE_INSENSITIVE);

    private record Column(String name, DimensionType type, boolean primaryKey) {}

    private record ForeignKey(String table, String column, String referencedTable, String referencedColumn) {}

    private static final class Table {
        final String name;
        final List<Column> columns = new ArrayList<>();
        final Set<String> primaryKey = new LinkedHashSet<>();

        Table(String name) {
            this.name = name;
        }
    }

    public List<Cube> generate(Path ddlFile) throws IOException {
        return generate(Files.readString(ddlFile));
    }

    public List<Cube> generate(String ddl) {
        Map<String, Table> tables = new LinkedHashMap<>();
        List<ForeignKey> foreignKeys = new ArrayList<>();

        int parsed = 0;
        try {
            Statements statements = CCJSqlParserUtil.parseStatements(preprocess(ddl));
            for (Statement statement : statements.getStatements()) {
                if (statement instanceof CreateTable createTable) {
                    Table table = readTable(createTable, foreignKeys);
                    tables.put(table.name.toLowerCase(Locale.ROOT), table);
                    parsed++;
                    log.debug("Parsed table: {}", table.name);
                }
            }
        } catch (JSQLParserException e) {
            log.error("Error parsing DDL: {}", e.getMessage());
            throw new IllegalArgumentException("Invalid SQL DDL: " + e.getMessage(), e);
        }
        // The parser can skip a broken statement instead of failing on it
        if (tables.isEmpty()) {
            log.error("No CREATE TABLE statement found in DDL");
            throw new IllegalArgumentException("Invalid SQL DDL: no CREATE TABLE statement could be parsed");
        }
        int declared = declaredTables(ddl);
        if (parsed < declared) {
            log.error("Only {} of {} CREATE TABLE statements parsed", parsed, declared);
            throw new IllegalArgumentException(String.format(
                    "Invalid SQL DDL: only %d of %d CREATE TABLE statements could be parsed", parsed, declared));
        }

        Map<String, Cube.CubeBuilder> cubes = new LinkedHashMap<>();
        Map<String, Set<String>> joinNames = new LinkedHashMap<>();
        Set<String> linkTables = linkTables(tables, foreignKeys);

        for (Table table : tables.values()) {
            if (!linkTables.contains(table.name)) {
                cubes.put(table.name, cube(table));
                joinNames.put(table.name, new HashSet<>());
            }
        }

        for (ForeignKey fk : foreignKeys) {
            Table referenced = tables.get(fk.referencedTable().toLowerCase(Locale.ROOT));
            if (referenced == null) {
                log.warn("Foreign key {}.{} references unknown table {}", fk.table(), fk.column(), fk.referencedTable());
                continue;
            }
            if (linkTables.contains(fk.table()) || linkTables.contains(referenced.name)) {
                continue;
            }
            String source = fk.table();
            String target = referenced.name;
            cubes.get(source).join(Relationship.builder()
                    .name(uniqueName(joinNames.get(source), cubeName(target), fk.column()))
                    .targetCube(cubeName(target))
                    .type(RelationshipType.BELONGS_TO)
                    .joinColumn(new JoinColumn(fk.column(), fk.referencedColumn()))
                    .build());
            cubes.get(target).join(Relationship.builder()
                    .name(uniqueName(joinNames.get(target), cubeName(source), fk.column()))
                    .targetCube(cubeName(source))
                    .type(RelationshipType.HAS_MANY)
                    .joinColumn(new JoinColumn(fk.referencedColumn(), fk.column()))
                    .build());
        }

        for (String linkTable : linkTables) {
            addManyToMany(linkTable, foreignKeys, tables, cubes, joinNames);
        }

        List<Cube> result = cubes.values().stream().map(Cube.CubeBuilder::build).toList();
        log.info("Generated {} cubes from {} tables", result.size(), tables.size());
        return result;
    }

    static int declaredTables(String ddl) {
        String code = SQL_COMMENT.matcher(ddl).replaceAll(" ");
        Matcher matcher = CREATE_TABLE.matcher(code);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static String preprocess(String ddl) {
        // SQL Server brackets and clustering keywords are not understood by the parser
        String processed = ddl.replaceAll("\\[([^]]+)]", "$1");
        processed = processed.replaceAll("DEFAULT\\s*\\(([A-Z_]+\\(\\))\\)", "DEFAULT '$1'");
        processed = processed.replaceAll("\\bCLUSTERED\\b", "");
        processed = processed.replaceAll("\\bNONCLUSTERED\\b", "");
        return processed.replaceAll("\\s+", " ");
    }

    private static Table readTable(CreateTable createTable, List<ForeignKey> foreignKeys) {
        Table table = new Table(clean(createTable.getTable().getName()));

        if (createTable.getColumnDefinitions() != null) {
            for (ColumnDefinition definition : createTable.getColumnDefinitions()) {
                String name = clean(definition.getColumnName());
                List<String> specs = definition.getColumnSpecs() != null ? definition.getColumnSpecs() : List.of();
                boolean primaryKey = specs.stream().anyMatch(spec -> spec.equalsIgnoreCase("PRIMARY")
                        || spec.toUpperCase(Locale.ROOT).contains("PRIMARY KEY"));
                if (primaryKey) {
                    table.primaryKey.add(name);
                }
                table.columns.add(new Column(name, dimensionType(definition.getColDataType().getDataType()), primaryKey));
                inlineReference(table.name, name, specs).ifPresent(foreignKeys::add);
            }
        }

        if (createTable.getIndexes() != null) {
            for (Index index : createTable.getIndexes()) {
                if (index instanceof ForeignKeyIndex fk) {
                    readForeignKey(table.name, fk).ifPresent(foreignKeys::add);
                } else if ("PRIMARY KEY".equalsIgnoreCase(index.getType())) {
                    index.getColumns().forEach(column -> table.primaryKey.add(clean(column.getColumnName())));
                }
            }
        }

        List<Column> columns = table.columns.stream()
                .map(c -> new Column(c.name(), c.type(), table.primaryKey.contains(c.name())))
                .toList();
        table.columns.clear();
        table.columns.addAll(columns);
        return table;
    }

    /**
     * {@code col INT REFERENCES other(id)} arrives as separate column specs.
     */
    private static Optional<ForeignKey> inlineReference(String table, String column, List<String> specs) {
        for (int i = 0; i < specs.size() - 1; i++) {
            if (specs.get(i).equalsIgnoreCase("REFERENCES")) {
                String next = specs.get(i + 1);
                String referencedTable = next;
                String referencedColumn = "id";
                int paren = next.indexOf('(');
                if (paren > 0) {
                    referencedTable = next.substring(0, paren);
                    referencedColumn = next.substring(paren).replaceAll("[()]", "");
                } else if (i + 2 < specs.size() && specs.get(i + 2).startsWith("(")) {
                    referencedColumn = specs.get(i + 2).replaceAll("[()]", "");
                }
                return Optional.of(new ForeignKey(table, column, clean(referencedTable), clean(referencedColumn)));
            }
        }
        return Optional.empty();
    }

    private static Optional<ForeignKey> readForeignKey(String table, ForeignKeyIndex fk) {
        List<String> columns = fk.getColumnsNames();
        if (fk.getTable() == null || columns == null || columns.isEmpty()) {
            return Optional.empty();
        }
        if (columns.size() > 1) {
            log.warn("Composite foreign key on {} uses only its first column", table);
        }
        List<String> referenced = fk.getReferencedColumnNames();
        String referencedColumn = referenced != null && !referenced.isEmpty() ? referenced.get(0) : "id";
        return Optional.of(new ForeignKey(table, clean(columns.get(0)),
                clean(fk.getTable().getName()), clean(referencedColumn)));
    }

    /**
     * A link table has a composite primary key made only of its two foreign key columns.
     */
    private static Set<String> linkTables(Map<String, Table> tables, List<ForeignKey> foreignKeys) {
        Set<String> links = new LinkedHashSet<>();
        for (Table table : tables.values()) {
            List<ForeignKey> outgoing = foreignKeys.stream().filter(fk -> fk.table().equals(table.name)).toList();
            boolean allForeignKeys = table.columns.size() == 2 && outgoing.size() == 2
                    && table.primaryKey.size() == 2
                    && outgoing.stream().allMatch(fk -> table.primaryKey.contains(fk.column()));
            if (allForeignKeys) {
                links.add(table.name);
            }
        }
        return links;
    }

    private static void addManyToMany(String linkTable, List<ForeignKey> foreignKeys, Map<String, Table> tables,
                                      Map<String, Cube.CubeBuilder> cubes, Map<String, Set<String>> joinNames) {
        List<ForeignKey> sides = foreignKeys.stream().filter(fk -> fk.table().equals(linkTable)).toList();
        ForeignKey left = sides.get(0);
        ForeignKey right = sides.get(1);
        Table leftTable = tables.get(left.referencedTable().toLowerCase(Locale.ROOT));
        Table rightTable = tables.get(right.referencedTable().toLowerCase(Locale.ROOT));
        if (leftTable == null || rightTable == null || !cubes.containsKey(leftTable.name)
                || !cubes.containsKey(rightTable.name)) {
            log.warn("Link table {} references tables without cubes", linkTable);
            return;
        }

        JunctionTable junction = JunctionTable.builder()
                .table(linkTable)
                .sourceColumn(new JoinColumn(left.referencedColumn(), left.column()))
                .targetColumn(new JoinColumn(right.column(), right.referencedColumn()))
                .build();
        cubes.get(leftTable.name).join(Relationship.builder()
                .name(uniqueName(joinNames.get(leftTable.name), cubeName(rightTable.name), linkTable))
                .targetCube(cubeName(rightTable.name))
                .type(RelationshipType.BELONGS_TO_MANY)
                .junctionTable(junction)
                .build());
        cubes.get(rightTable.name).join(Relationship.builder()
                .name(uniqueName(joinNames.get(rightTable.name), cubeName(leftTable.name), linkTable))
                .targetCube(cubeName(leftTable.name))
                .type(RelationshipType.BELONGS_TO_MANY)
                .junctionTable(junction.reversed())
                .build());
    }

    private static Cube.CubeBuilder cube(Table table) {
        Cube.CubeBuilder cube = Cube.builder()
                .name(cubeName(table.name))
                .sqlTable(table.name)
                .measure(Measure.builder().name("count").type(MeasureType.COUNT).build());
        for (Column column : table.columns) {
            cube.dimension(Dimension.builder()
                    .name(column.name())
                    .type(column.type())
                    .sql(column.name())
                    .primaryKey(column.primaryKey())
                    .build());
        }
        return cube;
    }

    static DimensionType dimensionType(String sqlType) {
        String type = sqlType.toLowerCase(Locale.ROOT);
        if (type.contains("bool") || type.equals("bit")) {
            return DimensionType.BOOLEAN;
        }
        if (type.contains("date") || type.contains("time")) {
            return DimensionType.TIME;
        }
        if (type.contains("int") || type.contains("numeric") || type.contains("decimal") || type.contains("float")
                || type.contains("double") || type.contains("real") || type.contains("money")
                || type.equals("number") || type.equals("serial") || type.equals("bigserial")) {
            return DimensionType.NUMBER;
        }
        return DimensionType.STRING;
    }

    /**
     * {@code order_items} becomes {@code OrderItems}.
     */
    static String cubeName(String table) {
        StringBuilder name = new StringBuilder();
        for (String part : table.split("[_\\s]+")) {
            if (!part.isEmpty()) {
                name.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
            }
        }
        return name.toString();
    }

    private static String uniqueName(Set<String> taken, String preferred, String qualifier) {
        String name = taken.contains(preferred) ? preferred + "_" + qualifier : preferred;
        taken.add(name);
        return name;
    }

    private static String clean(String identifier) {
        if (identifier == null) {
            return null;
        }
        return identifier.replaceAll("[\\[\\]`\"]", "").replaceAll("^dbo\\.", "");
    }
}
