package org.carball.cubeql.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CubeQLCLITest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private Path schema;

    @BeforeEach
    void setUp() throws Exception {
        schema = tempDir.resolve("ecommerce.yml");
        try (InputStream in = getClass().getResourceAsStream("/schema/ecommerce.yml")) {
            Files.copy(in, schema);
        }
    }

    @Test
    void shouldPrintUsageWithoutArguments() {
        int exit = run();

        assertThat(exit).isEqualTo(CubeQLCLI.EXIT_USAGE);
        assertThat(out()).contains("Usage: java -jar cubeql.jar");
    }

    @Test
    void shouldPrintHelp() {
        assertThat(run("--help")).isEqualTo(CubeQLCLI.EXIT_OK);
        assertThat(out()).contains("Compiler Configuration Options");
    }

    @Test
    void shouldCompileQueryFile() throws Exception {
        // Given
        Path query = write("query.json", "{\"measures\": [\"Orders.count\"], \"dimensions\": [\"Orders.status\"]}");

        // When
        int exit = run(schema.toString(), query.toString(), "-q");

        // Then
        assertThat(exit).isEqualTo(CubeQLCLI.EXIT_OK);
        assertThat(out()).contains("FROM orders AS orders").doesNotContain("CubeQL Semantic Query Compiler");
    }

    @Test
    void shouldWriteJsonToOutputFile() throws Exception {
        // Given
        Path query = write("query.json", "{\"measures\": [\"Orders.count\"]}");
        Path output = tempDir.resolve("compiled.json");

        // When
        int exit = run(schema.toString(), query.toString(), "--format", "json", "--output", output.toString());

        // Then
        assertThat(exit).isEqualTo(CubeQLCLI.EXIT_OK);
        assertThat(Files.readString(output)).contains("\"sql\" : \"SELECT COUNT(orders.id) AS \\\"Orders.count\\\"");
        assertThat(out()).contains("Compiled query written to");
    }

    @Test
    void shouldLabelEachQueryOfMultiQueryRequest() throws Exception {
        Path query = write("multi.json", "{\"queries\": ["
                + "{\"measures\": [\"Orders.count\"]},"
                + "{\"measures\": [\"Customers.count\"]}],"
                + "\"queryLabels\": [\"Orders\", \"Customers\"]}");

        int exit = run(schema.toString(), query.toString(), "-q");

        assertThat(exit).isEqualTo(CubeQLCLI.EXIT_OK);
        assertThat(out()).contains("-- Orders").contains("-- Customers").contains("FROM customers AS customers");
    }

    @Test
    void shouldFailOnUnknownMember() throws Exception {
        Path query = write("query.json", "{\"measures\": [\"Orders.nope\"]}");

        int exit = run(schema.toString(), query.toString(), "-q");

        assertThat(exit).isEqualTo(CubeQLCLI.EXIT_FAILED);
        assertThat(err()).contains("Compilation failed [incomplete_spec]: Unknown measure 'Orders.nope'");
    }

    @Test
    void shouldListSchemaProblems() throws Exception {
        // Given
        Path broken = write("broken.yml", "cubes:\n  - name: Orders\n");
        Path query = write("query.json", "{\"measures\": [\"Orders.count\"]}");

        // When
        int exit = run(broken.toString(), query.toString(), "-q");

        // Then
        assertThat(exit).isEqualTo(CubeQLCLI.EXIT_FAILED);
        assertThat(err()).contains("Schema error").contains("   - broken.yml: cube 'Orders' has no sqlTable");
    }

    @Test
    void shouldRejectBadArguments() throws Exception {
        Path query = write("query.json", "{}");

        assertThat(run(schema.toString(), query.toString(), "--bogus")).isEqualTo(CubeQLCLI.EXIT_USAGE);
        assertThat(err()).contains("Unknown option: --bogus");
        assertThat(run(schema.toString(), tempDir.resolve("missing.json").toString())).isEqualTo(CubeQLCLI.EXIT_USAGE);
        assertThat(err()).contains("Query file not found");
        assertThat(run(schema.toString(), query.toString(), "--format", "xml")).isEqualTo(CubeQLCLI.EXIT_USAGE);
        assertThat(err()).contains("Invalid output format");
    }

    @Test
    void shouldGenerateCubesFromDdl() throws Exception {
        // Given
        Path ddl = write("schema.sql", "CREATE TABLE customers (id INT PRIMARY KEY, city VARCHAR(50));\n"
                + "CREATE TABLE orders (id INT PRIMARY KEY, customer_id INT,"
                + " FOREIGN KEY (customer_id) REFERENCES customers(id));");
        Path output = tempDir.resolve("cubes.yml");

        // When
        int exit = run("--from-ddl", ddl.toString(), "--output", output.toString(), "-q");

        // Then
        assertThat(exit).isEqualTo(CubeQLCLI.EXIT_OK);
        assertThat(Files.readString(output)).startsWith("cubes:").contains("name: Customers").contains("relationship: hasMany");
    }

    @Test
    void shouldRejectUnknownEngine() {
        assertThatThrownBy(() -> CubeQLCLI.parseArgs(new String[]{"--engine", "oracle"}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private int run(String... args) {
        return CubeQLCLI.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
