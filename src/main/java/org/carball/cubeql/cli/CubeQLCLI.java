package org.carball.cubeql.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.compiler.ComparisonQueryExpander;
import org.carball.cubeql.compiler.QueryCompiler;
import org.carball.cubeql.config.CompilerConfig;
import org.carball.cubeql.config.ConfigurationLoader;
import org.carball.cubeql.exception.CompilationException;
import org.carball.cubeql.exception.SchemaException;
import org.carball.cubeql.model.query.MultiQueryRequest;
import org.carball.cubeql.model.query.SemanticQuery;
import org.carball.cubeql.model.result.CompiledQuery;
import org.carball.cubeql.model.result.MultiQueryCompilation;
import org.carball.cubeql.model.schema.Cube;
import org.carball.cubeql.model.schema.SchemaSnapshot;
import org.carball.cubeql.output.CompilationReport;
import org.carball.cubeql.parser.CubeDefinitionLoader;
import org.carball.cubeql.parser.CubeDefinitionWriter;
import org.carball.cubeql.parser.DdlCubeGenerator;
import org.carball.cubeql.sql.DatabaseEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Slf4j
public class CubeQLCLI {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║              CubeQL Semantic Query Compiler v%s              ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    enum OutputFormat {
        TEXT, JSON, MARKDOWN
    }

    static final class Options {
        Path schema;
        Path query;
        Path ddl;
        Path settings;
        String profile;
        String output;
        OutputFormat format = OutputFormat.TEXT;
        boolean verbose;
        boolean quiet;
        List<String> compilerArgs = new ArrayList<>();
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0 || isHelpRequested(args)) {
            printUsage(out);
            return args.length == 0 ? EXIT_USAGE : EXIT_OK;
        }

        try {
            Options options = parseArgs(args);
            if (options.verbose) {
                enableDebugLogging();
            }
            if (!options.quiet) {
                out.printf((BANNER) + "%n", VERSION);
            }
            if (options.ddl != null) {
                generateFromDdl(options, out);
            } else {
                compileQuery(options, out);
            }
            return EXIT_OK;

        } catch (IllegalArgumentException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_USAGE;
        } catch (SchemaException e) {
            err.println("\n❌ Schema error:");
            e.getProblems().forEach(problem -> err.println("   - " + problem));
            log.debug("Schema error details", e);
            return EXIT_FAILED;
        } catch (CompilationException e) {
            err.println("\n❌ Compilation failed [" + e.getErrorCode() + "]: " + e.getMessage());
            log.debug("Compilation error details", e);
            return EXIT_FAILED;
        } catch (IOException e) {
            err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_FAILED;
        } catch (Exception e) {
            err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return EXIT_FAILED;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage(PrintStream out) {
        out.println("\nUsage: java -jar cubeql.jar <schema> <query.json> [options]");
        out.println("       java -jar cubeql.jar --from-ddl <schema.sql> [--output cubes.yml]");
        out.println();
        out.println("Arguments:");
        out.println("  schema              Cube definition file (.yml, .yaml, .json) or a directory of them");
        out.println("  query.json          Semantic query, or a multi-query request with a \"queries\" list");
        out.println();
        out.println("Options:");
        out.println("  --engine, -e        Target database: postgres|mysql|sqlite (default: postgres)");
        out.println("  --format, -f        Output format: text|json|markdown (default: text)");
        out.println("  --output, -o        Write the result to a file instead of the console");
        out.println("  --profile           Compiler profile: postgres|mysql|dashboard|export");
        out.println("  --config            YAML settings file");
        out.println("  --from-ddl          Generate cube definitions from CREATE TABLE statements");
        out.println("  --quiet, -q         Print only the result");
        out.println("  --verbose, -v       Enable debug logging");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
        out.println("Examples:");
        out.println("  # Compile a query for PostgreSQL");
        out.println("  java -jar cubeql.jar model/ query.json");
        out.println();
        out.println("  # Compile for MySQL and show the planning analysis");
        out.println("  java -jar cubeql.jar model/ query.json --engine mysql --format markdown");
        out.println();
        out.println("  # Bootstrap cube definitions from an existing database schema");
        out.println("  java -jar cubeql.jar --from-ddl schema.sql --output cubes.yml");
    }

    static Options parseArgs(String[] args) {
        Options options = new Options();
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--engine":
                case "-e":
                    String engine = value(args, ++i, "Engine not specified");
                    DatabaseEngine.fromValue(engine);
                    options.compilerArgs.add("--compiler.engine");
                    options.compilerArgs.add(engine);
                    break;
                case "--format":
                case "-f":
                    String format = value(args, ++i, "Output format not specified");
                    try {
                        options.format = OutputFormat.valueOf(format.toUpperCase());
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: text, json, or markdown");
                    }
                    break;
                case "--output":
                case "-o":
                    options.output = value(args, ++i, "Output file not specified");
                    break;
                case "--profile":
                    options.profile = value(args, ++i, "Profile not specified");
                    break;
                case "--config":
                    options.settings = Paths.get(value(args, ++i, "Settings file not specified"));
                    break;
                case "--from-ddl":
                    options.ddl = Paths.get(value(args, ++i, "DDL file not specified"));
                    break;
                case "--verbose":
                case "-v":
                    options.verbose = true;
                    break;
                case "--quiet":
                case "-q":
                    options.quiet = true;
                    break;
                default:
                    if (args[i].startsWith("--compiler.")) {
                        options.compilerArgs.add(args[i]);
                        options.compilerArgs.add(value(args, ++i, "Value not specified for " + args[i - 1]));
                    } else if (args[i].startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                    } else {
                        positional.add(args[i]);
                    }
            }
        }

        if (options.ddl != null) {
            if (!Files.exists(options.ddl)) {
                throw new IllegalArgumentException("DDL file not found: " + options.ddl);
            }
            return options;
        }
        if (positional.size() != 2) {
            throw new IllegalArgumentException("Expected a schema and a query file");
        }
        options.schema = Paths.get(positional.get(0));
        options.query = Paths.get(positional.get(1));
        if (!Files.exists(options.schema)) {
            throw new IllegalArgumentException("Schema not found: " + options.schema);
        }
        if (!Files.exists(options.query)) {
            throw new IllegalArgumentException("Query file not found: " + options.query);
        }
        if (options.output != null) {
            Path outputDir = Paths.get(options.output).toAbsolutePath().getParent();
            if (outputDir != null && !Files.exists(outputDir)) {
                throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
            }
        }
        return options;
    }

    private static String value(String[] args, int index, String missing) {
        if (index >= args.length) {
            throw new IllegalArgumentException(missing);
        }
        return args[index];
    }

    private static void generateFromDdl(Options options, PrintStream out) throws IOException {
        List<Cube> cubes = new DdlCubeGenerator().generate(options.ddl);
        // Reject generated definitions the compiler itself would refuse
        SchemaSnapshot.of(1, cubes);
        String yaml = new CubeDefinitionWriter().toYaml(cubes);
        if (options.output != null) {
            Files.writeString(Paths.get(options.output), yaml);
            if (!options.quiet) {
                out.println("✅ Generated " + cubes.size() + " cubes into " + options.output);
            }
        } else {
            out.println(yaml);
        }
    }

    private static void compileQuery(Options options, PrintStream out) throws IOException {
        CompilerConfig config = loadConfig(options);
        SchemaSnapshot snapshot = new CubeDefinitionLoader().loadSnapshot(options.schema);
        if (options.verbose) {
            out.println("   Schema: " + snapshot.getCubes().size() + " cubes from " + options.schema);
            out.println("   Engine: " + config.getEngine().value());
        }

        QueryCompiler compiler = new QueryCompiler(snapshot, config);
        JsonNode request = queryMapper().readTree(Files.readString(options.query));
        List<String> rendered = new ArrayList<>();

        if (request.has("queries")) {
            MultiQueryRequest multi = queryMapper().treeToValue(request, MultiQueryRequest.class);
            MultiQueryCompilation compilation = compiler.compileMulti(multi);
            renderMulti(compilation, options.format, rendered);
        } else {
            SemanticQuery query = queryMapper().treeToValue(request, SemanticQuery.class);
            if (ComparisonQueryExpander.hasComparison(query)) {
                renderMulti(compiler.compileComparison(query), options.format, rendered);
            } else {
                rendered.add(render(compiler.compile(query), options.format));
            }
        }

        String result = String.join("\n", rendered);
        if (options.output != null) {
            Files.writeString(Paths.get(options.output), result);
            if (!options.quiet) {
                out.println("✅ Compiled query written to " + options.output);
            }
        } else {
            out.println(result);
        }
    }

    private static void renderMulti(MultiQueryCompilation compilation, OutputFormat format, List<String> rendered) {
        for (int i = 0; i < compilation.getQueries().size(); i++) {
            String label = i < compilation.getLabels().size() ? compilation.getLabels().get(i) : "Query " + (i + 1);
            if (format == OutputFormat.MARKDOWN) {
                rendered.add("<!-- " + label + " -->");
            } else if (format == OutputFormat.TEXT) {
                rendered.add("-- " + label);
            }
            rendered.add(render(compilation.getQueries().get(i), format));
        }
        compilation.getWarnings().forEach(warning -> rendered.add("-- Warning: " + warning));
    }

    private static String render(CompiledQuery compiled, OutputFormat format) {
        CompilationReport report = new CompilationReport(compiled);
        switch (format) {
            case JSON:
                return report.toJson();
            case MARKDOWN:
                return report.toMarkdown();
            case TEXT:
            default:
                return report.toText();
        }
    }

    private static CompilerConfig loadConfig(Options options) throws IOException {
        ConfigurationLoader loader = new ConfigurationLoader();
        String[] compilerArgs = options.compilerArgs.toArray(new String[0]);
        if (options.settings != null) {
            return loader.loadConfiguration(options.settings, compilerArgs);
        }
        if (options.profile != null) {
            return loader.loadConfigurationWithProfile(options.profile, compilerArgs);
        }
        return loader.loadConfiguration(compilerArgs);
    }

    static ObjectMapper queryMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private static void enableDebugLogging() {
        Logger compiler = LoggerFactory.getLogger("org.carball.cubeql");
        if (compiler instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.DEBUG);
        }
    }
}
