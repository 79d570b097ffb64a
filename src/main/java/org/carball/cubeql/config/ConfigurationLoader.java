package org.carball.cubeql.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.sql.DatabaseEngine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public CompilerConfig loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        CompilerConfig.CompilerConfigBuilder builder = CompilerConfig.builder();
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        CompilerConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > settings file > profile > defaults
     */
    public CompilerConfig loadConfiguration(Path settingsFile, String[] args) throws IOException {
        CompilerSettings settings = readSettings(settingsFile);
        CompilerConfig.CompilerConfigBuilder builder = settings.getProfile() != null
                ? loadProfile(settings.getProfile()).toBuilder()
                : CompilerConfig.builder();

        settings.applyTo(builder);
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        CompilerConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded from {}: {}", settingsFile, config.getConfigurationSummary());
        return config;
    }

    public CompilerConfig loadProfile(String profileName) {
        try {
            CompilerProfile profile = CompilerProfile.fromName(profileName);
            CompilerConfig config = profile.buildConfig();
            log.info("Loaded profile '{}': {}", profileName, config.getConfigurationSummary());
            return config;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    public CompilerConfig loadConfigurationWithProfile(String profileName, String[] args) {
        CompilerConfig.CompilerConfigBuilder builder = loadProfile(profileName).toBuilder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        CompilerConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded with profile '{}': {}", profileName, config.getConfigurationSummary());
        return config;
    }

    CompilerSettings readSettings(Path settingsFile) throws IOException {
        ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
        CompilerSettings settings = yaml.readValue(Files.readString(settingsFile), CompilerSettings.class);
        return settings != null ? settings : new CompilerSettings();
    }

    private void applyEnvironmentVariables(CompilerConfig.CompilerConfigBuilder builder) {
        try {
            if (environment.containsKey("CUBEQL_ENGINE")) {
                builder.engine(DatabaseEngine.fromValue(environment.get("CUBEQL_ENGINE")));
            }
            if (environment.containsKey("CUBEQL_MAX_LIMIT")) {
                builder.maxLimit(Integer.parseInt(environment.get("CUBEQL_MAX_LIMIT")));
            }
            if (environment.containsKey("CUBEQL_DEFAULT_LIMIT")) {
                builder.defaultLimit(Integer.parseInt(environment.get("CUBEQL_DEFAULT_LIMIT")));
            }
            if (environment.containsKey("CUBEQL_CACHE_ENABLED")) {
                builder.cacheEnabled(Boolean.parseBoolean(environment.get("CUBEQL_CACHE_ENABLED")));
            }
            if (environment.containsKey("CUBEQL_CACHE_MAX_ENTRIES")) {
                builder.cacheMaxEntries(Integer.parseInt(environment.get("CUBEQL_CACHE_MAX_ENTRIES")));
            }
            if (environment.containsKey("CUBEQL_EXPLAIN_TIMEOUT_SECONDS")) {
                builder.explainTimeoutSeconds(Integer.parseInt(environment.get("CUBEQL_EXPLAIN_TIMEOUT_SECONDS")));
            }
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring invalid environment setting: {}", e.getMessage());
        }
    }

    private void applyCLIArguments(CompilerConfig.CompilerConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--compiler.engine":
                        builder.engine(DatabaseEngine.fromValue(value));
                        break;
                    case "--compiler.default-limit":
                        builder.defaultLimit(Integer.parseInt(value));
                        break;
                    case "--compiler.max-limit":
                        builder.maxLimit(Integer.parseInt(value));
                        break;
                    case "--compiler.flow-depth-warning":
                        builder.flowDepthWarning(Integer.parseInt(value));
                        break;
                    case "--compiler.cache-enabled":
                        builder.cacheEnabled(Boolean.parseBoolean(value));
                        break;
                    case "--compiler.cache-max-entries":
                        builder.cacheMaxEntries(Integer.parseInt(value));
                        break;
                    case "--compiler.explain-threads":
                        builder.explainThreads(Integer.parseInt(value));
                        break;
                    case "--compiler.explain-timeout":
                        builder.explainTimeoutSeconds(Integer.parseInt(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            } catch (IllegalArgumentException e) {
                log.warn("Invalid value for {}: {}", arg, e.getMessage());
            }
        }
    }

    public static String getConfigurationHelp() {
        return """
            Compiler Configuration Options:

            CLI Arguments:
              --compiler.engine <engine>            Target database: postgres, mysql or sqlite
              --compiler.default-limit <num>        Row limit applied when a query sets none
              --compiler.max-limit <num>            Upper bound for any requested limit
              --compiler.flow-depth-warning <num>   Flow depth that triggers a performance warning
              --compiler.cache-enabled <bool>       Cache compiled queries
              --compiler.cache-max-entries <num>    Maximum cached compiled queries
              --compiler.explain-threads <num>      Threads used for EXPLAIN requests
              --compiler.explain-timeout <sec>      EXPLAIN timeout in seconds

            Environment Variables:
              CUBEQL_ENGINE                         Same as --compiler.engine
              CUBEQL_DEFAULT_LIMIT                  Same as --compiler.default-limit
              CUBEQL_MAX_LIMIT                      Same as --compiler.max-limit
              CUBEQL_CACHE_ENABLED                  Same as --compiler.cache-enabled
              CUBEQL_CACHE_MAX_ENTRIES              Same as --compiler.cache-max-entries
              CUBEQL_EXPLAIN_TIMEOUT_SECONDS        Same as --compiler.explain-timeout

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file (--config <file.yml>)
              4. Profile defaults or built-in defaults
            """;
    }
}
