package org.carball.cubeql.config;

import lombok.Getter;
import org.carball.cubeql.sql.DatabaseEngine;

@Getter
public enum CompilerProfile {

    POSTGRES("postgres", "PostgreSQL with default limits", DatabaseEngine.POSTGRES, null, 10_000, 30),

    MYSQL("mysql", "MySQL 8 with default limits", DatabaseEngine.MYSQL, null, 10_000, 30),

    DASHBOARD("dashboard", "Interactive dashboards - small result sets and quick EXPLAIN",
            DatabaseEngine.POSTGRES, 1_000, 5_000, 10),

    EXPORT("export", "Bulk exports - large result sets, nothing cached",
            DatabaseEngine.POSTGRES, null, 1_000_000, 120) {
        @Override
        public CompilerConfig buildConfig() {
            return super.buildConfig().toBuilder()
                    .cacheEnabled(false)
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final DatabaseEngine engine;
    private final Integer defaultLimit;
    private final int maxLimit;
    private final int explainTimeoutSeconds;

    CompilerProfile(String name, String description, DatabaseEngine engine,
                    Integer defaultLimit, int maxLimit, int explainTimeoutSeconds) {
        this.name = name;
        this.description = description;
        this.engine = engine;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
        this.explainTimeoutSeconds = explainTimeoutSeconds;
    }

    public CompilerConfig buildConfig() {
        return CompilerConfig.builder()
                .profileName(name)
                .profileDescription(description)
                .engine(engine)
                .defaultLimit(defaultLimit)
                .maxLimit(maxLimit)
                .explainTimeoutSeconds(explainTimeoutSeconds)
                .build();
    }

    public static CompilerProfile fromName(String name) {
        for (CompilerProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown compiler profile: " + name
                + ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (CompilerProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder("Available Compiler Profiles:\n\n");
        for (CompilerProfile profile : values()) {
            help.append(String.format("  %-12s %s\n", profile.getName(), profile.getDescription()));
        }
        return help.toString();
    }
}
