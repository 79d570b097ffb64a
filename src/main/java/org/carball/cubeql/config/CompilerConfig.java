package org.carball.cubeql.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.sql.DatabaseEngine;

@Data
@Builder(toBuilder = true)
@Slf4j
public class CompilerConfig {

    // Target database
    @Builder.Default
    private DatabaseEngine engine = DatabaseEngine.POSTGRES;

    // Row caps
    private Integer defaultLimit;

    @Builder.Default
    private int maxLimit = 10_000;

    // Flow compiler
    @Builder.Default
    private int flowDepthWarning = 4;

    // Compiled-query cache
    @Builder.Default
    private boolean cacheEnabled = true;

    @Builder.Default
    private int cacheMaxEntries = 500;

    // EXPLAIN execution
    @Builder.Default
    private int explainThreads = 2;

    @Builder.Default
    private int explainTimeoutSeconds = 30;

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "PostgreSQL with default limits";

    public static CompilerConfig defaults() {
        return CompilerConfig.builder().build();
    }

    /**
     * The limit actually applied: the requested one capped at {@code maxLimit}, or the default
     * when none was requested.
     */
    public Integer effectiveLimit(Integer requested) {
        if (requested == null) {
            return defaultLimit;
        }
        return Math.min(requested, maxLimit);
    }

    /**
     * Logs warnings for values that are likely mistakes.
     */
    public void validate() {
        if (maxLimit <= 0) {
            log.warn("Max limit ({}) should be positive", maxLimit);
        }
        if (defaultLimit != null && defaultLimit > maxLimit) {
            log.warn("Default limit ({}) is above max limit ({}) and will be clamped", defaultLimit, maxLimit);
        }
        if (defaultLimit != null && defaultLimit <= 0) {
            log.warn("Default limit ({}) should be positive", defaultLimit);
        }
        if (flowDepthWarning < 1 || flowDepthWarning > 5) {
            log.warn("Flow depth warning ({}) should be between 1 and 5", flowDepthWarning);
        }
        if (cacheEnabled && cacheMaxEntries <= 0) {
            log.warn("Cache is enabled but max entries ({}) is not positive", cacheMaxEntries);
        }
        if (explainThreads < 1) {
            log.warn("Explain threads ({}) should be at least 1", explainThreads);
        }
        if (explainTimeoutSeconds <= 0) {
            log.warn("Explain timeout ({}s) should be positive", explainTimeoutSeconds);
        }

        log.debug("Using compiler config - Engine: {}, Max limit: {}, Cache: {}, Profile: {}",
                engine.value(), maxLimit, cacheEnabled, profileName);
    }

    public String getConfigurationSummary() {
        return String.format("Profile: %s | Engine: %s | Default limit: %s | Max limit: %d | Cache: %s (%d) | Explain timeout: %ds",
                profileName, engine.value(), defaultLimit == null ? "none" : defaultLimit, maxLimit,
                cacheEnabled ? "on" : "off", cacheMaxEntries, explainTimeoutSeconds);
    }
}
