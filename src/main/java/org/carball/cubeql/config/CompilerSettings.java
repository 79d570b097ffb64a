package org.carball.cubeql.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import org.carball.cubeql.sql.DatabaseEngine;

/**
 * Optional YAML settings file. Unset keys leave the current value alone.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompilerSettings {

    @JsonProperty("profile")
    private String profile;

    @JsonProperty("engine")
    private String engine;

    @JsonProperty("default_limit")
    private Integer defaultLimit;

    @JsonProperty("max_limit")
    private Integer maxLimit;

    @JsonProperty("flow_depth_warning")
    private Integer flowDepthWarning;

    @JsonProperty("cache_enabled")
    private Boolean cacheEnabled;

    @JsonProperty("cache_max_entries")
    private Integer cacheMaxEntries;

    @JsonProperty("explain_threads")
    private Integer explainThreads;

    @JsonProperty("explain_timeout_seconds")
    private Integer explainTimeoutSeconds;

    void applyTo(CompilerConfig.CompilerConfigBuilder builder) {
        if (engine != null) {
            builder.engine(DatabaseEngine.fromValue(engine));
        }
        if (defaultLimit != null) {
            builder.defaultLimit(defaultLimit);
        }
        if (maxLimit != null) {
            builder.maxLimit(maxLimit);
        }
        if (flowDepthWarning != null) {
            builder.flowDepthWarning(flowDepthWarning);
        }
        if (cacheEnabled != null) {
            builder.cacheEnabled(cacheEnabled);
        }
        if (cacheMaxEntries != null) {
            builder.cacheMaxEntries(cacheMaxEntries);
        }
        if (explainThreads != null) {
            builder.explainThreads(explainThreads);
        }
        if (explainTimeoutSeconds != null) {
            builder.explainTimeoutSeconds(explainTimeoutSeconds);
        }
    }
}
