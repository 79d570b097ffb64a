package org.carball.cubeql.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.cubeql.model.analysis.QueryAnalysis;
import org.carball.cubeql.model.query.QueryMode;

import java.util.List;

/**
 * Parameterized SQL ready to run, plus the metadata of the mode that produced it.
 * Exactly one of analysis and the three mode metadata blocks is set.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class CompiledQuery {
    String sql;
    @Singular
    List<Object> params;
    QueryMode mode;
    long schemaVersion;
    QueryAnalysis analysis;
    FunnelMetadata funnelMetadata;
    FlowMetadata flowMetadata;
    RetentionMetadata retentionMetadata;
    @Singular
    List<String> warnings;
}
