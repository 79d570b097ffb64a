package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Several queries compiled together. The funnel strategy also needs the binding key and the time
 * dimension shared by the chained steps.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MultiQueryRequest {
    @Builder.Default
    private List<SemanticQuery> queries = new ArrayList<>();
    @Builder.Default
    private MergeStrategy mergeStrategy = MergeStrategy.CONCAT;
    @Builder.Default
    private List<String> mergeKeys = new ArrayList<>();
    @Builder.Default
    private List<String> queryLabels = new ArrayList<>();

    private MemberMapping funnelBindingKey;
    private MemberMapping funnelTimeDimension;
    @Builder.Default
    private List<String> stepTimeToConvert = new ArrayList<>();
}
