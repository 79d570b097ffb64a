package org.carball.cubeql.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.cubeql.model.query.MergeStrategy;

import java.util.List;

/**
 * Output of a multi-query request. Concat keeps one compiled query per input; merge and funnel
 * produce a single one. Labels line up with {@code queries}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class MultiQueryCompilation {
    MergeStrategy strategy;
    @Singular
    List<CompiledQuery> queries;
    @Singular
    List<String> labels;
    @Singular
    List<String> mergeKeys;
    @Singular
    List<String> warnings;
}
