package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetentionSpec {
    private MemberMapping timeDimension;
    private MemberMapping bindingKey;
    private DateRange dateRange;
    @Builder.Default
    private List<Filter> cohortFilters = new ArrayList<>();
    @Builder.Default
    private List<Filter> activityFilters = new ArrayList<>();
    @Builder.Default
    private List<String> breakdownDimensions = new ArrayList<>();
    @Builder.Default
    private TimeGranularity granularity = TimeGranularity.WEEK;
    @Builder.Default
    private int periods = 12;
    @Builder.Default
    private RetentionType retentionType = RetentionType.CLASSIC;
}
