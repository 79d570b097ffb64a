package org.carball.cubeql.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TimeDimension {
    private String dimension;
    private TimeGranularity granularity;
    private DateRange dateRange;
    private List<DateRange> compareDateRange;
    /**
     * Whether empty buckets in the date range are added to the rows; unset means yes.
     */
    private Boolean fillMissingDates;

    public boolean hasComparison() {
        return compareDateRange != null && !compareDateRange.isEmpty();
    }

    public boolean shouldFillMissingDates() {
        return !Boolean.FALSE.equals(fillMissingDates) && granularity != null && dateRange != null;
    }
}
