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
public class FunnelSpec {
    private MemberMapping bindingKey;
    private MemberMapping timeDimension;
    @Builder.Default
    private List<FunnelStep> steps = new ArrayList<>();
    private boolean includeTimeMetrics;
}
