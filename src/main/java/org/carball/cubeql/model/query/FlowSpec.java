package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlowSpec {
    private MemberMapping bindingKey;
    private MemberMapping timeDimension;
    private String eventDimension;
    private FlowStartingStep startingStep;
    private int stepsBefore;
    private int stepsAfter;
    private Integer entityLimit;
    @Builder.Default
    private FlowOutputMode outputMode = FlowOutputMode.SANKEY;
    @Builder.Default
    private FlowJoinStrategy joinStrategy = FlowJoinStrategy.AUTO;
}
