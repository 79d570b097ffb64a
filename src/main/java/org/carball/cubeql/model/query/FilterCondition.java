package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.function.Consumer;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(using = JsonDeserializer.None.class)
public class FilterCondition implements Filter {
    private String member;
    private FilterOperator operator;
    private List<Object> values;
    private DateRange dateRange;

    public static FilterCondition of(String member, FilterOperator operator, Object... values) {
        return new FilterCondition(member, operator, List.of(values), null);
    }

    @Override
    public void forEachCondition(Consumer<FilterCondition> action) {
        action.accept(this);
    }
}
