package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import org.carball.cubeql.model.schema.DimensionType;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

@Getter
public enum FilterOperator {
    EQUALS("equals", Kind.ANY),
    NOT_EQUALS("notEquals", Kind.ANY),
    CONTAINS("contains", Kind.TEXT),
    NOT_CONTAINS("notContains", Kind.TEXT),
    STARTS_WITH("startsWith", Kind.TEXT),
    NOT_STARTS_WITH("notStartsWith", Kind.TEXT),
    ENDS_WITH("endsWith", Kind.TEXT),
    NOT_ENDS_WITH("notEndsWith", Kind.TEXT),
    GT("gt", Kind.ORDERED),
    GTE("gte", Kind.ORDERED),
    LT("lt", Kind.ORDERED),
    LTE("lte", Kind.ORDERED),
    SET("set", Kind.NO_VALUE),
    NOT_SET("notSet", Kind.NO_VALUE),
    IN_DATE_RANGE("inDateRange", Kind.DATE),
    BEFORE_DATE("beforeDate", Kind.DATE),
    AFTER_DATE("afterDate", Kind.DATE),
    BETWEEN("between", Kind.ORDERED),
    NOT_BETWEEN("notBetween", Kind.ORDERED),
    IN("in", Kind.ANY),
    NOT_IN("notIn", Kind.ANY),
    LIKE("like", Kind.TEXT),
    NOT_LIKE("notLike", Kind.TEXT),
    ILIKE("ilike", Kind.TEXT),
    REGEX("regex", Kind.TEXT),
    NOT_REGEX("notRegex", Kind.TEXT),
    IS_EMPTY("isEmpty", Kind.NO_VALUE),
    IS_NOT_EMPTY("isNotEmpty", Kind.NO_VALUE),
    ARRAY_CONTAINS("arrayContains", Kind.ARRAY),
    ARRAY_OVERLAPS("arrayOverlaps", Kind.ARRAY),
    ARRAY_CONTAINED("arrayContained", Kind.ARRAY);

    /**
     * Families of operators sharing the same value-type rules.
     */
    public enum Kind {
        ANY,
        TEXT,
        ORDERED,
        DATE,
        NO_VALUE,
        ARRAY
    }

    private final String value;
    private final Kind kind;

    FilterOperator(String value, Kind kind) {
        this.value = value;
        this.kind = kind;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean requiresValues() {
        return kind != Kind.NO_VALUE;
    }

    /**
     * Value types of the member this operator may be applied to. Measures count as numbers.
     */
    public Set<DimensionType> supportedTypes() {
        switch (kind) {
            case TEXT:
            case ARRAY:
                return EnumSet.of(DimensionType.STRING);
            case ORDERED:
                return EnumSet.of(DimensionType.NUMBER, DimensionType.TIME, DimensionType.STRING);
            case DATE:
                return EnumSet.of(DimensionType.TIME);
            default:
                return EnumSet.allOf(DimensionType.class);
        }
    }

    @JsonCreator
    public static FilterOperator fromValue(String value) {
        return Arrays.stream(values())
                .filter(op -> op.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown filter operator: " + value));
    }
}
