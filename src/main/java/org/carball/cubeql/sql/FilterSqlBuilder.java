package org.carball.cubeql.sql;

import org.carball.cubeql.exception.InvalidFilterException;
import org.carball.cubeql.model.query.DateRange;
import org.carball.cubeql.model.query.Filter;
import org.carball.cubeql.model.query.FilterCondition;
import org.carball.cubeql.model.query.FilterOperator;
import org.carball.cubeql.model.query.LogicalFilter;
import org.carball.cubeql.model.schema.DimensionType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Translates filter trees into WHERE or HAVING conditions. Values always travel as parameters.
 * The caller decides how a member maps to SQL so the same rules serve the outer query, CTEs and
 * the analysis-mode compilers.
 */
public class FilterSqlBuilder {

    private final MemberSqlResolver members;
    private final SqlDialect dialect;
    private final DateRangeResolver dates;

    public FilterSqlBuilder(MemberSqlResolver members, DateRangeResolver dates) {
        this.members = members;
        this.dialect = members.dialect();
        this.dates = dates;
    }

    /**
     * Conditions for a list of top-level filters, ANDed together. Empty when nothing applies.
     */
    public SqlFragment build(List<Filter> filters, Function<String, SqlFragment> memberExpression) {
        if (filters == null || filters.isEmpty()) {
            return SqlFragment.empty();
        }
        List<SqlFragment> conditions = new ArrayList<>();
        for (Filter filter : filters) {
            SqlFragment condition = build(filter, memberExpression);
            if (!condition.isEmpty()) {
                conditions.add(condition);
            }
        }
        return combine(conditions, " AND ");
    }

    public SqlFragment build(Filter filter, Function<String, SqlFragment> memberExpression) {
        if (filter instanceof LogicalFilter logical) {
            List<SqlFragment> conditions = new ArrayList<>();
            for (Filter child : logical.getFilters()) {
                SqlFragment condition = build(child, memberExpression);
                if (!condition.isEmpty()) {
                    conditions.add(condition);
                }
            }
            String separator = logical.getType() == LogicalFilter.Type.OR ? " OR " : " AND ";
            SqlFragment combined = combine(conditions, separator);
            return conditions.size() > 1 ? combined.parenthesized() : combined;
        }
        FilterCondition condition = (FilterCondition) filter;
        return buildCondition(condition, memberExpression.apply(condition.getMember()));
    }

    /**
     * Checks a condition's member and operator without generating SQL.
     *
     * @throws InvalidFilterException when the member is unknown or the operator does not fit its type
     */
    public DimensionType validate(FilterCondition condition) {
        String member = condition.getMember();
        FilterOperator operator = condition.getOperator();
        String operatorName = operator == null ? null : operator.getValue();
        if (member == null || member.isBlank()) {
            throw new InvalidFilterException(member, operatorName, "Filter member is required");
        }
        if (operator == null) {
            throw new InvalidFilterException(member, null, "Filter on '" + member + "' is missing an operator");
        }
        DimensionType type = members.typeOf(member).orElseThrow(() -> new InvalidFilterException(
                member, operatorName, "Filter references unknown member '" + member + "'"));
        if (!operator.supportedTypes().contains(type)) {
            throw new InvalidFilterException(member, operatorName, String.format(
                    "Operator '%s' is not supported for %s member '%s'", operatorName, type.getValue(), member));
        }
        if (condition.getDateRange() != null) {
            if (type != DimensionType.TIME) {
                throw new InvalidFilterException(member, operatorName,
                        "dateRange can only be used on time dimensions, but '" + member + "' is " + type.getValue());
            }
            if (operator != FilterOperator.IN_DATE_RANGE) {
                throw new InvalidFilterException(member, operatorName,
                        "dateRange can only be used with the 'inDateRange' operator");
            }
        }
        if (operator.getKind() == FilterOperator.Kind.ARRAY && !dialect.supportsArrayOperators()) {
            throw new InvalidFilterException(member, operatorName, String.format(
                    "Operator '%s' requires array support, which %s does not have", operatorName, dialect.engine().value()));
        }
        return type;
    }

    private SqlFragment buildCondition(FilterCondition condition, SqlFragment expression) {
        DimensionType type = validate(condition);
        FilterOperator operator = condition.getOperator();
        String member = condition.getMember();

        if (condition.getDateRange() != null) {
            return dateRangeCondition(expression, resolve(condition, () -> dates.resolve(condition.getDateRange())));
        }

        List<Object> rawValues = condition.getValues() == null ? List.of() : condition.getValues();
        if (!operator.requiresValues()) {
            return noValueCondition(operator, expression);
        }
        if (rawValues.isEmpty()) {
            if (operator == FilterOperator.EQUALS) {
                return SqlFragment.raw(dialect.booleanLiteral(false));
            }
            throw new InvalidFilterException(member, operator.getValue(),
                    "Operator '" + operator.getValue() + "' on '" + member + "' requires a value");
        }

        List<Object> cleaned = cleanValues(rawValues);
        if (cleaned.isEmpty()) {
            return operator == FilterOperator.EQUALS ? SqlFragment.raw(dialect.booleanLiteral(false)) : SqlFragment.empty();
        }
        List<Object> values = operator.getKind() == FilterOperator.Kind.DATE
                ? cleaned
                : cleaned.stream().map(v -> coerce(condition, type, v)).toList();
        Object value = values.get(0);

        switch (operator) {
            case EQUALS:
                return values.size() > 1 ? inList(expression, values, false) : compare(expression, " = ", value);
            case NOT_EQUALS:
                return values.size() > 1 ? inList(expression, values, true) : compare(expression, " <> ", value);
            case IN:
                return inList(expression, values, false);
            case NOT_IN:
                return inList(expression, values, true);
            case CONTAINS:
                return dialect.caseInsensitiveLike(expression, SqlFragment.param("%" + value + "%"), false);
            case NOT_CONTAINS:
                return dialect.caseInsensitiveLike(expression, SqlFragment.param("%" + value + "%"), true);
            case STARTS_WITH:
                return dialect.caseInsensitiveLike(expression, SqlFragment.param(value + "%"), false);
            case NOT_STARTS_WITH:
                return dialect.caseInsensitiveLike(expression, SqlFragment.param(value + "%"), true);
            case ENDS_WITH:
                return dialect.caseInsensitiveLike(expression, SqlFragment.param("%" + value), false);
            case NOT_ENDS_WITH:
                return dialect.caseInsensitiveLike(expression, SqlFragment.param("%" + value), true);
            case LIKE:
                return compare(expression, " LIKE ", value);
            case NOT_LIKE:
                return compare(expression, " NOT LIKE ", value);
            case ILIKE:
                return dialect.caseInsensitiveLike(expression, SqlFragment.param(value), false);
            case REGEX:
                return dialect.regexMatch(expression, SqlFragment.param(value), false);
            case NOT_REGEX:
                return dialect.regexMatch(expression, SqlFragment.param(value), true);
            case GT:
                return compare(expression, " > ", value);
            case GTE:
                return compare(expression, " >= ", value);
            case LT:
                return compare(expression, " < ", value);
            case LTE:
                return compare(expression, " <= ", value);
            case BETWEEN:
                requireTwo(condition, values);
                return SqlFragment.builder()
                        .append(expression).sql(" >= ").param(values.get(0))
                        .sql(" AND ").append(expression).sql(" <= ").param(values.get(1))
                        .build().parenthesized();
            case NOT_BETWEEN:
                requireTwo(condition, values);
                return SqlFragment.builder()
                        .append(expression).sql(" < ").param(values.get(0))
                        .sql(" OR ").append(expression).sql(" > ").param(values.get(1))
                        .build().parenthesized();
            case IN_DATE_RANGE:
                requireTwo(condition, values);
                return dateRangeCondition(expression, resolve(condition, () -> dates.resolve(
                        DateRange.between(
                                String.valueOf(values.get(0)), String.valueOf(values.get(1))))));
            case BEFORE_DATE:
                return compare(expression, " < ", normalizeDate(condition, value));
            case AFTER_DATE:
                return compare(expression, " > ", normalizeDate(condition, value));
            case ARRAY_CONTAINS:
            case ARRAY_OVERLAPS:
            case ARRAY_CONTAINED:
                return dialect.arrayCondition(expression, operator.getValue(), values);
            default:
                throw new InvalidFilterException(member, operator.getValue(),
                        "Unsupported filter operator '" + operator.getValue() + "'");
        }
    }

    /**
     * {@code expr >= start AND expr <= end} with both bounds bound as timestamps.
     */
    public SqlFragment dateRangeCondition(SqlFragment expression, DateRangeResolver.Bounds bounds) {
        return SqlFragment.builder()
                .append(expression).sql(" >= ").param(bounds.start())
                .sql(" AND ").append(expression).sql(" <= ").param(bounds.end())
                .build().parenthesized();
    }

    private SqlFragment noValueCondition(FilterOperator operator, SqlFragment expression) {
        switch (operator) {
            case SET:
                return expression.append(" IS NOT NULL");
            case NOT_SET:
                return expression.append(" IS NULL");
            case IS_EMPTY:
                return SqlFragment.builder()
                        .append(expression).sql(" IS NULL OR ").append(expression).sql(" = ''")
                        .build().parenthesized();
            case IS_NOT_EMPTY:
            default:
                return SqlFragment.builder()
                        .append(expression).sql(" IS NOT NULL AND ").append(expression).sql(" <> ''")
                        .build().parenthesized();
        }
    }

    private static List<Object> cleanValues(List<Object> values) {
        return values.stream()
                .filter(Objects::nonNull)
                .filter(v -> !(v instanceof String s) || (!s.isEmpty() && s.indexOf('\u0000') < 0))
                .toList();
    }

    private Object coerce(FilterCondition condition, DimensionType type, Object value) {
        if (!(value instanceof String text)) {
            return value;
        }
        switch (type) {
            case TIME:
                return normalizeDate(condition, text);
            case BOOLEAN:
                return Boolean.parseBoolean(text.trim());
            case NUMBER:
                try {
                    return new BigDecimal(text.trim());
                } catch (NumberFormatException e) {
                    throw new InvalidFilterException(condition.getMember(), condition.getOperator().getValue(),
                            "Value '" + text + "' is not a number");
                }
            default:
                return text;
        }
    }

    private Object normalizeDate(FilterCondition condition, Object value) {
        if (!(value instanceof String text)) {
            return value;
        }
        return resolve(condition, () -> dates.resolve(DateRange.between(text, text)).start());
    }

    private static void requireTwo(FilterCondition condition, List<Object> values) {
        if (values.size() < 2) {
            throw new InvalidFilterException(condition.getMember(), condition.getOperator().getValue(),
                    "Operator '" + condition.getOperator().getValue() + "' needs two values");
        }
    }

    private static <T> T resolve(FilterCondition condition, Supplier<T> resolution) {
        try {
            return resolution.get();
        } catch (IllegalArgumentException e) {
            throw new InvalidFilterException(condition.getMember(), condition.getOperator().getValue(), e.getMessage());
        }
    }

    private static SqlFragment compare(SqlFragment expression, String operator, Object value) {
        return SqlFragment.builder().append(expression).sql(operator).param(value).build();
    }

    private static SqlFragment inList(SqlFragment expression, List<Object> values, boolean negate) {
        SqlFragment placeholders = SqlFragment.join(", ", values.stream().map(SqlFragment::param).toList());
        return SqlFragment.builder()
                .append(expression)
                .sql(negate ? " NOT IN (" : " IN (")
                .append(placeholders)
                .sql(")")
                .build();
    }

    private static SqlFragment combine(List<SqlFragment> conditions, String separator) {
        return SqlFragment.join(separator, conditions);
    }
}
