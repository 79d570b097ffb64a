package org.carball.cubeql.compiler;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.exception.IncompleteSpecException;
import org.carball.cubeql.exception.InvalidFilterException;
import org.carball.cubeql.exception.PathNotFoundException;
import org.carball.cubeql.model.analysis.QueryAnalysis;
import org.carball.cubeql.model.query.DateRange;
import org.carball.cubeql.model.query.Filter;
import org.carball.cubeql.model.query.FilterCondition;
import org.carball.cubeql.model.query.FilterOperator;
import org.carball.cubeql.model.query.LogicalFilter;
import org.carball.cubeql.model.query.OrderBy;
import org.carball.cubeql.model.query.QueryMode;
import org.carball.cubeql.model.query.SemanticQuery;
import org.carball.cubeql.model.query.TimeDimension;
import org.carball.cubeql.model.result.CompiledQuery;
import org.carball.cubeql.model.schema.Cube;
import org.carball.cubeql.model.schema.Dimension;
import org.carball.cubeql.model.schema.DimensionType;
import org.carball.cubeql.model.schema.GraphEdge;
import org.carball.cubeql.model.schema.JoinColumn;
import org.carball.cubeql.model.schema.Measure;
import org.carball.cubeql.model.schema.MemberRef;
import org.carball.cubeql.model.schema.SchemaSnapshot;
import org.carball.cubeql.planner.PreAggregationPlan;
import org.carball.cubeql.planner.QueryPlan;
import org.carball.cubeql.planner.QueryPlanner;
import org.carball.cubeql.sql.DatabaseEngine;
import org.carball.cubeql.sql.RenderedSql;
import org.carball.cubeql.sql.SqlFragment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Compiles a standard (non-analysis) query: pre-aggregation CTEs, the primary table and its joins,
 * WHERE, GROUP BY, HAVING, ORDER BY and the row cap.
 */
@Slf4j
public class StandardQueryCompiler {

    /**
     * A selected dimension. {@code inner} is its expression against the cube's own table;
     * {@code outer} is what the outer query selects, which differs when the cube is pre-aggregated.
     */
    private record SelectedDimension(String member, String alias, String cube, SqlFragment inner, SqlFragment outer) {}

    private record FilterPlacement(List<Filter> where,
                                   List<Filter> having,
                                   Map<String, List<Filter>> cteWhere,
                                   Map<String, List<Filter>> propagated) {}

    private final CompilationContext context;
    private final SchemaSnapshot snapshot;
    private final QueryPlanner planner;
    private final JoinClauseBuilder joinBuilder;
    private final QueryAnalysisBuilder analysisBuilder;

    public StandardQueryCompiler(CompilationContext context) {
        this.context = context;
        this.snapshot = context.getSnapshot();
        this.planner = new QueryPlanner(snapshot, context.getResolver());
        this.joinBuilder = new JoinClauseBuilder(context);
        this.analysisBuilder = new QueryAnalysisBuilder(context);
    }

    /**
     * @throws IncompleteSpecException when the query selects nothing or names unknown members
     * @throws InvalidFilterException  when a filter does not fit its member
     * @throws PathNotFoundException   when a touched cube cannot be joined
     */
    public CompiledQuery compile(SemanticQuery request) {
        SemanticQuery query = normalize(request);
        validate(query);
        QueryPlan plan = planner.plan(query, true);
        List<String> warnings = new ArrayList<>(plan.warnings());
        String primaryCube = plan.primaryCubeName();

        List<SelectedDimension> dimensions = selectDimensions(query, plan, warnings);
        Map<String, SqlFragment> preAggregated = preAggregatedMeasures(plan);
        SqlFragment runningOrder = SqlFragment.join(", ", dimensions.stream()
                .filter(d -> isTimeDimension(query, d.member()))
                .map(SelectedDimension::outer)
                .toList());

        FilterPlacement placement = placeFilters(query, plan, warnings);

        List<SqlFragment> ctes = new ArrayList<>();
        for (PreAggregationPlan preAggregation : plan.allPreAggregations()) {
            ctes.add(buildCte(preAggregation, dimensions, placement));
        }

        List<SqlFragment> selectItems = new ArrayList<>();
        for (SelectedDimension dimension : dimensions) {
            selectItems.add(dimension.outer().append(" AS " + context.quote(dimension.alias())));
        }
        for (String measure : query.getMeasures()) {
            selectItems.add(context.getMeasures().build(measure, preAggregated, runningOrder)
                    .append(" AS " + context.quote(measure)));
        }

        Cube primary = context.cube(primaryCube);
        JoinClauseBuilder.Joins joins = joinBuilder.build(plan.joins(), plan.preAggregations());

        SqlFragment.Builder sql = SqlFragment.builder();
        if (!ctes.isEmpty()) {
            sql.sql("WITH ").append(SqlFragment.join(",\n", ctes)).sql("\n");
        }
        sql.sql("SELECT ").append(SqlFragment.join(", ", selectItems));
        sql.sql("\nFROM " + primary.getSqlTable() + " AS " + primary.alias());
        if (!joins.clauses().isEmpty()) {
            sql.sql("\n" + joins.sql());
        }

        Function<String, SqlFragment> dimensionSql = member -> context.getMembers().dimension(member);
        SqlFragment where = context.getFilters().build(placement.where(), dimensionSql);
        if (!where.isEmpty()) {
            sql.sql("\nWHERE ").append(where);
        }
        if (!query.getMeasures().isEmpty() && !dimensions.isEmpty()) {
            sql.sql("\nGROUP BY ").append(SqlFragment.join(", ",
                    dimensions.stream().map(SelectedDimension::outer).toList()));
        }
        SqlFragment having = context.getFilters().build(placement.having(),
                member -> context.getMeasures().build(member, preAggregated, SqlFragment.empty()));
        if (!having.isEmpty()) {
            sql.sql("\nHAVING ").append(having);
        }

        String orderBy = orderBy(query, dimensions);
        if (!orderBy.isEmpty()) {
            sql.sql("\nORDER BY " + orderBy);
        }
        appendLimit(sql, query, warnings);

        RenderedSql rendered = sql.build().render(context.getDialect());
        log.debug("Compiled query on {} with {} join(s) and {} CTE(s)", primaryCube, joins.count(), ctes.size());
        return CompiledQuery.builder()
                .sql(rendered.sql())
                .params(rendered.params())
                .mode(QueryMode.QUERY)
                .schemaVersion(snapshot.getVersion())
                .analysis(analysisBuilder.build(plan, joins.count(), warnings))
                .warnings(warnings)
                .build();
    }

    /**
     * Plans the query without generating SQL. Missing join paths are recorded in the analysis
     * instead of failing.
     */
    public QueryAnalysis analyze(SemanticQuery request) {
        SemanticQuery query = normalize(request);
        validate(query);
        QueryPlan plan = planner.plan(query, false);
        JoinClauseBuilder.Joins joins = joinBuilder.build(plan.joins(), plan.preAggregations());
        return analysisBuilder.build(plan, joins.count(), plan.warnings());
    }

    private void validate(SemanticQuery query) {
        List<String> problems = new ArrayList<>();
        List<String> measures = nullSafe(query.getMeasures());
        List<String> dimensions = nullSafe(query.getDimensions());
        List<TimeDimension> timeDimensions = nullSafe(query.getTimeDimensions());

        if (measures.isEmpty() && dimensions.isEmpty() && timeDimensions.isEmpty()) {
            problems.add("Query must request at least one measure, dimension or time dimension");
        }
        for (String measure : measures) {
            if (!snapshot.isMeasure(measure)) {
                problems.add(snapshot.isDimension(measure)
                        ? "'" + measure + "' is a dimension and cannot be used as a measure"
                        : "Unknown measure '" + measure + "'");
            }
        }
        for (String dimension : dimensions) {
            if (!snapshot.isDimension(dimension)) {
                problems.add(snapshot.isMeasure(dimension)
                        ? "'" + dimension + "' is a measure and cannot be used as a dimension"
                        : "Unknown dimension '" + dimension + "'");
            }
        }
        for (TimeDimension timeDimension : timeDimensions) {
            Dimension dimension = snapshot.findDimension(timeDimension.getDimension()).orElse(null);
            if (dimension == null) {
                problems.add("Unknown time dimension '" + timeDimension.getDimension() + "'");
            } else if (dimension.getType() != DimensionType.TIME) {
                problems.add("Time dimension '" + timeDimension.getDimension() + "' must be of type time, but is "
                        + dimension.getType().getValue());
            }
        }
        if (query.getLimit() != null && query.getLimit() < 0) {
            problems.add("Limit must not be negative");
        }
        if (query.getOffset() != null && query.getOffset() < 0) {
            problems.add("Offset must not be negative");
        }

        Set<String> selectable = new LinkedHashSet<>(measures);
        selectable.addAll(dimensions);
        timeDimensions.forEach(td -> {
            selectable.add(td.getDimension());
            if (td.getGranularity() != null) {
                selectable.add(td.getDimension() + "." + td.getGranularity().value());
            }
        });
        for (OrderBy order : nullSafe(query.getOrder())) {
            if (!selectable.contains(order.field())) {
                problems.add("Cannot order by '" + order.field() + "' because it is not selected");
            }
        }

        if (!problems.isEmpty()) {
            throw new IncompleteSpecException(problems);
        }
        for (Filter filter : nullSafe(query.getFilters())) {
            filter.forEachCondition(condition -> context.getFilters().validate(condition));
        }
    }

    private List<SelectedDimension> selectDimensions(SemanticQuery query, QueryPlan plan, List<String> warnings) {
        List<SelectedDimension> selected = new ArrayList<>();
        for (String member : query.getDimensions()) {
            String cube = MemberRef.parse(member).cubeName();
            selected.add(selected(plan, member, member, cube, context.getMembers().dimension(member)));
        }

        Map<String, Integer> occurrences = new LinkedHashMap<>();
        query.getTimeDimensions().forEach(td -> occurrences.merge(td.getDimension(), 1, Integer::sum));
        for (TimeDimension timeDimension : query.getTimeDimensions()) {
            String member = timeDimension.getDimension();
            String alias = occurrences.get(member) > 1 && timeDimension.getGranularity() != null
                    ? member + "." + timeDimension.getGranularity().value()
                    : member;
            if (selected.stream().anyMatch(s -> s.alias().equals(alias))) {
                warnings.add("Time dimension '" + alias + "' is requested more than once; only the first is used");
                continue;
            }
            Cube cube = context.getMembers().cubeOf(member);
            SqlFragment expression = context.getMembers()
                    .timeDimension(member, timeDimension.getGranularity(), cube.alias());
            selected.add(selected(plan, member, alias, cube.getName(), expression));
        }
        return selected;
    }

    private SelectedDimension selected(QueryPlan plan, String member, String alias, String cube, SqlFragment inner) {
        SqlFragment outer = plan.preAggregationFor(cube)
                .map(p -> SqlFragment.raw(p.cteAlias() + "." + context.quote(alias)))
                .orElse(inner);
        return new SelectedDimension(member, alias, cube, inner, outer);
    }

    private Map<String, SqlFragment> preAggregatedMeasures(QueryPlan plan) {
        Map<String, SqlFragment> preAggregated = new LinkedHashMap<>();
        for (PreAggregationPlan preAggregation : plan.preAggregations().values()) {
            for (String member : preAggregation.allMeasures()) {
                Measure measure = snapshot.findMeasure(member).orElseThrow();
                SqlFragment column = SqlFragment.raw(preAggregation.cteAlias() + "." + context.quote(member));
                preAggregated.put(member, context.getMeasures().reaggregate(measure.getType(), column));
            }
        }
        return preAggregated;
    }

    /**
     * Splits top-level filters (AND groups are flattened) between the outer WHERE, HAVING and the
     * CTE WHERE clauses, and picks the filters that also restrict a CTE through its join key.
     */
    private FilterPlacement placeFilters(SemanticQuery query, QueryPlan plan, List<String> warnings) {
        List<Filter> pieces = new ArrayList<>();
        query.getFilters().forEach(filter -> flatten(filter, pieces));
        for (TimeDimension timeDimension : query.getTimeDimensions()) {
            DateRange range = timeDimension.getDateRange();
            if (range == null && timeDimension.hasComparison()) {
                range = timeDimension.getCompareDateRange().get(0);
                warnings.add("compareDateRange on '" + timeDimension.getDimension()
                        + "' compiled for its first period only; compile it as a comparison to get every period");
            }
            if (range != null) {
                pieces.add(FilterCondition.builder()
                        .member(timeDimension.getDimension())
                        .operator(FilterOperator.IN_DATE_RANGE)
                        .dateRange(range)
                        .build());
            }
        }

        FilterPlacement placement = new FilterPlacement(new ArrayList<>(), new ArrayList<>(),
                new TreeMap<>(), new TreeMap<>());
        for (Filter piece : pieces) {
            Set<String> cubes = new LinkedHashSet<>();
            List<FilterCondition> measureConditions = new ArrayList<>();
            List<FilterCondition> dimensionConditions = new ArrayList<>();
            piece.forEachCondition(condition -> {
                cubes.add(MemberRef.parse(condition.getMember()).cubeName());
                if (snapshot.isMeasure(condition.getMember())) {
                    measureConditions.add(condition);
                } else {
                    dimensionConditions.add(condition);
                }
            });

            if (!measureConditions.isEmpty()) {
                if (!dimensionConditions.isEmpty()) {
                    FilterCondition offending = dimensionConditions.get(0);
                    throw new InvalidFilterException(offending.getMember(), offending.getOperator().getValue(),
                            "A filter group cannot mix measures (" + measureConditions.get(0).getMember()
                                    + ") with dimensions (" + offending.getMember() + ")");
                }
                placement.having().add(piece);
                continue;
            }

            List<String> preAggregatedCubes = cubes.stream().filter(plan::isPreAggregated).toList();
            if (!preAggregatedCubes.isEmpty()) {
                Set<String> owners = new LinkedHashSet<>();
                cubes.forEach(cube -> owners.add(plan.owningPreAggregation(cube)
                        .map(PreAggregationPlan::cubeName)
                        .orElse("")));
                if (owners.size() > 1 || owners.contains("")) {
                    FilterCondition offending = dimensionConditions.get(0);
                    throw new InvalidFilterException(offending.getMember(), offending.getOperator().getValue(),
                            "A filter group cannot combine pre-aggregated cube " + preAggregatedCubes.get(0)
                                    + " with cubes outside its CTE " + cubes);
                }
                placement.cteWhere().computeIfAbsent(owners.iterator().next(), c -> new ArrayList<>()).add(piece);
                continue;
            }

            placement.where().add(piece);
            if (cubes.size() == 1) {
                String cube = cubes.iterator().next();
                for (PreAggregationPlan preAggregation : plan.preAggregations().values()) {
                    GraphEdge edge = preAggregation.joinEdge();
                    if (!edge.isManyToMany() && edge.fromCube().equals(cube)) {
                        placement.propagated().computeIfAbsent(preAggregation.cubeName(), c -> new ArrayList<>())
                                .add(piece);
                    }
                }
            }
        }
        return placement;
    }

    private static void flatten(Filter filter, List<Filter> pieces) {
        if (filter instanceof LogicalFilter logical && logical.getType() == LogicalFilter.Type.AND) {
            logical.getFilters().forEach(child -> flatten(child, pieces));
        } else {
            pieces.add(filter);
        }
    }

    /**
     * One CTE: the root table keyed by the fan-out hop's columns, the cubes joined behind it and the
     * nested CTEs it re-aggregates, grouped by the key and the requested dimensions it holds.
     */
    private SqlFragment buildCte(PreAggregationPlan plan, List<SelectedDimension> dimensions,
                                 FilterPlacement placement) {
        Cube cube = context.cube(plan.cubeName());
        String alias = cube.alias();
        GraphEdge edge = plan.joinEdge();
        String keyOwner = edge.isManyToMany() ? JoinClauseBuilder.junctionAlias(cube.getName()) : alias;

        List<SqlFragment> keys = plan.keyColumns().stream()
                .map(column -> SqlFragment.raw(keyOwner + "." + column))
                .toList();
        Set<String> aggregatedCubes = plan.cubes();
        List<SqlFragment> groupedDimensions = new ArrayList<>();
        List<SqlFragment> selectItems = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            selectItems.add(keys.get(i).append(" AS " + plan.keyColumns().get(i)));
        }
        for (SelectedDimension dimension : dimensions) {
            if (aggregatedCubes.contains(dimension.cube())) {
                SqlFragment expression = plan.nestedContaining(dimension.cube())
                        .map(child -> SqlFragment.raw(child.cteAlias() + "." + context.quote(dimension.alias())))
                        .orElse(dimension.inner());
                groupedDimensions.add(expression);
                selectItems.add(expression.append(" AS " + context.quote(dimension.alias())));
            }
        }
        for (String member : plan.measures()) {
            Measure measure = snapshot.findMeasure(member).orElseThrow();
            Cube owner = context.cube(MemberRef.parse(member).cubeName());
            selectItems.add(context.getMeasures().aggregate(measure, owner).append(" AS " + context.quote(member)));
        }
        Map<String, PreAggregationPlan> nestedByCube = new TreeMap<>();
        for (PreAggregationPlan child : plan.nested()) {
            nestedByCube.put(child.cubeName(), child);
            for (String member : child.allMeasures()) {
                Measure measure = snapshot.findMeasure(member).orElseThrow();
                SqlFragment column = SqlFragment.raw(child.cteAlias() + "." + context.quote(member));
                selectItems.add(context.getMeasures().reaggregate(measure.getType(), column)
                        .append(" AS " + context.quote(member)));
            }
        }

        SqlFragment.Builder cte = SqlFragment.builder()
                .sql(plan.cteAlias() + " AS (\n  SELECT ")
                .append(SqlFragment.join(", ", selectItems))
                .sql("\n  FROM " + cube.getSqlTable() + " AS " + alias);
        if (edge.isManyToMany()) {
            cte.sql("\n  INNER JOIN " + edge.junctionTable().getTable() + " AS " + keyOwner + " ON "
                    + JoinClauseBuilder.on(keyOwner, alias, edge.junctionTable().getTargetColumns()));
        }
        for (String clause : joinBuilder.build(plan.innerJoins(), nestedByCube).clauses()) {
            cte.sql("\n  " + clause);
        }

        List<SqlFragment> conditions = new ArrayList<>();
        Function<String, SqlFragment> dimensionSql = member -> context.getMembers().dimension(member);
        SqlFragment own = context.getFilters().build(placement.cteWhere().getOrDefault(plan.cubeName(), List.of()),
                dimensionSql);
        conditions.add(own);
        for (Filter piece : placement.propagated().getOrDefault(plan.cubeName(), List.of())) {
            conditions.add(propagatedCondition(edge, alias, context.getFilters().build(piece, dimensionSql)));
        }
        SqlFragment where = SqlFragment.join(" AND ", conditions);
        if (!where.isEmpty()) {
            cte.sql("\n  WHERE ").append(where);
        }

        List<SqlFragment> groupBy = new ArrayList<>(keys);
        groupBy.addAll(groupedDimensions);
        cte.sql("\n  GROUP BY ").append(SqlFragment.join(", ", groupBy)).sql("\n)");
        return cte.build();
    }

    /**
     * Restricts CTE rows to keys whose source-side row passes a filter on the source cube.
     */
    private SqlFragment propagatedCondition(GraphEdge edge, String cteCubeAlias, SqlFragment condition) {
        Cube source = context.cube(edge.fromCube());
        String sourceAlias = source.alias();
        List<JoinColumn> columns = edge.joinColumns();
        if (columns.size() == 1) {
            JoinColumn column = columns.get(0);
            return SqlFragment.builder()
                    .sql(cteCubeAlias + "." + column.targetColumn() + " IN (SELECT " + sourceAlias + "."
                            + column.sourceColumn() + " FROM " + source.getSqlTable() + " AS " + sourceAlias
                            + " WHERE ")
                    .append(condition)
                    .sql(")")
                    .build();
        }
        return SqlFragment.builder()
                .sql("EXISTS (SELECT 1 FROM " + source.getSqlTable() + " AS " + sourceAlias + " WHERE "
                        + JoinClauseBuilder.on(sourceAlias, cteCubeAlias, columns) + " AND ")
                .append(condition)
                .sql(")")
                .build();
    }

    private String orderBy(SemanticQuery query, List<SelectedDimension> dimensions) {
        List<String> items = new ArrayList<>();
        if (query.getOrder().isEmpty()) {
            dimensions.stream()
                    .filter(d -> isTimeDimension(query, d.member()))
                    .forEach(d -> items.add(context.quote(d.alias()) + " ASC"));
        } else {
            for (OrderBy order : query.getOrder()) {
                String alias = dimensions.stream()
                        .filter(d -> d.alias().equals(order.field()))
                        .map(SelectedDimension::alias)
                        .findFirst()
                        .orElse(order.field());
                items.add(context.quote(alias) + " " + order.direction().name());
            }
        }
        return String.join(", ", items);
    }

    private void appendLimit(SqlFragment.Builder sql, SemanticQuery query, List<String> warnings) {
        int maxLimit = context.getConfig().getMaxLimit();
        if (query.getLimit() != null && query.getLimit() > maxLimit) {
            log.warn("Requested limit {} exceeds the maximum of {}; clamping", query.getLimit(), maxLimit);
            warnings.add("Limit " + query.getLimit() + " exceeds the maximum of " + maxLimit + " and was clamped");
        }
        Integer limit = context.getConfig().effectiveLimit(query.getLimit());
        boolean hasOffset = query.getOffset() != null && query.getOffset() > 0;
        // MySQL and SQLite reject OFFSET without LIMIT
        if (limit == null && hasOffset && context.getDialect().engine() != DatabaseEngine.POSTGRES) {
            limit = maxLimit;
        }
        if (limit != null) {
            sql.sql("\nLIMIT ").param(limit);
        }
        if (hasOffset) {
            sql.sql("\nOFFSET ").param(query.getOffset());
        }
    }

    private static boolean isTimeDimension(SemanticQuery query, String member) {
        return query.getTimeDimensions().stream().anyMatch(td -> td.getDimension().equals(member));
    }

    /**
     * A copy with every list present, so the rest of the compiler never checks for null.
     */
    static SemanticQuery normalize(SemanticQuery query) {
        return query.toBuilder()
                .measures(nullSafe(query.getMeasures()))
                .dimensions(nullSafe(query.getDimensions()))
                .timeDimensions(nullSafe(query.getTimeDimensions()))
                .filters(nullSafe(query.getFilters()))
                .order(nullSafe(query.getOrder()))
                .build();
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
