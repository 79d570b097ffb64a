package org.carball.cubeql.merge;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.exception.IncompleteSpecException;
import org.carball.cubeql.model.query.FunnelSpec;
import org.carball.cubeql.model.query.FunnelStep;
import org.carball.cubeql.model.query.MergeStrategy;
import org.carball.cubeql.model.query.MultiQueryRequest;
import org.carball.cubeql.model.query.SemanticQuery;
import org.carball.cubeql.model.query.TimeDimension;
import org.carball.cubeql.model.result.CompiledQuery;
import org.carball.cubeql.model.result.MultiQueryCompilation;
import org.carball.cubeql.model.schema.MemberRef;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Compiles several queries together under one of three strategies: concat keeps them apart,
 * merge folds them into one query over a shared dimension set, and funnel chains them as steps.
 */
@Slf4j
public class MultiQueryMergeEngine {

    private final Function<SemanticQuery, CompiledQuery> compiler;
    private final MultiQueryValidator validator = new MultiQueryValidator();

    public MultiQueryMergeEngine(Function<SemanticQuery, CompiledQuery> compiler) {
        this.compiler = compiler;
    }

    /**
     * @throws IncompleteSpecException when the request is empty, a merge does not line up, or a
     *                                 funnel lacks its binding key or time dimension
     */
    public MultiQueryCompilation compile(MultiQueryRequest request) {
        List<SemanticQuery> queries = request.getQueries() == null ? List.of() : request.getQueries();
        if (queries.isEmpty()) {
            throw new IncompleteSpecException("A multi-query request needs at least one query");
        }
        MergeStrategy strategy = request.getMergeStrategy() == null ? MergeStrategy.CONCAT : request.getMergeStrategy();
        log.debug("Compiling {} queries with the {} strategy", queries.size(), strategy.value());

        switch (strategy) {
            case MERGE:
                return merge(request, queries);
            case FUNNEL:
                return funnel(request, queries);
            case CONCAT:
            default:
                return concat(request, queries);
        }
    }

    MultiQueryCompilation concat(MultiQueryRequest request, List<SemanticQuery> queries) {
        MultiQueryCompilation.MultiQueryCompilationBuilder result = MultiQueryCompilation.builder()
                .strategy(MergeStrategy.CONCAT);
        warnings(validator.validate(queries, MergeStrategy.CONCAT, List.of())).forEach(result::warning);
        for (int i = 0; i < queries.size(); i++) {
            result.query(compiler.apply(queries.get(i)));
            result.label(label(request.getQueryLabels(), i));
        }
        return result.build();
    }

    MultiQueryCompilation merge(MultiQueryRequest request, List<SemanticQuery> queries) {
        List<String> mergeKeys = request.getMergeKeys() == null || request.getMergeKeys().isEmpty()
                ? queries.get(0).getAllDimensionNames() : request.getMergeKeys();
        List<ValidationIssue> issues = validator.validate(queries, MergeStrategy.MERGE, request.getMergeKeys());
        List<String> errors = issues.stream().filter(ValidationIssue::isError).map(ValidationIssue::message).toList();
        if (!errors.isEmpty()) {
            throw new IncompleteSpecException(errors);
        }

        SemanticQuery first = queries.get(0);
        Set<String> measures = new LinkedHashSet<>();
        List<String> warnings = new ArrayList<>(warnings(issues));
        for (int i = 0; i < queries.size(); i++) {
            SemanticQuery query = queries.get(i);
            if (query.getMeasures() != null) {
                measures.addAll(query.getMeasures());
            }
            if (i > 0 && !Objects.equals(nonNull(query.getFilters()), nonNull(first.getFilters()))) {
                warnings.add("Query " + (i + 1) + " filters differ from Query 1; the merged query applies Query 1 filters");
            }
        }
        SemanticQuery merged = first.toBuilder()
                .measures(new ArrayList<>(measures))
                .build();
        CompiledQuery compiled = compiler.apply(merged);
        return MultiQueryCompilation.builder()
                .strategy(MergeStrategy.MERGE)
                .query(compiled)
                .label(label(request.getQueryLabels(), 0))
                .mergeKeys(mergeKeys)
                .warnings(warnings)
                .build();
    }

    /**
     * Each query becomes a funnel step on the cube of its first member; its filters become the step's.
     */
    MultiQueryCompilation funnel(MultiQueryRequest request, List<SemanticQuery> queries) {
        List<String> problems = new ArrayList<>();
        if (request.getFunnelBindingKey() == null) {
            problems.add("Funnel merge requires a funnelBindingKey");
        }
        if (request.getFunnelTimeDimension() == null) {
            problems.add("Funnel merge requires a funnelTimeDimension");
        }
        if (!problems.isEmpty()) {
            throw new IncompleteSpecException(problems);
        }

        List<String> timeToConvert = request.getStepTimeToConvert() == null ? List.of() : request.getStepTimeToConvert();
        List<FunnelStep> steps = new ArrayList<>();
        for (int i = 0; i < queries.size(); i++) {
            SemanticQuery query = queries.get(i);
            String window = i > 0 && i < timeToConvert.size() ? timeToConvert.get(i) : null;
            steps.add(FunnelStep.builder()
                    .name(label(request.getQueryLabels(), i, "Step "))
                    .cube(cubeOf(query).orElse(null))
                    .filters(new ArrayList<>(nonNull(query.getFilters())))
                    .timeToConvert(window == null || window.isBlank() ? null : window)
                    .build());
        }
        FunnelSpec funnel = FunnelSpec.builder()
                .bindingKey(request.getFunnelBindingKey())
                .timeDimension(request.getFunnelTimeDimension())
                .steps(steps)
                .build();
        CompiledQuery compiled = compiler.apply(SemanticQuery.builder().funnel(funnel).build());
        return MultiQueryCompilation.builder()
                .strategy(MergeStrategy.FUNNEL)
                .query(compiled)
                .labels(steps.stream().map(FunnelStep::getName).toList())
                .build();
    }

    private static Optional<String> cubeOf(SemanticQuery query) {
        List<String> members = new ArrayList<>(nonNull(query.getMeasures()));
        members.addAll(nonNull(query.getDimensions()));
        if (query.getTimeDimensions() != null) {
            query.getTimeDimensions().stream().map(TimeDimension::getDimension).forEach(members::add);
        }
        return members.stream().filter(MemberRef::isQualified).map(m -> MemberRef.parse(m).cubeName()).findFirst();
    }

    static String label(List<String> labels, int index) {
        return label(labels, index, "Query ");
    }

    private static String label(List<String> labels, int index, String prefix) {
        if (labels != null && index < labels.size() && labels.get(index) != null && !labels.get(index).isBlank()) {
            return labels.get(index);
        }
        return prefix + (index + 1);
    }

    private static List<String> warnings(List<ValidationIssue> issues) {
        return issues.stream().filter(issue -> !issue.isError()).map(ValidationIssue::message).toList();
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }
}
