package org.carball.cubeql.compiler;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.cache.CompiledQueryCache;
import org.carball.cubeql.cache.QueryFingerprint;
import org.carball.cubeql.config.CompilerConfig;
import org.carball.cubeql.exception.CompilationException;
import org.carball.cubeql.exception.IncompleteSpecException;
import org.carball.cubeql.merge.MultiQueryMergeEngine;
import org.carball.cubeql.model.analysis.QueryAnalysis;
import org.carball.cubeql.model.query.MergeStrategy;
import org.carball.cubeql.model.query.MultiQueryRequest;
import org.carball.cubeql.model.query.QueryMode;
import org.carball.cubeql.model.query.SemanticQuery;
import org.carball.cubeql.model.result.CompilationResult;
import org.carball.cubeql.model.result.CompiledQuery;
import org.carball.cubeql.model.result.MultiQueryCompilation;
import org.carball.cubeql.model.schema.SchemaSnapshot;
import org.carball.cubeql.schema.SchemaRegistry;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point of the compiler. Each call takes the current schema snapshot, dispatches on the
 * query's mode and returns freshly built SQL; nothing is shared between calls except the cache.
 */
@Slf4j
public class QueryCompiler {

    private final Supplier<SchemaSnapshot> snapshots;
    private final CompilerConfig config;
    private final Clock clock;
    private final CompiledQueryCache cache;

    public QueryCompiler(SchemaRegistry registry, CompilerConfig config, Clock clock) {
        this(registry::snapshot, config, clock);
        if (cache != null) {
            cache.bindTo(registry);
        }
    }

    public QueryCompiler(SchemaRegistry registry, CompilerConfig config) {
        this(registry, config, Clock.systemUTC());
    }

    /**
     * A compiler over a fixed snapshot, for one-off compilations such as the CLI.
     */
    public QueryCompiler(SchemaSnapshot snapshot, CompilerConfig config) {
        this(() -> snapshot, config, Clock.systemUTC());
    }

    private QueryCompiler(Supplier<SchemaSnapshot> snapshots, CompilerConfig config, Clock clock) {
        this.snapshots = snapshots;
        this.config = config;
        this.clock = clock;
        this.cache = config.isCacheEnabled() ? new CompiledQueryCache(config.getCacheMaxEntries()) : null;
    }

    /**
     * @throws CompilationException when the query cannot be compiled; no SQL is produced
     */
    public CompiledQuery compile(SemanticQuery query) {
        if (query == null) {
            throw new IncompleteSpecException("Query is required");
        }
        SchemaSnapshot snapshot = snapshots.get();
        if (cache == null) {
            return compileUncached(snapshot, query);
        }
        QueryFingerprint fingerprint = QueryFingerprint.of(snapshot.getVersion(), config.getEngine(),
                LocalDate.now(clock.withZone(ZoneOffset.UTC)), query);
        return cache.computeIfAbsent(fingerprint, () -> compileUncached(snapshot, query));
    }

    /**
     * Like {@link #compile} but reports failure as a value.
     */
    public CompilationResult tryCompile(SemanticQuery query) {
        try {
            return CompilationResult.success(compile(query));
        } catch (CompilationException e) {
            log.debug("Compilation failed with {}: {}", e.getErrorCode(), e.getMessage());
            return CompilationResult.failure(e);
        }
    }

    /**
     * The planning rationale of a standard query without its SQL. Unreachable cubes are reported
     * in the analysis instead of failing.
     */
    public QueryAnalysis analyze(SemanticQuery query) {
        return new StandardQueryCompiler(newContext(snapshots.get())).analyze(query);
    }

    public MultiQueryCompilation compileMulti(MultiQueryRequest request) {
        return new MultiQueryMergeEngine(this::compile).compile(request);
    }

    /**
     * Compiles each {@code compareDateRange} period as its own query, labelled by period.
     */
    public MultiQueryCompilation compileComparison(SemanticQuery query) {
        ComparisonQueryExpander expander = new ComparisonQueryExpander(newContext(snapshots.get()).getDates());
        List<ComparisonQueryExpander.PeriodQuery> periods = expander.expand(query);
        if (periods.isEmpty()) {
            throw new IncompleteSpecException("None of the compareDateRange periods could be resolved");
        }
        MultiQueryCompilation.MultiQueryCompilationBuilder result = MultiQueryCompilation.builder()
                .strategy(MergeStrategy.CONCAT);
        for (ComparisonQueryExpander.PeriodQuery period : periods) {
            result.query(compile(period.query()));
            result.label(period.label());
        }
        return result.build();
    }

    public CompiledQueryCache getCache() {
        return cache;
    }

    public CompilerConfig getConfig() {
        return config;
    }

    private CompiledQuery compileUncached(SchemaSnapshot snapshot, SemanticQuery query) {
        CompilationContext context = newContext(snapshot);
        QueryMode mode = query.getMode();
        log.debug("Compiling {} query against schema version {}", mode.value(), snapshot.getVersion());
        switch (mode) {
            case FUNNEL:
                return new FunnelQueryCompiler(context).compile(query.getFunnel());
            case FLOW:
                return new FlowQueryCompiler(context).compile(query.getFlow());
            case RETENTION:
                return new RetentionQueryCompiler(context).compile(query.getRetention());
            case QUERY:
            default:
                return new StandardQueryCompiler(context).compile(query);
        }
    }

    private CompilationContext newContext(SchemaSnapshot snapshot) {
        return new CompilationContext(snapshot, config, clock);
    }
}
