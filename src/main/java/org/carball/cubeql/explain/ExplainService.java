package org.carball.cubeql.explain;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.config.CompilerConfig;
import org.carball.cubeql.exception.ExplainException;
import org.carball.cubeql.sql.DatabaseEngine;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs EXPLAIN off the caller's thread. Requests can be tied to a slot, such as one chart on a
 * dashboard; a newer request for the same slot cancels the older one so its result is never
 * delivered.
 */
@Slf4j
public class ExplainService implements AutoCloseable {

    private static final Pattern POSTGRES_PLACEHOLDER = Pattern.compile("\\$(\\d+)");
    private static final String QUERY_PLAN = "QUERY PLAN";

    private final ExplainExecutor executor;
    private final DatabaseEngine engine;
    private final ExecutorService pool;
    private final long timeoutSeconds;
    private final Map<String, CompletableFuture<ExplainResult>> slots = new ConcurrentHashMap<>();
    private final PostgresExplainParser postgresParser = new PostgresExplainParser();
    private final MySqlExplainParser mySqlParser = new MySqlExplainParser();
    private final SqliteExplainParser sqliteParser = new SqliteExplainParser();

    public ExplainService(ExplainExecutor executor, CompilerConfig config) {
        this(executor, config.getEngine(), Executors.newFixedThreadPool(Math.max(1, config.getExplainThreads())),
                config.getExplainTimeoutSeconds());
    }

    ExplainService(ExplainExecutor executor, DatabaseEngine engine, ExecutorService pool, long timeoutSeconds) {
        this.executor = executor;
        this.engine = engine;
        this.pool = pool;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Completes exceptionally with {@link ExplainException} when the database rejects the
     * statement or the timeout passes.
     */
    public CompletableFuture<ExplainResult> explain(ExplainRequest request) {
        CompletableFuture<ExplainResult> future = CompletableFuture.supplyAsync(() -> run(request), pool);
        if (timeoutSeconds > 0) {
            future = future.orTimeout(timeoutSeconds, TimeUnit.SECONDS);
        }
        return future.exceptionallyCompose(ExplainService::unwrap);
    }

    /**
     * Like {@link #explain(ExplainRequest)}, cancelling whatever is still running for the slot.
     */
    public CompletableFuture<ExplainResult> explain(String slot, ExplainRequest request) {
        CompletableFuture<ExplainResult> future = explain(request);
        CompletableFuture<ExplainResult> previous = slots.put(slot, future);
        if (previous != null && !previous.isDone()) {
            log.debug("Cancelling stale EXPLAIN for slot {}", slot);
            previous.cancel(true);
        }
        future.whenComplete((result, error) -> slots.remove(slot, future));
        return future;
    }

    public void cancel(String slot) {
        CompletableFuture<ExplainResult> running = slots.remove(slot);
        if (running != null) {
            running.cancel(true);
        }
    }

    public boolean isRunning(String slot) {
        CompletableFuture<ExplainResult> running = slots.get(slot);
        return running != null && !running.isDone();
    }

    @Override
    public void close() {
        slots.values().forEach(future -> future.cancel(true));
        slots.clear();
        pool.shutdownNow();
    }

    private ExplainResult run(ExplainRequest request) {
        String prefix = request.analyze() ? "EXPLAIN ANALYZE " : "EXPLAIN ";
        try {
            switch (engine) {
                case MYSQL: {
                    List<Map<String, Object>> rows = executor.execute(prefix + request.sql(), request.params());
                    return mySqlParser.parse(rows, request.sql(), request.params());
                }
                case SQLITE: {
                    // SQLite has no EXPLAIN ANALYZE; only the plan is available
                    if (request.analyze()) {
                        log.debug("Ignoring analyze on SQLite, running EXPLAIN QUERY PLAN only");
                    }
                    List<Map<String, Object>> rows = executor.execute("EXPLAIN QUERY PLAN " + request.sql(),
                            request.params());
                    return sqliteParser.parse(rows, request.sql(), request.params());
                }
                case POSTGRES:
                default: {
                    String inlined = inlinePostgresParameters(request.sql(), request.params());
                    List<Map<String, Object>> rows = executor.execute(prefix + inlined, List.of());
                    return postgresParser.parse(planLines(rows), request.sql(), request.params());
                }
            }
        } catch (ExplainException e) {
            log.warn("EXPLAIN failed: {}", e.getMessage());
            throw new CompletionException(e);
        } catch (RuntimeException e) {
            throw new CompletionException(new ExplainException("Could not read EXPLAIN output: " + e.getMessage(), e));
        }
    }

    /**
     * PostgreSQL cannot plan a statement with unbound {@code $n} placeholders, so values are
     * written into the text as literals.
     */
    static String inlinePostgresParameters(String sql, List<Object> params) {
        Matcher matcher = POSTGRES_PLACEHOLDER.matcher(sql);
        StringBuilder inlined = new StringBuilder();
        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1)) - 1;
            String literal = index >= 0 && index < params.size() ? literal(params.get(index)) : matcher.group();
            matcher.appendReplacement(inlined, Matcher.quoteReplacement(literal));
        }
        matcher.appendTail(inlined);
        return inlined.toString();
    }

    static String literal(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof Boolean bool) {
            return bool ? "TRUE" : "FALSE";
        }
        if (value instanceof TemporalAccessor) {
            return "'" + value + "'";
        }
        if (value instanceof List<?> list) {
            List<String> elements = new ArrayList<>();
            list.forEach(element -> elements.add(literal(element)));
            return "ARRAY[" + String.join(", ", elements) + "]";
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }

    private static List<String> planLines(List<Map<String, Object>> rows) {
        List<String> lines = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Object line = null;
            for (Map.Entry<String, Object> column : row.entrySet()) {
                if (column.getKey().equalsIgnoreCase(QUERY_PLAN) || column.getKey().equalsIgnoreCase("queryplan")) {
                    line = column.getValue();
                }
            }
            if (line == null && row.size() == 1) {
                line = row.values().iterator().next();
            }
            if (line != null) {
                lines.add(line.toString());
            }
        }
        return lines;
    }

    private static CompletableFuture<ExplainResult> unwrap(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            cause = new ExplainException("EXPLAIN timed out", cause);
        }
        return CompletableFuture.failedFuture(cause);
    }
}
