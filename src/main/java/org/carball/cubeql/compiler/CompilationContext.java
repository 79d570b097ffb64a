package org.carball.cubeql.compiler;

import lombok.Getter;
import org.carball.cubeql.config.CompilerConfig;
import org.carball.cubeql.model.schema.Cube;
import org.carball.cubeql.model.schema.SchemaSnapshot;
import org.carball.cubeql.planner.JoinPathResolver;
import org.carball.cubeql.sql.DateRangeResolver;
import org.carball.cubeql.sql.FilterSqlBuilder;
import org.carball.cubeql.sql.MeasureSqlBuilder;
import org.carball.cubeql.sql.MemberSqlResolver;
import org.carball.cubeql.sql.SqlDialect;

import java.time.Clock;

/**
 * Everything one compilation works with. Built per call; the join path memo lives exactly as
 * long as the compilation, so funnel steps and merged queries share it.
 */
@Getter
public class CompilationContext {

    private final SchemaSnapshot snapshot;
    private final CompilerConfig config;
    private final SqlDialect dialect;
    private final Clock clock;
    private final DateRangeResolver dates;
    private final JoinPathResolver resolver;
    private final MemberSqlResolver members;
    private final MeasureSqlBuilder measures;
    private final FilterSqlBuilder filters;

    public CompilationContext(SchemaSnapshot snapshot, CompilerConfig config, Clock clock) {
        this.snapshot = snapshot;
        this.config = config;
        this.dialect = config.getEngine().dialect();
        this.clock = clock;
        this.dates = new DateRangeResolver(clock);
        this.resolver = new JoinPathResolver(snapshot.getJoinGraph());
        this.members = new MemberSqlResolver(snapshot, dialect);
        this.measures = new MeasureSqlBuilder(snapshot, dialect);
        this.filters = new FilterSqlBuilder(members, dates);
    }

    public Cube cube(String name) {
        return snapshot.findCube(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown cube: " + name));
    }

    public String quote(String identifier) {
        return dialect.quoteIdentifier(identifier);
    }
}
