package org.carball.cubeql.sql;

import org.carball.cubeql.model.query.TimeGranularity;
import org.carball.cubeql.model.schema.Cube;
import org.carball.cubeql.model.schema.Dimension;
import org.carball.cubeql.model.schema.DimensionType;
import org.carball.cubeql.model.schema.MemberRef;
import org.carball.cubeql.model.schema.SchemaSnapshot;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves member names to SQL expressions against a table alias. A bare column name is qualified
 * with the alias; anything else is an expression where {@code {CUBE}} stands for the alias.
 */
public class MemberSqlResolver {

    private static final Pattern BARE_IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private final SchemaSnapshot snapshot;
    private final SqlDialect dialect;

    public MemberSqlResolver(SchemaSnapshot snapshot, SqlDialect dialect) {
        this.snapshot = snapshot;
        this.dialect = dialect;
    }

    public static SqlFragment qualify(String sql, String alias) {
        String trimmed = sql.trim();
        if (BARE_IDENTIFIER.matcher(trimmed).matches()) {
            return SqlFragment.raw(alias + "." + trimmed);
        }
        return SqlFragment.raw(trimmed.replace("{CUBE}", alias));
    }

    /**
     * Condition text from a measure filter, with {@code {CUBE}} substituted.
     */
    public static SqlFragment condition(String sql, String alias) {
        return SqlFragment.raw(sql.trim().replace("{CUBE}", alias));
    }

    public SqlFragment dimension(String member) {
        Cube cube = cubeOf(member);
        return dimension(member, cube.alias());
    }

    public SqlFragment dimension(String member, String alias) {
        Dimension dimension = snapshot.findDimension(member)
                .orElseThrow(() -> new IllegalArgumentException("Unknown dimension: " + member));
        return qualify(dimension.getSql(), alias);
    }

    /**
     * The dimension expression, truncated when a granularity is given.
     */
    public SqlFragment timeDimension(String member, TimeGranularity granularity, String alias) {
        SqlFragment expression = dimension(member, alias);
        return granularity == null ? expression : dialect.truncateTime(granularity, expression);
    }

    /**
     * Value type of a member; measures count as numbers.
     */
    public Optional<DimensionType> typeOf(String member) {
        Optional<Dimension> dimension = snapshot.findDimension(member);
        if (dimension.isPresent()) {
            return Optional.of(dimension.get().getType());
        }
        return snapshot.isMeasure(member) ? Optional.of(DimensionType.NUMBER) : Optional.empty();
    }

    public String columnAlias(String member) {
        return dialect.quoteIdentifier(member);
    }

    public Cube cubeOf(String member) {
        return snapshot.findCube(MemberRef.parse(member).cubeName())
                .orElseThrow(() -> new IllegalArgumentException("Unknown cube in member: " + member));
    }

    public SchemaSnapshot snapshot() {
        return snapshot;
    }

    public SqlDialect dialect() {
        return dialect;
    }
}
