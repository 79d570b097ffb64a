package org.carball.cubeql.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable piece of SQL whose values are kept apart from the text. Fragments are combined
 * freely while a query is assembled; placeholders are numbered only when the final statement is
 * rendered, so the same fragment can be reused in several positions.
 */
public final class SqlFragment {

    private static final SqlFragment EMPTY = new SqlFragment(List.of());

    /**
     * A bound value. Rendered as the dialect's placeholder.
     */
    public record Param(Object value) {}

    private final List<Object> parts;

    private SqlFragment(List<Object> parts) {
        this.parts = parts;
    }

    public static SqlFragment empty() {
        return EMPTY;
    }

    public static SqlFragment raw(String sql) {
        return sql == null || sql.isEmpty() ? EMPTY : new SqlFragment(List.of(sql));
    }

    public static SqlFragment param(Object value) {
        return new SqlFragment(List.of(new Param(value)));
    }

    /**
     * Joins fragments with a separator, skipping empty ones.
     */
    public static SqlFragment join(String separator, List<SqlFragment> fragments) {
        Builder builder = builder();
        boolean first = true;
        for (SqlFragment fragment : fragments) {
            if (fragment == null || fragment.isEmpty()) {
                continue;
            }
            if (!first) {
                builder.sql(separator);
            }
            builder.append(fragment);
            first = false;
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public SqlFragment append(String sql) {
        return builder().append(this).sql(sql).build();
    }

    public SqlFragment append(SqlFragment other) {
        return builder().append(this).append(other).build();
    }

    public SqlFragment prepend(String sql) {
        return builder().sql(sql).append(this).build();
    }

    /**
     * This fragment in parentheses.
     */
    public SqlFragment parenthesized() {
        return builder().sql("(").append(this).sql(")").build();
    }

    public boolean isEmpty() {
        return parts.isEmpty();
    }

    public boolean hasParams() {
        return parts.stream().anyMatch(p -> p instanceof Param);
    }

    /**
     * Numbers the placeholders in order of appearance and collects their values.
     */
    public RenderedSql render(SqlDialect dialect) {
        StringBuilder sql = new StringBuilder();
        List<Object> params = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Param param) {
                params.add(param.value());
                sql.append(dialect.placeholder(params.size()));
            } else {
                sql.append((String) part);
            }
        }
        return new RenderedSql(sql.toString(), Collections.unmodifiableList(params));
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof SqlFragment other && parts.equals(other.parts));
    }

    @Override
    public int hashCode() {
        return parts.hashCode();
    }

    /**
     * Debug form with values shown as {@code ?}.
     */
    @Override
    public String toString() {
        StringBuilder sql = new StringBuilder();
        for (Object part : parts) {
            sql.append(part instanceof Param ? "?" : part);
        }
        return sql.toString();
    }

    public static final class Builder {

        private final List<Object> parts = new ArrayList<>();

        private Builder() {
        }

        public Builder sql(String sql) {
            if (sql == null || sql.isEmpty()) {
                return this;
            }
            int last = parts.size() - 1;
            if (last >= 0 && parts.get(last) instanceof String previous) {
                parts.set(last, previous + sql);
            } else {
                parts.add(sql);
            }
            return this;
        }

        public Builder param(Object value) {
            parts.add(new Param(value));
            return this;
        }

        public Builder append(SqlFragment fragment) {
            for (Object part : fragment.parts) {
                if (part instanceof String text) {
                    sql(text);
                } else {
                    parts.add(part);
                }
            }
            return this;
        }

        public boolean isEmpty() {
            return parts.isEmpty();
        }

        public SqlFragment build() {
            return parts.isEmpty() ? EMPTY : new SqlFragment(List.copyOf(parts));
        }
    }
}
