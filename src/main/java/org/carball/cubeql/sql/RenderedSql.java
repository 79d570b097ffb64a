package org.carball.cubeql.sql;

import java.util.List;

/**
 * Final SQL text with its positional parameter values.
 */
public record RenderedSql(String sql, List<Object> params) {}
