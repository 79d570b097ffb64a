package org.carball.cubeql.explain;

import org.carball.cubeql.exception.ExplainException;

import java.util.List;
import java.util.Map;

/**
 * Runs one statement and returns its rows as column maps in result order.
 */
@FunctionalInterface
public interface ExplainExecutor {

    List<Map<String, Object>> execute(String sql, List<Object> params) throws ExplainException;
}
