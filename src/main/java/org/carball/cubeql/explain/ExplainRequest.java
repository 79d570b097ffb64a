package org.carball.cubeql.explain;

import org.carball.cubeql.model.result.CompiledQuery;

import java.util.List;

/**
 * EXPLAIN input: already compiled SQL with its parameters in placeholder order.
 */
public record ExplainRequest(String sql, List<Object> params, boolean analyze) {

    public ExplainRequest {
        params = params == null ? List.of() : List.copyOf(params);
    }

    public static ExplainRequest of(CompiledQuery compiled, boolean analyze) {
        return new ExplainRequest(compiled.getSql(), compiled.getParams(), analyze);
    }
}
