package org.carball.cubeql.explain;

import java.util.List;

/**
 * A parsed plan. {@code raw} is the plan exactly as the database printed it and stays
 * authoritative; the operations and summary are best-effort readings of it.
 */
public record ExplainResult(
    String raw,
    List<PlanOperation> operations,
    ExplainSummary summary,
    String sql,
    List<Object> params
) {}
