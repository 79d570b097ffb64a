package org.carball.cubeql.model.analysis;

import java.util.List;

public record PrimaryCubeAnalysis(
    String selectedCube,
    SelectionReason reason,
    String explanation,
    List<PrimaryCubeCandidate> candidates
) {}
