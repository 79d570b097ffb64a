package org.carball.cubeql.model.result;

import java.util.List;

public record FlowResult(List<FlowNode> nodes, List<FlowLink> links) {}
