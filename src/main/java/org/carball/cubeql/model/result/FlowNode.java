package org.carball.cubeql.model.result;

public record FlowNode(String id, String name, int layer, long value) {}
