package org.carball.cubeql.model.result;

public record FlowLink(String source, String target, long value) {}
