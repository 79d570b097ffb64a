package org.carball.cubeql.model.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class Relationship {
    String name;
    String targetCube;
    RelationshipType type;
    @Singular
    List<JoinColumn> joinColumns;
    JunctionTable junctionTable;
    JoinType sqlJoinType;

    public JoinType effectiveJoinType() {
        return sqlJoinType != null ? sqlJoinType : type.defaultJoinType();
    }
}
