package org.carball.cubeql.model.schema;

import java.util.List;

/**
 * A relationship as seen when walking from {@code fromCube} to {@code toCube}. Join columns and the
 * junction table are already oriented in the walking direction; {@code reversed} tells whether the
 * relationship was declared on the other cube.
 */
public record GraphEdge(String fromCube,
                        String toCube,
                        String relationshipName,
                        RelationshipType type,
                        JoinType joinType,
                        List<JoinColumn> joinColumns,
                        JunctionTable junctionTable,
                        boolean reversed) {

    static GraphEdge forward(String fromCube, Relationship relationship) {
        return new GraphEdge(fromCube, relationship.getTargetCube(), relationship.getName(),
                relationship.getType(), relationship.effectiveJoinType(),
                relationship.getJoinColumns(), relationship.getJunctionTable(), false);
    }

    static GraphEdge backward(String declaringCube, Relationship relationship) {
        RelationshipType inverse = relationship.getType().inverse();
        List<JoinColumn> swapped = relationship.getJoinColumns().stream().map(JoinColumn::swapped).toList();
        JunctionTable junction = relationship.getJunctionTable() != null
                ? relationship.getJunctionTable().reversed() : null;
        return new GraphEdge(relationship.getTargetCube(), declaringCube, relationship.getName(),
                inverse, inverse.defaultJoinType(), swapped, junction, true);
    }

    public boolean isManyToMany() {
        return type == RelationshipType.BELONGS_TO_MANY;
    }
}
