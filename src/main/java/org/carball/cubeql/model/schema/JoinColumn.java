package org.carball.cubeql.model.schema;

/**
 * One column pair of an equi-join: {@code source.sourceColumn = target.targetColumn}.
 */
public record JoinColumn(String sourceColumn, String targetColumn) {

    public JoinColumn swapped() {
        return new JoinColumn(targetColumn, sourceColumn);
    }
}
