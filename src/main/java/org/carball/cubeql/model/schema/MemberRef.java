package org.carball.cubeql.model.schema;

/**
 * A {@code Cube.member} reference split into its two parts.
 */
public record MemberRef(String cubeName, String memberName) {

    public static MemberRef parse(String qualifiedName) {
        if (qualifiedName == null) {
            throw new IllegalArgumentException("Member name is required");
        }
        int dot = qualifiedName.indexOf('.');
        if (dot <= 0 || dot == qualifiedName.length() - 1 || qualifiedName.indexOf('.', dot + 1) >= 0) {
            throw new IllegalArgumentException(
                    "Member '" + qualifiedName + "' must use the format 'Cube.member'");
        }
        return new MemberRef(qualifiedName.substring(0, dot), qualifiedName.substring(dot + 1));
    }

    public static boolean isQualified(String name) {
        if (name == null) {
            return false;
        }
        int dot = name.indexOf('.');
        return dot > 0 && dot < name.length() - 1 && name.indexOf('.', dot + 1) < 0;
    }

    @Override
    public String toString() {
        return cubeName + "." + memberName;
    }
}
