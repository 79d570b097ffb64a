package org.carball.cubeql.model.schema;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the measures a calculated measure template refers to. {@code {CUBE}} is the alias
 * placeholder, not a reference.
 */
public final class MeasureReferences {

    public static final Pattern REFERENCE = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)?)}");

    private MeasureReferences() {
        // Utility class - prevent instantiation
    }

    /**
     * Qualified names of the measures referenced by the template, in order of first appearance.
     */
    public static List<String> of(String cubeName, String template) {
        Set<String> references = new LinkedHashSet<>();
        if (template == null) {
            return List.of();
        }
        Matcher matcher = REFERENCE.matcher(template);
        while (matcher.find()) {
            String reference = matcher.group(1);
            if ("CUBE".equals(reference)) {
                continue;
            }
            references.add(reference.contains(".") ? reference : cubeName + "." + reference);
        }
        return List.copyOf(references);
    }
}
