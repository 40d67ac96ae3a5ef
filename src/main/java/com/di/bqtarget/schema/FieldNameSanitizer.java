package com.di.bqtarget.schema;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Maps Singer property names onto legal BigQuery column names.
 * Hyphens and dots become underscores; a leading digit gets an underscore prefix.
 */
public final class FieldNameSanitizer {

    private FieldNameSanitizer() {}

    public static String sanitize(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String cleaned = name.replace('-', '_').replace('.', '_');
        if (Character.isDigit(cleaned.charAt(0))) {
            cleaned = "_" + cleaned;
        }
        return cleaned;
    }

    public static Set<String> sanitizeAll(Collection<String> names) {
        Set<String> out = new LinkedHashSet<>();
        if (names != null) {
            names.forEach(n -> out.add(sanitize(n)));
        }
        return out;
    }
}
