package com.crdtypes.generator.codegen.util;

import java.util.Locale;
import java.util.Set;

/**
 * Utility for consistent Java naming conventions.
 */
public class NamingUtil {

    private static final Set<String> JAVA_KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "var", "record", "yield");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts a schema name such as {@code lastTransitionTime}, {@code x-kubernetes}
     * or {@code tls_config} to PascalCase. Word boundaries are non-alphanumeric
     * characters; the casing inside a word is kept.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (String word : name.split("[^A-Za-z0-9]+")) {
            sb.append(capitalize(word));
        }
        return sb.toString();
    }

    /**
     * Converts a schema name to camelCase.
     */
    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal == null || pascal.isEmpty()) {
            return pascal;
        }
        return pascal.substring(0, 1).toLowerCase(Locale.ROOT) + pascal.substring(1);
    }

    /**
     * Converts name to SCREAMING_SNAKE_CASE for enum constants.
     */
    public static String toScreamingSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        // Handle camelCase or PascalCase
        String result = name.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        // Everything that cannot appear in an identifier becomes a separator
        result = result.replaceAll("[^A-Za-z0-9]+", "_");
        result = result.replaceAll("^_+|_+$", "");
        return result.toUpperCase(Locale.ROOT);
    }

    /**
     * Makes {@code name} usable as a Java identifier: prefixes a leading digit
     * and suffixes reserved words.
     */
    public static String toJavaIdentifier(String name, String emptyFallback) {
        String result = name == null || name.isEmpty() ? emptyFallback : name;
        if (Character.isDigit(result.charAt(0))) {
            result = "_" + result;
        }
        if (isJavaKeyword(result)) {
            result = result + "_";
        }
        return result;
    }

    public static boolean isJavaKeyword(String name) {
        return JAVA_KEYWORDS.contains(name);
    }

    /**
     * Disambiguates a name by appending a numeric suffix.
     */
    public static String disambiguate(String baseName, Set<String> usedNames) {
        if (!usedNames.contains(baseName)) {
            return baseName;
        }
        int suffix = 2;
        String candidate;
        do {
            candidate = baseName + suffix;
            suffix++;
        } while (usedNames.contains(candidate));

        return candidate;
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1);
    }
}
