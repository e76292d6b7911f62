package com.crdtypes.generator.codegen.model;

import java.util.Locale;

/**
 * Derivable behaviours a generated type can carry.
 */
public enum Capability {
    EQUALITY,
    ORDERING,
    DEFAULT,
    SCHEMA,
    BUILDER;

    /**
     * Parses a capability name, case-insensitively, accepting the common
     * aliases used on the command line.
     */
    public static Capability fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Capability name must not be blank");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "equality", "eq", "partialeq", "equals" -> EQUALITY;
            case "ordering", "ord", "partialord", "comparable" -> ORDERING;
            case "default" -> DEFAULT;
            case "schema", "jsonschema" -> SCHEMA;
            case "builder", "typedbuilder" -> BUILDER;
            default -> throw new IllegalArgumentException("Unknown capability: " + name);
        };
    }
}
