package com.crdtypes.generator.schema;

import java.util.Locale;
import java.util.Optional;

/**
 * JSON schema scalar {@code type} values.
 */
public enum ScalarKind {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN;

    public String schemaName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ScalarKind> fromSchemaType(String type) {
        if (type == null) {
            return Optional.empty();
        }
        for (ScalarKind kind : values()) {
            if (kind.schemaName().equals(type)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
