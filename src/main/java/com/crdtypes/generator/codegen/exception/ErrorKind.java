package com.crdtypes.generator.codegen.exception;

/**
 * Classification of analysis failures.
 */
public enum ErrorKind {
    UNSUPPORTED_SCHEMA_CONSTRUCT(true),
    NAMING_COLLISION(false),
    IRRECONCILABLE_UNION(true),
    RECONCILE_ERROR(false),
    CYCLE_DEPTH_EXCEEDED(false);

    private final boolean relaxable;

    ErrorKind(boolean relaxable) {
        this.relaxable = relaxable;
    }

    /**
     * Whether relaxed mode may downgrade this failure to a diagnostic.
     */
    public boolean isRelaxable() {
        return relaxable;
    }
}
