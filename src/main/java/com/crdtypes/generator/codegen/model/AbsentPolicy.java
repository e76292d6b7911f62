package com.crdtypes.generator.codegen.model;

/**
 * How a required field behaves when the wire value is absent.
 */
public enum AbsentPolicy {
    NONE,
    /** Required sequences and maps deserialize an absent value as empty. */
    TREAT_ABSENT_AS_EMPTY
}
