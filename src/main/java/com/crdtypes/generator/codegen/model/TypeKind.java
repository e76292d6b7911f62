package com.crdtypes.generator.codegen.model;

public enum TypeKind {
    /** Product type with named fields. */
    COMPOSITE,
    /** Sum type whose variants carry a payload. */
    TAGGED_ENUM,
    /** Closed set of literal values. */
    UNIT_ENUM
}
