package com.crdtypes.generator.codegen.derive;

/**
 * Which generated types a capability request applies to.
 */
public enum CapabilityTarget {
    ALL,
    /** A single type, by its final name. */
    TYPE,
    COMPOSITES,
    ENUMS,
    /** Enumerations whose variants carry no payload. */
    UNIT_ENUMS
}
