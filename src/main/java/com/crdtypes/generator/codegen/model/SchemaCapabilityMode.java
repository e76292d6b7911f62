package com.crdtypes.generator.codegen.model;

/**
 * Whether generated types describe their own schema.
 */
public enum SchemaCapabilityMode {
    DISABLED,
    MANUAL,
    DERIVED
}
