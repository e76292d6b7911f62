package com.crdtypes.generator.codegen.model;

/**
 * Scalar leaf types of the Type Graph.
 */
public enum PrimitiveType {
    STRING,
    BOOLEAN,
    INT8,
    INT16,
    INT32,
    INT64,
    UINT8,
    UINT16,
    UINT32,
    UINT64,
    FLOAT32,
    FLOAT64,
    DATE,
    DATE_TIME,
    BYTES;

    public boolean isIntegral() {
        return switch (this) {
            case INT8, INT16, INT32, INT64, UINT8, UINT16, UINT32, UINT64 -> true;
            default -> false;
        };
    }
}
