package com.crdtypes.generator.codegen.model;

public enum MapRepresentation {
    ORDERED,
    UNORDERED
}
