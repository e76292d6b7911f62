package com.crdtypes.generator.codegen.emit.view;

import lombok.Value;

@Value
public class VariantView {
    String fieldName;
    /** Capitalized variant name used in factory and accessor names. */
    String methodSuffix;
    String javaType;
}
