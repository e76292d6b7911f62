package com.crdtypes.generator.codegen.emit.view;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class FieldView {
    String javaName;
    String javaType;
    @Singular("javadocLine")
    List<String> javadoc;
    @Singular
    List<String> annotations;
    /** Initializer expression, or null. */
    String initializer;
}
