package com.crdtypes.generator.codegen.emit.view;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Template data for a class generated from a composite type.
 */
@Value
@Builder
public class CompositeView {
    /** Comment lines written above the package declaration. */
    @Singular("headerLine")
    List<String> header;
    String packageName;
    List<String> imports;
    @Singular("javadocLine")
    List<String> javadoc;
    @Singular
    List<String> annotations;
    String className;
    /** Extends clause, or null. */
    String superclass;
    @Singular("implemented")
    List<String> interfaces;
    @Singular
    List<FieldView> fields;
}
