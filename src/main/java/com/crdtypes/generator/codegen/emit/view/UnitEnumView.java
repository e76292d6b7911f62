package com.crdtypes.generator.codegen.emit.view;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Template data for a Java enum generated from a unit enum.
 */
@Value
@Builder
public class UnitEnumView {
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
    /** Java type of the wire literals. */
    String valueType;
    @Singular
    List<ConstantView> constants;
    /** Constant returned by {@code defaultValue()}, or null when there is none. */
    String defaultConstant;
}
