package com.crdtypes.generator.codegen.emit.view;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Template data for a class generated from a tagged enum. Exactly one variant
 * is set on an instance.
 */
@Value
@Builder
public class TaggedEnumView {
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
    @Singular
    List<VariantView> variants;
}
