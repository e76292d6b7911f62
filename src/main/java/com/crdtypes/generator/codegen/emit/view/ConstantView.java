package com.crdtypes.generator.codegen.emit.view;

import lombok.Value;

@Value
public class ConstantView {
    String name;
    /** Wire literal as a Java expression. */
    String literal;
}
