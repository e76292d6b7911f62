package com.crdtypes.generator.codegen.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A variant of an enumerated type.
 *
 * Unit variants carry the literal exactly as spelled in the schema and no
 * payload; tagged variants carry a payload and no literal.
 */
@Value
public class EnumVariant {
    @NonNull
    String name;
    Object literal;
    TypeRef payload;

    public static EnumVariant unit(String name, Object literal) {
        return new EnumVariant(name, literal, null);
    }

    public static EnumVariant tagged(String name, TypeRef payload) {
        return new EnumVariant(name, null, payload);
    }

    public boolean isUnit() {
        return payload == null;
    }
}
