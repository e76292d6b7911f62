package com.crdtypes.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A field of a composite type. {@code name} is the wire name, exactly as it
 * appears in the schema.
 */
@Value
@Builder(toBuilder = true)
public class CompositeField {

    @NonNull
    String name;

    /**
     * Field type; wrapped in {@link TypeRef.OptionalRef} when {@link #optional}.
     */
    @NonNull
    TypeRef type;

    boolean optional;

    @NonNull
    @Builder.Default
    AbsentPolicy absentPolicy = AbsentPolicy.NONE;

    String documentation;

    /**
     * Schema-declared default value, as plain Java values.
     */
    Object defaultValue;

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }
}
