package com.crdtypes.generator.schema;

import lombok.Builder;
import lombok.Value;

/**
 * Annotations shared by every schema node: documentation, nullability and the
 * Kubernetes {@code x-kubernetes-*} extension flags.
 */
@Value
@Builder(toBuilder = true)
public class SchemaFlags {

    public static final SchemaFlags NONE = SchemaFlags.builder().build();

    String description;

    boolean nullable;

    /**
     * {@code x-kubernetes-int-or-string}
     */
    boolean intOrString;

    /**
     * {@code x-kubernetes-preserve-unknown-fields}
     */
    boolean preserveUnknownFields;

    /**
     * {@code x-kubernetes-embedded-resource}
     */
    boolean embeddedResource;

    /**
     * The schema's {@code default}, already converted to plain Java values
     * (String, Number, Boolean, List, Map).
     */
    Object defaultValue;
}
