package com.crdtypes.generator.schema;

import java.util.Objects;

import lombok.Builder;
import lombok.Value;

/**
 * One entry of a resource's {@code spec.versions}.
 */
@Value
public class SchemaVersion {
    String label;
    boolean served;
    boolean storage;
    boolean statusSubresource;
    SchemaNode root;

    @Builder(toBuilder = true)
    public SchemaVersion(String label, boolean served, boolean storage, boolean statusSubresource, SchemaNode root) {
        this.label = Objects.requireNonNull(label, "label");
        this.served = served;
        this.storage = storage;
        this.statusSubresource = statusSubresource;
        this.root = Objects.requireNonNull(root, "root");
    }
}
