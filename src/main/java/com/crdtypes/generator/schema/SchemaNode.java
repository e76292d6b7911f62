package com.crdtypes.generator.schema;

import lombok.EqualsAndHashCode;

/**
 * Base class for all schema nodes.
 *
 * Nodes are immutable once built. Equality is structural, which lets
 * {@code allOf} flattening and version merging compare branches.
 */
@EqualsAndHashCode
public abstract class SchemaNode {

    protected final SchemaFlags flags;

    protected SchemaNode(SchemaFlags flags) {
        this.flags = flags != null ? flags : SchemaFlags.NONE;
    }

    public abstract <R> R accept(SchemaNodeVisitor<R> visitor);

    public SchemaFlags getFlags() {
        return flags;
    }

    public String getDescription() {
        return flags.getDescription();
    }

    public boolean isNullable() {
        return flags.isNullable();
    }

    public boolean isIntOrString() {
        return flags.isIntOrString();
    }

    public boolean isPreserveUnknownFields() {
        return flags.isPreserveUnknownFields();
    }

    public boolean isEmbeddedResource() {
        return flags.isEmbeddedResource();
    }

    public Object getDefaultValue() {
        return flags.getDefaultValue();
    }

    /**
     * Follows {@link ReferenceNode}s to the node that actually carries a shape.
     */
    public SchemaNode resolve() {
        return this;
    }
}
