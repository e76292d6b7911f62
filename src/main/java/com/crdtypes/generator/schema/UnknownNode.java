package com.crdtypes.generator.schema;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A schema-less value: an empty schema or one that preserves unknown fields.
 */
@ToString
@EqualsAndHashCode(callSuper = true)
public final class UnknownNode extends SchemaNode {

    public UnknownNode(SchemaFlags flags) {
        super(flags);
    }

    public static UnknownNode of() {
        return new UnknownNode(null);
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
