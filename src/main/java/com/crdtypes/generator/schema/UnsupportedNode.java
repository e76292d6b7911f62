package com.crdtypes.generator.schema;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A schema the model has no shape for, such as a property without a type or
 * an unknown {@code type} keyword. Kept in the tree so that analysis can report
 * it with its path, or replace it with an untyped value in relaxed mode.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public final class UnsupportedNode extends SchemaNode {
    private final String reason;

    public UnsupportedNode(SchemaFlags flags, String reason) {
        super(flags);
        this.reason = reason;
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
