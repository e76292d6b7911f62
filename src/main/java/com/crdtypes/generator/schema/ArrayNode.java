package com.crdtypes.generator.schema;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A homogeneous array. {@code items} is null when the source schema has no
 * single items schema (missing or tuple-style).
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public final class ArrayNode extends SchemaNode {
    private final SchemaNode items;

    @Builder
    public ArrayNode(SchemaFlags flags, SchemaNode items) {
        super(flags);
        this.items = items;
    }

    public static ArrayNode of(SchemaNode items) {
        return new ArrayNode(null, items);
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
