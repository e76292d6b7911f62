package com.crdtypes.generator.schema;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An open object ({@code additionalProperties}) keyed by string.
 * A null value schema means any value is accepted.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public final class MapNode extends SchemaNode {
    private final SchemaNode valueSchema;

    @Builder
    public MapNode(SchemaFlags flags, SchemaNode valueSchema) {
        super(flags);
        this.valueSchema = valueSchema;
    }

    public static MapNode of(SchemaNode valueSchema) {
        return new MapNode(null, valueSchema);
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
