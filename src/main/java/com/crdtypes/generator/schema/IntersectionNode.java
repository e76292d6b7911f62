package com.crdtypes.generator.schema;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * {@code allOf}: every branch applies at once. Only object branches can be
 * flattened into a single shape.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public final class IntersectionNode extends SchemaNode {
    private final List<SchemaNode> branches;

    @Builder
    public IntersectionNode(SchemaFlags flags, @Singular List<SchemaNode> branches) {
        super(flags);
        this.branches = branches != null ? List.copyOf(branches) : List.of();
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
