package com.crdtypes.generator.schema;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * {@code oneOf} / {@code anyOf} over alternative shapes.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public final class UnionNode extends SchemaNode {

    public enum Combinator {
        ONE_OF,
        ANY_OF
    }

    private final Combinator combinator;
    private final List<SchemaNode> variants;

    @Builder
    public UnionNode(SchemaFlags flags, Combinator combinator, @Singular List<SchemaNode> variants) {
        super(flags);
        this.combinator = combinator != null ? combinator : Combinator.ONE_OF;
        this.variants = variants != null ? List.copyOf(variants) : List.of();
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
