package com.crdtypes.generator.schema;

import java.util.Objects;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A string, integer, number or boolean, optionally refined by a {@code format}.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public final class ScalarNode extends SchemaNode {
    private final ScalarKind kind;
    private final String format;

    @Builder
    public ScalarNode(SchemaFlags flags, ScalarKind kind, String format) {
        super(flags);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.format = format;
    }

    public static ScalarNode of(ScalarKind kind) {
        return new ScalarNode(null, kind, null);
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
