package com.crdtypes.generator.schema;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A named alias to a shared definition ({@code $ref}).
 *
 * The target is bound once, after the definition has been built, which is
 * what lets an otherwise immutable tree refer back to one of its ancestors.
 * Equality and {@code toString} only look at the name so that cyclic
 * structures never recurse.
 */
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(callSuper = true, onlyExplicitlyIncluded = true)
public final class ReferenceNode extends SchemaNode {

    @Getter
    @ToString.Include
    @EqualsAndHashCode.Include
    private final String name;

    private SchemaNode target;

    public ReferenceNode(SchemaFlags flags, String name) {
        super(flags);
        this.name = name;
    }

    public static ReferenceNode named(String name) {
        return new ReferenceNode(null, name);
    }

    public void bind(SchemaNode target) {
        if (this.target != null) {
            throw new IllegalStateException("Reference '" + name + "' is already bound");
        }
        if (target == null) {
            throw new IllegalArgumentException("Reference '" + name + "' cannot be bound to null");
        }
        this.target = target;
    }

    public boolean isBound() {
        return target != null;
    }

    public SchemaNode getTarget() {
        if (target == null) {
            throw new IllegalStateException("Reference '" + name + "' was never bound");
        }
        return target;
    }

    @Override
    public SchemaNode resolve() {
        SchemaNode current = getTarget();
        int hops = 0;
        while (current instanceof ReferenceNode ref) {
            if (++hops > 32) {
                throw new IllegalStateException("Reference '" + name + "' only resolves to other references");
            }
            current = ref.getTarget();
        }
        return current;
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
