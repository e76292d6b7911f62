package com.crdtypes.generator.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * A closed list of literal values ({@code enum}).
 *
 * Literals keep their source spelling and order; a literal may be null when
 * the source enumerates {@code null} for a nullable field.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public final class EnumerationNode extends SchemaNode {
    private final ScalarKind baseKind;
    private final List<Object> literals;

    @Builder
    public EnumerationNode(SchemaFlags flags, ScalarKind baseKind, @Singular List<Object> literals) {
        super(flags);
        this.baseKind = baseKind != null ? baseKind : ScalarKind.STRING;
        // List.copyOf rejects null elements
        this.literals = Collections.unmodifiableList(literals != null ? new ArrayList<>(literals) : List.of());
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
