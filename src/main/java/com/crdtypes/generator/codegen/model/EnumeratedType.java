package com.crdtypes.generator.codegen.model;

import java.util.List;
import java.util.Optional;

import lombok.Getter;

@Getter
public final class EnumeratedType extends GeneratedType {

    private final List<EnumVariant> variants;
    private final Object defaultLiteral;

    public EnumeratedType(String name, SchemaPath originPath, String documentation, TypeKind kind,
                          List<EnumVariant> variants, Object defaultLiteral) {
        super(name, originPath, documentation, kind);
        if (kind == TypeKind.COMPOSITE) {
            throw new IllegalArgumentException("Enumerated type cannot be of kind " + kind);
        }
        this.variants = List.copyOf(variants);
        this.defaultLiteral = defaultLiteral;
    }

    public Optional<Object> getDefaultLiteral() {
        return Optional.ofNullable(defaultLiteral);
    }

    public boolean isUnitEnum() {
        return getKind() == TypeKind.UNIT_ENUM;
    }
}
