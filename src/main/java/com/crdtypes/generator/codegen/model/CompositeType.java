package com.crdtypes.generator.codegen.model;

import java.util.List;
import java.util.Optional;

import lombok.Getter;

@Getter
public final class CompositeType extends GeneratedType {

    private final List<CompositeField> fields;

    public CompositeType(String name, SchemaPath originPath, String documentation, List<CompositeField> fields) {
        super(name, originPath, documentation, TypeKind.COMPOSITE);
        this.fields = List.copyOf(fields);
    }

    public Optional<CompositeField> field(String fieldName) {
        return fields.stream().filter(f -> f.getName().equals(fieldName)).findFirst();
    }
}
