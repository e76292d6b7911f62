package com.crdtypes.generator.codegen.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import lombok.Getter;

/**
 * A named type synthesized from the schema.
 *
 * Structure is fixed at construction. Capabilities and the elided flag are
 * assigned afterwards through {@link TypeGraph}, which rejects the change once
 * the graph is frozen.
 */
@Getter
public abstract class GeneratedType {

    private final String name;
    private final SchemaPath originPath;
    private final String documentation;
    private final TypeKind kind;
    private Set<Capability> capabilities = Collections.unmodifiableSet(EnumSet.noneOf(Capability.class));
    private boolean elided;

    protected GeneratedType(String name, SchemaPath originPath, String documentation, TypeKind kind) {
        this.name = Objects.requireNonNull(name, "name");
        this.originPath = Objects.requireNonNull(originPath, "originPath");
        this.documentation = documentation;
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public boolean has(Capability capability) {
        return capabilities.contains(capability);
    }

    void setCapabilities(Set<Capability> granted) {
        EnumSet<Capability> copy = EnumSet.noneOf(Capability.class);
        copy.addAll(granted);
        this.capabilities = Collections.unmodifiableSet(copy);
    }

    void setElided(boolean elided) {
        this.elided = elided;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + " @ " + originPath + ")";
    }
}
