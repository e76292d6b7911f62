package com.crdtypes.generator.codegen.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import com.crdtypes.generator.codegen.model.core.context.ToolDiagnostics;

import lombok.Getter;

/**
 * The normalized output of analysis: named types in name-assignment order and
 * the reference to the root.
 *
 * A graph is populated by a single builder run, annotated by the capability
 * resolver and then frozen; every mutator throws {@link IllegalStateException}
 * afterwards.
 */
public class TypeGraph {

    private final Map<String, GeneratedType> types = new LinkedHashMap<>();

    @Getter
    private final MapRepresentation mapRepresentation;
    @Getter
    private final SchemaCapabilityMode schemaCapabilityMode;
    @Getter
    private final ToolDiagnostics diagnostics;

    @Getter
    private TypeRef rootRef;
    @Getter
    private ResourceInfo resourceInfo;
    @Getter
    private boolean frozen;

    public TypeGraph(MapRepresentation mapRepresentation, SchemaCapabilityMode schemaCapabilityMode,
                     ToolDiagnostics diagnostics) {
        this.mapRepresentation = mapRepresentation;
        this.schemaCapabilityMode = schemaCapabilityMode;
        this.diagnostics = diagnostics != null ? diagnostics : new ToolDiagnostics();
    }

    public void addType(GeneratedType type) {
        checkMutable();
        if (types.containsKey(type.getName())) {
            throw new IllegalArgumentException("Type name already in use: " + type.getName());
        }
        types.put(type.getName(), type);
    }

    public void setRootRef(TypeRef rootRef) {
        checkMutable();
        this.rootRef = rootRef;
    }

    public void setResourceInfo(ResourceInfo resourceInfo) {
        checkMutable();
        this.resourceInfo = resourceInfo;
    }

    public void assignCapabilities(String typeName, Set<Capability> capabilities) {
        checkMutable();
        require(typeName).setCapabilities(capabilities.isEmpty() ? EnumSet.noneOf(Capability.class) : capabilities);
    }

    public void markElided(String typeName) {
        checkMutable();
        require(typeName).setElided(true);
    }

    /**
     * Checks that every named reference resolves, then makes the graph read-only.
     */
    public void freeze() {
        if (frozen) {
            return;
        }
        List<String> dangling = new ArrayList<>();
        forEachReference(ref -> {
            List<String> names = new ArrayList<>();
            ref.collectNames(names);
            for (String name : names) {
                if (!types.containsKey(name)) {
                    dangling.add(name);
                }
            }
        });
        if (!dangling.isEmpty()) {
            throw new IllegalStateException("Unresolved type references: " + dangling);
        }
        frozen = true;
    }

    public Collection<GeneratedType> getTypes() {
        return Collections.unmodifiableCollection(types.values());
    }

    public List<String> getTypeNames() {
        return List.copyOf(types.keySet());
    }

    public Optional<GeneratedType> getType(String name) {
        return Optional.ofNullable(types.get(name));
    }

    public GeneratedType require(String name) {
        GeneratedType type = types.get(name);
        if (type == null) {
            throw new IllegalArgumentException("No such type: " + name);
        }
        return type;
    }

    public int size() {
        return types.size();
    }

    public List<GeneratedType> getElidedTypes() {
        return types.values().stream().filter(GeneratedType::isElided).toList();
    }

    /**
     * Known shapes referenced anywhere in the graph, in first-use order.
     */
    public Set<KnownShape> externalShapesUsed() {
        Set<KnownShape> shapes = new LinkedHashSet<>();
        forEachReference(ref -> collectShapes(ref, shapes));
        return shapes;
    }

    private void forEachReference(Consumer<TypeRef> consumer) {
        if (rootRef != null) {
            consumer.accept(rootRef);
        }
        for (GeneratedType type : types.values()) {
            if (type instanceof CompositeType composite) {
                composite.getFields().forEach(f -> consumer.accept(f.getType()));
            } else if (type instanceof EnumeratedType enumerated) {
                enumerated.getVariants().stream()
                        .filter(v -> v.getPayload() != null)
                        .forEach(v -> consumer.accept(v.getPayload()));
            }
        }
    }

    private static void collectShapes(TypeRef ref, Set<KnownShape> shapes) {
        if (ref instanceof TypeRef.ExternalRef external) {
            shapes.add(external.getShape());
        } else if (ref instanceof TypeRef.OptionalRef optional) {
            collectShapes(optional.getInner(), shapes);
        } else if (ref instanceof TypeRef.SequenceRef sequence) {
            collectShapes(sequence.getElement(), shapes);
        } else if (ref instanceof TypeRef.MapRef map) {
            collectShapes(map.getValue(), shapes);
        }
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Type graph is frozen");
        }
    }
}
