package com.crdtypes.generator.codegen.derive;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crdtypes.generator.codegen.model.Capability;
import com.crdtypes.generator.codegen.model.CompositeField;
import com.crdtypes.generator.codegen.model.CompositeType;
import com.crdtypes.generator.codegen.model.EnumeratedType;
import com.crdtypes.generator.codegen.model.GeneratedType;
import com.crdtypes.generator.codegen.model.SchemaCapabilityMode;
import com.crdtypes.generator.codegen.model.TypeGraph;
import com.crdtypes.generator.codegen.model.TypeKind;
import com.crdtypes.generator.codegen.model.TypeRef;
import com.crdtypes.generator.codegen.model.core.context.GeneratorConfig;

/**
 * Decides, per generated type, which of the requested capabilities it can
 * actually support.
 *
 * Every decision depends only on the graph's structure, so the order in which
 * types are resolved does not matter. Defaultability is computed once per
 * graph.
 */
public class CapabilityResolver {

    private static final Logger log = LoggerFactory.getLogger(CapabilityResolver.class);

    private final GeneratorConfig config;

    public CapabilityResolver(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public void resolve(TypeGraph graph) {
        Defaults defaults = new Defaults(graph);
        int withheld = 0;
        for (GeneratedType type : graph.getTypes()) {
            Set<Capability> requested = requested(type);
            Set<Capability> granted = EnumSet.noneOf(Capability.class);
            for (Capability capability : requested) {
                if (supports(type, capability, defaults)) {
                    granted.add(capability);
                } else {
                    withheld++;
                    log.debug("{}: withholding {}", type.getName(), capability);
                }
            }
            graph.assignCapabilities(type.getName(), granted);
        }

        for (String name : config.getElidedTypes()) {
            if (graph.getType(name).isPresent()) {
                graph.markElided(name);
                log.debug("Eliding {} from the output", name);
            } else {
                log.warn("Cannot elide {}: no such generated type", name);
            }
        }
        log.debug("Resolved capabilities for {} types ({} withheld)", graph.size(), withheld);
    }

    Set<Capability> requested(GeneratedType type) {
        Set<Capability> requested = EnumSet.noneOf(Capability.class);
        for (CapabilityRequest request : config.getCapabilityRequests()) {
            if (request.appliesTo(type)) {
                requested.add(request.getCapability());
            }
        }
        if (config.isEnableBuilders() && type.getKind() == TypeKind.COMPOSITE) {
            requested.add(Capability.BUILDER);
        }
        if (config.getEffectiveSchemaMode() == SchemaCapabilityMode.DERIVED) {
            requested.add(Capability.SCHEMA);
        }
        return requested;
    }

    private boolean supports(GeneratedType type, Capability capability, Defaults defaults) {
        return switch (capability) {
            case EQUALITY, SCHEMA -> true;
            case BUILDER -> type.getKind() == TypeKind.COMPOSITE;
            case ORDERING -> !containsUnknown(type);
            case DEFAULT -> defaults.isDefaultable(type);
        };
    }

    private static boolean containsUnknown(GeneratedType type) {
        return switch (type.getKind()) {
            case COMPOSITE -> ((CompositeType) type).getFields().stream()
                    .anyMatch(f -> f.getType().containsUnknown());
            case TAGGED_ENUM -> ((EnumeratedType) type).getVariants().stream()
                    .anyMatch(v -> v.getPayload() != null && v.getPayload().containsUnknown());
            case UNIT_ENUM -> false;
        };
    }

    /**
     * Answers "does this type have a zero value" for every type of the graph.
     *
     * Computed once as a greatest fixed point: every type starts out
     * defaultable and loses it when one of its required fields has no default
     * under the current answers. A required back-edge of a cycle never has a
     * zero value, since constructing one would never terminate. The answer is
     * the same in any resolution order.
     */
    private static final class Defaults {
        private final Map<String, Boolean> memo = new HashMap<>();

        Defaults(TypeGraph graph) {
            graph.getTypes().forEach(t -> memo.put(t.getName(), Boolean.TRUE));
            boolean changed = true;
            while (changed) {
                changed = false;
                for (GeneratedType type : graph.getTypes()) {
                    if (memo.get(type.getName()) && !evaluate(type)) {
                        memo.put(type.getName(), Boolean.FALSE);
                        changed = true;
                    }
                }
            }
        }

        boolean isDefaultable(GeneratedType type) {
            return memo.getOrDefault(type.getName(), Boolean.FALSE);
        }

        private boolean evaluate(GeneratedType type) {
            return switch (type.getKind()) {
                case COMPOSITE -> ((CompositeType) type).getFields().stream().allMatch(this::hasDefault);
                case UNIT_ENUM -> ((EnumeratedType) type).getDefaultLiteral().isPresent();
                case TAGGED_ENUM -> false;
            };
        }

        private boolean hasDefault(CompositeField field) {
            return field.hasDefaultValue() || field.isOptional() || refHasDefault(field.getType());
        }

        private boolean refHasDefault(TypeRef ref) {
            if (ref instanceof TypeRef.OptionalRef || ref instanceof TypeRef.SequenceRef
                    || ref instanceof TypeRef.MapRef || ref instanceof TypeRef.PrimitiveRef) {
                return true;
            }
            if (ref instanceof TypeRef.ExternalRef external) {
                return external.getShape().hasDefault();
            }
            if (ref instanceof TypeRef.NamedRef named) {
                return !named.isIndirect() && memo.getOrDefault(named.getTypeName(), Boolean.FALSE);
            }
            return false;
        }
    }
}
