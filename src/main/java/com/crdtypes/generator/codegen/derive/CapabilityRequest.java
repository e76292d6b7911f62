package com.crdtypes.generator.codegen.derive;

import com.crdtypes.generator.codegen.model.Capability;
import com.crdtypes.generator.codegen.model.GeneratedType;
import com.crdtypes.generator.codegen.model.TypeKind;

import lombok.NonNull;
import lombok.Value;

/**
 * A user request to add a capability to a set of types.
 *
 * Textual form: {@code Capability}, {@code TypeName=Capability},
 * {@code @struct=Capability}, {@code @enum=Capability} or
 * {@code @enum:simple=Capability}.
 */
@Value
public class CapabilityRequest {

    @NonNull
    CapabilityTarget target;
    String typeName;
    @NonNull
    Capability capability;

    public static CapabilityRequest all(Capability capability) {
        return new CapabilityRequest(CapabilityTarget.ALL, null, capability);
    }

    public static CapabilityRequest forType(String typeName, Capability capability) {
        return new CapabilityRequest(CapabilityTarget.TYPE, typeName, capability);
    }

    public static CapabilityRequest parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Capability request must not be blank");
        }
        int eq = value.indexOf('=');
        if (eq < 0) {
            return all(Capability.fromName(value));
        }
        String target = value.substring(0, eq).trim();
        String capability = value.substring(eq + 1).trim();
        if (target.isEmpty()) {
            throw new IllegalArgumentException("Capability target cannot be empty in '" + value + "'");
        }
        if (capability.isEmpty()) {
            throw new IllegalArgumentException("Capability cannot be empty in '" + value + "'");
        }
        if (!target.startsWith("@")) {
            return forType(target, Capability.fromName(capability));
        }
        CapabilityTarget group = switch (target.substring(1)) {
            case "struct", "structs" -> CapabilityTarget.COMPOSITES;
            case "enum", "enums" -> CapabilityTarget.ENUMS;
            case "enum:simple", "enums:simple" -> CapabilityTarget.UNIT_ENUMS;
            default -> throw new IllegalArgumentException("Unknown capability target " + target
                    + ", must be one of @struct, @enum or @enum:simple");
        };
        return new CapabilityRequest(group, null, Capability.fromName(capability));
    }

    public boolean appliesTo(GeneratedType type) {
        return switch (target) {
            case ALL -> true;
            case TYPE -> type.getName().equals(typeName);
            case COMPOSITES -> type.getKind() == TypeKind.COMPOSITE;
            case ENUMS -> type.getKind() != TypeKind.COMPOSITE;
            case UNIT_ENUMS -> type.getKind() == TypeKind.UNIT_ENUM;
        };
    }
}
