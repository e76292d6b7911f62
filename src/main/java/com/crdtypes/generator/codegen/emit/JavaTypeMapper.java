package com.crdtypes.generator.codegen.emit;

import java.util.Objects;

import com.crdtypes.generator.codegen.model.KnownShape;
import com.crdtypes.generator.codegen.model.MapRepresentation;
import com.crdtypes.generator.codegen.model.PrimitiveType;
import com.crdtypes.generator.codegen.model.TypeRef;
import com.crdtypes.generator.codegen.util.ImportManager;

/**
 * Maps Type Graph references to Java source types.
 *
 * Fields are always declared with reference types so that an absent value can
 * be told apart from a zero value.
 */
public class JavaTypeMapper {

    static final String JSON_NODE = "com.fasterxml.jackson.databind.JsonNode";

    private final MapRepresentation mapRepresentation;

    public JavaTypeMapper(MapRepresentation mapRepresentation) {
        this.mapRepresentation = Objects.requireNonNull(mapRepresentation, "mapRepresentation");
    }

    public String javaType(TypeRef ref, ImportManager imports) {
        if (ref instanceof TypeRef.OptionalRef optional) {
            return javaType(optional.getInner(), imports);
        }
        if (ref instanceof TypeRef.PrimitiveRef primitive) {
            return primitiveType(primitive.getType(), imports);
        }
        if (ref instanceof TypeRef.NamedRef named) {
            return named.getTypeName();
        }
        if (ref instanceof TypeRef.ExternalRef external) {
            return imports.use(externalClass(external.getShape()));
        }
        if (ref instanceof TypeRef.SequenceRef sequence) {
            return imports.use("java.util.List") + "<" + javaType(sequence.getElement(), imports) + ">";
        }
        if (ref instanceof TypeRef.MapRef map) {
            return imports.use("java.util.Map") + "<String, " + javaType(map.getValue(), imports) + ">";
        }
        return imports.use(JSON_NODE);
    }

    /**
     * Concrete map class matching the configured key ordering.
     */
    public String mapImplementation() {
        return mapRepresentation == MapRepresentation.ORDERED ? "java.util.TreeMap" : "java.util.HashMap";
    }

    static String primitiveType(PrimitiveType type, ImportManager imports) {
        return switch (type) {
            case STRING -> "String";
            case BOOLEAN -> "Boolean";
            case INT8, INT16, INT32, UINT8, UINT16 -> "Integer";
            case INT64, UINT32 -> "Long";
            case UINT64 -> imports.use("java.math.BigInteger");
            case FLOAT32 -> "Float";
            case FLOAT64 -> "Double";
            case DATE -> imports.use("java.time.LocalDate");
            case DATE_TIME -> imports.use("java.time.OffsetDateTime");
            case BYTES -> "byte[]";
        };
    }

    static String externalClass(KnownShape shape) {
        return switch (shape) {
            case CONDITION -> "io.fabric8.kubernetes.api.model.Condition";
            case OBJECT_REFERENCE -> "io.fabric8.kubernetes.api.model.ObjectReference";
            case INT_OR_STRING -> "io.fabric8.kubernetes.api.model.IntOrString";
        };
    }
}
