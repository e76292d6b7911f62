package com.crdtypes.generator.codegen.model;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A use of a type from a field, a container or a variant payload.
 *
 * References are immutable values; two references are equal when they denote
 * the same type.
 */
public abstract class TypeRef {

    TypeRef() {
    }

    /**
     * Compact, deterministic rendering such as {@code Optional<Sequence<string>>}.
     */
    public abstract String describe();

    /**
     * Returns a copy where every {@link NamedRef} name has been passed through
     * {@code renamer}.
     */
    public TypeRef mapNames(UnaryOperator<String> renamer) {
        return this;
    }

    /**
     * Adds every type name reachable through this reference (without following
     * into the named types themselves).
     */
    public void collectNames(Collection<String> names) {
    }

    /**
     * Whether {@link UnknownRef} occurs anywhere in this reference, looking
     * through containers.
     */
    public boolean containsUnknown() {
        return false;
    }

    public TypeRef unwrapOptional() {
        return this;
    }

    @Override
    public String toString() {
        return describe();
    }

    public static PrimitiveRef primitive(PrimitiveType type) {
        return new PrimitiveRef(type);
    }

    public static NamedRef named(String typeName) {
        return new NamedRef(typeName, false);
    }

    public static NamedRef indirect(String typeName) {
        return new NamedRef(typeName, true);
    }

    public static ExternalRef external(KnownShape shape) {
        return new ExternalRef(shape);
    }

    public static UnknownRef unknown() {
        return UnknownRef.INSTANCE;
    }

    public static SequenceRef sequence(TypeRef element) {
        return new SequenceRef(element);
    }

    public static MapRef mapOf(TypeRef value) {
        return new MapRef(value);
    }

    /**
     * Wraps {@code inner} as optional; already optional references are returned
     * as they are.
     */
    public static TypeRef optional(TypeRef inner) {
        return inner instanceof OptionalRef ? inner : new OptionalRef(inner);
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class PrimitiveRef extends TypeRef {
        @NonNull
        PrimitiveType type;

        @Override
        public String describe() {
            return type.name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Reference to a type in the graph. {@code indirect} marks a back-edge of a
     * cycle, which has to be boxed by any emitter with value semantics.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class NamedRef extends TypeRef {
        @NonNull
        String typeName;
        boolean indirect;

        @Override
        public String describe() {
            return indirect ? "&" + typeName : typeName;
        }

        @Override
        public TypeRef mapNames(UnaryOperator<String> renamer) {
            String renamed = renamer.apply(typeName);
            return Objects.equals(renamed, typeName) ? this : new NamedRef(renamed, indirect);
        }

        @Override
        public void collectNames(Collection<String> names) {
            names.add(typeName);
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class ExternalRef extends TypeRef {
        @NonNull
        KnownShape shape;

        @Override
        public String describe() {
            return "external:" + shape.getCanonicalId();
        }
    }

    public static final class UnknownRef extends TypeRef {
        static final UnknownRef INSTANCE = new UnknownRef();

        private UnknownRef() {
        }

        @Override
        public String describe() {
            return "unknown";
        }

        @Override
        public boolean containsUnknown() {
            return true;
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class SequenceRef extends TypeRef {
        @NonNull
        TypeRef element;

        @Override
        public String describe() {
            return "Sequence<" + element.describe() + ">";
        }

        @Override
        public TypeRef mapNames(UnaryOperator<String> renamer) {
            return new SequenceRef(element.mapNames(renamer));
        }

        @Override
        public void collectNames(Collection<String> names) {
            element.collectNames(names);
        }

        @Override
        public boolean containsUnknown() {
            return element.containsUnknown();
        }
    }

    /**
     * String-keyed map.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class MapRef extends TypeRef {
        @NonNull
        TypeRef value;

        @Override
        public String describe() {
            return "Map<" + value.describe() + ">";
        }

        @Override
        public TypeRef mapNames(UnaryOperator<String> renamer) {
            return new MapRef(value.mapNames(renamer));
        }

        @Override
        public void collectNames(Collection<String> names) {
            value.collectNames(names);
        }

        @Override
        public boolean containsUnknown() {
            return value.containsUnknown();
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class OptionalRef extends TypeRef {
        @NonNull
        TypeRef inner;

        @Override
        public String describe() {
            return "Optional<" + inner.describe() + ">";
        }

        @Override
        public TypeRef mapNames(UnaryOperator<String> renamer) {
            return new OptionalRef(inner.mapNames(renamer));
        }

        @Override
        public void collectNames(Collection<String> names) {
            inner.collectNames(names);
        }

        @Override
        public boolean containsUnknown() {
            return inner.containsUnknown();
        }

        @Override
        public TypeRef unwrapOptional() {
            return inner;
        }
    }
}
