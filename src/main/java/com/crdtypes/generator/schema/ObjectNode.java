package com.crdtypes.generator.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An object with a fixed set of named properties.
 *
 * Property order is the declared order when the supplied map has one
 * ({@link LinkedHashMap}, {@link SortedMap}); any other map is sorted lexically
 * so that iteration is always deterministic.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public final class ObjectNode extends SchemaNode {
    private final Map<String, SchemaNode> properties;
    private final Set<String> required;

    @Builder
    public ObjectNode(SchemaFlags flags, Map<String, SchemaNode> properties, Set<String> required) {
        super(flags);
        this.properties = Collections.unmodifiableMap(orderedCopy(properties));
        this.required = Collections.unmodifiableSet(required != null ? new LinkedHashSet<>(required) : Set.of());

        for (String name : this.required) {
            if (!this.properties.containsKey(name)) {
                throw new IllegalArgumentException("Required property '" + name + "' is not declared in properties "
                        + this.properties.keySet());
            }
        }
    }

    public boolean isRequired(String propertyName) {
        return required.contains(propertyName);
    }

    @Override
    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    private static Map<String, SchemaNode> orderedCopy(Map<String, SchemaNode> properties) {
        if (properties == null) {
            return new LinkedHashMap<>();
        }
        if (properties instanceof LinkedHashMap || properties instanceof SortedMap) {
            return new LinkedHashMap<>(properties);
        }
        return new LinkedHashMap<>(new TreeMap<>(properties));
    }
}
