package com.crdtypes.generator.schema;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * The parts of a CustomResourceDefinition the generator needs: identity of the
 * resource plus the schema of each declared version, in declaration order.
 */
@Value
@Builder
public class CustomResourceDocument {
    String group;
    String kind;
    String plural;
    boolean namespaced;
    @Singular
    List<SchemaVersion> versions;

    public Optional<SchemaVersion> findVersion(String label) {
        return versions.stream().filter(v -> v.getLabel().equals(label)).findFirst();
    }
}
