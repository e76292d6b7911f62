package com.crdtypes.generator.codegen.model;

import lombok.Builder;
import lombok.Value;

/**
 * Identity of the custom resource the graph was built for.
 */
@Value
@Builder
public class ResourceInfo {
    String group;
    String kind;
    String plural;
    String version;
    boolean namespaced;
    boolean statusSubresource;
}
