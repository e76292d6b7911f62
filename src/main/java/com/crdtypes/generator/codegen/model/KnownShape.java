package com.crdtypes.generator.codegen.model;

/**
 * Platform types that are recognized by shape and referenced instead of being
 * synthesized.
 */
public enum KnownShape {
    CONDITION("io.k8s.apimachinery.pkg.apis.meta.v1.Condition", true, true),
    OBJECT_REFERENCE("io.k8s.api.core.v1.ObjectReference", true, true),
    INT_OR_STRING("io.k8s.apimachinery.pkg.util.intstr.IntOrString", false, false);

    private final String canonicalId;
    private final boolean hasDefault;
    private final boolean suppressible;

    KnownShape(String canonicalId, boolean hasDefault, boolean suppressible) {
        this.canonicalId = canonicalId;
        this.hasDefault = hasDefault;
        this.suppressible = suppressible;
    }

    public String getCanonicalId() {
        return canonicalId;
    }

    /**
     * Whether the platform type has a zero value.
     */
    public boolean hasDefault() {
        return hasDefault;
    }

    public boolean isSuppressible() {
        return suppressible;
    }
}
