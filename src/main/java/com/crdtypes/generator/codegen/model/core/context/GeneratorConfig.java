package com.crdtypes.generator.codegen.model.core.context;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import com.crdtypes.generator.codegen.derive.CapabilityRequest;
import com.crdtypes.generator.codegen.model.KnownShape;
import com.crdtypes.generator.codegen.model.MapRepresentation;
import com.crdtypes.generator.codegen.model.SchemaCapabilityMode;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Configuration for one generation run.
 *
 * Analysis settings drive version selection, graph building and capability
 * resolution. Output settings are only read by the emitter; a run without an
 * output directory stops at the frozen graph.
 */
@Value
@Builder(toBuilder = true)
public class GeneratorConfig {

    /**
     * Version label to use instead of the default selection.
     */
    String versionPin;

    /**
     * Merge every served version into one schema.
     */
    boolean combineVersions;

    /**
     * Keep schema descriptions as type and field documentation.
     */
    boolean enableDocs;

    boolean enableBuilders;

    @Builder.Default
    SchemaCapabilityMode schemaCapabilityMode = SchemaCapabilityMode.DISABLED;

    @Singular
    List<CapabilityRequest> capabilityRequests;

    /**
     * Exact generated type names to leave out of the output, so that they can
     * be written by hand.
     */
    @Singular("elidedType")
    Set<String> elidedTypes;

    /**
     * Downgrade unsupported constructs and irreconcilable unions to Unknown.
     */
    boolean relaxed;

    @Singular("suppressKnownShape")
    Set<KnownShape> suppressKnownShapes;

    @Builder.Default
    MapRepresentation mapRepresentation = MapRepresentation.ORDERED;

    /**
     * Shorthand for derived schema capability plus documentation.
     */
    boolean auto;

    @Builder.Default
    int maxDepth = 64;

    /**
     * Leave {@code apiVersion}, {@code kind} and {@code metadata} of the root
     * object to the resource envelope.
     */
    @Builder.Default
    boolean skipEnvelopeProperties = true;

    /**
     * Emit the root type as a plain class instead of a custom resource.
     */
    boolean hideResourceAnnotations;

    Path outputDir;

    @Builder.Default
    String basePackage = "com.example.crd";

    /**
     * Command line recorded in the header of every generated file, or null
     * when the run did not come from the command line.
     */
    String invocation;

    public boolean isDocsEnabled() {
        return enableDocs || auto;
    }

    public SchemaCapabilityMode getEffectiveSchemaMode() {
        return auto ? SchemaCapabilityMode.DERIVED : schemaCapabilityMode;
    }

    public boolean isSuppressed(KnownShape shape) {
        return shape.isSuppressible() && suppressKnownShapes.contains(shape);
    }

    public static GeneratorConfig defaults() {
        return GeneratorConfig.builder().build();
    }
}
