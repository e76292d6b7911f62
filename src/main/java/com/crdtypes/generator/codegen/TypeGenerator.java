package com.crdtypes.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crdtypes.generator.codegen.analysis.TypeGraphBuilder;
import com.crdtypes.generator.codegen.derive.CapabilityResolver;
import com.crdtypes.generator.codegen.emit.JavaSourceEmitter;
import com.crdtypes.generator.codegen.exception.AnalysisException;
import com.crdtypes.generator.codegen.model.GeneratedType;
import com.crdtypes.generator.codegen.model.ResourceInfo;
import com.crdtypes.generator.codegen.model.TypeGraph;
import com.crdtypes.generator.codegen.model.TypeKind;
import com.crdtypes.generator.codegen.model.core.context.GeneratorConfig;
import com.crdtypes.generator.codegen.util.NamingUtil;
import com.crdtypes.generator.codegen.version.MultiVersionReconciler;
import com.crdtypes.generator.schema.CustomResourceDocument;
import com.crdtypes.generator.schema.SchemaVersion;
import com.crdtypes.generator.schema.loader.CrdLoadException;
import com.crdtypes.generator.schema.loader.CrdSchemaLoader;

/**
 * Runs the whole pipeline for one custom resource: version selection, graph
 * building, capability resolution and, when an output directory is
 * configured, source emission.
 */
public class TypeGenerator {
    private static final Logger log = LoggerFactory.getLogger(TypeGenerator.class);

    private final GeneratorConfig config;

    public TypeGenerator(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public GeneratorResult generate(Path crdFile) {
        log.info("Step 1: Loading {}...", crdFile);
        CustomResourceDocument document;
        try {
            document = new CrdSchemaLoader().load(crdFile);
        } catch (CrdLoadException e) {
            log.error("Failed to load CRD: {}", e.getMessage());
            return GeneratorResult.failure(e.getMessage());
        }
        return generate(document);
    }

    public GeneratorResult generate(CustomResourceDocument document) {
        TypeGraph graph;
        SchemaVersion selected;
        try {
            log.info("Step 2: Selecting schema version...");
            selected = new MultiVersionReconciler(config).select(document.getVersions());
            log.info("Using version {}", selected.getLabel());

            log.info("Step 3: Analyzing schema...");
            graph = analyze(selected, document);
        } catch (AnalysisException e) {
            log.error("Analysis failed: {}", e.getMessage());
            return GeneratorResult.analysisFailure(e.getKind(), e.getMessage());
        }

        GeneratorResult.GeneratorResultBuilder result = GeneratorResult.builder()
                .success(true)
                .typeGraph(graph)
                .selectedVersion(selected.getLabel())
                .compositeTypes(count(graph, TypeKind.COMPOSITE))
                .enumeratedTypes(count(graph, TypeKind.UNIT_ENUM) + count(graph, TypeKind.TAGGED_ENUM))
                .elidedTypes(graph.getElidedTypes().size())
                .diagnostics(graph.getDiagnostics().getDowngrades());

        if (config.getOutputDir() != null) {
            log.info("Step 4: Writing Java sources...");
            try {
                List<Path> written = new JavaSourceEmitter(config).emit(graph);
                result.filesWritten(written).outputPath(config.getOutputDir());
            } catch (IOException e) {
                log.error("Failed to write sources", e);
                return GeneratorResult.failure("Failed to write sources to " + config.getOutputDir() + ": "
                        + e.getMessage());
            }
        }

        log.info("Generation complete!");
        return result.build();
    }

    /**
     * Builds, resolves and freezes the graph for an already selected version.
     *
     * @throws AnalysisException when the schema cannot be represented
     */
    public TypeGraph analyze(SchemaVersion version, CustomResourceDocument document) {
        TypeGraph graph = new TypeGraphBuilder(config).build(version.getRoot(),
                NamingUtil.toPascalCase(document.getKind()));
        graph.setResourceInfo(ResourceInfo.builder()
                .group(document.getGroup())
                .kind(document.getKind())
                .plural(document.getPlural())
                .version(version.getLabel())
                .namespaced(document.isNamespaced())
                .statusSubresource(version.isStatusSubresource())
                .build());
        new CapabilityResolver(config).resolve(graph);
        graph.freeze();

        if (graph.getDiagnostics().hasDowngrades()) {
            log.warn("{} construct(s) were replaced by untyped values", graph.getDiagnostics().getDowngrades().size());
        }
        log.debug("Type graph: {}", graph.getTypeNames());
        return graph;
    }

    /**
     * Selects a version and analyzes it.
     *
     * @throws AnalysisException when no version can be selected or the schema
     *                           cannot be represented
     */
    public TypeGraph analyze(CustomResourceDocument document) {
        return analyze(new MultiVersionReconciler(config).select(document.getVersions()), document);
    }

    private static int count(TypeGraph graph, TypeKind kind) {
        return (int) graph.getTypes().stream().map(GeneratedType::getKind).filter(kind::equals).count();
    }
}
