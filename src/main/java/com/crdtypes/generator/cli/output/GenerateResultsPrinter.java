package com.crdtypes.generator.cli.output;

import java.io.PrintStream;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crdtypes.generator.cli.model.GenerateOptions;
import com.crdtypes.generator.cli.model.ValidatedGenerateOptions;
import com.crdtypes.generator.codegen.GeneratorResult;
import com.crdtypes.generator.codegen.emit.JavaSourceEmitter;
import com.crdtypes.generator.codegen.model.GeneratedType;
import com.crdtypes.generator.codegen.model.TypeGraph;
import com.crdtypes.generator.codegen.model.core.context.Diagnostic;
import com.crdtypes.generator.codegen.model.core.context.GeneratorConfig;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 *
 * Progress goes to the log; generated sources, when no output directory is
 * given, go to {@code out}.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    private final PrintStream out;

    public GenerateResultsPrinter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("CRD Type Generator");
        log.info("=================================================");
        log.info("CRD File: {}", v.getCrdFile());
        log.info("API Version: {}", o.getApiVersion() != null ? o.getApiVersion()
                : o.isCombineVersions() ? "all served (combined)" : "default");
        log.info("Package: {}", o.getPackageName());
        log.info("Output Directory: {}", v.getOutputDir() != null ? v.getOutputDir() : "stdout");
        log.info("Relaxed: {}", o.isRelaxed());
        log.info("=================================================");
    }

    /**
     * Writes every non-elided type of the result to {@code out}.
     */
    public void printSources(GeneratorResult result, GeneratorConfig config) {
        TypeGraph graph = result.getTypeGraph();
        JavaSourceEmitter emitter = new JavaSourceEmitter(config);
        for (GeneratedType type : graph.getTypes()) {
            if (type.isElided()) {
                continue;
            }
            out.println("// " + type.getName() + ".java");
            out.println(emitter.render(type, graph));
        }
        out.flush();
    }

    public void printSuccess(GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Version: {}", result.getSelectedVersion());
        log.info("Composite Types: {}", result.getCompositeTypes());
        log.info("Enumerated Types: {}", result.getEnumeratedTypes());
        if (result.getElidedTypes() > 0) {
            log.info("Elided Types: {}", result.getElidedTypes());
        }
        if (result.getOutputPath() != null) {
            log.info("Files Written: {} (under {})", result.getFilesWritten().size(), result.getOutputPath());
        }
        if (!result.getDiagnostics().isEmpty()) {
            log.warn("");
            log.warn("Replaced by untyped values:");
            for (Diagnostic diagnostic : result.getDiagnostics()) {
                log.warn("  {}", diagnostic);
            }
        }
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
        if (result.getErrorKind() != null && result.getErrorKind().isRelaxable()) {
            log.error("Re-run with --relaxed to replace this construct with an untyped value");
        }
    }
}
