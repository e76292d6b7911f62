package com.crdtypes.generator.cli;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crdtypes.generator.cli.exception.OptionsValidationException;
import com.crdtypes.generator.cli.model.GenerateOptions;
import com.crdtypes.generator.cli.model.ValidatedGenerateOptions;
import com.crdtypes.generator.cli.output.GenerateResultsPrinter;
import com.crdtypes.generator.cli.validation.GenerateOptionsValidator;
import com.crdtypes.generator.codegen.GeneratorResult;
import com.crdtypes.generator.codegen.TypeGenerator;
import com.crdtypes.generator.codegen.emit.JavaSourceEmitter;
import com.crdtypes.generator.codegen.model.KnownShape;
import com.crdtypes.generator.codegen.model.core.context.GeneratorConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command for generating Java types from a CustomResourceDefinition.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "crd-type-generator 1.0.0",
        description = "Generates Java types from the structural schema of a Kubernetes CustomResourceDefinition."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    @Spec
    private CommandSpec spec;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer;

    public GenerateCommand() {
        this(new GenerateResultsPrinter(System.out));
    }

    public GenerateCommand(GenerateResultsPrinter printer) {
        this.printer = printer;
    }

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        GeneratorConfig config = toConfig(options, validated).toBuilder()
                .invocation(invocation(spec.commandLine().getParseResult().originalArgs()))
                .build();
        printer.printBanner(options, validated);

        GeneratorResult result = new TypeGenerator(config).generate(validated.getCrdFile());
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }
        if (validated.getOutputDir() == null) {
            printer.printSources(result, config);
        }
        printer.printSuccess(result);
        return 0;
    }

    /**
     * The command line as it would be typed again, quoting arguments with
     * whitespace.
     */
    static String invocation(List<String> args) {
        String joined = args.stream()
                .map(arg -> arg.isEmpty() || arg.chars().anyMatch(Character::isWhitespace) ? "'" + arg + "'" : arg)
                .collect(Collectors.joining(" "));
        return joined.isEmpty() ? JavaSourceEmitter.GENERATOR_NAME : JavaSourceEmitter.GENERATOR_NAME + " " + joined;
    }

    static GeneratorConfig toConfig(GenerateOptions o, ValidatedGenerateOptions v) {
        GeneratorConfig.GeneratorConfigBuilder config = GeneratorConfig.builder()
                .versionPin(o.getApiVersion())
                .combineVersions(o.isCombineVersions())
                .enableDocs(o.isDocs())
                .enableBuilders(o.isBuilders())
                .schemaCapabilityMode(o.getSchemaMode())
                .capabilityRequests(v.getCapabilityRequests())
                .relaxed(o.isRelaxed())
                .mapRepresentation(o.getMapType())
                .auto(o.isAuto())
                .hideResourceAnnotations(o.isHideKube())
                .outputDir(v.getOutputDir())
                .basePackage(o.getPackageName());
        o.getElide().forEach(name -> config.elidedType(name.trim()));
        if (o.isNoCondition()) {
            config.suppressKnownShape(KnownShape.CONDITION);
        }
        if (o.isNoObjectReference()) {
            config.suppressKnownShape(KnownShape.OBJECT_REFERENCE);
        }
        return config.build();
    }
}
