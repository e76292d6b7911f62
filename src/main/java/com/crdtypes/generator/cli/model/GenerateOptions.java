package com.crdtypes.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.crdtypes.generator.codegen.model.MapRepresentation;
import com.crdtypes.generator.codegen.model.SchemaCapabilityMode;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Parameters(index = "0", paramLabel = "CRD_FILE", description = "CustomResourceDefinition file (YAML or JSON)")
	private Path crdFile;

	@Option(names = { "--api-version" }, description = "Use this version instead of the storage or highest-priority served version")
	private String apiVersion;

	@Option(names = { "--combine-versions" }, description = "Merge the schemas of all served versions into one set of types")
	private boolean combineVersions;

	@Option(names = { "--docs", "-d" }, description = "Emit schema descriptions as Javadoc")
	private boolean docs;

	@Option(names = { "--builders", "-b" }, description = "Request a builder on every composite type")
	private boolean builders;

	@Option(names = { "--schema" }, defaultValue = "DISABLED",
			description = "Schema capability mode: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
	private SchemaCapabilityMode schemaMode;

	@Option(names = { "--derive", "-D" }, paramLabel = "[TARGET=]CAPABILITY",
			description = "Request a capability; TARGET is a type name, @struct, @enum or @enum:simple (repeatable)")
	private List<String> derive = new ArrayList<>();

	@Option(names = { "--elide", "-e" }, paramLabel = "TYPE",
			description = "Leave a generated type out of the output (repeatable)")
	private List<String> elide = new ArrayList<>();

	@Option(names = { "--relaxed" }, description = "Replace unsupported constructs and irreconcilable unions with untyped values")
	private boolean relaxed;

	@Option(names = { "--no-condition" }, description = "Do not substitute the platform Condition type")
	private boolean noCondition;

	@Option(names = { "--no-object-reference" }, description = "Do not substitute the platform ObjectReference type")
	private boolean noObjectReference;

	@Option(names = { "--map-type" }, defaultValue = "ORDERED",
			description = "Map representation: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
	private MapRepresentation mapType;

	@Option(names = { "--auto", "-A" }, description = "Shorthand for --schema=DERIVED with documentation")
	private boolean auto;

	@Option(names = { "--hide-kube" }, description = "Emit the root type as a plain class instead of a CustomResource")
	private boolean hideKube;

	@Option(names = { "--output-dir", "-o" }, description = "Source root to write into (prints to stdout when omitted)")
	private Path outputDir;

	@Option(names = { "--package", "-p" }, defaultValue = "com.example.crd", description = "Package of the generated types")
	private String packageName;
}
