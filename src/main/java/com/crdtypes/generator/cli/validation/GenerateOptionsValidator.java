package com.crdtypes.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.crdtypes.generator.cli.exception.OptionsValidationException;
import com.crdtypes.generator.cli.model.GenerateOptions;
import com.crdtypes.generator.cli.model.ValidatedGenerateOptions;
import com.crdtypes.generator.codegen.derive.CapabilityRequest;
import com.crdtypes.generator.codegen.util.NamingUtil;

public class GenerateOptionsValidator {

	private static final Pattern PACKAGE_SEGMENT = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		Path crdFile = null;
		if (o.getCrdFile() == null) {
			errors.add("A CRD file is required.");
		} else if (!Files.isRegularFile(o.getCrdFile())) {
			errors.add("CRD file does not exist or is not a file: " + o.getCrdFile());
		} else {
			crdFile = o.getCrdFile().toAbsolutePath().normalize();
		}

		if (o.getApiVersion() != null && o.getApiVersion().isBlank()) {
			errors.add("--api-version must not be blank.");
		}
		if (o.getApiVersion() != null && o.isCombineVersions()) {
			errors.add("--api-version and --combine-versions cannot be used together.");
		}

		List<CapabilityRequest> requests = new ArrayList<>();
		for (String raw : o.getDerive()) {
			try {
				requests.add(CapabilityRequest.parse(raw));
			} catch (IllegalArgumentException e) {
				errors.add("Invalid --derive value '" + raw + "': " + e.getMessage());
			}
		}

		for (String name : o.getElide()) {
			if (isBlank(name)) {
				errors.add("--elide requires a type name.");
			}
		}

		if (!isValidPackage(o.getPackageName())) {
			errors.add("Not a valid Java package name: " + o.getPackageName());
		}

		Path outputDir = null;
		if (o.getOutputDir() != null) {
			outputDir = o.getOutputDir().toAbsolutePath().normalize();
			if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
				errors.add("Output path exists and is not a directory: " + outputDir);
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(crdFile, outputDir, requests);
	}

	private static boolean isValidPackage(String packageName) {
		if (isBlank(packageName)) {
			return false;
		}
		for (String segment : packageName.split("\\.", -1)) {
			if (!PACKAGE_SEGMENT.matcher(segment).matches() || NamingUtil.isJavaKeyword(segment)) {
				return false;
			}
		}
		return true;
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
