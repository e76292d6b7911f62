package com.crdtypes.generator;

import com.crdtypes.generator.cli.GenerateCommand;

import picocli.CommandLine;

/**
 * Main entry point for the CRD Type Generator.
 * Reads a Kubernetes CustomResourceDefinition and generates Java types for the
 * schema of one of its versions.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
