package com.crdtypes.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.crdtypes.generator.codegen.derive.CapabilityRequest;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path crdFile;
    /** Null when the sources go to stdout. */
    Path outputDir;
    List<CapabilityRequest> capabilityRequests;
}
