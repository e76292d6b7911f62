package com.crdtypes.generator.codegen.model.core.context;

import java.util.ArrayList;
import java.util.List;

import com.crdtypes.generator.codegen.exception.AnalysisException;

import lombok.Getter;

/**
 * Downgrades accumulated while relaxed analysis keeps going past failures.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ToolDiagnostics {
    private final List<Diagnostic> downgrades = new ArrayList<>();

    public void recordDowngrade(AnalysisException failure) {
        downgrades.add(new Diagnostic(failure.getKind(), failure.getPath(), failure.getDetail()));
    }

    public boolean hasDowngrades() {
        return !downgrades.isEmpty();
    }
}
