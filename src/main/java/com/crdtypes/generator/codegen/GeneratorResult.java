package com.crdtypes.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import com.crdtypes.generator.codegen.exception.ErrorKind;
import com.crdtypes.generator.codegen.model.TypeGraph;
import com.crdtypes.generator.codegen.model.core.context.Diagnostic;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of a generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    /** Set when analysis failed; null for load and output failures. */
    private ErrorKind errorKind;

    private TypeGraph typeGraph;
    private String selectedVersion;

    private int compositeTypes;
    private int enumeratedTypes;
    private int elidedTypes;

    @Singular("fileWritten")
    private List<Path> filesWritten;
    private Path outputPath;

    @Singular
    private List<Diagnostic> diagnostics;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static GeneratorResult analysisFailure(ErrorKind kind, String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorKind(kind)
                .errorMessage(errorMessage)
                .build();
    }
}
