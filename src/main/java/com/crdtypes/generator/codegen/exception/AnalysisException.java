package com.crdtypes.generator.codegen.exception;

import com.crdtypes.generator.codegen.model.SchemaPath;

import lombok.Getter;

/**
 * Terminal failure of a generation run. Carries the kind of failure and the
 * schema location it was raised for, when there is one.
 */
@Getter
public class AnalysisException extends RuntimeException {

    private final ErrorKind kind;
    private final SchemaPath path;
    private final String detail;

    public AnalysisException(ErrorKind kind, SchemaPath path, String detail) {
        super(format(kind, path, detail));
        this.kind = kind;
        this.path = path;
        this.detail = detail;
    }

    public AnalysisException(ErrorKind kind, String detail) {
        this(kind, null, detail);
    }

    private static String format(ErrorKind kind, SchemaPath path, String detail) {
        if (path == null) {
            return "[" + kind + "] " + detail;
        }
        return "[" + kind + "] at " + path.render() + ": " + detail;
    }
}
