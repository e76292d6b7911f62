package com.crdtypes.generator.codegen.model.core.context;

import com.crdtypes.generator.codegen.exception.ErrorKind;
import com.crdtypes.generator.codegen.model.SchemaPath;

import lombok.Value;

/**
 * A failure that relaxed mode downgraded instead of aborting.
 */
@Value
public class Diagnostic {
    ErrorKind kind;
    SchemaPath path;
    String message;

    @Override
    public String toString() {
        return "[" + kind + "] at " + path + ": " + message;
    }
}
