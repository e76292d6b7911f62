package com.crdtypes.generator.schema.loader;

/**
 * A CustomResourceDefinition could not be read or does not have the expected
 * structure.
 */
public class CrdLoadException extends Exception {

    public CrdLoadException(String message) {
        super(message);
    }

    public CrdLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
