package com.pdp.exception;

/**
 * Structural error in a policy document: unknown tag, malformed shape or wrong JSON type.
 */
public class SchemaException extends PolicyLoadException {

    public SchemaException(String message, String path) {
        super(message, path);
    }

    public SchemaException(String message, String path, Throwable cause) {
        super(message, path, cause);
    }
}
