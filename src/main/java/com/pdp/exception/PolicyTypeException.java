package com.pdp.exception;

/**
 * Type error in a policy document: expression or designator type mismatch, duplicate id,
 * unknown combining algorithm or function, unresolvable reference.
 */
public class PolicyTypeException extends PolicyLoadException {

    public PolicyTypeException(String message, String path) {
        super(message, path);
    }

    public PolicyTypeException(String message, String path, Throwable cause) {
        super(message, path, cause);
    }
}
