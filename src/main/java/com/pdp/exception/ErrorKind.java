package com.pdp.exception;

/**
 * Kinds of evaluation-time failure. Each of them narrows to an Indeterminate decision.
 */
public enum ErrorKind {
    /**
     * A designated attribute is absent from the request and could not be resolved.
     */
    RESOLUTION,

    /**
     * A function's runtime precondition was violated.
     */
    FUNCTION,

    /**
     * More than one child was applicable under only-one-applicable.
     */
    AMBIGUITY
}
