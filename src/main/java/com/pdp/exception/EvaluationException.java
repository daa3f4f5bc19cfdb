package com.pdp.exception;

/**
 * Evaluation-time failure. Never escapes the engine: the node that catches it
 * turns it into an Indeterminate result.
 */
public class EvaluationException extends PdpException {

    private final ErrorKind kind;
    private final String function;

    public EvaluationException(ErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public EvaluationException(ErrorKind kind, String function, String message) {
        this(kind, function, message, null);
    }

    public EvaluationException(ErrorKind kind, String function, String message, Throwable cause) {
        super(function == null ? message : function + ": " + message, cause);
        this.kind = kind;
        this.function = function;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Name of the function that raised the error, or null if it did not come from a function.
     */
    public String getFunction() {
        return function;
    }

    public static EvaluationException function(String function, String message) {
        return new EvaluationException(ErrorKind.FUNCTION, function, message);
    }

    public static EvaluationException resolution(String message) {
        return new EvaluationException(ErrorKind.RESOLUTION, message);
    }
}
