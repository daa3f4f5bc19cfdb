package com.pdp.exception;

/**
 * Exception thrown when a policy document cannot be turned into a policy tree.
 * A load that fails with this exception never publishes anything.
 */
public class PolicyLoadException extends PdpException {

    private final String detail;
    private final String path;

    public PolicyLoadException(String message, String path) {
        super(format(message, path));
        this.detail = message;
        this.path = path;
    }

    public PolicyLoadException(String message, String path, Throwable cause) {
        super(format(message, path), cause);
        this.detail = message;
        this.path = path;
    }

    /**
     * Message without location.
     */
    public String getDetail() {
        return detail;
    }

    /**
     * Location of the failure in the source document, e.g. {@code root>policies>"Root">rules},
     * or null if the error was raised outside of a document.
     */
    public String getPath() {
        return path;
    }

    private static String format(String message, String path) {
        return path == null || path.isEmpty() ? message : message + " (at " + path + ")";
    }
}
