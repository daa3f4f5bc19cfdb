package com.pdp.exception;

/**
 * Base exception for the policy decision point.
 */
public class PdpException extends RuntimeException {

    public PdpException(String message) {
        super(message);
    }

    public PdpException(String message, Throwable cause) {
        super(message, cause);
    }
}
