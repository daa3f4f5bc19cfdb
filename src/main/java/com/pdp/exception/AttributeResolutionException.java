package com.pdp.exception;

/**
 * Thrown by an external attribute resolver when the lookup itself failed
 * (as opposed to the attribute simply not existing).
 */
public class AttributeResolutionException extends PdpException {

    public AttributeResolutionException(String message) {
        super(message);
    }

    public AttributeResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
