package com.pdp.exception;

import com.pdp.attribute.AttributeType;

/**
 * Thrown when a raw value cannot be coerced to the requested attribute type.
 */
public class AttributeTypeException extends PdpException {

    private final AttributeType expected;

    public AttributeTypeException(AttributeType expected, Object actual) {
        super("Expected " + expected + " but got " + describe(actual));
        this.expected = expected;
    }

    public AttributeTypeException(AttributeType expected, Object actual, Throwable cause) {
        super("Expected " + expected + " but got " + describe(actual), cause);
        this.expected = expected;
    }

    public AttributeType getExpected() {
        return expected;
    }

    private static String describe(Object actual) {
        if (actual == null) {
            return "null";
        }
        return actual.getClass().getSimpleName() + " '" + actual + "'";
    }
}
