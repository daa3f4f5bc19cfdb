package com.pdp.engine;

import com.pdp.attribute.AttributeValue;

/**
 * Resolved obligation: an attribute id and the value its expression produced.
 */
public record AssignedObligation(String id, AttributeValue value) {

    @Override
    public String toString() {
        return id + "=" + value;
    }
}
