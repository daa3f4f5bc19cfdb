package com.pdp.attribute;

/**
 * Declared attribute: an id and the type every value under that id must have.
 *
 * @param id   Attribute id (case-sensitive)
 * @param type Declared type
 */
public record Attribute(String id, AttributeType type) {

    @Override
    public String toString() {
        return id + ":" + type;
    }
}
