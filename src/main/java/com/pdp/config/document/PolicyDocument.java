package com.pdp.config.document;

import com.pdp.attribute.AttributeType;
import com.pdp.policy.Evaluable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed policy document: the attribute declarations, in document order, and the root node.
 *
 * @param declarations Attribute id to declared type
 * @param root         Root Policy or PolicySet
 */
public record PolicyDocument(Map<String, AttributeType> declarations, Evaluable root) {

    public PolicyDocument {
        declarations = Collections.unmodifiableMap(new LinkedHashMap<>(declarations));
        Objects.requireNonNull(root, "root");
    }
}
