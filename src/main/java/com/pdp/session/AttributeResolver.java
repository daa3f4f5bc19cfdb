package com.pdp.session;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.exception.AttributeResolutionException;

import java.util.Optional;

/**
 * Hook for fetching attribute values that the request does not carry
 * (a Policy Information Point). Called synchronously, at most once per attribute id
 * and evaluation session.
 */
@FunctionalInterface
public interface AttributeResolver {

    /**
     * Resolve a missing attribute.
     *
     * @param id           Attribute id
     * @param expectedType Declared type of the attribute
     * @param request      The request being evaluated
     * @return The value, or empty if the attribute does not exist for this request
     * @throws AttributeResolutionException if the lookup itself failed
     */
    Optional<AttributeValue> resolve(String id, AttributeType expectedType, Request request);

    /**
     * Resolver that never finds anything.
     */
    static AttributeResolver none() {
        return (id, expectedType, request) -> Optional.empty();
    }
}
