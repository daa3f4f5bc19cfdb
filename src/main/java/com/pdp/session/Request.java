package com.pdp.session;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Authorization request: a flat mapping of attribute id to typed value.
 * Immutable after creation. Ids are case-sensitive.
 */
public final class Request {

    private final String requestId;
    private final Map<String, AttributeValue> attributes;

    private Request(Builder builder) {
        this.requestId = builder.requestId != null ? builder.requestId : UUID.randomUUID().toString();
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    /**
     * Get an attribute carried by the request itself.
     *
     * @param id Attribute id
     * @return Value, or empty if the request does not carry it
     */
    public Optional<AttributeValue> getAttribute(String id) {
        return Optional.ofNullable(attributes.get(id));
    }

    public Map<String, AttributeValue> getAttributes() {
        return attributes;
    }

    /**
     * Identifier used in logs to correlate a decision with its request.
     */
    public String getRequestId() {
        return requestId;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "Request{" +
                "requestId='" + requestId + '\'' +
                ", attributes=" + attributes +
                '}';
    }

    /**
     * Builder for Request.
     */
    public static final class Builder {
        private String requestId;
        private final Map<String, AttributeValue> attributes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder attribute(String id, AttributeValue value) {
            if (id != null && value != null) {
                attributes.put(id, value);
            }
            return this;
        }

        /**
         * Add an attribute from its raw form.
         *
         * @throws com.pdp.exception.AttributeTypeException if the raw value does not fit the type
         */
        public Builder attribute(String id, AttributeType type, Object raw) {
            return attribute(id, type.coerce(raw));
        }

        public Builder attributes(Map<String, AttributeValue> values) {
            if (values != null) {
                values.forEach(this::attribute);
            }
            return this;
        }

        public Request build() {
            return new Request(this);
        }
    }
}
