package com.pdp.expression;

import com.pdp.attribute.Attribute;
import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.session.EvaluationSession;

/**
 * Reference to a declared attribute of the current request.
 */
public final class AttributeDesignator implements Expression {

    private final Attribute attribute;

    public AttributeDesignator(Attribute attribute) {
        this.attribute = attribute;
    }

    @Override
    public AttributeValue evaluate(EvaluationSession session) {
        return session.resolve(attribute);
    }

    @Override
    public AttributeType getResultType() {
        return attribute.type();
    }

    public Attribute getAttribute() {
        return attribute;
    }

    @Override
    public String toString() {
        return "attr(" + attribute.id() + ")";
    }
}
