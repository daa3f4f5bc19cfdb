package com.pdp.expression;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.session.EvaluationSession;

/**
 * Constant value, validated when the policy is parsed.
 */
public final class Literal implements Expression {

    private final AttributeValue value;

    public Literal(AttributeValue value) {
        this.value = value;
    }

    @Override
    public AttributeValue evaluate(EvaluationSession session) {
        return value;
    }

    @Override
    public AttributeType getResultType() {
        return value.getType();
    }

    public AttributeValue getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
