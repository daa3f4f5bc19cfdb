package com.pdp.expression.impl;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.expression.Expression;
import com.pdp.expression.FunctionExpression;
import com.pdp.expression.FunctionType;
import com.pdp.session.EvaluationSession;

import java.util.List;

/**
 * Equality of two values of the same type. String comparison is case-sensitive.
 */
public class EqualFunction extends FunctionExpression {

    public EqualFunction(Expression left, Expression right) {
        super(List.of(left, right), AttributeType.BOOLEAN);
    }

    @Override
    public AttributeValue evaluate(EvaluationSession session) {
        AttributeValue left = arguments.get(0).evaluate(session);
        AttributeValue right = arguments.get(1).evaluate(session);
        return AttributeValue.ofBoolean(left.equals(right));
    }

    @Override
    public FunctionType getFunctionType() {
        return FunctionType.EQUAL;
    }
}
