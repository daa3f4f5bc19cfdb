package com.pdp.expression.impl;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.expression.Expression;
import com.pdp.expression.FunctionExpression;
import com.pdp.expression.FunctionType;
import com.pdp.session.EvaluationSession;

import java.util.List;

/**
 * Number of elements of a collection, or length of a string.
 */
public class LenFunction extends FunctionExpression {

    public LenFunction(Expression argument) {
        super(List.of(argument), AttributeType.INTEGER);
    }

    @Override
    public AttributeValue evaluate(EvaluationSession session) {
        return AttributeValue.ofInteger(arguments.get(0).evaluate(session).size());
    }

    @Override
    public FunctionType getFunctionType() {
        return FunctionType.LEN;
    }
}
