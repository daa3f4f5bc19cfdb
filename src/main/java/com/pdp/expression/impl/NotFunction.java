package com.pdp.expression.impl;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.expression.Expression;
import com.pdp.expression.FunctionExpression;
import com.pdp.expression.FunctionType;
import com.pdp.session.EvaluationSession;

import java.util.List;

public class NotFunction extends FunctionExpression {

    public NotFunction(Expression argument) {
        super(List.of(argument), AttributeType.BOOLEAN);
    }

    @Override
    public AttributeValue evaluate(EvaluationSession session) {
        return AttributeValue.ofBoolean(!arguments.get(0).evaluate(session).booleanValue());
    }

    @Override
    public FunctionType getFunctionType() {
        return FunctionType.NOT;
    }
}
