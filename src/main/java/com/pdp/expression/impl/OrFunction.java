package com.pdp.expression.impl;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.expression.Expression;
import com.pdp.expression.FunctionExpression;
import com.pdp.expression.FunctionType;
import com.pdp.session.EvaluationSession;

import java.util.List;

/**
 * Logical OR. Stops at the first true operand.
 */
public class OrFunction extends FunctionExpression {

    public OrFunction(List<Expression> arguments) {
        super(arguments, AttributeType.BOOLEAN);
    }

    @Override
    public AttributeValue evaluate(EvaluationSession session) {
        for (Expression argument : arguments) {
            if (argument.evaluate(session).booleanValue()) {
                return AttributeValue.TRUE;
            }
        }
        return AttributeValue.FALSE;
    }

    @Override
    public FunctionType getFunctionType() {
        return FunctionType.OR;
    }
}
