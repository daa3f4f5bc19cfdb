package com.pdp.expression.impl;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.expression.Expression;
import com.pdp.expression.FunctionExpression;
import com.pdp.expression.FunctionType;
import com.pdp.session.EvaluationSession;

import java.util.List;

/**
 * Logical AND. Stops at the first false operand; an operand error stops evaluation
 * and propagates.
 */
public class AndFunction extends FunctionExpression {

    public AndFunction(List<Expression> arguments) {
        super(arguments, AttributeType.BOOLEAN);
    }

    @Override
    public AttributeValue evaluate(EvaluationSession session) {
        for (Expression argument : arguments) {
            if (!argument.evaluate(session).booleanValue()) {
                return AttributeValue.FALSE;
            }
        }
        return AttributeValue.TRUE;
    }

    @Override
    public FunctionType getFunctionType() {
        return FunctionType.AND;
    }
}
