package com.pdp.expression.impl;

import com.pdp.attribute.AttributeValue;
import com.pdp.exception.EvaluationException;
import com.pdp.expression.Expression;
import com.pdp.expression.FunctionExpression;
import com.pdp.expression.FunctionType;
import com.pdp.session.EvaluationSession;

import java.util.List;

/**
 * Value of the first argument that evaluates without error.
 * If every argument fails, the last error propagates.
 */
public class TryFunction extends FunctionExpression {

    public TryFunction(List<Expression> arguments) {
        super(arguments, arguments.get(0).getResultType());
    }

    @Override
    public AttributeValue evaluate(EvaluationSession session) {
        EvaluationException last = null;
        for (Expression argument : arguments) {
            try {
                return argument.evaluate(session);
            } catch (EvaluationException e) {
                last = e;
            }
        }
        throw last;
    }

    @Override
    public FunctionType getFunctionType() {
        return FunctionType.TRY;
    }
}
