package com.pdp.expression.impl;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.expression.Expression;
import com.pdp.expression.FunctionExpression;
import com.pdp.expression.FunctionType;
import com.pdp.session.EvaluationSession;

import java.util.List;

/**
 * Ordering comparison (greater, less) of two values of the same ordered type.
 */
public class ComparisonFunction extends FunctionExpression {

    private final FunctionType type;

    public ComparisonFunction(FunctionType type, Expression left, Expression right) {
        super(List.of(left, right), AttributeType.BOOLEAN);
        if (type != FunctionType.GREATER && type != FunctionType.LESS) {
            throw new IllegalArgumentException("Invalid comparison type: " + type);
        }
        this.type = type;
    }

    @Override
    public AttributeValue evaluate(EvaluationSession session) {
        AttributeValue left = arguments.get(0).evaluate(session);
        AttributeValue right = arguments.get(1).evaluate(session);
        int cmp = AttributeValue.compare(left, right);
        return AttributeValue.ofBoolean(type == FunctionType.GREATER ? cmp > 0 : cmp < 0);
    }

    @Override
    public FunctionType getFunctionType() {
        return type;
    }

    public static ComparisonFunction greater(Expression left, Expression right) {
        return new ComparisonFunction(FunctionType.GREATER, left, right);
    }

    public static ComparisonFunction less(Expression left, Expression right) {
        return new ComparisonFunction(FunctionType.LESS, left, right);
    }
}
