package com.pdp.expression.impl;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.exception.ErrorKind;
import com.pdp.exception.EvaluationException;
import com.pdp.expression.Expression;
import com.pdp.expression.FunctionExpression;
import com.pdp.expression.FunctionType;
import com.pdp.session.EvaluationSession;

import java.util.List;

/**
 * Integer or float arithmetic on two operands of the same numeric type.
 * Integer overflow and division by zero are function errors.
 */
public class ArithmeticFunction extends FunctionExpression {

    private final FunctionType type;

    public ArithmeticFunction(FunctionType type, Expression left, Expression right) {
        super(List.of(left, right), left.getResultType());
        this.type = type;
    }

    @Override
    public AttributeValue evaluate(EvaluationSession session) {
        AttributeValue left = arguments.get(0).evaluate(session);
        AttributeValue right = arguments.get(1).evaluate(session);

        if (getResultType() == AttributeType.INTEGER) {
            return AttributeValue.ofInteger(integer(left.integerValue(), right.integerValue()));
        }
        return AttributeValue.ofFloat(floating(left.floatValue(), right.floatValue()));
    }

    private long integer(long a, long b) {
        try {
            return switch (type) {
                case ADD -> Math.addExact(a, b);
                case SUBTRACT -> Math.subtractExact(a, b);
                case MULTIPLY -> Math.multiplyExact(a, b);
                case DIVIDE -> {
                    if (b == 0) {
                        throw EvaluationException.function(name(), "division by zero");
                    }
                    if (a == Long.MIN_VALUE && b == -1) {
                        throw new ArithmeticException("long overflow");
                    }
                    yield a / b;
                }
                default -> throw new IllegalStateException("Invalid arithmetic type: " + type);
            };
        } catch (ArithmeticException e) {
            throw new EvaluationException(ErrorKind.FUNCTION, name(),
                    "integer overflow on " + a + " and " + b, e);
        }
    }

    private double floating(double a, double b) {
        return switch (type) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE -> {
                if (b == 0.0) {
                    throw EvaluationException.function(name(), "division by zero");
                }
                yield a / b;
            }
            default -> throw new IllegalStateException("Invalid arithmetic type: " + type);
        };
    }

    @Override
    public FunctionType getFunctionType() {
        return type;
    }
}
