package com.pdp.expression;

import com.pdp.attribute.AttributeType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Base class for function applications. Arguments are type-checked by
 * {@link FunctionFactory} before an instance is created.
 */
public abstract class FunctionExpression implements Expression {

    protected final List<Expression> arguments;
    private final AttributeType resultType;

    protected FunctionExpression(List<Expression> arguments, AttributeType resultType) {
        this.arguments = List.copyOf(arguments);
        this.resultType = resultType;
    }

    /**
     * The built-in function this node applies.
     */
    public abstract FunctionType getFunctionType();

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public AttributeType getResultType() {
        return resultType;
    }

    protected String name() {
        return getFunctionType().getFunctionName();
    }

    @Override
    public String toString() {
        return name() + "(" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
    }
}
