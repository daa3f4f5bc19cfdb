package com.pdp.expression;

import java.util.List;

/**
 * Resolves a function name and argument list to a type-checked expression.
 */
public interface FunctionFactory {

    /**
     * Create a function application.
     *
     * @param name      Function name as written in the document (case-insensitive)
     * @param arguments Already parsed argument expressions
     * @return Type-checked expression
     * @throws com.pdp.exception.PolicyTypeException if the function is unknown or no overload fits
     */
    Expression create(String name, List<Expression> arguments);
}
