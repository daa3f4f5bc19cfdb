package com.pdp.expression;

import com.pdp.attribute.AttributeType;
import com.pdp.exception.PolicyTypeException;
import com.pdp.expression.impl.AndFunction;
import com.pdp.expression.impl.ArithmeticFunction;
import com.pdp.expression.impl.CollectionFunction;
import com.pdp.expression.impl.ComparisonFunction;
import com.pdp.expression.impl.ContainsFunction;
import com.pdp.expression.impl.EqualFunction;
import com.pdp.expression.impl.LenFunction;
import com.pdp.expression.impl.NotFunction;
import com.pdp.expression.impl.OrFunction;
import com.pdp.expression.impl.TryFunction;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Default implementation of FunctionFactory.
 * Resolves overloads and checks argument types once, when the policy is parsed,
 * so that evaluation never sees an ill-typed call.
 * <p>
 * Errors are raised without a document path; the parser attaches it.
 */
public class DefaultFunctionFactory implements FunctionFactory {

    @Override
    public Expression create(String name, List<Expression> arguments) {
        FunctionType type = FunctionType.fromName(name)
                .orElseThrow(() -> new PolicyTypeException("Unknown function '" + name + "'", null));
        if (arguments == null) {
            throw new PolicyTypeException(type.getFunctionName() + " requires arguments", null);
        }

        return switch (type) {
            case AND -> new AndFunction(requireBooleans(type, arguments));
            case OR -> new OrFunction(requireBooleans(type, arguments));
            case NOT -> {
                requireArity(type, arguments, 1);
                yield new NotFunction(requireBooleans(type, arguments).get(0));
            }

            case EQUAL -> createEqual(arguments);
            case GREATER, LESS -> createComparison(type, arguments);

            case CONTAINS -> createContains(arguments);
            case INTERSECT, UNION -> createCollection(type, arguments);
            case LEN -> createLen(arguments);

            case ADD, SUBTRACT, MULTIPLY, DIVIDE -> createArithmetic(type, arguments);

            case TRY -> createTry(arguments);
        };
    }

    private Expression createEqual(List<Expression> arguments) {
        requireArity(FunctionType.EQUAL, arguments, 2);
        requireSameType(FunctionType.EQUAL, arguments);
        return new EqualFunction(arguments.get(0), arguments.get(1));
    }

    private Expression createComparison(FunctionType type, List<Expression> arguments) {
        requireArity(type, arguments, 2);
        AttributeType argType = requireSameType(type, arguments);
        if (!argType.isOrdered()) {
            throw mismatch(type, arguments, "ordered values");
        }
        return new ComparisonFunction(type, arguments.get(0), arguments.get(1));
    }

    private Expression createContains(List<Expression> arguments) {
        requireArity(FunctionType.CONTAINS, arguments, 2);
        Expression container = arguments.get(0);
        Expression candidate = arguments.get(1);
        ContainsFunction.Mode mode = ContainsFunction.Mode
                .forTypes(container.getResultType(), candidate.getResultType())
                .orElseThrow(() -> mismatch(FunctionType.CONTAINS, arguments,
                        "a container and a candidate of its element type"));
        return new ContainsFunction(mode, container, candidate);
    }

    private Expression createCollection(FunctionType type, List<Expression> arguments) {
        requireArity(type, arguments, 2);
        AttributeType argType = requireSameType(type, arguments);
        if (!CollectionFunction.supports(argType)) {
            throw mismatch(type, arguments, "two sets or two lists of the same type");
        }
        return new CollectionFunction(type, arguments.get(0), arguments.get(1));
    }

    private Expression createLen(List<Expression> arguments) {
        requireArity(FunctionType.LEN, arguments, 1);
        AttributeType argType = arguments.get(0).getResultType();
        if (!argType.isCollection() && argType != AttributeType.STRING) {
            throw mismatch(FunctionType.LEN, arguments, "a collection or a string");
        }
        return new LenFunction(arguments.get(0));
    }

    private Expression createArithmetic(FunctionType type, List<Expression> arguments) {
        requireArity(type, arguments, 2);
        AttributeType argType = requireSameType(type, arguments);
        if (argType != AttributeType.INTEGER && argType != AttributeType.FLOAT) {
            throw mismatch(type, arguments, "two Integers or two Floats");
        }
        return new ArithmeticFunction(type, arguments.get(0), arguments.get(1));
    }

    private Expression createTry(List<Expression> arguments) {
        if (arguments.isEmpty()) {
            throw new PolicyTypeException("try requires at least one argument", null);
        }
        requireSameType(FunctionType.TRY, arguments);
        return new TryFunction(arguments);
    }

    // Validation helpers

    private List<Expression> requireBooleans(FunctionType type, List<Expression> arguments) {
        if (arguments.isEmpty()) {
            throw new PolicyTypeException(type.getFunctionName() + " requires at least one argument", null);
        }
        for (Expression argument : arguments) {
            if (argument.getResultType() != AttributeType.BOOLEAN) {
                throw mismatch(type, arguments, "Boolean arguments");
            }
        }
        return arguments;
    }

    private void requireArity(FunctionType type, List<Expression> arguments, int arity) {
        if (arguments.size() != arity) {
            throw new PolicyTypeException(type.getFunctionName() + " expects " + arity
                    + " argument(s) but got " + arguments.size(), null);
        }
    }

    private AttributeType requireSameType(FunctionType type, List<Expression> arguments) {
        AttributeType first = arguments.get(0).getResultType();
        for (Expression argument : arguments) {
            if (argument.getResultType() != first) {
                throw mismatch(type, arguments, "arguments of the same type");
            }
        }
        return first;
    }

    private PolicyTypeException mismatch(FunctionType type, List<Expression> arguments, String expected) {
        String actual = arguments.stream()
                .map(a -> a.getResultType().getTag())
                .collect(Collectors.joining(", "));
        return new PolicyTypeException(type.getFunctionName() + " expects " + expected
                + " but got (" + actual + ")", null);
    }
}
