package com.pdp.expression;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Built-in functions available to target, condition and obligation expressions.
 */
public enum FunctionType {
    // Logical
    AND("and"),
    OR("or"),
    NOT("not"),

    // Comparison
    EQUAL("equal"),
    GREATER("greater"),
    LESS("less"),

    // Containment and collections
    CONTAINS("contains"),
    INTERSECT("intersect"),
    UNION("union"),
    LEN("len"),

    // Arithmetic
    ADD("add"),
    SUBTRACT("subtract"),
    MULTIPLY("multiply"),
    DIVIDE("divide"),

    // Error handling
    TRY("try");

    private static final Map<String, FunctionType> BY_NAME = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(f -> f.functionName, Function.identity()));

    private final String functionName;

    FunctionType(String functionName) {
        this.functionName = functionName;
    }

    /**
     * Name used in policy documents.
     */
    public String getFunctionName() {
        return functionName;
    }

    /**
     * Look up a function by document name, ignoring case.
     */
    public static Optional<FunctionType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.toLowerCase(Locale.ROOT)));
    }
}
