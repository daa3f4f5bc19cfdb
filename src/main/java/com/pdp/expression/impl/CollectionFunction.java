package com.pdp.expression.impl;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.expression.Expression;
import com.pdp.expression.FunctionExpression;
import com.pdp.expression.FunctionType;
import com.pdp.session.EvaluationSession;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Intersection and union of two collections of the same type.
 * Results keep the order of the first operand, followed by new elements of the second.
 * For lists, union appends and intersection keeps elements of the first list found in the second.
 */
public class CollectionFunction extends FunctionExpression {

    private final FunctionType type;

    public CollectionFunction(FunctionType type, Expression left, Expression right) {
        super(List.of(left, right), left.getResultType());
        if (type != FunctionType.INTERSECT && type != FunctionType.UNION) {
            throw new IllegalArgumentException("Invalid collection operation: " + type);
        }
        this.type = type;
    }

    @Override
    public AttributeValue evaluate(EvaluationSession session) {
        AttributeValue left = arguments.get(0).evaluate(session);
        AttributeValue right = arguments.get(1).evaluate(session);

        return switch (getResultType()) {
            case SET_OF_STRINGS -> AttributeValue.ofStringSet(
                    combineSets(left.stringSetValue(), right.stringSetValue()));
            case SET_OF_NETWORKS -> AttributeValue.ofNetworkSet(
                    combineSets(left.networkSetValue(), right.networkSetValue()));
            case SET_OF_DOMAINS -> AttributeValue.ofDomainSet(
                    combineSets(left.domainSetValue(), right.domainSetValue()));
            case LIST_OF_STRINGS -> AttributeValue.ofStringList(
                    combineLists(left.stringListValue(), right.stringListValue()));
            default -> throw new IllegalStateException(name() + " is not defined for " + getResultType());
        };
    }

    private <T> Collection<T> combineSets(Set<T> left, Set<T> right) {
        Set<T> result = new LinkedHashSet<>(left);
        if (type == FunctionType.INTERSECT) {
            result.retainAll(right);
        } else {
            result.addAll(right);
        }
        return result;
    }

    private List<String> combineLists(List<String> left, List<String> right) {
        List<String> result = new ArrayList<>(left);
        if (type == FunctionType.INTERSECT) {
            result.retainAll(new LinkedHashSet<>(right));
        } else {
            result.addAll(right);
        }
        return result;
    }

    @Override
    public FunctionType getFunctionType() {
        return type;
    }

    /**
     * Whether the collection operations are defined for a type.
     */
    public static boolean supports(AttributeType type) {
        return type == AttributeType.SET_OF_STRINGS
                || type == AttributeType.SET_OF_NETWORKS
                || type == AttributeType.SET_OF_DOMAINS
                || type == AttributeType.LIST_OF_STRINGS;
    }
}
