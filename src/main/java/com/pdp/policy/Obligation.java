package com.pdp.policy;

import com.pdp.attribute.Attribute;
import com.pdp.expression.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Attribute assignment attached to a node's effect. The expression is evaluated only
 * when the node is part of the winning branch of the final decision.
 *
 * @param attribute  Declared attribute receiving the value
 * @param expression Expression of the attribute's type
 * @param path       Node ids from the outermost node that adopted this obligation down to the node carrying it
 */
public record Obligation(Attribute attribute, Expression expression, List<String> path) {

    public Obligation {
        path = path == null ? List.of() : List.copyOf(path);
    }

    public Obligation(Attribute attribute, Expression expression) {
        this(attribute, expression, List.of());
    }

    /**
     * Copy of this obligation bound to the node that carries it.
     */
    public Obligation withOrigin(String nodeId) {
        return new Obligation(attribute, expression, List.of(nodeId));
    }

    /**
     * Same obligation seen from a parent node.
     */
    public Obligation under(String parentId) {
        List<String> extended = new ArrayList<>(path.size() + 1);
        extended.add(parentId);
        extended.addAll(path);
        return new Obligation(attribute, expression, extended);
    }

    /**
     * Id of the node carrying this obligation, or null if unbound.
     */
    public String origin() {
        return path.isEmpty() ? null : path.get(path.size() - 1);
    }

    @Override
    public String toString() {
        return attribute.id() + " = " + expression;
    }
}
