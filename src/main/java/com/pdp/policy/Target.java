package com.pdp.policy;

import com.pdp.attribute.AttributeType;
import com.pdp.exception.PolicyTypeException;
import com.pdp.expression.Expression;
import com.pdp.session.EvaluationSession;

import java.util.List;

/**
 * Applicability filter of a node: a conjunction of {@link AnyOf} clauses, each of which
 * is a disjunction of {@link AllOf} groups of Boolean match expressions.
 * An empty target matches every request.
 */
public final class Target {

    public static final Target EMPTY = new Target(List.of());

    private final List<AnyOf> clauses;

    public Target(List<AnyOf> clauses) {
        this.clauses = List.copyOf(clauses);
    }

    /**
     * Target made of plain match expressions that must all be true.
     */
    public static Target allOf(List<Expression> matches) {
        return new Target(matches.stream()
                .map(m -> new AnyOf(List.of(new AllOf(List.of(m)))))
                .toList());
    }

    /**
     * Whether the request is in scope of the node.
     *
     * @throws com.pdp.exception.EvaluationException if a match expression cannot be evaluated
     */
    public boolean matches(EvaluationSession session) {
        for (AnyOf clause : clauses) {
            if (!clause.matches(session)) {
                return false;
            }
        }
        return true;
    }

    public List<AnyOf> getClauses() {
        return clauses;
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    @Override
    public String toString() {
        return "Target" + clauses;
    }

    /**
     * At least one group must match.
     */
    public record AnyOf(List<AllOf> groups) {

        public AnyOf {
            groups = List.copyOf(groups);
        }

        boolean matches(EvaluationSession session) {
            for (AllOf group : groups) {
                if (group.matches(session)) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * Every match expression must be true.
     */
    public record AllOf(List<Expression> matches) {

        public AllOf {
            matches = List.copyOf(matches);
            for (Expression match : matches) {
                if (match.getResultType() != AttributeType.BOOLEAN) {
                    throw new PolicyTypeException("Target match must be Boolean but got "
                            + match.getResultType(), null);
                }
            }
        }

        boolean matches(EvaluationSession session) {
            for (Expression match : matches) {
                if (!match.evaluate(session).booleanValue()) {
                    return false;
                }
            }
            return true;
        }
    }
}
