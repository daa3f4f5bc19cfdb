package com.pdp.policy;

import com.pdp.attribute.AttributeType;
import com.pdp.exception.EvaluationException;
import com.pdp.exception.PolicyTypeException;
import com.pdp.expression.Expression;
import com.pdp.session.EvaluationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Leaf of the policy tree: a target, an optional Boolean condition and the effect
 * the rule yields when both hold.
 */
public final class Rule implements Evaluable {

    private static final Logger log = LoggerFactory.getLogger(Rule.class);

    private final String id;
    private final Target target;
    private final Expression condition;
    private final Effect effect;
    private final List<Obligation> obligations;

    public Rule(String id, Target target, Expression condition, Effect effect, List<Obligation> obligations) {
        this.id = Objects.requireNonNull(id, "id");
        this.target = target != null ? target : Target.EMPTY;
        this.condition = condition;
        this.effect = Objects.requireNonNull(effect, "effect");
        if (effect != Effect.PERMIT && effect != Effect.DENY) {
            throw new PolicyTypeException("Rule '" + id + "' effect must be Permit or Deny but got " + effect, null);
        }
        if (condition != null && condition.getResultType() != AttributeType.BOOLEAN) {
            throw new PolicyTypeException("Rule '" + id + "' condition must be Boolean but got "
                    + condition.getResultType(), null);
        }
        this.obligations = obligations == null ? List.of()
                : obligations.stream().map(o -> o.withOrigin(id)).toList();
    }

    @Override
    public Result evaluate(EvaluationSession session) {
        try {
            if (!target.matches(session)) {
                log.trace("Rule '{}': target does not match", id);
                return Result.notApplicable();
            }
            if (condition != null && !condition.evaluate(session).booleanValue()) {
                log.trace("Rule '{}': condition is false", id);
                return Result.notApplicable();
            }
        } catch (EvaluationException e) {
            log.debug("Rule '{}' is indeterminate: {}", id, e.getMessage());
            return Result.indeterminate(EvaluationError.of(e, id));
        }

        log.trace("Rule '{}': {}", id, effect);
        return Result.of(effect, obligations);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RULE;
    }

    @Override
    public Target getTarget() {
        return target;
    }

    public Optional<Expression> getCondition() {
        return Optional.ofNullable(condition);
    }

    public Effect getEffect() {
        return effect;
    }

    @Override
    public List<Obligation> getObligations() {
        return obligations;
    }

    @Override
    public String toString() {
        return "Rule{" + id + " -> " + effect + "}";
    }
}
