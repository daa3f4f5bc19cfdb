package com.pdp.expression;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.session.EvaluationSession;

/**
 * A typed expression node: a literal, an attribute designator or a function application.
 * The result type is fixed when the policy is parsed.
 */
public interface Expression {

    /**
     * Evaluate this expression within a session.
     *
     * @param session Session of the request being evaluated
     * @return Value of {@link #getResultType()}
     * @throws com.pdp.exception.EvaluationException if the value cannot be computed
     */
    AttributeValue evaluate(EvaluationSession session);

    /**
     * Static type of the values this expression produces.
     */
    AttributeType getResultType();
}
