package com.pdp.policy;

import com.pdp.session.EvaluationSession;

import java.util.List;

/**
 * A node of the policy tree. Nodes are immutable once built and safe to evaluate
 * from any number of threads at once.
 */
public interface Evaluable {

    String getId();

    NodeKind getKind();

    Target getTarget();

    List<Obligation> getObligations();

    /**
     * Evaluate this node for one request.
     * Never throws for evaluation-time errors: those become an Indeterminate result.
     *
     * @param session Session of the request
     * @return Result with unresolved obligations of the winning branch
     */
    Result evaluate(EvaluationSession session);
}
