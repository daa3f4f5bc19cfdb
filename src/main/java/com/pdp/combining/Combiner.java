package com.pdp.combining;

import com.pdp.policy.Evaluable;
import com.pdp.policy.Result;
import com.pdp.session.EvaluationSession;

import java.util.List;

/**
 * Aggregates the results of a container's children into one result.
 * Implementations are stateless with respect to requests and safe for concurrent use.
 */
public interface Combiner {

    /**
     * The algorithm this combiner implements.
     */
    CombiningAlgorithm getAlgorithm();

    /**
     * Evaluate children as the algorithm prescribes and combine their results.
     *
     * @param children Children in declared order
     * @param session  Session of the request
     * @return Combined result (without the container's own obligations)
     */
    Result combine(List<? extends Evaluable> children, EvaluationSession session);
}
