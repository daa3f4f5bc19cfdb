package com.pdp.combining;

import com.pdp.policy.Effect;
import com.pdp.policy.Evaluable;
import com.pdp.policy.Result;
import com.pdp.session.EvaluationSession;

import java.util.List;

/**
 * Children are tried in declared order; the first one that is not NotApplicable decides.
 */
public class FirstApplicableCombiner implements Combiner {

    @Override
    public Result combine(List<? extends Evaluable> children, EvaluationSession session) {
        for (Evaluable child : children) {
            Result result = child.evaluate(session);
            if (result.getEffect() != Effect.NOT_APPLICABLE) {
                return result;
            }
        }
        return Result.notApplicable();
    }

    @Override
    public CombiningAlgorithm getAlgorithm() {
        return CombiningAlgorithm.FIRST_APPLICABLE;
    }
}
