package com.pdp.combining;

import com.pdp.exception.ErrorKind;
import com.pdp.policy.Effect;
import com.pdp.policy.EvaluationError;
import com.pdp.policy.Evaluable;
import com.pdp.policy.Result;
import com.pdp.session.EvaluationSession;

import java.util.List;

/**
 * At most one child may be applicable. A second applicable child makes the result
 * Indeterminate regardless of effects; an Indeterminate child does too.
 */
public class OnlyOneApplicableCombiner implements Combiner {

    @Override
    public Result combine(List<? extends Evaluable> children, EvaluationSession session) {
        Result selected = null;
        String selectedId = null;

        for (Evaluable child : children) {
            Result result = child.evaluate(session);
            if (result.getEffect() == Effect.NOT_APPLICABLE) {
                continue;
            }
            if (result.getEffect() == Effect.INDETERMINATE) {
                return result;
            }
            if (selected != null) {
                return Result.indeterminate(EvaluationError.of(ErrorKind.AMBIGUITY,
                        "Both '" + selectedId + "' and '" + child.getId() + "' are applicable",
                        child.getId()));
            }
            selected = result;
            selectedId = child.getId();
        }

        return selected != null ? selected : Result.notApplicable();
    }

    @Override
    public CombiningAlgorithm getAlgorithm() {
        return CombiningAlgorithm.ONLY_ONE_APPLICABLE;
    }
}
