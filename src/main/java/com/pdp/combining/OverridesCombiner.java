package com.pdp.combining;

import com.pdp.policy.Effect;
import com.pdp.policy.EvaluationError;
import com.pdp.policy.Evaluable;
import com.pdp.policy.Obligation;
import com.pdp.policy.Result;
import com.pdp.session.EvaluationSession;

import java.util.ArrayList;
import java.util.List;

/**
 * Deny-overrides and permit-overrides.
 * <p>
 * The first child with the overriding effect decides at once, with its obligations.
 * Otherwise an Indeterminate child makes the result Indeterminate (first error reported);
 * otherwise the other effect wins with the obligations of every child that produced it;
 * otherwise NotApplicable.
 */
public class OverridesCombiner implements Combiner {

    private final Effect overriding;
    private final Effect other;
    private final CombiningAlgorithm algorithm;

    private OverridesCombiner(Effect overriding, Effect other, CombiningAlgorithm algorithm) {
        this.overriding = overriding;
        this.other = other;
        this.algorithm = algorithm;
    }

    public static OverridesCombiner denyOverrides() {
        return new OverridesCombiner(Effect.DENY, Effect.PERMIT, CombiningAlgorithm.DENY_OVERRIDES);
    }

    public static OverridesCombiner permitOverrides() {
        return new OverridesCombiner(Effect.PERMIT, Effect.DENY, CombiningAlgorithm.PERMIT_OVERRIDES);
    }

    @Override
    public Result combine(List<? extends Evaluable> children, EvaluationSession session) {
        EvaluationError firstError = null;
        boolean sawOther = false;
        List<Obligation> otherObligations = new ArrayList<>();

        for (Evaluable child : children) {
            Result result = child.evaluate(session);
            Effect effect = result.getEffect();
            if (effect == overriding) {
                return result;
            }
            if (effect == Effect.INDETERMINATE) {
                if (firstError == null) {
                    firstError = result.getError();
                }
            } else if (effect == other) {
                sawOther = true;
                otherObligations.addAll(result.getObligations());
            }
        }

        if (firstError != null) {
            return Result.indeterminate(firstError);
        }
        if (sawOther) {
            return Result.of(other, otherObligations);
        }
        return Result.notApplicable();
    }

    @Override
    public CombiningAlgorithm getAlgorithm() {
        return algorithm;
    }
}
