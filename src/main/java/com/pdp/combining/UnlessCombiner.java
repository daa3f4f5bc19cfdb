package com.pdp.combining;

import com.pdp.policy.Effect;
import com.pdp.policy.Evaluable;
import com.pdp.policy.Obligation;
import com.pdp.policy.Result;
import com.pdp.session.EvaluationSession;

import java.util.ArrayList;
import java.util.List;

/**
 * Deny-unless-permit and permit-unless-deny. Never NotApplicable or Indeterminate:
 * the first child with the winning effect decides, otherwise the fallback effect is returned
 * with the obligations of the children that produced it.
 */
public class UnlessCombiner implements Combiner {

    private final Effect winning;
    private final Effect fallback;
    private final CombiningAlgorithm algorithm;

    private UnlessCombiner(Effect winning, Effect fallback, CombiningAlgorithm algorithm) {
        this.winning = winning;
        this.fallback = fallback;
        this.algorithm = algorithm;
    }

    public static UnlessCombiner denyUnlessPermit() {
        return new UnlessCombiner(Effect.PERMIT, Effect.DENY, CombiningAlgorithm.DENY_UNLESS_PERMIT);
    }

    public static UnlessCombiner permitUnlessDeny() {
        return new UnlessCombiner(Effect.DENY, Effect.PERMIT, CombiningAlgorithm.PERMIT_UNLESS_DENY);
    }

    @Override
    public Result combine(List<? extends Evaluable> children, EvaluationSession session) {
        List<Obligation> fallbackObligations = new ArrayList<>();
        for (Evaluable child : children) {
            Result result = child.evaluate(session);
            if (result.getEffect() == winning) {
                return result;
            }
            if (result.getEffect() == fallback) {
                fallbackObligations.addAll(result.getObligations());
            }
        }
        return Result.of(fallback, fallbackObligations);
    }

    @Override
    public CombiningAlgorithm getAlgorithm() {
        return algorithm;
    }
}
