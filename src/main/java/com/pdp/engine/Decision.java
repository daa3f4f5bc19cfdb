package com.pdp.engine;

import com.pdp.policy.Effect;
import com.pdp.policy.EvaluationError;

import java.util.List;
import java.util.Objects;

/**
 * Final answer for a request.
 * <p>
 * Indeterminate is never Permit. Callers that need a binary answer must treat
 * anything other than {@link #isPermit()} as a denial.
 */
public final class Decision {

    private final Effect effect;
    private final List<AssignedObligation> obligations;
    private final EvaluationError reason;
    private final long generation;

    private Decision(Effect effect, List<AssignedObligation> obligations, EvaluationError reason, long generation) {
        this.effect = effect;
        this.obligations = List.copyOf(obligations);
        this.reason = reason;
        this.generation = generation;
    }

    public static Decision of(Effect effect, List<AssignedObligation> obligations, long generation) {
        if (effect == Effect.INDETERMINATE) {
            throw new IllegalArgumentException("Indeterminate decisions require a reason");
        }
        return new Decision(effect, obligations, null, generation);
    }

    public static Decision notApplicable(long generation) {
        return new Decision(Effect.NOT_APPLICABLE, List.of(), null, generation);
    }

    public static Decision indeterminate(EvaluationError reason, long generation) {
        return new Decision(Effect.INDETERMINATE, List.of(), Objects.requireNonNull(reason, "reason"), generation);
    }

    public Effect getEffect() {
        return effect;
    }

    /**
     * Resolved obligations of the winning branch, innermost node first.
     */
    public List<AssignedObligation> getObligations() {
        return obligations;
    }

    /**
     * Why the decision is Indeterminate, null otherwise.
     */
    public EvaluationError getReason() {
        return reason;
    }

    /**
     * Generation of the policy snapshot this decision was drawn from. Zero before any load.
     */
    public long getGeneration() {
        return generation;
    }

    public boolean isPermit() {
        return effect == Effect.PERMIT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Decision that)) return false;
        return generation == that.generation
                && effect == that.effect
                && obligations.equals(that.obligations)
                && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(effect, obligations, reason, generation);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Decision{").append(effect);
        if (!obligations.isEmpty()) {
            sb.append(", obligations=").append(obligations);
        }
        if (reason != null) {
            sb.append(", reason=").append(reason);
        }
        return sb.append(", generation=").append(generation).append('}').toString();
    }
}
