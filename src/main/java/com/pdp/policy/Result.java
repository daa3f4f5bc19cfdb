package com.pdp.policy;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of evaluating one node: the effect, the still unresolved obligations of the
 * winning branch and, for Indeterminate, the error.
 */
public final class Result {

    private static final Result NOT_APPLICABLE = new Result(Effect.NOT_APPLICABLE, List.of(), null);

    private final Effect effect;
    private final List<Obligation> obligations;
    private final EvaluationError error;

    private Result(Effect effect, List<Obligation> obligations, EvaluationError error) {
        this.effect = effect;
        this.obligations = obligations;
        this.error = error;
    }

    public static Result notApplicable() {
        return NOT_APPLICABLE;
    }

    public static Result indeterminate(EvaluationError error) {
        return new Result(Effect.INDETERMINATE, List.of(), error);
    }

    /**
     * Permit or Deny carrying obligations.
     */
    public static Result of(Effect effect, List<Obligation> obligations) {
        if (effect != Effect.PERMIT && effect != Effect.DENY) {
            throw new IllegalArgumentException("Obligations can only be attached to Permit or Deny, not " + effect);
        }
        return new Result(effect, List.copyOf(obligations), null);
    }

    public static Result permit(List<Obligation> obligations) {
        return of(Effect.PERMIT, obligations);
    }

    public static Result deny(List<Obligation> obligations) {
        return of(Effect.DENY, obligations);
    }

    /**
     * Adopt this result as the result of a parent node: the parent's own obligations
     * follow those of the child, and error and obligation paths gain the parent's id.
     */
    public Result under(String parentId, List<Obligation> parentObligations) {
        return switch (effect) {
            case PERMIT, DENY -> {
                List<Obligation> merged = new ArrayList<>(obligations.size() + parentObligations.size());
                for (Obligation obligation : obligations) {
                    merged.add(obligation.under(parentId));
                }
                merged.addAll(parentObligations);
                yield new Result(effect, List.copyOf(merged), null);
            }
            case INDETERMINATE -> new Result(effect, List.of(), error.under(parentId));
            case NOT_APPLICABLE -> this;
        };
    }

    public Effect getEffect() {
        return effect;
    }

    public List<Obligation> getObligations() {
        return obligations;
    }

    /**
     * Error for an Indeterminate result, null otherwise.
     */
    public EvaluationError getError() {
        return error;
    }

    public boolean isApplicable() {
        return effect != Effect.NOT_APPLICABLE;
    }

    @Override
    public String toString() {
        if (error != null) {
            return effect + "{" + error + "}";
        }
        return effect + (obligations.isEmpty() ? "" : obligations.toString());
    }
}
