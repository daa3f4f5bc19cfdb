package com.pdp.combining;

import com.pdp.exception.PolicyTypeException;

/**
 * Factory for the combiners that need no parameters.
 * Mapper combiners are built with {@link MapperCombiner#MapperCombiner}.
 */
public final class CombinerFactory {

    private static final Combiner FIRST_APPLICABLE = new FirstApplicableCombiner();
    private static final Combiner DENY_OVERRIDES = OverridesCombiner.denyOverrides();
    private static final Combiner PERMIT_OVERRIDES = OverridesCombiner.permitOverrides();
    private static final Combiner ONLY_ONE_APPLICABLE = new OnlyOneApplicableCombiner();
    private static final Combiner DENY_UNLESS_PERMIT = UnlessCombiner.denyUnlessPermit();
    private static final Combiner PERMIT_UNLESS_DENY = UnlessCombiner.permitUnlessDeny();

    private CombinerFactory() {
    }

    /**
     * Get the shared combiner for an algorithm.
     *
     * @throws PolicyTypeException for {@link CombiningAlgorithm#MAPPER}, which needs parameters
     */
    public static Combiner create(CombiningAlgorithm algorithm) {
        return switch (algorithm) {
            case FIRST_APPLICABLE -> FIRST_APPLICABLE;
            case DENY_OVERRIDES -> DENY_OVERRIDES;
            case PERMIT_OVERRIDES -> PERMIT_OVERRIDES;
            case ONLY_ONE_APPLICABLE -> ONLY_ONE_APPLICABLE;
            case DENY_UNLESS_PERMIT -> DENY_UNLESS_PERMIT;
            case PERMIT_UNLESS_DENY -> PERMIT_UNLESS_DENY;
            case MAPPER -> throw new PolicyTypeException("Mapper requires map parameters", null);
        };
    }

    /**
     * Combiner used when a policy does not name an algorithm.
     */
    public static Combiner createDefault() {
        return FIRST_APPLICABLE;
    }
}
