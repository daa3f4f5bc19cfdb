package com.pdp.policy;

import java.util.Optional;

/**
 * Outcome of evaluating a node. Rules may only declare PERMIT or DENY.
 */
public enum Effect {
    PERMIT("Permit"),
    DENY("Deny"),
    NOT_APPLICABLE("NotApplicable"),
    INDETERMINATE("Indeterminate");

    private final String tag;

    Effect(String tag) {
        this.tag = tag;
    }

    /**
     * Name used in policy documents and decisions.
     */
    public String getTag() {
        return tag;
    }

    /**
     * Look up an effect by document tag, ignoring case.
     */
    public static Optional<Effect> fromTag(String tag) {
        for (Effect effect : values()) {
            if (effect.tag.equalsIgnoreCase(tag)) {
                return Optional.of(effect);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return tag;
    }
}
