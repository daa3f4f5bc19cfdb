package com.pdp.policy;

import com.pdp.combining.Combiner;

import java.util.List;

/**
 * Policy: combines an ordered list of rules.
 */
public final class Policy extends PolicyContainer<Rule> {

    public Policy(String id, Target target, Combiner combiner, List<Rule> rules, List<Obligation> obligations) {
        super(id, target, combiner, rules, obligations);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.POLICY;
    }
}
