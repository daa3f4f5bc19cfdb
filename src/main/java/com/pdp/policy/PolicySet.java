package com.pdp.policy;

import com.pdp.combining.Combiner;
import com.pdp.exception.PolicyTypeException;

import java.util.List;

/**
 * Policy set: combines an ordered list of policies and nested policy sets.
 */
public final class PolicySet extends PolicyContainer<Evaluable> {

    public PolicySet(String id, Target target, Combiner combiner, List<Evaluable> children,
                     List<Obligation> obligations) {
        super(id, target, combiner, requireContainers(id, children), obligations);
    }

    private static List<Evaluable> requireContainers(String id, List<Evaluable> children) {
        for (Evaluable child : children) {
            if (child.getKind() == NodeKind.RULE) {
                throw new PolicyTypeException("Policy set '" + id + "' cannot hold rule '" + child.getId() + "'", null);
            }
        }
        return children;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.POLICY_SET;
    }
}
