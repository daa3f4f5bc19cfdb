package com.pdp.policy;

/**
 * Kinds of policy tree node. Rules are leaves, policies hold rules and
 * policy sets hold policies or other policy sets.
 */
public enum NodeKind {
    RULE,
    POLICY,
    POLICY_SET
}
