package com.pdp.config.document;

/**
 * Keys of the policy and request document vocabulary. Documents are matched
 * against these in lower case.
 */
public final class Tags {

    private Tags() {
    }

    // Root
    public static final String ROOT = "root";
    public static final String ATTRIBUTES = "attributes";
    public static final String POLICIES = "policies";

    // Nodes
    public static final String ID = "id";
    public static final String TARGET = "target";
    public static final String ALG = "alg";
    public static final String RULES = "rules";
    public static final String OBLIGATIONS = "obligations";
    public static final String CONDITION = "condition";
    public static final String EFFECT = "effect";

    // Target
    public static final String ANY = "any";
    public static final String ALL = "all";

    // Expressions
    public static final String ATTR = "attr";
    public static final String VAL = "val";
    public static final String TYPE = "type";
    public static final String CONTENT = "content";

    // Mapper
    public static final String MAP = "map";
    public static final String DEFAULT = "default";
    public static final String ERROR = "error";
    public static final String UNMATCHED = "unmatched";
}
