package com.pdp.store;

import com.pdp.attribute.AttributeType;
import com.pdp.config.document.PolicyDocument;
import com.pdp.policy.Evaluable;

import java.util.Map;

/**
 * Immutable published state of a {@link PolicyStore}: one validated document and the
 * generation it was published as.
 */
public final class PolicySnapshot {

    private static final PolicySnapshot EMPTY = new PolicySnapshot(0, null);

    private final long generation;
    private final PolicyDocument document;

    PolicySnapshot(long generation, PolicyDocument document) {
        this.generation = generation;
        this.document = document;
    }

    /**
     * Snapshot served before the first successful load. Every request is NotApplicable.
     */
    public static PolicySnapshot empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return document == null;
    }

    public long getGeneration() {
        return generation;
    }

    /**
     * Root node, or null for the empty snapshot.
     */
    public Evaluable getRoot() {
        return document == null ? null : document.root();
    }

    public Map<String, AttributeType> getDeclarations() {
        return document == null ? Map.of() : document.declarations();
    }

    /**
     * Document this snapshot was built from, or null for the empty snapshot.
     */
    public PolicyDocument getDocument() {
        return document;
    }

    @Override
    public String toString() {
        return "PolicySnapshot{generation=" + generation
                + (document == null ? ", empty" : ", root=" + document.root().getId()) + "}";
    }
}
