package com.pdp.engine;

import com.pdp.attribute.AttributeValue;
import com.pdp.exception.EvaluationException;
import com.pdp.policy.EvaluationError;
import com.pdp.policy.Obligation;
import com.pdp.policy.Result;
import com.pdp.session.AttributeResolver;
import com.pdp.session.CancellationToken;
import com.pdp.session.EvaluationSession;
import com.pdp.session.Request;
import com.pdp.store.PolicySnapshot;
import com.pdp.store.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Default implementation of PolicyEngine.
 * Captures the store's snapshot once per request, evaluates the tree, then resolves the
 * obligations of the winning branch.
 */
public class DefaultPolicyEngine implements PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultPolicyEngine.class);

    private final PolicyStore store;
    private final AttributeResolver resolver;

    public DefaultPolicyEngine(PolicyStore store) {
        this(store, AttributeResolver.none());
    }

    public DefaultPolicyEngine(PolicyStore store, AttributeResolver resolver) {
        this.store = store;
        this.resolver = resolver;
    }

    @Override
    public Decision evaluate(Request request) {
        return evaluate(request, CancellationToken.none());
    }

    @Override
    public Decision evaluate(Request request, CancellationToken cancellation) {
        PolicySnapshot snapshot = store.current();
        EvaluationSession session = new EvaluationSession(request, resolver, cancellation);
        Decision decision = decide(snapshot, session);
        log.debug("Request {} decided {} (generation {}, {} resolver calls)",
                request.getRequestId(), decision.getEffect(), snapshot.getGeneration(),
                session.getResolverCalls());
        return decision;
    }

    /**
     * Evaluate one snapshot for one session.
     */
    static Decision decide(PolicySnapshot snapshot, EvaluationSession session) {
        long generation = snapshot.getGeneration();
        if (snapshot.isEmpty()) {
            return Decision.notApplicable(generation);
        }

        Result result = snapshot.getRoot().evaluate(session);
        return switch (result.getEffect()) {
            case NOT_APPLICABLE -> Decision.notApplicable(generation);
            case INDETERMINATE -> Decision.indeterminate(result.getError(), generation);
            case PERMIT, DENY -> resolveObligations(result, session, generation);
        };
    }

    private static Decision resolveObligations(Result result, EvaluationSession session, long generation) {
        List<AssignedObligation> assigned = new ArrayList<>(result.getObligations().size());
        for (Obligation obligation : result.getObligations()) {
            try {
                AttributeValue value = obligation.expression().evaluate(session);
                assigned.add(new AssignedObligation(obligation.attribute().id(), value));
            } catch (EvaluationException e) {
                log.debug("Obligation {} of '{}' failed: {}", obligation.attribute().id(),
                        String.join(" > ", obligation.path()), e.getMessage());
                return Decision.indeterminate(EvaluationError.of(e, obligation.path()), generation);
            }
        }
        return Decision.of(result.getEffect(), assigned, generation);
    }
}
