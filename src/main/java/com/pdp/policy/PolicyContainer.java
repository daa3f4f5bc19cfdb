package com.pdp.policy;

import com.pdp.combining.Combiner;
import com.pdp.exception.EvaluationException;
import com.pdp.exception.PolicyTypeException;
import com.pdp.session.EvaluationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Common part of {@link Policy} and {@link PolicySet}: a target, a combining algorithm
 * over an ordered list of children, and obligations.
 * <p>
 * Children are owned exclusively by their parent and are never shared or back-referenced,
 * so the tree is acyclic by construction.
 *
 * @param <C> Child node type
 */
public abstract class PolicyContainer<C extends Evaluable> implements Evaluable {

    private static final Logger log = LoggerFactory.getLogger(PolicyContainer.class);

    private final String id;
    private final Target target;
    private final Combiner combiner;
    private final List<C> children;
    private final List<Obligation> obligations;

    protected PolicyContainer(String id, Target target, Combiner combiner, List<C> children,
                              List<Obligation> obligations) {
        this.id = Objects.requireNonNull(id, "id");
        this.target = target != null ? target : Target.EMPTY;
        this.combiner = Objects.requireNonNull(combiner, "combiner");
        this.children = List.copyOf(children);
        this.obligations = obligations == null ? List.of()
                : obligations.stream().map(o -> o.withOrigin(id)).toList();

        Set<String> seen = new HashSet<>();
        for (C child : this.children) {
            if (!seen.add(child.getId())) {
                throw new PolicyTypeException("Duplicate id '" + child.getId() + "' in '" + id + "'", null);
            }
        }
    }

    @Override
    public Result evaluate(EvaluationSession session) {
        try {
            if (!target.matches(session)) {
                log.trace("{} '{}': target does not match", getKind(), id);
                return Result.notApplicable();
            }
        } catch (EvaluationException e) {
            log.debug("{} '{}' target is indeterminate: {}", getKind(), id, e.getMessage());
            return Result.indeterminate(EvaluationError.of(e, id));
        }

        Result combined = combiner.combine(children, session).under(id, obligations);
        log.trace("{} '{}': {}", getKind(), id, combined);
        return combined;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Target getTarget() {
        return target;
    }

    public Combiner getCombiner() {
        return combiner;
    }

    public List<C> getChildren() {
        return children;
    }

    @Override
    public List<Obligation> getObligations() {
        return obligations;
    }

    @Override
    public String toString() {
        return getKind() + "{" + id + ", " + combiner.getAlgorithm() + ", " + children.size() + " children}";
    }
}
