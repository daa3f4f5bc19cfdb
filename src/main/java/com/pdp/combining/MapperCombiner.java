package com.pdp.combining;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.exception.ErrorKind;
import com.pdp.exception.EvaluationException;
import com.pdp.exception.PolicyTypeException;
import com.pdp.expression.Expression;
import com.pdp.policy.Effect;
import com.pdp.policy.EvaluationError;
import com.pdp.policy.Evaluable;
import com.pdp.policy.Result;
import com.pdp.session.EvaluationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Selects children by id from the value of a map expression instead of scanning them.
 * <p>
 * A String value selects one child. A Set or List of Strings selects every child named,
 * in the value's order, and combines them with a nested algorithm.
 * Values that name no child fall back to the default child; without one, the
 * configured unmatched effect is returned. A failing map expression selects the
 * error child, or makes the result Indeterminate.
 */
public class MapperCombiner implements Combiner {

    private static final Logger log = LoggerFactory.getLogger(MapperCombiner.class);

    private final Expression map;
    private final Map<String, Evaluable> childrenById;
    private final Evaluable defaultChild;
    private final Evaluable errorChild;
    private final Combiner subCombiner;
    private final Effect unmatched;

    /**
     * @param children    Children of the owning container, in declared order
     * @param map         Expression of type String, Set of Strings or List of Strings
     * @param defaultId   Id of the child used when nothing matches, or null
     * @param errorId     Id of the child used when the map expression fails, or null
     * @param subCombiner Algorithm for multi-valued selections; must be null for single-valued maps
     * @param unmatched   NotApplicable or Indeterminate, returned when nothing matches and there is no default
     * @throws PolicyTypeException if the map type, ids or nested algorithm are invalid
     */
    public MapperCombiner(List<? extends Evaluable> children, Expression map, String defaultId, String errorId,
                          Combiner subCombiner, Effect unmatched) {
        this.map = Objects.requireNonNull(map, "map");
        this.childrenById = new LinkedHashMap<>();
        for (Evaluable child : children) {
            childrenById.put(child.getId(), child);
        }

        AttributeType mapType = map.getResultType();
        if (mapType != AttributeType.STRING
                && mapType != AttributeType.SET_OF_STRINGS
                && mapType != AttributeType.LIST_OF_STRINGS) {
            throw new PolicyTypeException("Mapper expects a map of type String, Set of Strings or "
                    + "List of Strings but got " + mapType, null);
        }
        if (subCombiner != null && subCombiner.getAlgorithm() == CombiningAlgorithm.MAPPER) {
            throw new PolicyTypeException("Mapper cannot be nested as the algorithm of a Mapper", null);
        }
        if (mapType == AttributeType.STRING && subCombiner != null) {
            throw new PolicyTypeException("Mapper over a single String selects one child and takes no "
                    + "algorithm, got " + subCombiner.getAlgorithm(), null);
        }
        if (mapType != AttributeType.STRING && subCombiner == null) {
            this.subCombiner = CombinerFactory.createDefault();
        } else {
            this.subCombiner = subCombiner;
        }

        this.defaultChild = lookup(defaultId, "default");
        this.errorChild = lookup(errorId, "error");

        Effect unmatchedEffect = unmatched != null ? unmatched : Effect.NOT_APPLICABLE;
        if (unmatchedEffect != Effect.NOT_APPLICABLE && unmatchedEffect != Effect.INDETERMINATE) {
            throw new PolicyTypeException("Mapper unmatched effect must be NotApplicable or Indeterminate but got "
                    + unmatchedEffect, null);
        }
        this.unmatched = unmatchedEffect;
    }

    private Evaluable lookup(String id, String role) {
        if (id == null) {
            return null;
        }
        Evaluable child = childrenById.get(id);
        if (child == null) {
            throw new PolicyTypeException("Mapper " + role + " refers to unknown child '" + id + "'", null);
        }
        return child;
    }

    @Override
    public Result combine(List<? extends Evaluable> children, EvaluationSession session) {
        AttributeValue key;
        try {
            key = map.evaluate(session);
        } catch (EvaluationException e) {
            if (errorChild != null) {
                log.debug("Mapper key failed ({}), using error child '{}'", e.getMessage(), errorChild.getId());
                return errorChild.evaluate(session);
            }
            return Result.indeterminate(EvaluationError.unplaced(e));
        }

        if (key.getType() == AttributeType.STRING) {
            Evaluable child = childrenById.get(key.stringValue());
            return child != null ? child.evaluate(session) : noMatch(key, session);
        }

        Collection<String> names = key.getType() == AttributeType.SET_OF_STRINGS
                ? key.stringSetValue() : key.stringListValue();
        if (names.isEmpty()) {
            return Result.notApplicable();
        }
        List<Evaluable> selected = new ArrayList<>();
        for (String name : names) {
            Evaluable child = childrenById.get(name);
            if (child != null && !selected.contains(child)) {
                selected.add(child);
            }
        }
        if (selected.isEmpty()) {
            return noMatch(key, session);
        }
        return subCombiner.combine(selected, session);
    }

    private Result noMatch(AttributeValue key, EvaluationSession session) {
        if (defaultChild != null) {
            return defaultChild.evaluate(session);
        }
        if (unmatched == Effect.INDETERMINATE) {
            return Result.indeterminate(EvaluationError.unplaced(ErrorKind.RESOLUTION,
                    "Mapper key " + key + " matches no child"));
        }
        return Result.notApplicable();
    }

    @Override
    public CombiningAlgorithm getAlgorithm() {
        return CombiningAlgorithm.MAPPER;
    }

    public Expression getMap() {
        return map;
    }

    public Evaluable getDefaultChild() {
        return defaultChild;
    }

    public Evaluable getErrorChild() {
        return errorChild;
    }

    public Combiner getSubCombiner() {
        return subCombiner;
    }

    public Effect getUnmatched() {
        return unmatched;
    }
}
