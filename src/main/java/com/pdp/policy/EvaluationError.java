package com.pdp.policy;

import com.pdp.exception.ErrorKind;
import com.pdp.exception.EvaluationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Why a node evaluated to Indeterminate.
 *
 * @param kind     Error kind
 * @param message  Human-readable description
 * @param function Name of the function that failed, or null
 * @param path     Node ids from the outermost evaluated node down to the failing one
 */
public record EvaluationError(ErrorKind kind, String message, String function, List<String> path) {

    public EvaluationError {
        path = List.copyOf(path);
    }

    public static EvaluationError of(EvaluationException e, String nodeId) {
        return new EvaluationError(e.getKind(), e.getMessage(), e.getFunction(), List.of(nodeId));
    }

    /**
     * Error raised by a container itself rather than by one of its children.
     * The path is filled in when the container adopts the result.
     */
    public static EvaluationError unplaced(EvaluationException e) {
        return new EvaluationError(e.getKind(), e.getMessage(), e.getFunction(), List.of());
    }

    public static EvaluationError unplaced(ErrorKind kind, String message) {
        return new EvaluationError(kind, message, null, List.of());
    }

    /**
     * Error raised at the end of a known node path, e.g. by an obligation of the winning branch.
     */
    public static EvaluationError of(EvaluationException e, List<String> path) {
        return new EvaluationError(e.getKind(), e.getMessage(), e.getFunction(), path);
    }

    public static EvaluationError of(ErrorKind kind, String message, String nodeId) {
        return new EvaluationError(kind, message, null, List.of(nodeId));
    }

    /**
     * Same error seen from a parent node.
     */
    public EvaluationError under(String parentId) {
        List<String> extended = new ArrayList<>(path.size() + 1);
        extended.add(parentId);
        extended.addAll(path);
        return new EvaluationError(kind, message, function, extended);
    }

    public String toPathString() {
        return String.join(" > ", path);
    }

    @Override
    public String toString() {
        return kind + " at " + toPathString() + ": " + message;
    }
}
