package com.pdp.session;

import com.pdp.attribute.Attribute;
import com.pdp.attribute.AttributeValue;
import com.pdp.exception.AttributeResolutionException;
import com.pdp.exception.EvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Per-request scratch state: the request's attributes, a cache of externally resolved
 * attributes and the external resolution hook.
 * <p>
 * A session belongs to exactly one request and one thread. It is discarded once the
 * decision is produced; nothing in it outlives the request.
 */
public final class EvaluationSession {

    private static final Logger log = LoggerFactory.getLogger(EvaluationSession.class);

    private final Request request;
    private final AttributeResolver resolver;
    private final CancellationToken cancellation;
    private final Map<String, Resolution> resolved = new HashMap<>();
    private int resolverCalls;

    public EvaluationSession(Request request, AttributeResolver resolver, CancellationToken cancellation) {
        this.request = request;
        this.resolver = resolver != null ? resolver : AttributeResolver.none();
        this.cancellation = cancellation != null ? cancellation : CancellationToken.none();
    }

    public EvaluationSession(Request request) {
        this(request, AttributeResolver.none(), CancellationToken.none());
    }

    /**
     * Resolve a designated attribute.
     * Request values win; otherwise the external resolver is consulted once and its
     * outcome (including "not found" and failures) is cached for the rest of the session.
     *
     * @param attribute Declared attribute
     * @return Value of the declared type
     * @throws EvaluationException with kind RESOLUTION if the value is missing, unresolvable or mistyped
     * @throws CancellationException if the caller cancelled around the lookup
     */
    public AttributeValue resolve(Attribute attribute) {
        Optional<AttributeValue> carried = request.getAttribute(attribute.id());
        if (carried.isPresent()) {
            return checkType(attribute, carried.get(), "request");
        }

        Resolution resolution = resolved.get(attribute.id());
        if (resolution == null) {
            resolution = resolveExternally(attribute);
            resolved.put(attribute.id(), resolution);
        }
        if (resolution.error() != null) {
            throw EvaluationException.resolution(resolution.error());
        }
        return resolution.value();
    }

    private Resolution resolveExternally(Attribute attribute) {
        cancellation.throwIfCancelled();
        resolverCalls++;
        Optional<AttributeValue> value;
        try {
            value = resolver.resolve(attribute.id(), attribute.type(), request);
        } catch (AttributeResolutionException e) {
            log.warn("Attribute resolver failed for '{}' in request {}: {}",
                    attribute.id(), request.getRequestId(), e.getMessage());
            cancellation.throwIfCancelled();
            return Resolution.failed("Failed to resolve attribute '" + attribute.id() + "': " + e.getMessage());
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Attribute resolver threw {} for '{}' in request {}", e.getClass().getSimpleName(),
                    attribute.id(), request.getRequestId(), e);
            cancellation.throwIfCancelled();
            return Resolution.failed("Failed to resolve attribute '" + attribute.id() + "': " + e);
        }
        cancellation.throwIfCancelled();

        if (value == null || value.isEmpty()) {
            log.debug("Attribute '{}' not found for request {}", attribute.id(), request.getRequestId());
            return Resolution.failed("Missing attribute '" + attribute.id() + "'");
        }
        try {
            return Resolution.found(checkType(attribute, value.get(), "resolver"));
        } catch (EvaluationException e) {
            return Resolution.failed(e.getMessage());
        }
    }

    private AttributeValue checkType(Attribute attribute, AttributeValue value, String source) {
        if (value.getType() != attribute.type()) {
            throw EvaluationException.resolution("Attribute '" + attribute.id() + "' from " + source
                    + " has type " + value.getType() + " but is declared as " + attribute.type());
        }
        return value;
    }

    public Request getRequest() {
        return request;
    }

    public CancellationToken getCancellation() {
        return cancellation;
    }

    /**
     * Number of times the external resolver was invoked in this session.
     */
    public int getResolverCalls() {
        return resolverCalls;
    }

    private record Resolution(AttributeValue value, String error) {
        static Resolution found(AttributeValue value) {
            return new Resolution(value, null);
        }

        static Resolution failed(String error) {
            return new Resolution(null, error);
        }
    }
}
