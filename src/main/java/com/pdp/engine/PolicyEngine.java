package com.pdp.engine;

import com.pdp.session.CancellationToken;
import com.pdp.session.Request;

/**
 * Evaluates requests against the currently published policy.
 * Safe to call from any number of threads, concurrently with policy reloads.
 */
public interface PolicyEngine {

    /**
     * Decide a request.
     *
     * @param request Request attributes
     * @return Decision drawn wholly from one policy generation
     */
    Decision evaluate(Request request);

    /**
     * Decide a request that the caller may abandon.
     *
     * @throws java.util.concurrent.CancellationException if the token is cancelled while
     *                                                    an external attribute is resolved
     */
    Decision evaluate(Request request, CancellationToken cancellation);
}
