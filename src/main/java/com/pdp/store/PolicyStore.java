package com.pdp.store;

import com.pdp.config.document.DocumentFormat;
import com.pdp.config.document.PolicyDocument;
import com.pdp.config.document.PolicyParser;
import com.pdp.engine.DefaultPolicyEngine;
import com.pdp.engine.Decision;
import com.pdp.engine.PolicyEngine;
import com.pdp.exception.PolicyLoadException;
import com.pdp.exception.SchemaException;
import com.pdp.session.AttributeResolver;
import com.pdp.session.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current policy behind an atomically replaced reference.
 * <p>
 * A load parses and validates the whole document before anything is published; readers
 * see either the previous snapshot or the new one. A failed load leaves the current
 * snapshot untouched. Generations increase by one with every successful publish.
 */
public class PolicyStore {

    private static final Logger log = LoggerFactory.getLogger(PolicyStore.class);

    private final AtomicReference<PolicySnapshot> current = new AtomicReference<>(PolicySnapshot.empty());
    private final PolicyParser parser;
    private final PolicyEngine engine;
    private final Object publishLock = new Object();

    public PolicyStore() {
        this(new PolicyParser(), AttributeResolver.none());
    }

    /**
     * @param parser   Parser used for every load
     * @param resolver Resolver used by {@link #currentDecision(Request)}
     */
    public PolicyStore(PolicyParser parser, AttributeResolver resolver) {
        this.parser = parser;
        this.engine = new DefaultPolicyEngine(this, resolver);
    }

    /**
     * Parse, validate and publish a document.
     *
     * @return The published snapshot
     * @throws PolicyLoadException if the document is rejected; nothing is published
     */
    public PolicySnapshot load(byte[] content, DocumentFormat format) {
        PolicyDocument document;
        try {
            document = parser.parse(content, format);
        } catch (PolicyLoadException e) {
            log.warn("Rejected policy document, keeping generation {}: {}",
                    current.get().getGeneration(), e.getMessage());
            throw e;
        }
        return publish(document);
    }

    public PolicySnapshot load(String content, DocumentFormat format) {
        return load(content.getBytes(StandardCharsets.UTF_8), format);
    }

    public PolicySnapshot load(InputStream input, DocumentFormat format) {
        byte[] content;
        try {
            content = input.readAllBytes();
        } catch (IOException e) {
            log.warn("Failed to read policy document: {}", e.getMessage());
            throw new SchemaException("Failed to read document: " + e.getMessage(), null, e);
        }
        return load(content, format);
    }

    /**
     * JSON document.
     */
    public PolicySnapshot load(byte[] content) {
        return load(content, DocumentFormat.JSON);
    }

    /**
     * Publish an already validated document.
     */
    public PolicySnapshot publish(PolicyDocument document) {
        synchronized (publishLock) {
            PolicySnapshot previous = current.get();
            PolicySnapshot next = new PolicySnapshot(previous.getGeneration() + 1, document);
            current.set(next);
            log.info("Published policy '{}' as generation {} ({} attribute declarations)",
                    document.root().getId(), next.getGeneration(), document.declarations().size());
            return next;
        }
    }

    /**
     * The snapshot currently served. Capture it once per request.
     */
    public PolicySnapshot current() {
        return current.get();
    }

    /**
     * Decide a request against the current snapshot with this store's resolver.
     */
    public Decision currentDecision(Request request) {
        return engine.evaluate(request);
    }

    /**
     * Engine serving {@link #currentDecision(Request)}, bound to this store and its resolver.
     */
    public PolicyEngine getEngine() {
        return engine;
    }
}
