package com.pdp.store;

import com.pdp.attribute.AttributeValue;
import com.pdp.config.document.DocumentFormat;
import com.pdp.engine.Decision;
import com.pdp.exception.PolicyLoadException;
import com.pdp.exception.PolicyTypeException;
import com.pdp.exception.SchemaException;
import com.pdp.policy.Effect;
import com.pdp.session.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PolicyStore publishing and snapshot isolation.
 */
class PolicyStoreTest {

    private PolicyStore store;

    @BeforeEach
    void setUp() {
        store = new PolicyStore();
    }

    /**
     * Policy whose single rule has the given effect and tags its decision with the generation marker.
     */
    private static String policy(String effect, long marker) {
        return "{\"attributes\": {\"marker\": \"Integer\", \"echo\": \"Integer\"},"
                + " \"policies\": {\"id\": \"Root\", \"rules\": [{\"id\": \"only\", \"effect\": \"" + effect + "\","
                + " \"obligations\": [{\"marker\": {\"val\": {\"type\": \"Integer\", \"content\": " + marker + "}}},"
                + " {\"echo\": {\"val\": {\"type\": \"Integer\", \"content\": " + marker + "}}}]}]}}";
    }

    private static final Request EMPTY_REQUEST = Request.builder().build();

    @Test
    @DisplayName("Should serve NotApplicable before the first load")
    void emptyStoreShouldBeNotApplicable() {
        assertTrue(store.current().isEmpty());
        assertEquals(0, store.current().getGeneration());

        Decision decision = store.currentDecision(EMPTY_REQUEST);

        assertEquals(Effect.NOT_APPLICABLE, decision.getEffect());
        assertEquals(0, decision.getGeneration());
    }

    @Test
    @DisplayName("Each successful load should publish the next generation")
    void loadShouldPublishNextGeneration() {
        PolicySnapshot first = store.load(policy("Permit", 1), DocumentFormat.JSON);
        PolicySnapshot second = store.load(policy("Deny", 2).getBytes(StandardCharsets.UTF_8));

        assertEquals(1, first.getGeneration());
        assertEquals(2, second.getGeneration());
        assertSame(second, store.current());
        assertEquals(Effect.DENY, store.currentDecision(EMPTY_REQUEST).getEffect());
        assertEquals(2, store.current().getDeclarations().size());
    }

    @Test
    @DisplayName("A failed load should leave the current snapshot untouched")
    void failedLoadShouldKeepSnapshot() {
        PolicySnapshot published = store.load(policy("Permit", 1), DocumentFormat.JSON);

        assertThrows(SchemaException.class, () -> store.load("{\"policies\": {\"id\": 1}}", DocumentFormat.JSON));
        assertThrows(PolicyTypeException.class, () -> store.load(
                "{\"policies\": {\"id\": \"Root\", \"alg\": \"Nope\", \"rules\": []}}", DocumentFormat.JSON));
        assertThrows(PolicyLoadException.class, () -> store.load("not a document", DocumentFormat.JSON));

        assertSame(published, store.current());
        assertEquals(Effect.PERMIT, store.currentDecision(EMPTY_REQUEST).getEffect());
    }

    @Test
    @DisplayName("Concurrent loads and evaluations should only see whole generations")
    void concurrentLoadsShouldNotTearSnapshots() throws Exception {
        store.load(policy("Permit", 1), DocumentFormat.JSON);

        int evaluators = 8;
        int reloads = 200;
        ExecutorService pool = Executors.newFixedThreadPool(evaluators + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean loading = new AtomicBoolean(true);
        ConcurrentLinkedQueue<String> failures = new ConcurrentLinkedQueue<>();

        try {
            Future<?> loader = pool.submit(() -> {
                start.await();
                for (int i = 2; i <= reloads + 1; i++) {
                    store.load(policy(i % 2 == 0 ? "Deny" : "Permit", i), DocumentFormat.JSON);
                    if (i % 10 == 0) {
                        assertThrows(PolicyLoadException.class,
                                () -> store.load("{\"policies\": {}}", DocumentFormat.JSON));
                    }
                }
                loading.set(false);
                return null;
            });

            List<Future<Integer>> readers = new ArrayList<>();
            for (int t = 0; t < evaluators; t++) {
                readers.add(pool.submit(() -> {
                    start.await();
                    int decisions = 0;
                    while (loading.get() || decisions < 100) {
                        Decision decision = store.currentDecision(EMPTY_REQUEST);
                        long generation = decision.getGeneration();
                        Effect expected = generation % 2 == 0 ? Effect.DENY : Effect.PERMIT;
                        AttributeValue marker = decision.getObligations().get(0).value();
                        AttributeValue echo = decision.getObligations().get(1).value();
                        if (decision.getEffect() != expected
                                || marker.integerValue() != generation
                                || !marker.equals(echo)) {
                            failures.add(decision.toString());
                        }
                        decisions++;
                    }
                    return decisions;
                }));
            }

            start.countDown();
            loader.get(30, TimeUnit.SECONDS);
            for (Future<Integer> reader : readers) {
                assertTrue(reader.get(30, TimeUnit.SECONDS) >= 100);
            }
        } finally {
            pool.shutdownNow();
        }

        assertTrue(failures.isEmpty(), () -> "Torn decisions: " + failures);
        assertEquals(reloads + 1, store.current().getGeneration());
    }
}
