package com.pdp.engine;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.config.document.DocumentFormat;
import com.pdp.exception.ErrorKind;
import com.pdp.policy.Effect;
import com.pdp.session.AttributeResolver;
import com.pdp.session.CancellationToken;
import com.pdp.session.Request;
import com.pdp.store.PolicyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests for DefaultPolicyEngine against the sample access policy.
 */
class DefaultPolicyEngineTest {

    private PolicyStore store;
    private PolicyEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        store = new PolicyStore();
        try (InputStream input = getClass().getResourceAsStream("/policies/access.json")) {
            store.load(input, DocumentFormat.JSON);
        }
        engine = new DefaultPolicyEngine(store);
    }

    private static Request.Builder request(String role, String action) {
        Request.Builder builder = Request.builder()
                .attribute("role", AttributeValue.ofString(role))
                .attribute("address", AttributeValue.ofAddress("192.0.2.10"));
        if (action != null) {
            builder.attribute("action", AttributeValue.ofString(action));
        }
        return builder;
    }

    private static List<String> obligationIds(Decision decision) {
        return decision.getObligations().stream().map(AssignedObligation::id).toList();
    }

    @Test
    @DisplayName("Should permit a reader with the rule's obligations before the root's")
    void shouldPermitReader() {
        Decision decision = engine.evaluate(request("reader", "read").build());

        assertEquals(Effect.PERMIT, decision.getEffect());
        assertTrue(decision.isPermit());
        assertEquals(List.of("audit", "reason"), obligationIds(decision));
        assertEquals(AttributeValue.FALSE, decision.getObligations().get(0).value());
        assertEquals(AttributeValue.ofString("root"), decision.getObligations().get(1).value());
        assertEquals(1, decision.getGeneration());
    }

    @Test
    @DisplayName("Should permit staff from a covered domain")
    void shouldPermitStaffByDomain() {
        Decision decision = engine.evaluate(request("guest", "read")
                .attribute("groups", AttributeValue.ofStringSet(List.of("staff")))
                .attribute("domain", AttributeType.DOMAIN, "intranet.example.com")
                .build());

        assertEquals(Effect.PERMIT, decision.getEffect());
    }

    @Test
    @DisplayName("Blocked networks should deny regardless of the action")
    void blockedNetworkShouldDeny() {
        Decision decision = engine.evaluate(request("reader", "read")
                .attribute("address", AttributeValue.ofAddress("203.0.113.7"))
                .build());

        assertEquals(Effect.DENY, decision.getEffect());
        assertFalse(decision.isPermit());
        assertEquals(AttributeValue.ofString("blocked network"), decision.getObligations().get(0).value());
    }

    @Test
    @DisplayName("Unknown and missing actions should fall back to the Other rule")
    void unknownActionShouldUseDefault() {
        assertEquals(Effect.DENY, engine.evaluate(request("reader", "delete").build()).getEffect());
        assertEquals(Effect.DENY, engine.evaluate(request("reader", null).build()).getEffect());
    }

    @Test
    @DisplayName("A writer without quota should be Indeterminate with the failing path")
    void missingQuotaShouldBeIndeterminate() {
        Decision decision = engine.evaluate(request("writer", "write").build());

        assertEquals(Effect.INDETERMINATE, decision.getEffect());
        assertFalse(decision.isPermit());
        assertEquals(ErrorKind.RESOLUTION, decision.getReason().kind());
        assertEquals(List.of("Root", "Actions", "write"), decision.getReason().path());
        assertTrue(decision.getObligations().isEmpty());
    }

    @Test
    @DisplayName("Should resolve missing attributes through the resolver")
    void shouldUseResolver() {
        AttributeResolver resolver = mock(AttributeResolver.class);
        when(resolver.resolve(eq("quota"), eq(AttributeType.INTEGER), any()))
                .thenReturn(Optional.of(AttributeValue.ofInteger(10)));
        PolicyEngine resolving = new DefaultPolicyEngine(store, resolver);

        Decision decision = resolving.evaluate(request("writer", "write").build());

        assertEquals(Effect.PERMIT, decision.getEffect());
        assertEquals(AttributeValue.TRUE, decision.getObligations().get(0).value());
        verify(resolver, times(1)).resolve(eq("quota"), eq(AttributeType.INTEGER), any());
    }

    @Test
    @DisplayName("A resolver throwing an unchecked exception should give an Indeterminate decision")
    void failingResolverShouldBeIndeterminate() {
        AttributeResolver resolver = (id, type, request) -> {
            throw new IllegalStateException("information point unreachable");
        };
        PolicyEngine resolving = new DefaultPolicyEngine(store, resolver);

        Decision decision = resolving.evaluate(request("writer", "write").build());

        assertEquals(Effect.INDETERMINATE, decision.getEffect());
        assertFalse(decision.isPermit());
        assertEquals(ErrorKind.RESOLUTION, decision.getReason().kind());
        assertEquals(List.of("Root", "Actions", "write"), decision.getReason().path());
    }

    @Test
    @DisplayName("Cancellation should propagate to the caller without a decision")
    void cancellationShouldPropagate() {
        CancellationToken token = CancellationToken.create();
        AttributeResolver resolver = (id, type, request) -> {
            token.cancel();
            return Optional.empty();
        };
        PolicyEngine resolving = new DefaultPolicyEngine(store, resolver);

        assertThrows(CancellationException.class,
                () -> resolving.evaluate(request("writer", "write").build(), token));
    }

    @Test
    @DisplayName("Obligations of a losing branch should never be evaluated")
    void losingObligationsShouldNotBeEvaluated() {
        store.load("{\"attributes\": {\"n\": \"Integer\", \"out\": \"Integer\"},"
                + " \"policies\": {\"id\": \"Root\", \"alg\": \"FirstApplicableEffect\", \"rules\": ["
                + "{\"id\": \"win\", \"effect\": \"Deny\","
                + " \"obligations\": [{\"out\": {\"val\": {\"type\": \"Integer\", \"content\": 1}}}]},"
                + "{\"id\": \"lose\", \"effect\": \"Permit\","
                + " \"obligations\": [{\"out\": {\"divide\": [{\"attr\": \"n\"},"
                + " {\"val\": {\"type\": \"Integer\", \"content\": 0}}]}}]}]}}", DocumentFormat.JSON);

        Decision decision = engine.evaluate(Request.builder().build());

        assertEquals(Effect.DENY, decision.getEffect());
        assertEquals(List.of(new AssignedObligation("out", AttributeValue.ofInteger(1))), decision.getObligations());
    }

    @Test
    @DisplayName("A failing obligation of the winning branch should make the decision Indeterminate")
    void failingObligationShouldBeIndeterminate() {
        store.load("{\"attributes\": {\"out\": \"Integer\"},"
                + " \"policies\": {\"id\": \"Root\", \"policies\": [{\"id\": \"Inner\", \"rules\": ["
                + "{\"id\": \"win\", \"effect\": \"Permit\", \"obligations\": [{\"out\": {\"divide\": ["
                + "{\"val\": {\"type\": \"Integer\", \"content\": 1}},"
                + " {\"val\": {\"type\": \"Integer\", \"content\": 0}}]}}]}]}]}}", DocumentFormat.JSON);

        Decision decision = engine.evaluate(Request.builder().build());

        assertEquals(Effect.INDETERMINATE, decision.getEffect());
        assertEquals(ErrorKind.FUNCTION, decision.getReason().kind());
        assertEquals("divide", decision.getReason().function());
        assertEquals(List.of("Root", "Inner", "win"), decision.getReason().path());
    }

    @Test
    @DisplayName("A failing container obligation should report the path down to that container")
    void failingContainerObligationShouldReportContainerPath() {
        store.load("{\"attributes\": {\"out\": \"Integer\"},"
                + " \"policies\": {\"id\": \"Root\", \"policies\": [{\"id\": \"Inner\","
                + " \"rules\": [{\"id\": \"win\", \"effect\": \"Deny\"}],"
                + " \"obligations\": [{\"out\": {\"add\": ["
                + "{\"val\": {\"type\": \"Integer\", \"content\": 9223372036854775807}},"
                + " {\"val\": {\"type\": \"Integer\", \"content\": 1}}]}}]}]}}", DocumentFormat.JSON);

        Decision decision = engine.evaluate(Request.builder().build());

        assertEquals(Effect.INDETERMINATE, decision.getEffect());
        assertEquals("add", decision.getReason().function());
        assertEquals(List.of("Root", "Inner"), decision.getReason().path());
    }

    @Test
    @DisplayName("Repeated evaluation of the same request should give identical decisions")
    void evaluationShouldBeDeterministic() {
        Request request = request("guest", "read")
                .attribute("groups", AttributeValue.ofStringSet(List.of("staff", "ops")))
                .attribute("domain", AttributeType.DOMAIN, "example.com")
                .build();

        Decision first = engine.evaluate(request);
        for (int i = 0; i < 100; i++) {
            assertEquals(first, engine.evaluate(request));
        }
    }
}
