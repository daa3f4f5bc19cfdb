package com.pdp.session;

import com.pdp.attribute.Attribute;
import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.exception.AttributeResolutionException;
import com.pdp.exception.ErrorKind;
import com.pdp.exception.EvaluationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for EvaluationSession attribute resolution, caching and cancellation.
 */
class EvaluationSessionTest {

    private static final Attribute DEPARTMENT = new Attribute("department", AttributeType.STRING);

    private AttributeResolver resolver;
    private Request request;

    @BeforeEach
    void setUp() {
        resolver = mock(AttributeResolver.class);
        request = Request.builder()
                .requestId("req-1")
                .attribute("role", AttributeValue.ofString("admin"))
                .build();
    }

    @Test
    @DisplayName("Request values should win without calling the resolver")
    void requestValuesShouldWin() {
        EvaluationSession session = new EvaluationSession(request, resolver, CancellationToken.none());

        assertEquals("admin", session.resolve(new Attribute("role", AttributeType.STRING)).stringValue());
        verifyNoInteractions(resolver);
    }

    @Test
    @DisplayName("Should call the resolver once per attribute and cache the value")
    void shouldCacheResolvedValues() {
        when(resolver.resolve(eq("department"), eq(AttributeType.STRING), any()))
                .thenReturn(Optional.of(AttributeValue.ofString("sales")));
        EvaluationSession session = new EvaluationSession(request, resolver, CancellationToken.none());

        assertEquals("sales", session.resolve(DEPARTMENT).stringValue());
        assertEquals("sales", session.resolve(DEPARTMENT).stringValue());

        verify(resolver, times(1)).resolve("department", AttributeType.STRING, request);
        assertEquals(1, session.getResolverCalls());
    }

    @Test
    @DisplayName("Should cache not-found and failed lookups as resolution errors")
    void shouldCacheMisses() {
        when(resolver.resolve(eq("department"), any(), any())).thenReturn(Optional.empty());
        when(resolver.resolve(eq("clearance"), any(), any()))
                .thenThrow(new AttributeResolutionException("directory unavailable"));
        EvaluationSession session = new EvaluationSession(request, resolver, CancellationToken.none());
        Attribute clearance = new Attribute("clearance", AttributeType.INTEGER);

        for (int i = 0; i < 3; i++) {
            EvaluationException missing = assertThrows(EvaluationException.class, () -> session.resolve(DEPARTMENT));
            assertEquals(ErrorKind.RESOLUTION, missing.getKind());
            EvaluationException failed = assertThrows(EvaluationException.class, () -> session.resolve(clearance));
            assertTrue(failed.getMessage().contains("directory unavailable"));
        }

        verify(resolver, times(1)).resolve("department", AttributeType.STRING, request);
        verify(resolver, times(1)).resolve("clearance", AttributeType.INTEGER, request);
    }

    @Test
    @DisplayName("Unchecked resolver failures should become cached resolution errors")
    void uncheckedResolverFailureShouldBeResolutionError() {
        when(resolver.resolve(eq("department"), any(), any()))
                .thenThrow(new IllegalStateException("connection refused"));
        EvaluationSession session = new EvaluationSession(request, resolver, CancellationToken.none());

        for (int i = 0; i < 2; i++) {
            EvaluationException e = assertThrows(EvaluationException.class, () -> session.resolve(DEPARTMENT));
            assertEquals(ErrorKind.RESOLUTION, e.getKind());
            assertTrue(e.getMessage().contains("connection refused"));
        }
        verify(resolver, times(1)).resolve("department", AttributeType.STRING, request);
    }

    @Test
    @DisplayName("Cancellation raised by the resolver should reach the caller")
    void resolverCancellationShouldPropagate() {
        when(resolver.resolve(any(), any(), any())).thenThrow(new CancellationException("client gone"));
        EvaluationSession session = new EvaluationSession(request, resolver, CancellationToken.none());

        assertThrows(CancellationException.class, () -> session.resolve(DEPARTMENT));
    }

    @Test
    @DisplayName("A mistyped value should be a resolution error")
    void mistypedValueShouldBeResolutionError() {
        when(resolver.resolve(any(), any(), any())).thenReturn(Optional.of(AttributeValue.ofInteger(3)));
        EvaluationSession session = new EvaluationSession(request, resolver, CancellationToken.none());

        EvaluationException e = assertThrows(EvaluationException.class, () -> session.resolve(DEPARTMENT));
        assertEquals(ErrorKind.RESOLUTION, e.getKind());
        assertThrows(EvaluationException.class,
                () -> session.resolve(new Attribute("role", AttributeType.INTEGER)));
    }

    @Test
    @DisplayName("Should not call the resolver once cancelled")
    void shouldCheckCancellationBeforeLookup() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        EvaluationSession session = new EvaluationSession(request, resolver, token);

        assertThrows(CancellationException.class, () -> session.resolve(DEPARTMENT));
        verifyNoInteractions(resolver);
    }

    @Test
    @DisplayName("Should abandon evaluation when cancelled during a lookup")
    void shouldCheckCancellationAfterLookup() {
        CancellationToken token = CancellationToken.create();
        when(resolver.resolve(any(), any(), any())).thenAnswer(invocation -> {
            token.cancel();
            return Optional.of(AttributeValue.ofString("sales"));
        });
        EvaluationSession session = new EvaluationSession(request, resolver, token);

        assertThrows(CancellationException.class, () -> session.resolve(DEPARTMENT));
        assertTrue(token.isCancelled());
    }

    @Test
    @DisplayName("The shared token should not be cancellable")
    void noneTokenShouldNotCancel() {
        assertThrows(UnsupportedOperationException.class, () -> CancellationToken.none().cancel());
        assertFalse(CancellationToken.none().isCancelled());
    }
}
