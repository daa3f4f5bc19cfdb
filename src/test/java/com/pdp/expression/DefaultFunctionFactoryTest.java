package com.pdp.expression;

import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.attribute.DomainName;
import com.pdp.attribute.Network;
import com.pdp.exception.ErrorKind;
import com.pdp.exception.EvaluationException;
import com.pdp.exception.PolicyTypeException;
import com.pdp.expression.impl.ContainsFunction;
import com.pdp.session.EvaluationSession;
import com.pdp.session.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pdp.PolicyFixtures.attr;
import static com.pdp.PolicyFixtures.bool;
import static com.pdp.PolicyFixtures.string;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultFunctionFactory overload resolution and the built-in functions.
 */
class DefaultFunctionFactoryTest {

    private FunctionFactory factory;
    private EvaluationSession session;

    @BeforeEach
    void setUp() {
        factory = new DefaultFunctionFactory();
        session = new EvaluationSession(Request.builder()
                .attribute("role", AttributeValue.ofString("admin"))
                .build());
    }

    private AttributeValue eval(String name, Expression... arguments) {
        return factory.create(name, List.of(arguments)).evaluate(session);
    }

    private static Expression integer(long value) {
        return new Literal(AttributeValue.ofInteger(value));
    }

    private static Expression floating(double value) {
        return new Literal(AttributeValue.ofFloat(value));
    }

    // =====================================================================
    // Type checking
    // =====================================================================

    @Test
    @DisplayName("Should reject unknown functions")
    void shouldRejectUnknownFunction() {
        PolicyTypeException e = assertThrows(PolicyTypeException.class,
                () -> factory.create("concat", List.of(string("a"), string("b"))));
        assertTrue(e.getMessage().contains("concat"));
    }

    @Test
    @DisplayName("Should reject arguments of different types")
    void shouldRejectMixedArgumentTypes() {
        assertThrows(PolicyTypeException.class, () -> factory.create("equal", List.of(string("1"), integer(1))));
        assertThrows(PolicyTypeException.class, () -> factory.create("add", List.of(integer(1), floating(1))));
        assertThrows(PolicyTypeException.class, () -> factory.create("and", List.of(bool(true), string("x"))));
    }

    @Test
    @DisplayName("Should reject wrong arity and unordered comparisons")
    void shouldRejectArityAndOrdering() {
        assertThrows(PolicyTypeException.class, () -> factory.create("not", List.of(bool(true), bool(false))));
        assertThrows(PolicyTypeException.class, () -> factory.create("and", List.of()));
        assertThrows(PolicyTypeException.class, () -> factory.create("greater", List.of(bool(true), bool(false))));
        assertThrows(PolicyTypeException.class, () -> factory.create("len", List.of(integer(3))));
    }

    @Test
    @DisplayName("Should resolve contains overloads from argument types")
    void shouldResolveContainsOverloads() {
        Expression networkContains = factory.create("contains", List.of(
                new Literal(AttributeValue.ofNetwork(Network.parse("10.0.0.0/8"))),
                new Literal(AttributeValue.ofAddress("10.1.2.3"))));

        assertEquals(ContainsFunction.Mode.NETWORK_ADDRESS, ((ContainsFunction) networkContains).getMode());
        assertEquals(AttributeType.BOOLEAN, networkContains.getResultType());
        assertThrows(PolicyTypeException.class,
                () -> factory.create("contains", List.of(string("abc"), integer(1))));
    }

    @Test
    @DisplayName("Function names should be case-insensitive")
    void functionNamesShouldIgnoreCase() {
        assertEquals(AttributeValue.TRUE, eval("EQUAL", string("a"), string("a")));
    }

    // =====================================================================
    // Evaluation
    // =====================================================================

    @Test
    @DisplayName("Should evaluate boolean and comparison functions")
    void shouldEvaluateLogic() {
        assertEquals(AttributeValue.TRUE, eval("and", bool(true), bool(true)));
        assertEquals(AttributeValue.FALSE, eval("or", bool(false), bool(false)));
        assertEquals(AttributeValue.FALSE, eval("not", bool(true)));
        assertEquals(AttributeValue.TRUE, eval("equal", attr("role", AttributeType.STRING), string("admin")));
        assertEquals(AttributeValue.FALSE, eval("equal", string("Admin"), string("admin")));
        assertEquals(AttributeValue.TRUE, eval("greater", integer(3), integer(2)));
        assertEquals(AttributeValue.TRUE, eval("less", string("abc"), string("abd")));
    }

    @Test
    @DisplayName("And should stop at the first false argument")
    void andShouldShortCircuit() {
        Expression missing = attr("missing", AttributeType.BOOLEAN);

        assertEquals(AttributeValue.FALSE, eval("and", bool(false), missing));
        assertEquals(AttributeValue.TRUE, eval("or", bool(true), missing));

        EvaluationException e = assertThrows(EvaluationException.class, () -> eval("and", bool(true), missing));
        assertEquals(ErrorKind.RESOLUTION, e.getKind());
    }

    @Test
    @DisplayName("Should evaluate every contains mode")
    void shouldEvaluateContains() {
        assertEquals(AttributeValue.TRUE, eval("contains", string("administrator"), string("min")));
        assertEquals(AttributeValue.TRUE, eval("contains",
                new Literal(AttributeValue.ofDomain(DomainName.parse("example.com"))),
                new Literal(AttributeValue.ofDomain(DomainName.parse("api.example.com")))));
        assertEquals(AttributeValue.TRUE, eval("contains",
                new Literal(AttributeValue.ofStringSet(List.of("read", "write"))), string("write")));
        assertEquals(AttributeValue.FALSE, eval("contains",
                new Literal(AttributeValue.ofStringList(List.of("read"))), string("write")));
        assertEquals(AttributeValue.TRUE, eval("contains",
                new Literal(AttributeValue.ofNetworkSet(List.of(Network.parse("10.0.0.0/8"),
                        Network.parse("192.168.0.0/16")))),
                new Literal(AttributeValue.ofAddress("192.168.4.4"))));
        assertEquals(AttributeValue.FALSE, eval("contains",
                new Literal(AttributeValue.ofDomainSet(List.of(DomainName.parse("example.org")))),
                new Literal(AttributeValue.ofDomain(DomainName.parse("example.com")))));
    }

    @Test
    @DisplayName("Should evaluate collection functions keeping left order")
    void shouldEvaluateCollections() {
        Expression left = new Literal(AttributeValue.ofStringSet(List.of("c", "a", "b")));
        Expression right = new Literal(AttributeValue.ofStringSet(List.of("b", "c", "d")));

        assertEquals(List.of("c", "b"), List.copyOf(eval("intersect", left, right).stringSetValue()));
        assertEquals(List.of("c", "a", "b", "d"), List.copyOf(eval("union", left, right).stringSetValue()));
        assertEquals(3L, eval("len", left).integerValue());
        assertEquals(5L, eval("len", string("hello")).integerValue());
    }

    @Test
    @DisplayName("Should report arithmetic failures as function errors")
    void shouldReportArithmeticFailures() {
        assertEquals(7L, eval("add", integer(3), integer(4)).integerValue());
        assertEquals(2.5, eval("divide", floating(5), floating(2)).floatValue());

        EvaluationException zero = assertThrows(EvaluationException.class,
                () -> eval("divide", integer(1), integer(0)));
        assertEquals(ErrorKind.FUNCTION, zero.getKind());
        assertEquals("divide", zero.getFunction());

        EvaluationException overflow = assertThrows(EvaluationException.class,
                () -> eval("multiply", integer(Long.MAX_VALUE), integer(2)));
        assertEquals(ErrorKind.FUNCTION, overflow.getKind());
        assertEquals("multiply", overflow.getFunction());
    }

    @Test
    @DisplayName("Try should return the first argument that does not fail")
    void tryShouldFallBack() {
        Expression failing = factory.create("divide", List.of(integer(1), integer(0)));

        assertEquals(9L, eval("try", failing, integer(9)).integerValue());
        EvaluationException e = assertThrows(EvaluationException.class, () -> eval("try", failing, failing));
        assertEquals("divide", e.getFunction());
    }
}
