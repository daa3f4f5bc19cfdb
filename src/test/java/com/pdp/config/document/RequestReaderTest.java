package com.pdp.config.document;

import com.pdp.attribute.AttributeType;
import com.pdp.exception.AttributeTypeException;
import com.pdp.exception.SchemaException;
import com.pdp.session.Request;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RequestReader.
 */
class RequestReaderTest {

    private static final Map<String, AttributeType> DECLARATIONS = Map.of(
            "role", AttributeType.STRING,
            "quota", AttributeType.INTEGER,
            "groups", AttributeType.SET_OF_STRINGS,
            "address", AttributeType.ADDRESS);

    private final RequestReader reader = new RequestReader();

    private Request read(String document, DocumentFormat format) {
        return reader.read(new ByteArrayInputStream(document.getBytes(StandardCharsets.UTF_8)), format, DECLARATIONS);
    }

    @Test
    @DisplayName("Should read declared attributes and ignore undeclared ones")
    void shouldReadDeclaredAttributes() {
        Request request = read("{\"role\": {\"type\": \"String\", \"content\": \"admin\"},"
                + " \"quota\": {\"type\": \"integer\", \"content\": 5},"
                + " \"groups\": {\"type\": \"Set of Strings\", \"content\": [\"a\", \"b\"]},"
                + " \"colour\": {\"type\": \"String\", \"content\": \"red\"}}", DocumentFormat.JSON);

        assertEquals("admin", request.getAttribute("role").orElseThrow().stringValue());
        assertEquals(5L, request.getAttribute("quota").orElseThrow().integerValue());
        assertEquals(List.of("a", "b"), List.copyOf(request.getAttribute("groups").orElseThrow().stringSetValue()));
        assertTrue(request.getAttribute("colour").isEmpty());
    }

    @Test
    @DisplayName("Should read YAML requests")
    void shouldReadYaml() {
        Request request = read("address:\n  type: Address\n  content: 10.0.0.1\n", DocumentFormat.YAML);

        assertEquals(AttributeType.ADDRESS, request.getAttribute("address").orElseThrow().getType());
    }

    @Test
    @DisplayName("Should reject type mismatches and malformed entries")
    void shouldRejectMismatches() {
        assertThrows(AttributeTypeException.class,
                () -> read("{\"quota\": {\"type\": \"String\", \"content\": \"5\"}}", DocumentFormat.JSON));
        assertThrows(AttributeTypeException.class,
                () -> read("{\"quota\": {\"type\": \"Integer\", \"content\": 1.5}}", DocumentFormat.JSON));
        assertThrows(SchemaException.class,
                () -> read("{\"quota\": 5}", DocumentFormat.JSON));
        assertThrows(SchemaException.class, () -> read("[1]", DocumentFormat.JSON));
        assertThrows(SchemaException.class, () -> read("{", DocumentFormat.JSON));
    }
}
