package com.pdp.config;

import com.pdp.config.document.DocumentFormat;
import com.pdp.config.document.PolicyDocument;
import com.pdp.exception.SchemaException;
import com.pdp.store.PolicySnapshot;
import com.pdp.store.PolicyStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PolicyLoader.
 */
class PolicyLoaderTest {

    @Test
    @DisplayName("Should load a document from the classpath")
    void shouldLoadFromClasspath() {
        PolicyDocument document = PolicyLoader.load("classpath:policies/access.yaml", null);

        assertEquals("Root", document.root().getId());
        assertTrue(document.declarations().containsKey("quota"));
    }

    @Test
    @DisplayName("Should load a document from the file system")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("policy.json");
        try (InputStream in = getClass().getResourceAsStream("/policies/access.json")) {
            Files.copy(in, file);
        }

        PolicyStore store = new PolicyStore();
        PolicySnapshot snapshot = PolicyLoader.loadInto(store, file.toString(), DocumentFormat.JSON);

        assertEquals(1, snapshot.getGeneration());
        assertSame(snapshot, store.current());
    }

    @Test
    @DisplayName("Missing documents should be rejected without publishing")
    void missingDocumentShouldFail() {
        PolicyStore store = new PolicyStore();

        assertThrows(SchemaException.class, () -> PolicyLoader.load("classpath:policies/missing.json", null));
        assertThrows(SchemaException.class, () -> PolicyLoader.loadInto(store, "/does/not/exist.yaml", null));
        assertEquals(0, store.current().getGeneration());
    }
}
