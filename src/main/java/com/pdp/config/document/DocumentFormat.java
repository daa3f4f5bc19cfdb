package com.pdp.config.document;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.util.Locale;

/**
 * Syntax of a policy or request document. Both syntaxes share one vocabulary
 * and are decoded by the same streaming parser.
 */
public enum DocumentFormat {
    JSON(new JsonFactory()),
    YAML(new YAMLFactory());

    private final JsonFactory factory;

    DocumentFormat(JsonFactory factory) {
        this.factory = factory;
    }

    /**
     * Token stream factory for this syntax. Factories are thread-safe.
     */
    public JsonFactory getFactory() {
        return factory;
    }

    /**
     * Guess the format from a file name, defaulting to JSON.
     */
    public static DocumentFormat fromPath(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            return YAML;
        }
        return JSON;
    }

    /**
     * Look up a format by name, ignoring case.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static DocumentFormat fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
