package com.pdp.config;

import com.pdp.config.document.DocumentFormat;
import com.pdp.config.document.PolicyDocument;
import com.pdp.config.document.PolicyParser;
import com.pdp.exception.SchemaException;
import com.pdp.store.PolicySnapshot;
import com.pdp.store.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads policy documents from the classpath or the file system.
 */
public class PolicyLoader {

    private static final Logger log = LoggerFactory.getLogger(PolicyLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    private PolicyLoader() {
    }

    /**
     * Parse a policy document from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path   Path to the document
     * @param format Syntax, or null to guess it from the file extension
     * @return Validated document
     */
    public static PolicyDocument load(String path, DocumentFormat format) {
        return load(path, format, new PolicyParser());
    }

    public static PolicyDocument load(String path, DocumentFormat format, PolicyParser parser) {
        DocumentFormat effective = format != null ? format : DocumentFormat.fromPath(path);
        log.info("Loading {} policy document from: {}", effective, path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parser.parse(inputStream, effective);
        } catch (IOException e) {
            throw new SchemaException("Failed to load policy document from: " + path, null, e);
        }
    }

    /**
     * Load a document from a path and publish it to a store.
     */
    public static PolicySnapshot loadInto(PolicyStore store, String path, DocumentFormat format) {
        DocumentFormat effective = format != null ? format : DocumentFormat.fromPath(path);
        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return store.load(inputStream, effective);
        } catch (IOException e) {
            throw new SchemaException("Failed to load policy document from: " + path, null, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }
}
