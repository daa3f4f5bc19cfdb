package com.pdp.config.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pdp.attribute.AttributeType;
import com.pdp.exception.AttributeTypeException;
import com.pdp.exception.SchemaException;
import com.pdp.session.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads request documents of the form {@code {"<id>": {"type": "<tag>", "content": <raw>}}}
 * against the attribute declarations of the active policy.
 * <p>
 * Ids that are not declared are skipped. A declared id whose tag names a different type is rejected.
 */
public class RequestReader {

    private static final Logger log = LoggerFactory.getLogger(RequestReader.class);
    private static final String REQUEST = "request";

    private final Map<DocumentFormat, ObjectMapper> mappers = new EnumMap<>(DocumentFormat.class);

    public RequestReader() {
        for (DocumentFormat format : DocumentFormat.values()) {
            mappers.put(format, new ObjectMapper(format.getFactory()));
        }
    }

    /**
     * @param input        Request document
     * @param format       Syntax of the document
     * @param declarations Declared attribute types of the active policy
     * @throws SchemaException        if the document is malformed
     * @throws AttributeTypeException if a value does not fit its declared type
     */
    public Request read(InputStream input, DocumentFormat format, Map<String, AttributeType> declarations) {
        JsonNode root;
        try {
            root = mappers.get(format).readTree(input);
        } catch (IOException e) {
            throw new SchemaException("Malformed request: " + e.getMessage(), REQUEST, e);
        }
        if (root == null || !root.isObject()) {
            throw new SchemaException("Request must be an object", REQUEST);
        }

        Request.Builder builder = Request.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String id = field.getKey();
            String path = REQUEST + ">\"" + id + "\"";
            AttributeType declared = declarations.get(id);
            if (declared == null) {
                log.debug("Ignoring undeclared request attribute '{}'", id);
                continue;
            }

            JsonNode entry = field.getValue();
            JsonNode tag = entry.get(Tags.TYPE);
            JsonNode content = entry.get(Tags.CONTENT);
            if (!entry.isObject() || tag == null || !tag.isTextual() || content == null) {
                throw new SchemaException("Expected {\"type\", \"content\"} for attribute '" + id + "'", path);
            }
            AttributeType type = AttributeType.fromTag(tag.asText())
                    .orElseThrow(() -> new SchemaException("Unknown type '" + tag.asText() + "'", path));
            if (type != declared) {
                throw new AttributeTypeException(declared, tag.asText());
            }
            builder.attribute(id, declared, toRaw(content, path));
        }
        return builder.build();
    }

    private static Object toRaw(JsonNode node, String path) {
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isArray()) {
            List<Object> items = new ArrayList<>();
            for (JsonNode item : node) {
                if (item.isContainerNode()) {
                    throw new SchemaException("Nested structures are not allowed in a value", path);
                }
                items.add(toRaw(item, path));
            }
            return items;
        }
        throw new SchemaException("Unsupported value " + node.getNodeType(), path);
    }
}
