package com.pdp.config.document;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.pdp.attribute.Attribute;
import com.pdp.attribute.AttributeType;
import com.pdp.attribute.AttributeValue;
import com.pdp.combining.Combiner;
import com.pdp.combining.CombinerFactory;
import com.pdp.combining.CombiningAlgorithm;
import com.pdp.combining.MapperCombiner;
import com.pdp.exception.AttributeTypeException;
import com.pdp.exception.PolicyTypeException;
import com.pdp.exception.SchemaException;
import com.pdp.expression.AttributeDesignator;
import com.pdp.expression.DefaultFunctionFactory;
import com.pdp.expression.Expression;
import com.pdp.expression.FunctionFactory;
import com.pdp.expression.Literal;
import com.pdp.policy.Effect;
import com.pdp.policy.Evaluable;
import com.pdp.policy.Obligation;
import com.pdp.policy.Policy;
import com.pdp.policy.PolicySet;
import com.pdp.policy.Rule;
import com.pdp.policy.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Streaming decoder for policy documents.
 * <p>
 * The document is consumed token by token in a single pass; no generic tree is built first.
 * Every object dispatches on its keys case-insensitively and rejects keys it does not know.
 * Failures carry the location in the document, for example
 * {@code root>policies>"Root">rules>"Deny All">condition}.
 * <p>
 * The parser itself is stateless and may be shared; each call works on its own context.
 */
public class PolicyParser {

    private static final Logger log = LoggerFactory.getLogger(PolicyParser.class);

    private final FunctionFactory functionFactory;

    public PolicyParser() {
        this(new DefaultFunctionFactory());
    }

    public PolicyParser(FunctionFactory functionFactory) {
        this.functionFactory = functionFactory;
    }

    /**
     * Parse a policy document.
     *
     * @param input  Document bytes; the stream is not closed
     * @param format Syntax of the document
     * @return Validated document
     * @throws SchemaException     if the document is malformed or uses unknown keys
     * @throws PolicyTypeException if the document is well formed but ill typed
     */
    public PolicyDocument parse(InputStream input, DocumentFormat format) {
        try (JsonParser parser = format.getFactory().createParser(input)) {
            parser.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
            PolicyDocument document = new Context(parser).parseRoot();
            log.debug("Parsed {} document with {} attribute declarations, root '{}'",
                    format, document.declarations().size(), document.root().getId());
            return document;
        } catch (IOException e) {
            throw new SchemaException("Failed to read document: " + e.getMessage(), Tags.ROOT, e);
        }
    }

    public PolicyDocument parse(byte[] content, DocumentFormat format) {
        return parse(new ByteArrayInputStream(content), format);
    }

    public PolicyDocument parse(String content, DocumentFormat format) {
        return parse(content.getBytes(StandardCharsets.UTF_8), format);
    }

    @FunctionalInterface
    private interface FieldHandler {
        void handle(String key) throws IOException;
    }

    @FunctionalInterface
    private interface ItemHandler {
        void handle(int index) throws IOException;
    }

    @FunctionalInterface
    private interface Reader<T> {
        T read() throws IOException;
    }

    /**
     * Algorithm reference as written in a document. Mapper parameters are kept until
     * the children are known.
     */
    private record AlgorithmSpec(CombiningAlgorithm algorithm, Expression map, String defaultId,
                                 String errorId, AlgorithmSpec sub, Effect unmatched) {

        static AlgorithmSpec simple(CombiningAlgorithm algorithm) {
            return new AlgorithmSpec(algorithm, null, null, null, null, null);
        }

        Combiner build(List<? extends Evaluable> children) {
            if (algorithm != CombiningAlgorithm.MAPPER) {
                return CombinerFactory.create(algorithm);
            }
            Combiner subCombiner = sub != null ? CombinerFactory.create(sub.algorithm) : null;
            return new MapperCombiner(children, map, defaultId, errorId, subCombiner, unmatched);
        }
    }

    /**
     * State of one parse: the token stream, the declarations seen so far and the current location.
     */
    private final class Context {

        private final JsonParser parser;
        private final Map<String, AttributeType> declarations = new LinkedHashMap<>();
        private final List<String> path = new ArrayList<>();

        Context(JsonParser parser) {
            this.parser = parser;
        }

        PolicyDocument parseRoot() throws IOException {
            path.add(Tags.ROOT);
            try {
                JsonToken first = parser.nextToken();
                if (first == null) {
                    throw schema("Empty document");
                }
                expect(JsonToken.START_OBJECT, "document object");

                List<Evaluable> root = new ArrayList<>(1);
                readObject(key -> {
                    switch (lower(key)) {
                        case Tags.ATTRIBUTES -> inKey(key, () -> {
                            parseDeclarations();
                            return null;
                        });
                        case Tags.POLICIES -> root.add(inKey(key, () -> parseNode("[0]")));
                        default -> throw unknownKey(key);
                    }
                });
                if (root.isEmpty()) {
                    throw schema("Missing '" + Tags.POLICIES + "'");
                }
                if (parser.nextToken() != null) {
                    throw schema("Unexpected content after the document object");
                }
                return new PolicyDocument(declarations, root.get(0));
            } catch (JsonProcessingException e) {
                throw new SchemaException("Malformed document: " + e.getOriginalMessage(), path(), e);
            }
        }

        // Declarations

        private void parseDeclarations() throws IOException {
            expect(JsonToken.START_OBJECT, "attribute declarations");
            while (next() != JsonToken.END_OBJECT) {
                String id = parser.currentName();
                path.add(quote(id));
                next();
                String tag = readString("type tag");
                AttributeType type = AttributeType.fromTag(tag)
                        .orElseThrow(() -> typeError("Unknown type '" + tag + "'"));
                if (declarations.putIfAbsent(id, type) != null) {
                    throw typeError("Attribute '" + id + "' is declared twice");
                }
                path.remove(path.size() - 1);
            }
        }

        // Nodes

        private Evaluable parseNode(String placeholder) throws IOException {
            expect(JsonToken.START_OBJECT, "policy or policy set");
            path.add(placeholder);

            String[] id = new String[1];
            Target[] target = new Target[1];
            AlgorithmSpec[] alg = new AlgorithmSpec[1];
            List<Rule> rules = new ArrayList<>();
            List<Evaluable> policies = new ArrayList<>();
            boolean[] kind = new boolean[2];
            List<Obligation> obligations = new ArrayList<>();

            readObject(key -> {
                switch (lower(key)) {
                    case Tags.ID -> {
                        id[0] = readString("id");
                        path.set(path.size() - 1, quote(id[0]));
                    }
                    case Tags.TARGET -> target[0] = inKey(key, this::parseTarget);
                    case Tags.ALG -> alg[0] = inKey(key, this::parseAlgorithm);
                    case Tags.RULES -> {
                        kind[0] = true;
                        rules.addAll(inKey(key, this::parseRules));
                    }
                    case Tags.POLICIES -> {
                        kind[1] = true;
                        policies.addAll(inKey(key, this::parseChildNodes));
                    }
                    case Tags.OBLIGATIONS -> obligations.addAll(inKey(key, this::parseObligations));
                    default -> throw unknownKey(key);
                }
            });

            if (id[0] == null) {
                throw schema("Missing '" + Tags.ID + "'");
            }
            if (kind[0] && kind[1]) {
                throw schema("A node has either '" + Tags.RULES + "' or '" + Tags.POLICIES + "', not both");
            }
            if (!kind[0] && !kind[1]) {
                throw schema("Missing '" + Tags.RULES + "' or '" + Tags.POLICIES + "'");
            }

            Evaluable node;
            if (kind[0]) {
                node = typed(() -> new Policy(id[0], target[0], combiner(alg[0], rules), rules, obligations));
            } else {
                node = typed(() -> new PolicySet(id[0], target[0], combiner(alg[0], policies), policies,
                        obligations));
            }
            path.remove(path.size() - 1);
            return node;
        }

        private Combiner combiner(AlgorithmSpec spec, List<? extends Evaluable> children) {
            return spec == null ? CombinerFactory.createDefault() : spec.build(children);
        }

        private List<Evaluable> parseChildNodes() throws IOException {
            expect(JsonToken.START_ARRAY, "list of policies");
            List<Evaluable> children = new ArrayList<>();
            readArray(index -> children.add(parseNode("[" + index + "]")));
            return children;
        }

        private List<Rule> parseRules() throws IOException {
            expect(JsonToken.START_ARRAY, "list of rules");
            List<Rule> rules = new ArrayList<>();
            readArray(index -> rules.add(parseRule("[" + index + "]")));
            return rules;
        }

        private Rule parseRule(String placeholder) throws IOException {
            expect(JsonToken.START_OBJECT, "rule");
            path.add(placeholder);

            String[] id = new String[1];
            Target[] target = new Target[1];
            Expression[] condition = new Expression[1];
            Effect[] effect = new Effect[1];
            List<Obligation> obligations = new ArrayList<>();

            readObject(key -> {
                switch (lower(key)) {
                    case Tags.ID -> {
                        id[0] = readString("id");
                        path.set(path.size() - 1, quote(id[0]));
                    }
                    case Tags.TARGET -> target[0] = inKey(key, this::parseTarget);
                    case Tags.CONDITION -> condition[0] = inKey(key, this::parseExpression);
                    case Tags.EFFECT -> effect[0] = inKey(key, () -> {
                        String tag = readString("effect");
                        return Effect.fromTag(tag)
                                .filter(e -> e == Effect.PERMIT || e == Effect.DENY)
                                .orElseThrow(() -> schema("Unknown effect '" + tag + "'"));
                    });
                    case Tags.OBLIGATIONS -> obligations.addAll(inKey(key, this::parseObligations));
                    default -> throw unknownKey(key);
                }
            });

            if (id[0] == null) {
                throw schema("Missing '" + Tags.ID + "'");
            }
            if (effect[0] == null) {
                throw schema("Missing '" + Tags.EFFECT + "'");
            }
            Rule rule = typed(() -> new Rule(id[0], target[0], condition[0], effect[0], obligations));
            path.remove(path.size() - 1);
            return rule;
        }

        // Algorithms

        private AlgorithmSpec parseAlgorithm() throws IOException {
            if (parser.currentToken() == JsonToken.VALUE_STRING) {
                CombiningAlgorithm algorithm = algorithmByName(parser.getText());
                if (algorithm == CombiningAlgorithm.MAPPER) {
                    throw schema("Mapper requires an object with '" + Tags.MAP + "'");
                }
                return AlgorithmSpec.simple(algorithm);
            }
            expect(JsonToken.START_OBJECT, "algorithm name or object");

            CombiningAlgorithm[] algorithm = new CombiningAlgorithm[1];
            Expression[] map = new Expression[1];
            String[] defaultId = new String[1];
            String[] errorId = new String[1];
            AlgorithmSpec[] sub = new AlgorithmSpec[1];
            Effect[] unmatched = new Effect[1];

            readObject(key -> {
                switch (lower(key)) {
                    case Tags.ID -> algorithm[0] = algorithmByName(readString("algorithm name"));
                    case Tags.MAP -> map[0] = inKey(key, this::parseExpression);
                    case Tags.DEFAULT -> defaultId[0] = readString("child id");
                    case Tags.ERROR -> errorId[0] = readString("child id");
                    case Tags.ALG -> sub[0] = inKey(key, this::parseAlgorithm);
                    case Tags.UNMATCHED -> unmatched[0] = inKey(key, () -> {
                        String tag = readString("effect");
                        return Effect.fromTag(tag)
                                .filter(e -> e == Effect.NOT_APPLICABLE || e == Effect.INDETERMINATE)
                                .orElseThrow(() -> schema("Unmatched must be NotApplicable or "
                                        + "Indeterminate but got '" + tag + "'"));
                    });
                    default -> throw unknownKey(key);
                }
            });

            if (algorithm[0] == null) {
                throw schema("Missing algorithm '" + Tags.ID + "'");
            }
            if (algorithm[0] != CombiningAlgorithm.MAPPER) {
                if (map[0] != null || defaultId[0] != null || errorId[0] != null || sub[0] != null
                        || unmatched[0] != null) {
                    throw schema(algorithm[0] + " takes no parameters");
                }
                return AlgorithmSpec.simple(algorithm[0]);
            }
            if (map[0] == null) {
                throw schema("Mapper requires '" + Tags.MAP + "'");
            }
            if (sub[0] != null && sub[0].algorithm() == CombiningAlgorithm.MAPPER) {
                throw typeError("Mapper cannot be nested as the algorithm of a Mapper");
            }
            return new AlgorithmSpec(algorithm[0], map[0], defaultId[0], errorId[0], sub[0], unmatched[0]);
        }

        private CombiningAlgorithm algorithmByName(String name) {
            return CombiningAlgorithm.fromName(name)
                    .orElseThrow(() -> typeError("Unknown combining algorithm '" + name + "'"));
        }

        // Targets

        private Target parseTarget() throws IOException {
            expect(JsonToken.START_ARRAY, "list of target clauses");
            List<Target.AnyOf> clauses = new ArrayList<>();
            readArray(index -> {
                expect(JsonToken.START_OBJECT, "target clause");
                String key = firstKey();
                if (Tags.ANY.equals(lower(key))) {
                    clauses.add(inKey(key, () -> {
                        next();
                        expect(JsonToken.START_ARRAY, "list of alternatives");
                        List<Target.AllOf> groups = new ArrayList<>();
                        readArray(i -> groups.add(parseAllOf()));
                        return new Target.AnyOf(groups);
                    }));
                    closeSingleKeyObject();
                } else {
                    Expression match = parseExpressionBody(key);
                    closeSingleKeyObject();
                    clauses.add(new Target.AnyOf(List.of(allOf(List.of(match)))));
                }
            });
            return new Target(clauses);
        }

        private Target.AllOf parseAllOf() throws IOException {
            expect(JsonToken.START_OBJECT, "target alternative");
            String key = firstKey();
            List<Expression> matches;
            if (Tags.ALL.equals(lower(key))) {
                matches = inKey(key, () -> {
                    next();
                    expect(JsonToken.START_ARRAY, "list of matches");
                    List<Expression> items = new ArrayList<>();
                    readArray(i -> items.add(parseExpression()));
                    return items;
                });
            } else {
                matches = List.of(parseExpressionBody(key));
            }
            closeSingleKeyObject();
            return allOf(matches);
        }

        private Target.AllOf allOf(List<Expression> matches) {
            return typed(() -> new Target.AllOf(matches));
        }

        // Obligations

        private List<Obligation> parseObligations() throws IOException {
            expect(JsonToken.START_ARRAY, "list of obligations");
            List<Obligation> obligations = new ArrayList<>();
            readArray(index -> {
                expect(JsonToken.START_OBJECT, "obligation");
                String id = firstKey();
                path.add(quote(id));
                AttributeType type = declarations.get(id);
                if (type == null) {
                    throw typeError("Undeclared attribute '" + id + "'");
                }
                next();
                Expression expression = parseExpression();
                if (expression.getResultType() != type) {
                    throw typeError("Obligation '" + id + "' is " + type + " but expression is "
                            + expression.getResultType());
                }
                obligations.add(new Obligation(new Attribute(id, type), expression));
                path.remove(path.size() - 1);
                closeSingleKeyObject();
            });
            return obligations;
        }

        // Expressions

        private Expression parseExpression() throws IOException {
            expect(JsonToken.START_OBJECT, "expression");
            String key = firstKey();
            Expression expression = parseExpressionBody(key);
            closeSingleKeyObject();
            return expression;
        }

        /**
         * Parse the value of an expression whose single key has just been read.
         */
        private Expression parseExpressionBody(String key) throws IOException {
            path.add(key);
            next();
            Expression expression = switch (lower(key)) {
                case Tags.ATTR -> {
                    String id = readString("attribute id");
                    AttributeType type = declarations.get(id);
                    if (type == null) {
                        throw typeError("Undeclared attribute '" + id + "'");
                    }
                    yield new AttributeDesignator(new Attribute(id, type));
                }
                case Tags.VAL -> parseLiteral();
                default -> {
                    expect(JsonToken.START_ARRAY, "list of arguments");
                    List<Expression> arguments = new ArrayList<>();
                    readArray(index -> arguments.add(parseExpression()));
                    yield typed(() -> functionFactory.create(key, arguments));
                }
            };
            path.remove(path.size() - 1);
            return expression;
        }

        private Expression parseLiteral() throws IOException {
            expect(JsonToken.START_OBJECT, "value object");
            String[] tag = new String[1];
            Object[] content = new Object[1];
            readObject(key -> {
                switch (lower(key)) {
                    case Tags.TYPE -> tag[0] = readString("type tag");
                    case Tags.CONTENT -> content[0] = inKey(key, this::readRaw);
                    default -> throw unknownKey(key);
                }
            });
            if (tag[0] == null) {
                throw schema("Missing '" + Tags.TYPE + "'");
            }
            if (content[0] == null) {
                throw schema("Missing '" + Tags.CONTENT + "'");
            }
            AttributeType type = AttributeType.fromTag(tag[0])
                    .orElseThrow(() -> typeError("Unknown type '" + tag[0] + "'"));
            AttributeValue value = typed(() -> type.coerce(content[0]));
            return new Literal(value);
        }

        private Object readRaw() throws IOException {
            JsonToken token = parser.currentToken();
            switch (token) {
                case VALUE_STRING:
                    return parser.getText();
                case VALUE_NUMBER_INT:
                    return parser.getNumberValue();
                case VALUE_NUMBER_FLOAT:
                    return parser.getDoubleValue();
                case VALUE_TRUE:
                    return Boolean.TRUE;
                case VALUE_FALSE:
                    return Boolean.FALSE;
                case START_ARRAY: {
                    List<Object> items = new ArrayList<>();
                    readArray(index -> {
                        if (parser.currentToken().isStructStart()) {
                            throw schema("Nested structures are not allowed in a value");
                        }
                        items.add(readRaw());
                    });
                    return items;
                }
                default:
                    throw schema("Expected a value but got " + token);
            }
        }

        // Token helpers

        private JsonToken next() throws IOException {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw schema("Unexpected end of document");
            }
            return token;
        }

        private void expect(JsonToken expected, String what) {
            if (parser.currentToken() != expected) {
                throw schema("Expected " + what + " but got " + describe(parser.currentToken()));
            }
        }

        private String readString(String what) {
            if (parser.currentToken() != JsonToken.VALUE_STRING) {
                throw schema("Expected " + what + " string but got " + describe(parser.currentToken()));
            }
            try {
                return parser.getText();
            } catch (IOException e) {
                throw new SchemaException("Failed to read " + what, path(), e);
            }
        }

        /**
         * Read the key of a single-key object positioned at its start.
         */
        private String firstKey() throws IOException {
            if (next() != JsonToken.FIELD_NAME) {
                throw schema("Expected a single key but got an empty object");
            }
            return parser.currentName();
        }

        private void closeSingleKeyObject() throws IOException {
            if (next() != JsonToken.END_OBJECT) {
                throw schema("Expected a single key but got '" + parser.currentName() + "' as well");
            }
        }

        /**
         * Walk a vocabulary object positioned at its start. Keys are unique regardless of case;
         * the handler is called positioned at the value and must consume it.
         */
        private void readObject(FieldHandler handler) throws IOException {
            Set<String> seen = new HashSet<>();
            while (next() != JsonToken.END_OBJECT) {
                String key = parser.currentName();
                if (!seen.add(lower(key))) {
                    throw schema("Duplicate key '" + key + "'");
                }
                next();
                handler.handle(key);
            }
        }

        private void readArray(ItemHandler handler) throws IOException {
            int index = 0;
            while (next() != JsonToken.END_ARRAY) {
                handler.handle(index++);
            }
        }

        private <T> T inKey(String key, Reader<T> reader) throws IOException {
            path.add(key);
            T result = reader.read();
            path.remove(path.size() - 1);
            return result;
        }

        /**
         * Run a construction step, attaching the current location to type errors it raises.
         */
        private <T> T typed(Supplier<T> step) {
            try {
                return step.get();
            } catch (PolicyTypeException e) {
                if (e.getPath() != null) {
                    throw e;
                }
                throw new PolicyTypeException(e.getDetail(), path(), e);
            } catch (AttributeTypeException e) {
                throw new PolicyTypeException(e.getMessage(), path(), e);
            }
        }

        private SchemaException schema(String message) {
            return new SchemaException(message, path());
        }

        private SchemaException unknownKey(String key) {
            return schema("Unknown key '" + key + "'");
        }

        private PolicyTypeException typeError(String message) {
            return new PolicyTypeException(message, path());
        }

        private String path() {
            return String.join(">", path);
        }
    }

    private static String lower(String key) {
        return key.toLowerCase(Locale.ROOT);
    }

    private static String quote(String id) {
        return "\"" + id + "\"";
    }

    private static String describe(JsonToken token) {
        return token == null ? "end of document" : token.toString();
    }
}
