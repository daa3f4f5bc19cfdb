package com.pdp.config.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pdp.combining.Combiner;
import com.pdp.combining.MapperCombiner;
import com.pdp.exception.PdpException;
import com.pdp.expression.AttributeDesignator;
import com.pdp.expression.Expression;
import com.pdp.expression.FunctionExpression;
import com.pdp.expression.Literal;
import com.pdp.policy.Effect;
import com.pdp.policy.Evaluable;
import com.pdp.policy.NodeKind;
import com.pdp.policy.Obligation;
import com.pdp.policy.PolicyContainer;
import com.pdp.policy.Rule;
import com.pdp.policy.Target;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes a parsed policy document back to JSON or YAML in the vocabulary
 * {@link PolicyParser} reads. Output is deterministic: keys and children keep document order.
 */
public class PolicyWriter {

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String write(PolicyDocument document, DocumentFormat format) {
        Map<String, Object> root = toMap(document);
        return switch (format) {
            case JSON -> writeJson(root);
            case YAML -> yaml().dump(root);
        };
    }

    private String writeJson(Map<String, Object> root) {
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new PdpException("Failed to write policy document", e);
        }
    }

    private static Yaml yaml() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        // Yaml instances are not thread-safe
        return new Yaml(options);
    }

    /**
     * Plain map form of a document: maps, lists, strings, numbers and booleans only.
     */
    public Map<String, Object> toMap(PolicyDocument document) {
        Map<String, Object> root = new LinkedHashMap<>();
        Map<String, Object> attributes = new LinkedHashMap<>();
        document.declarations().forEach((id, type) -> attributes.put(id, type.getTag()));
        root.put(Tags.ATTRIBUTES, attributes);
        root.put(Tags.POLICIES, node(document.root()));
        return root;
    }

    private Map<String, Object> node(Evaluable node) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(Tags.ID, node.getId());
        if (!node.getTarget().isEmpty()) {
            map.put(Tags.TARGET, target(node.getTarget()));
        }

        if (node instanceof Rule rule) {
            rule.getCondition().ifPresent(c -> map.put(Tags.CONDITION, expression(c)));
            map.put(Tags.EFFECT, rule.getEffect().getTag());
        } else if (node instanceof PolicyContainer<?> container) {
            map.put(Tags.ALG, algorithm(container.getCombiner()));
            List<Object> children = new ArrayList<>();
            for (Evaluable child : container.getChildren()) {
                children.add(node(child));
            }
            map.put(node.getKind() == NodeKind.POLICY ? Tags.RULES : Tags.POLICIES, children);
        }

        if (!node.getObligations().isEmpty()) {
            List<Object> obligations = new ArrayList<>();
            for (Obligation obligation : node.getObligations()) {
                obligations.add(Map.of(obligation.attribute().id(), expression(obligation.expression())));
            }
            map.put(Tags.OBLIGATIONS, obligations);
        }
        return map;
    }

    private Object algorithm(Combiner combiner) {
        if (!(combiner instanceof MapperCombiner mapper)) {
            return combiner.getAlgorithm().getDocumentName();
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(Tags.ID, mapper.getAlgorithm().getDocumentName());
        map.put(Tags.MAP, expression(mapper.getMap()));
        if (mapper.getDefaultChild() != null) {
            map.put(Tags.DEFAULT, mapper.getDefaultChild().getId());
        }
        if (mapper.getErrorChild() != null) {
            map.put(Tags.ERROR, mapper.getErrorChild().getId());
        }
        if (mapper.getSubCombiner() != null) {
            map.put(Tags.ALG, mapper.getSubCombiner().getAlgorithm().getDocumentName());
        }
        if (mapper.getUnmatched() != Effect.NOT_APPLICABLE) {
            map.put(Tags.UNMATCHED, mapper.getUnmatched().getTag());
        }
        return map;
    }

    private List<Object> target(Target target) {
        List<Object> clauses = new ArrayList<>();
        for (Target.AnyOf clause : target.getClauses()) {
            if (clause.groups().size() == 1 && clause.groups().get(0).matches().size() == 1) {
                clauses.add(expression(clause.groups().get(0).matches().get(0)));
                continue;
            }
            List<Object> groups = new ArrayList<>();
            for (Target.AllOf group : clause.groups()) {
                if (group.matches().size() == 1) {
                    groups.add(expression(group.matches().get(0)));
                } else {
                    groups.add(Map.of(Tags.ALL, group.matches().stream().map(this::expression).toList()));
                }
            }
            clauses.add(Map.of(Tags.ANY, groups));
        }
        return clauses;
    }

    private Object expression(Expression expression) {
        if (expression instanceof AttributeDesignator designator) {
            return Map.of(Tags.ATTR, designator.getAttribute().id());
        }
        if (expression instanceof Literal literal) {
            Map<String, Object> value = new LinkedHashMap<>();
            value.put(Tags.TYPE, literal.getValue().getType().getTag());
            value.put(Tags.CONTENT, literal.getValue().toRaw());
            return Map.of(Tags.VAL, value);
        }
        if (expression instanceof FunctionExpression function) {
            List<Object> arguments = new ArrayList<>();
            for (Expression argument : function.getArguments()) {
                arguments.add(expression(argument));
            }
            return Map.of(function.getFunctionType().getFunctionName(), arguments);
        }
        throw new PdpException("Cannot serialize expression " + expression);
    }
}
