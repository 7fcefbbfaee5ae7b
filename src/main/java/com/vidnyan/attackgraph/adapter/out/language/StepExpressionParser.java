package com.vidnyan.attackgraph.adapter.out.language;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.attackgraph.domain.language.LanguageSpecificationException;
import com.vidnyan.attackgraph.domain.language.StepExpression;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps step expressions of a compiled language specification to {@link StepExpression}.
 * Unknown types become {@link StepExpression.Unknown} so that the evaluator can
 * report them without failing the load.
 */
@Slf4j
class StepExpressionParser {

    StepExpression parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new LanguageSpecificationException("Step expression must be an object: " + node);
        }
        String type = node.path("type").asText("");

        return switch (type) {
            case "attackStep" -> new StepExpression.AttackStep(text(node, "name"));
            case "field" -> new StepExpression.Field(text(node, "name"));
            case "variable" -> new StepExpression.Variable(text(node, "name"));
            case "union" -> new StepExpression.Union(parse(node.get("lhs")), parse(node.get("rhs")));
            case "intersection" -> new StepExpression.Intersection(parse(node.get("lhs")), parse(node.get("rhs")));
            case "difference" -> new StepExpression.Difference(parse(node.get("lhs")), parse(node.get("rhs")));
            case "collect" -> new StepExpression.Collect(parse(node.get("lhs")), parse(node.get("rhs")));
            case "transitive" -> new StepExpression.Transitive(parse(node.get("stepExpression")));
            case "subType" -> new StepExpression.SubType(parse(node.get("stepExpression")), text(node, "subType"));
            default -> {
                log.warn("Unknown step expression type '{}'", type);
                yield new StepExpression.Unknown(type);
            }
        };
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new LanguageSpecificationException(
                    "Step expression of type '" + node.path("type").asText() + "' has no '" + field + "'");
        }
        return value.asText();
    }
}
