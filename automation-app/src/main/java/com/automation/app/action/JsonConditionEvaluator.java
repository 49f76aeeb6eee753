package com.automation.app.action;

import com.automation.core.model.Condition;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Evaluates trigger conditions against a JSON payload.
 * 
 * Fields are dotted paths into the payload ("invoice.status"). All conditions
 * must hold. Supported operators: equals, not_equals, contains, greater_than,
 * less_than, greater_than_or_equal, less_than_or_equal, exists, not_exists,
 * in, not_in, starts_with, ends_with. Unknown operators never match.
 */
public class JsonConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(JsonConditionEvaluator.class);

    public boolean evaluate(List<Condition> conditions, JsonNode payload) {
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }
        for (Condition condition : conditions) {
            if (!evaluate(condition, payload)) {
                return false;
            }
        }
        return true;
    }

    boolean evaluate(Condition condition, JsonNode payload) {
        if (condition.operator() == null) {
            log.warn("Condition on field {} has no operator", condition.field());
            return false;
        }
        JsonNode actual = resolve(payload, condition.field());
        JsonNode expected = condition.value();
        boolean present = actual != null && !actual.isNull();
        
        return switch (condition.operator()) {
            case "equals" -> present && sameValue(actual, expected);
            case "not_equals" -> !present || !sameValue(actual, expected);
            case "contains" -> present && contains(actual, expected);
            case "greater_than" -> isNumeric(actual, expected) && compare(actual, expected) > 0;
            case "less_than" -> isNumeric(actual, expected) && compare(actual, expected) < 0;
            case "greater_than_or_equal" -> isNumeric(actual, expected) && compare(actual, expected) >= 0;
            case "less_than_or_equal" -> isNumeric(actual, expected) && compare(actual, expected) <= 0;
            case "exists" -> present;
            case "not_exists" -> !present;
            case "in" -> present && expected != null && expected.isArray() && arrayContains(expected, actual);
            case "not_in" -> expected != null && expected.isArray() && !(present && arrayContains(expected, actual));
            case "starts_with" -> present && expected != null && actual.asText().startsWith(expected.asText());
            case "ends_with" -> present && expected != null && actual.asText().endsWith(expected.asText());
            default -> {
                log.warn("Unsupported condition operator '{}' on field {}", condition.operator(), condition.field());
                yield false;
            }
        };
    }

    private static JsonNode resolve(JsonNode payload, String field) {
        if (payload == null || field == null) {
            return null;
        }
        JsonNode node = payload.at("/" + field.replace('.', '/'));
        return node.isMissingNode() ? null : node;
    }

    private static boolean sameValue(JsonNode actual, JsonNode expected) {
        if (expected == null) {
            return false;
        }
        if (actual.isNumber() && expected.isNumber()) {
            return actual.decimalValue().compareTo(expected.decimalValue()) == 0;
        }
        if (actual.isValueNode() && expected.isValueNode()) {
            return actual.asText().equals(expected.asText());
        }
        return actual.equals(expected);
    }

    private static boolean contains(JsonNode actual, JsonNode expected) {
        if (expected == null) {
            return false;
        }
        if (actual.isArray()) {
            return arrayContains(actual, expected);
        }
        return actual.asText().contains(expected.asText());
    }

    private static boolean arrayContains(JsonNode array, JsonNode value) {
        for (JsonNode element : array) {
            if (sameValue(element, value)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNumeric(JsonNode actual, JsonNode expected) {
        return actual != null && expected != null && toNumber(actual) != null && toNumber(expected) != null;
    }

    private static int compare(JsonNode actual, JsonNode expected) {
        return Double.compare(toNumber(actual), toNumber(expected));
    }

    private static Double toNumber(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        try {
            return Double.parseDouble(node.asText());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
