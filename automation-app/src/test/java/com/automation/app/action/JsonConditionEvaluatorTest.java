package com.automation.app.action;

import com.automation.core.model.Condition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JsonConditionEvaluatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonConditionEvaluator evaluator = new JsonConditionEvaluator();

    private JsonNode payload;

    @BeforeEach
    void setUp() throws Exception {
        payload = objectMapper.readTree("""
            {
              "clientId": "client-1",
              "amount": 250,
              "invoice": {"status": "paid", "number": "INV-001"},
              "client": {"tags": ["vip", "tax"]}
            }
            """);
    }

    @Test
    void equalityOnNestedPaths() {
        assertThat(holds("invoice.status", "equals", TextNode.valueOf("paid"))).isTrue();
        assertThat(holds("invoice.status", "not_equals", TextNode.valueOf("paid"))).isFalse();
        assertThat(holds("amount", "equals", IntNode.valueOf(250))).isTrue();
        assertThat(holds("amount", "equals", TextNode.valueOf("250"))).isTrue();
    }

    @Test
    void numericComparisons() {
        assertThat(holds("amount", "greater_than", IntNode.valueOf(100))).isTrue();
        assertThat(holds("amount", "less_than", IntNode.valueOf(100))).isFalse();
        assertThat(holds("amount", "greater_than_or_equal", IntNode.valueOf(250))).isTrue();
        assertThat(holds("invoice.status", "less_than_or_equal", IntNode.valueOf(1))).isFalse();
    }

    @Test
    void presenceAndMembership() throws Exception {
        assertThat(holds("invoice.number", "exists", null)).isTrue();
        assertThat(holds("invoice.dueDate", "not_exists", null)).isTrue();
        assertThat(holds("client.tags", "contains", TextNode.valueOf("vip"))).isTrue();
        assertThat(holds("clientId", "in", objectMapper.readTree("[\"client-1\", \"client-2\"]"))).isTrue();
        assertThat(holds("clientId", "not_in", objectMapper.readTree("[\"client-2\"]"))).isTrue();
        assertThat(holds("invoice.number", "starts_with", TextNode.valueOf("INV"))).isTrue();
        assertThat(holds("invoice.number", "ends_with", TextNode.valueOf("999"))).isFalse();
    }

    @Test
    void allConditionsMustHold() {
        List<Condition> conditions = List.of(
            new Condition("invoice.status", "equals", TextNode.valueOf("paid")),
            new Condition("amount", "greater_than", IntNode.valueOf(1000)));

        assertThat(evaluator.evaluate(conditions, payload)).isFalse();
        assertThat(evaluator.evaluate(List.of(), payload)).isTrue();
    }

    @Test
    void unknownOperatorNeverMatches() {
        assertThat(holds("clientId", "matches_regex", TextNode.valueOf(".*"))).isFalse();
        assertThat(holds("clientId", null, TextNode.valueOf("client-1"))).isFalse();
    }

    private boolean holds(String field, String operator, JsonNode value) {
        return evaluator.evaluate(List.of(new Condition(field, operator, value)), payload);
    }
}
