package com.automation.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A single condition of an event trigger, evaluated by the action executor
 * against the enriched event payload.
 */
public record Condition(
    String field,
    String operator,
    JsonNode value
) {}
