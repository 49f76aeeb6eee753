package com.automation.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One configured action. The core never interprets it; it is handed
 * verbatim to the {@link com.automation.core.action.ActionExecutor}.
 */
public record ActionConfig(
    String type,
    JsonNode config
) {
    public static ActionConfig of(String type) {
        return new ActionConfig(type, null);
    }
}
