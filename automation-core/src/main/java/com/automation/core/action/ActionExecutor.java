package com.automation.core.action;

import com.automation.core.model.ActionConfig;
import com.automation.core.model.Condition;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Evaluates trigger conditions and performs configured actions.
 * Implemented outside the core; the scheduler and the event engine only
 * decide when and whether it is called.
 */
public interface ActionExecutor {

    /**
     * @param conditions Conditions of an event trigger
     * @param payload The enriched event payload
     * @return true if all conditions hold
     */
    boolean evaluateConditions(List<Condition> conditions, JsonNode payload);

    /**
     * Run the actions. Failures are reported by throwing.
     * 
     * @param actions Actions to run, in order
     * @param context Identifiers and payload of the triggering occurrence
     */
    void executeActions(List<ActionConfig> actions, ActionContext context);
}
