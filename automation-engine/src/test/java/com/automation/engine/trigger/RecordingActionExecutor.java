package com.automation.engine.trigger;

import com.automation.core.action.ActionContext;
import com.automation.core.action.ActionExecutor;
import com.automation.core.exception.ActionExecutionException;
import com.automation.core.model.ActionConfig;
import com.automation.core.model.Condition;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Test executor that records every executed action. Conditions are simple
 * equality checks on dotted payload paths; actions of type "fail" throw.
 */
class RecordingActionExecutor implements ActionExecutor {

    record Execution(ActionConfig action, ActionContext context) {}

    final List<Execution> executions = new CopyOnWriteArrayList<>();

    @Override
    public boolean evaluateConditions(List<Condition> conditions, JsonNode payload) {
        for (Condition condition : conditions) {
            JsonNode actual = payload.at("/" + condition.field().replace('.', '/'));
            if (actual.isMissingNode() || !actual.equals(condition.value())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void executeActions(List<ActionConfig> actions, ActionContext context) {
        for (ActionConfig action : actions) {
            if ("fail".equals(action.type())) {
                throw new ActionExecutionException(action.type(), "Injected failure");
            }
            executions.add(new Execution(action, context));
        }
    }

    List<String> executedTypes() {
        return executions.stream().map(e -> e.action().type()).collect(Collectors.toList());
    }
}
