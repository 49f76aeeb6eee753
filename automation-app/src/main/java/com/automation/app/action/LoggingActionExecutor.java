package com.automation.app.action;

import com.automation.core.action.ActionContext;
import com.automation.core.action.ActionExecutor;
import com.automation.core.exception.ActionExecutionException;
import com.automation.core.model.ActionConfig;
import com.automation.core.model.Condition;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Default action executor: evaluates conditions on the payload and logs each
 * action instead of performing it. Hosts provide their own ActionExecutor bean
 * to send emails, create tasks and so on.
 */
public class LoggingActionExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(LoggingActionExecutor.class);

    private final JsonConditionEvaluator conditionEvaluator;

    public LoggingActionExecutor() {
        this(new JsonConditionEvaluator());
    }

    public LoggingActionExecutor(JsonConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    @Override
    public boolean evaluateConditions(List<Condition> conditions, JsonNode payload) {
        return conditionEvaluator.evaluate(conditions, payload);
    }

    @Override
    public void executeActions(List<ActionConfig> actions, ActionContext context) {
        for (ActionConfig action : actions) {
            if (action.type() == null || action.type().isBlank()) {
                throw new ActionExecutionException(String.valueOf(action.type()), "Action has no type");
            }
            log.info("Action {} for {} (organization {}, workflow {}, user {}): {}",
                action.type(),
                describe(context),
                context.organizationId(),
                context.workflowId(),
                context.userId(),
                action.config());
        }
    }

    private static String describe(ActionContext context) {
        if (context.triggerId() != null) {
            return "trigger " + context.triggerId();
        }
        return "event " + context.event();
    }
}
