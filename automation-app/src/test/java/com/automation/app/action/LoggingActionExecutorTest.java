package com.automation.app.action;

import com.automation.core.action.ActionContext;
import com.automation.core.exception.ActionExecutionException;
import com.automation.core.model.ActionConfig;
import com.automation.core.model.AutomationTrigger;
import com.automation.core.model.Condition;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class LoggingActionExecutorTest {

    private final LoggingActionExecutor executor = new LoggingActionExecutor();

    private final ActionContext context = ActionContext.forScheduledTrigger(
        AutomationTrigger.cron("t-1", "org-1", "wf-1", "Daily", "0 0 * * *", List.of(), null),
        Instant.parse("2024-03-01T00:00:00Z"));

    @Test
    void executeActions_logsTypedActions() {
        assertThatCode(() -> executor.executeActions(
            List.of(ActionConfig.of("send_email"), ActionConfig.of("create_task")), context))
            .doesNotThrowAnyException();
    }

    @Test
    void evaluateConditions_delegatesToEvaluator() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("documentType", "W2");

        assertThat(executor.evaluateConditions(
            List.of(new Condition("documentType", "equals", TextNode.valueOf("W2"))), payload)).isTrue();
        assertThat(executor.evaluateConditions(
            List.of(new Condition("documentType", "equals", TextNode.valueOf("1099"))), payload)).isFalse();
    }

    @Test
    void executeActions_rejectsUntypedAction() {
        assertThatThrownBy(() -> executor.executeActions(List.of(new ActionConfig(null, null)), context))
            .isInstanceOf(ActionExecutionException.class)
            .hasMessageContaining("Action has no type");
    }
}
