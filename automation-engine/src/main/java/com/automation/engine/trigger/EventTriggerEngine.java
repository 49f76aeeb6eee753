package com.automation.engine.trigger;

import com.automation.core.action.ActionContext;
import com.automation.core.action.ActionExecutor;
import com.automation.core.model.EventTriggerConfig;
import com.automation.core.model.TriggerEvent;
import com.automation.core.repository.DomainRecordRepository;
import com.automation.engine.advance.AssignmentAdvancer;
import com.automation.engine.logging.LoggingContext;
import com.automation.engine.metrics.AutomationMetrics;
import com.automation.engine.service.ProgressionService;
import com.automation.engine.trigger.event.DocumentUploadedEvent;
import com.automation.engine.trigger.event.FormSubmittedEvent;
import com.automation.engine.trigger.event.InvoicePaidEvent;
import com.automation.engine.trigger.event.PaymentReceivedEvent;
import com.automation.engine.trigger.event.ProposalAcceptedEvent;
import com.automation.engine.trigger.event.StageCompletedEvent;
import com.automation.engine.trigger.event.StepCompletedEvent;
import com.automation.engine.trigger.event.TaskCompletedEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reacts to domain events: enriches the payload, runs the matching event
 * triggers and auto-advances the affected assignment.
 * 
 * Handlers never throw. Each trigger configuration runs in isolation, so one
 * failing configuration does not stop the others for the same event.
 */
public class EventTriggerEngine {

    private static final Logger log = LoggerFactory.getLogger(EventTriggerEngine.class);

    private final EventTriggerRegistry registry;
    private final ActionExecutor actionExecutor;
    private final DomainRecordRepository domainRecords;
    private final AssignmentAdvancer advancer;
    private final ProgressionService progressionService;
    private final AutomationMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EventTriggerEngine(
            EventTriggerRegistry registry,
            ActionExecutor actionExecutor,
            DomainRecordRepository domainRecords,
            AssignmentAdvancer advancer,
            ProgressionService progressionService,
            AutomationMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        this.registry = registry;
        this.actionExecutor = actionExecutor;
        this.domainRecords = domainRecords;
        this.advancer = advancer;
        this.progressionService = progressionService;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ========== Registration ==========

    public void registerTrigger(EventTriggerConfig config) {
        registry.register(config);
    }

    public boolean unregisterTrigger(String triggerId) {
        return registry.unregister(triggerId);
    }

    public void clearAllTriggers() {
        registry.clear();
    }

    public List<EventTriggerConfig> getTriggersForEvent(TriggerEvent event) {
        return registry.triggersFor(event);
    }

    // ========== Event Handlers ==========

    /**
     * A payment also counts as the invoice being paid.
     */
    public void handlePaymentReceived(PaymentReceivedEvent event) {
        ObjectNode payload = toPayload(event);
        enrich(payload, "invoice", event.invoiceId(), domainRecords::findInvoice);
        enrich(payload, "client", event.clientId(), domainRecords::findClient);
        
        dispatch(TriggerEvent.PAYMENT_RECEIVED, payload);
        dispatch(TriggerEvent.INVOICE_PAID, payload);
        advance(event.assignmentId(), TriggerEvent.PAYMENT_RECEIVED);
    }

    public void handleInvoicePaid(InvoicePaidEvent event) {
        ObjectNode payload = toPayload(event);
        enrich(payload, "invoice", event.invoiceId(), domainRecords::findInvoice);
        
        dispatch(TriggerEvent.INVOICE_PAID, payload);
        advance(event.assignmentId(), TriggerEvent.INVOICE_PAID);
    }

    public void handleDocumentUploaded(DocumentUploadedEvent event) {
        ObjectNode payload = toPayload(event);
        enrich(payload, "document", event.documentId(), domainRecords::findDocument);
        enrich(payload, "client", event.clientId(), domainRecords::findClient);
        
        dispatch(TriggerEvent.DOCUMENT_UPLOADED, payload);
        advance(event.assignmentId(), TriggerEvent.DOCUMENT_UPLOADED);
    }

    /**
     * An organizer is a form, so form_submitted triggers run as well.
     */
    public void handleOrganizerSubmitted(FormSubmittedEvent event) {
        ObjectNode payload = toPayload(event);
        enrich(payload, "formSubmission", event.formSubmissionId(), domainRecords::findFormSubmission);
        enrich(payload, "client", event.clientId(), domainRecords::findClient);
        
        dispatch(TriggerEvent.ORGANIZER_SUBMITTED, payload);
        dispatch(TriggerEvent.FORM_SUBMITTED, payload);
        advance(event.assignmentId(), TriggerEvent.ORGANIZER_SUBMITTED);
    }

    public void handleFormSubmitted(FormSubmittedEvent event) {
        ObjectNode payload = toPayload(event);
        enrich(payload, "formSubmission", event.formSubmissionId(), domainRecords::findFormSubmission);
        enrich(payload, "client", event.clientId(), domainRecords::findClient);
        
        dispatch(TriggerEvent.FORM_SUBMITTED, payload);
        advance(event.assignmentId(), TriggerEvent.FORM_SUBMITTED);
    }

    public void handleProposalAccepted(ProposalAcceptedEvent event) {
        ObjectNode payload = toPayload(event);
        enrich(payload, "client", event.clientId(), domainRecords::findClient);
        
        dispatch(TriggerEvent.PROPOSAL_ACCEPTED, payload);
        advance(event.assignmentId(), TriggerEvent.PROPOSAL_ACCEPTED);
    }

    public void handleTaskCompleted(TaskCompletedEvent event) {
        dispatch(TriggerEvent.TASK_COMPLETED, toPayload(event));
        checkProgression(TriggerEvent.TASK_COMPLETED, event.stepId(), progressionService::checkStepCompletion);
        advance(event.assignmentId(), TriggerEvent.TASK_COMPLETED);
    }

    public void handleStepCompleted(StepCompletedEvent event) {
        dispatch(TriggerEvent.STEP_COMPLETED, toPayload(event));
        checkProgression(TriggerEvent.STEP_COMPLETED, event.stageId(), progressionService::checkStageCompletion);
        advance(event.assignmentId(), TriggerEvent.STEP_COMPLETED);
    }

    public void handleStageCompleted(StageCompletedEvent event) {
        dispatch(TriggerEvent.STAGE_COMPLETED, toPayload(event));
        checkProgression(TriggerEvent.STAGE_COMPLETED, event.workflowId(), progressionService::checkWorkflowCompletion);
        advance(event.assignmentId(), TriggerEvent.STAGE_COMPLETED);
    }

    // ========== Dispatch ==========

    /**
     * Run every configuration registered for the event against the payload.
     */
    void dispatch(TriggerEvent event, JsonNode payload) {
        List<EventTriggerConfig> configs = registry.triggersFor(event);
        
        try (var ctx = LoggingContext.forEvent(event, text(payload, "organizationId"), text(payload, "assignmentId"))) {
            metrics.eventDispatched(event);
            log.debug("Dispatching {} to {} trigger(s)", event, configs.size());
            
            for (EventTriggerConfig config : configs) {
                try {
                    processTrigger(config, event, payload);
                } catch (RuntimeException e) {
                    metrics.eventTriggerFailed(event);
                    log.error("Event trigger {} failed for {}", config.id(), event, e);
                }
            }
        }
    }

    private void processTrigger(EventTriggerConfig config, TriggerEvent event, JsonNode payload) {
        String workflowId = text(payload, "workflowId");
        if (!config.matchesWorkflow(workflowId)) {
            log.debug("Event trigger {} skipped: scoped to workflow {}, event is for {}",
                config.id(), config.workflowId(), workflowId);
            return;
        }
        
        if (config.hasConditions() && !actionExecutor.evaluateConditions(config.conditions(), payload)) {
            log.debug("Event trigger {} skipped: conditions not met", config.id());
            return;
        }
        
        if (config.hasActions()) {
            actionExecutor.executeActions(config.actions(), ActionContext.forEvent(event, payload, clock.instant()));
        }
        
        String assignmentId = text(payload, "assignmentId");
        if (config.autoAdvanceEnabled() && assignmentId != null) {
            advancer.autoAdvanceToStage(assignmentId, config.autoAdvance().targetStageId());
        }
        
        log.info("Event trigger {} processed for {}", config.id(), event);
    }

    // ========== Internal Methods ==========

    private void advance(String assignmentId, TriggerEvent reason) {
        if (assignmentId == null) {
            return;
        }
        advancer.autoAdvanceAssignment(assignmentId, reason.wireName());
    }

    private void checkProgression(TriggerEvent event, String nodeId, Function<String, Boolean> check) {
        if (nodeId == null) {
            return;
        }
        try {
            check.apply(nodeId);
        } catch (RuntimeException e) {
            log.error("Progression check for {} {} failed", event, nodeId, e);
        }
    }

    private ObjectNode toPayload(Object event) {
        return objectMapper.valueToTree(event);
    }

    private void enrich(ObjectNode payload, String field, String id, Function<String, Optional<JsonNode>> lookup) {
        if (id == null) {
            return;
        }
        try {
            lookup.apply(id).ifPresent(record -> payload.set(field, record));
        } catch (RuntimeException e) {
            log.warn("Could not load {} {} for event enrichment", field, id, e);
        }
    }

    private static String text(JsonNode payload, String field) {
        JsonNode value = payload.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
