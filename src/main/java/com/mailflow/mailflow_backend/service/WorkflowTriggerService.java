package com.mailflow.mailflow_backend.service;

import com.mailflow.mailflow_backend.engine.TriggerEvaluator;
import com.mailflow.mailflow_backend.model.domain.ExecutionStatus;
import com.mailflow.mailflow_backend.model.domain.NodeCategory;
import com.mailflow.mailflow_backend.model.domain.Workflow;
import com.mailflow.mailflow_backend.model.domain.WorkflowExecution;
import com.mailflow.mailflow_backend.model.domain.WorkflowNode;
import com.mailflow.mailflow_backend.model.domain.WorkflowSettings;
import com.mailflow.mailflow_backend.model.result.TriggerEvaluationResult;
import com.mailflow.mailflow_backend.model.result.TriggerResult;
import com.mailflow.mailflow_backend.model.trigger.LabelChange;
import com.mailflow.mailflow_backend.model.trigger.ThreadSnapshot;
import com.mailflow.mailflow_backend.model.trigger.TriggerContext;
import com.mailflow.mailflow_backend.model.trigger.TriggerEvent;
import com.mailflow.mailflow_backend.repository.WorkflowExecutionRepository;
import com.mailflow.mailflow_backend.repository.WorkflowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Matches an inbound mail event against the user's enabled workflows and opens a pending
 * execution for every workflow whose trigger fires.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowTriggerService {

    private static final Duration RATE_WINDOW = Duration.ofHours(1);

    private final WorkflowRepository          workflowRepository;
    private final WorkflowExecutionRepository executionRepository;
    private final TriggerEvaluator            triggerEvaluator;

    public TriggerResult evaluateAndTrigger(String userId,
                                            String connectionId,
                                            TriggerEvent event,
                                            ThreadSnapshot thread,
                                            LabelChange labelChange) {
        List<TriggerResult.TriggeredWorkflow> triggered = new ArrayList<>();
        List<TriggerResult.TriggerError> errors = new ArrayList<>();

        TriggerContext context = TriggerEvaluator.buildTriggerContext(event, thread, labelChange);
        List<Workflow> workflows = workflowRepository.findByUserIdAndEnabledTrue(userId);

        for (Workflow workflow : workflows) {
            if (workflow.getConnectionId() != null && !workflow.getConnectionId().equals(connectionId)) {
                continue;
            }
            try {
                List<WorkflowNode> triggers = workflow.getNodes().stream()
                        .filter(n -> n.getCategory() == NodeCategory.TRIGGER)
                        .toList();
                TriggerEvaluationResult match = triggerEvaluator.evaluateWorkflow(triggers, context);
                if (!match.triggered()) {
                    continue;
                }

                Integer limit = hourlyLimit(workflow.getSettings());
                if (limit != null) {
                    long recent = executionRepository.countByWorkflowIdAndStartedAtAfter(
                            workflow.getId(), Instant.now().minus(RATE_WINDOW));
                    if (recent >= limit) {
                        log.warn("[WorkflowTrigger] Workflow {} hit its limit of {} executions per hour", workflow.getId(), limit);
                        errors.add(new TriggerResult.TriggerError(workflow.getId(),
                                "Rate limit exceeded: " + limit + " executions per hour"));
                        continue;
                    }
                }

                WorkflowExecution execution = new WorkflowExecution();
                execution.setWorkflowId(workflow.getId());
                execution.setThreadId(thread != null ? thread.id() : null);
                execution.setTriggerData(context);
                execution.setTriggerNodeId(match.matchedTriggerId());
                execution.setStatus(ExecutionStatus.PENDING);
                execution.setStartedAt(Instant.now());
                WorkflowExecution saved = executionRepository.save(execution);

                log.info("[WorkflowTrigger] Workflow '{}' triggered by {} on {}, execution {}",
                        workflow.getName(), match.matchedTriggerId(), event.getValue(), saved.getId());
                triggered.add(new TriggerResult.TriggeredWorkflow(
                        workflow.getId(), workflow.getName(), saved.getId(), match.matchedTriggerId()));

            } catch (Exception e) {
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.error("[WorkflowTrigger] Workflow {} could not be evaluated: {}", workflow.getId(), error, e);
                errors.add(new TriggerResult.TriggerError(workflow.getId(), error));
            }
        }

        return new TriggerResult(triggered, errors);
    }

    private static Integer hourlyLimit(WorkflowSettings settings) {
        if (settings == null || settings.getMaxExecutionsPerHour() == null || settings.getMaxExecutionsPerHour() <= 0) {
            return null;
        }
        return settings.getMaxExecutionsPerHour();
    }
}
