package com.mailflow.mailflow_backend.controller;

import com.mailflow.mailflow_backend.engine.TestWorkflowOptions;
import com.mailflow.mailflow_backend.engine.WorkflowEngine;
import com.mailflow.mailflow_backend.engine.WorkflowTestRunner;
import com.mailflow.mailflow_backend.model.domain.Workflow;
import com.mailflow.mailflow_backend.model.domain.WorkflowExecution;
import com.mailflow.mailflow_backend.model.dto.MailEventRequest;
import com.mailflow.mailflow_backend.model.dto.TestWorkflowRequest;
import com.mailflow.mailflow_backend.model.dto.WorkflowDefinition;
import com.mailflow.mailflow_backend.model.result.TestWorkflowResult;
import com.mailflow.mailflow_backend.model.result.TriggerResult;
import com.mailflow.mailflow_backend.model.result.ValidationResult;
import com.mailflow.mailflow_backend.repository.WorkflowExecutionRepository;
import com.mailflow.mailflow_backend.repository.WorkflowRepository;
import com.mailflow.mailflow_backend.service.WorkflowExecutionService;
import com.mailflow.mailflow_backend.service.WorkflowTriggerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/workflows")
@RequiredArgsConstructor
public class WorkflowController {

    private final WorkflowEngine              workflowEngine;
    private final WorkflowTestRunner          testRunner;
    private final WorkflowTriggerService      triggerService;
    private final WorkflowExecutionService    executionService;
    private final WorkflowRepository          workflowRepository;
    private final WorkflowExecutionRepository executionRepository;

    // POST /api/workflows?userId=...&connectionId=...: import a definition; rejected with its errors when invalid
    @PostMapping
    public ResponseEntity<?> importWorkflow(@RequestParam String userId,
                                            @RequestParam(required = false) String connectionId,
                                            @RequestBody WorkflowDefinition definition) {
        if (definition.name() == null || definition.name().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "name is required");
        }
        ValidationResult validation = workflowEngine.validateWorkflow(definition.nodes(), definition.connections());
        if (!validation.valid()) {
            return ResponseEntity.badRequest().body(validation);
        }

        Workflow workflow = new Workflow();
        workflow.setUserId(userId);
        workflow.setConnectionId(connectionId);
        workflow.setName(definition.name().trim());
        workflow.setDescription(definition.description());
        workflow.setEnabled(!Boolean.FALSE.equals(definition.active()));
        workflow.setNodes(workflowEngine.convertDefinitionToInternal(definition.nodes()));
        workflow.setConnections(definition.connections());
        workflow.setSettings(definition.settings());
        return ResponseEntity.ok(workflowRepository.save(workflow));
    }

    // POST /api/workflows/validate: structural check, nothing is saved
    @PostMapping("/validate")
    public ValidationResult validate(@RequestBody WorkflowDefinition definition) {
        return workflowEngine.validateWorkflow(definition.nodes(), definition.connections());
    }

    // POST /api/workflows/test: dry run against a sample event
    @PostMapping("/test")
    public TestWorkflowResult test(@RequestBody TestWorkflowRequest request) {
        if (request.triggerContext() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "triggerContext is required");
        }
        return testRunner.testWorkflow(TestWorkflowOptions.builder()
                .nodes(request.nodes())
                .connections(request.connections())
                .triggerContext(request.triggerContext())
                .userId(request.userId())
                .connectionId(request.connectionId())
                .build());
    }

    // POST /api/workflows/events: mail sync layer reports an event; matching workflows run in the background
    @PostMapping("/events")
    public TriggerResult onMailEvent(@RequestBody MailEventRequest request) {
        if (request.userId() == null || request.userId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "userId is required");
        }
        if (request.event() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "event is required");
        }

        TriggerResult result = triggerService.evaluateAndTrigger(
                request.userId(), request.connectionId(), request.event(), request.thread(), request.labelChange());
        result.triggeredWorkflows().forEach(t -> executionService.dispatch(t.executionId()));
        log.info("[WorkflowController] {} event for user {}: {} triggered, {} error(s)",
                request.event().getValue(), request.userId(), result.triggeredWorkflows().size(), result.errors().size());
        return result;
    }

    // GET /api/workflows/{workflowId}/executions: run history, newest first
    @GetMapping("/{workflowId}/executions")
    public ResponseEntity<List<WorkflowExecution>> listExecutions(@PathVariable UUID workflowId) {
        if (!workflowRepository.existsById(workflowId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(executionRepository.findByWorkflowIdOrderByStartedAtDesc(workflowId));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
