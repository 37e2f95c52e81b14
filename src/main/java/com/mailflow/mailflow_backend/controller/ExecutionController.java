package com.mailflow.mailflow_backend.controller;

import com.mailflow.mailflow_backend.model.domain.WorkflowExecution;
import com.mailflow.mailflow_backend.model.result.ExecutionResult;
import com.mailflow.mailflow_backend.repository.WorkflowExecutionRepository;
import com.mailflow.mailflow_backend.service.WorkflowExecutionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
public class ExecutionController {

    private final WorkflowExecutionRepository executionRepository;
    private final WorkflowExecutionService    executionService;

    // POST /api/executions/{id}/run: runs (or re-runs) a pending execution and waits for the outcome
    @PostMapping("/{id}/run")
    public ResponseEntity<ExecutionResult> run(@PathVariable UUID id) {
        if (!executionRepository.existsById(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(executionService.dispatch(id).join());
    }

    // GET /api/executions/{id}: status, trigger snapshot and per-node results
    @GetMapping("/{id}")
    public ResponseEntity<WorkflowExecution> getById(@PathVariable UUID id) {
        return executionRepository.findById(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
