package com.mailflow.mailflow_backend.repository;

import com.mailflow.mailflow_backend.model.domain.WorkflowExecution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface WorkflowExecutionRepository extends JpaRepository<WorkflowExecution, UUID> {

    // Run history of one workflow, newest first
    List<WorkflowExecution> findByWorkflowIdOrderByStartedAtDesc(UUID workflowId);

    // Rate limiting: executions started inside the current window
    long countByWorkflowIdAndStartedAtAfter(UUID workflowId, Instant since);

    @Transactional
    long deleteByStartedAtBefore(Instant cutoff);
}
